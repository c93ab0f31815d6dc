package com.myorg.evbus.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.bus.MessageHandler;
import com.myorg.evbus.contracts.core.envelope.BusMessage;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * {@link MessageHandler} calling an {@link EventConsumer} method.
 */
@Getter
@EqualsAndHashCode(of = {"target", "method"})
public class ConsumerMethodInvoker implements MessageHandler {
    private final Object target;
    private final Method method;
    private final Class<?> payloadClass;
    private final ObjectMapper mapper;

    public ConsumerMethodInvoker(Object target, Method method, Class<?> payloadClass, ObjectMapper mapper) {
        int params = method.getParameterCount();
        if (params == 2 && !BusMessage.class.equals(method.getParameterTypes()[0])) {
            throw new IllegalStateException("First parameter of a 2-arg consumer must be BusMessage: " + method);
        }
        if (params != 1 && params != 2) {
            throw new IllegalStateException("Consumer method must have 1 or 2 params: (payload) or (message,payload): " + method);
        }
        this.target = target;
        this.method = method;
        this.payloadClass = payloadClass;
        this.mapper = mapper;
    }

    @Override
    public void handle(BusMessage message) throws Exception {
        Object payloadObj = TypedMessageHandler.convert(mapper, message.getPayload(), payloadClass);
        try {
            if (method.getParameterCount() == 1) {
                method.invoke(target, payloadObj);
            } else {
                method.invoke(target, message, payloadObj);
            }
        } catch (InvocationTargetException e) {
            // rethrow what the consumer threw so retry classification sees the real exception
            Throwable cause = e.getTargetException();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    @Override
    public String toString() {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }
}
