package com.myorg.evbus.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.bus.EventBus;
import com.myorg.evbus.eventing.ConsumerMethodInvoker;
import com.myorg.evbus.eventing.EventConsumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.aop.support.AopUtils;
import org.springframework.context.ApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Starts the bus with the application context, subscribes every {@link EventConsumer} method,
 * and closes the bus when the context stops.
 */
@Slf4j
public class EventConsumerRegistrar implements SmartLifecycle {

    private final ApplicationContext ctx;
    private final EventBus bus;
    private final ObjectMapper mapper;
    private final boolean autoStart;

    private volatile boolean running;

    public EventConsumerRegistrar(ApplicationContext ctx, EventBus bus, ObjectMapper mapper, boolean autoStart) {
        this.ctx = ctx;
        this.bus = bus;
        this.mapper = mapper;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        if (autoStart) {
            bus.start();
        }
        List<AnnotatedConsumer> consumers = scan();
        consumers.forEach(c -> bus.registerConsumer(c.topic(), c.invoker()));
        log.info("Registered {} annotated event consumer(s)", consumers.size());
        running = true;
    }

    List<AnnotatedConsumer> scan() {
        List<AnnotatedConsumer> out = new ArrayList<>();
        Map<String, Object> beans = ctx.getBeansWithAnnotation(Component.class);

        beans.values().forEach(bean -> {
            // annotations live on the target class, not on a CGLIB/JDK proxy
            Class<?> targetClass = AopProxyUtils.ultimateTargetClass(bean);

            Map<Method, EventConsumer> methods = MethodIntrospector.selectMethods(
                    targetClass,
                    (MethodIntrospector.MetadataLookup<EventConsumer>) m ->
                            AnnotatedElementUtils.findMergedAnnotation(m, EventConsumer.class)
            );

            methods.forEach((method, ann) -> {
                Method invocable = AopUtils.selectInvocableMethod(method, bean.getClass());
                out.add(new AnnotatedConsumer(ann.topic(),
                        new ConsumerMethodInvoker(bean, invocable, ann.payload(), mapper)));
            });
        });
        return out;
    }

    @Override
    public void stop() {
        try {
            bus.close();
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // start after the rest of the context, stop (close consumers) before it
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }

    record AnnotatedConsumer(String topic, ConsumerMethodInvoker invoker) {}
}
