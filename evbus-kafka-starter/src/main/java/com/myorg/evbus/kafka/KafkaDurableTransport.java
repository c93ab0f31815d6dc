package com.myorg.evbus.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.bus.BusTransport;
import com.myorg.evbus.contracts.core.bus.ConsumerRegistration;
import com.myorg.evbus.contracts.core.bus.MessageHandler;
import com.myorg.evbus.contracts.core.conventions.TopicNames;
import com.myorg.evbus.contracts.core.envelope.BusHealth;
import com.myorg.evbus.contracts.core.exception.BusTransportException;
import com.myorg.evbus.contracts.core.spi.RecordProcessingListener;
import com.myorg.evbus.contracts.core.trace.TracePropagator;
import com.myorg.evbus.eventing.HandlerRegistry;
import com.myorg.evbus.kafka.processing.InboundRecord;
import com.myorg.evbus.kafka.processing.RecordProcessor;
import com.myorg.evbus.kafka.processing.RetryPolicy;
import com.myorg.evbus.kafka.processing.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Node;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.CommonContainerStoppingErrorHandler;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Kafka-backed transport: at-least-once delivery with per-partition ordering.
 *
 * <ul>
 *   <li>The producer is created once, on first use, under a lock; concurrent first publishers share it.</li>
 *   <li>{@code publish} returns only after the broker acknowledged the record.</li>
 *   <li>Each subscribed topic gets one listener container, group {@code <clientId>-<topic>},
 *       committing after each record reached an outcome (handled or dead-lettered).</li>
 * </ul>
 */
@Slf4j
public class KafkaDurableTransport implements BusTransport {

    private final KafkaProperties props;
    private final String clientId;
    private final ObjectMapper mapper;
    private final ProducerFactory<String, String> producerFactory;
    private final ConsumerFactory<String, String> consumerFactory;
    private final Map<String, Object> adminConfig;

    private final HandlerRegistry registry = new HandlerRegistry();
    private final Map<String, ConcurrentMessageListenerContainer<String, String>> containers = new ConcurrentHashMap<>();
    private final ExecutorService attemptExecutor;
    private final RecordProcessor processor;

    private final ReentrantLock producerLock = new ReentrantLock();
    private volatile KafkaTemplate<String, String> template;
    private boolean producerClosed;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public KafkaDurableTransport(KafkaProperties props,
                                 String clientId,
                                 ObjectMapper mapper,
                                 ProducerFactory<String, String> producerFactory,
                                 ConsumerFactory<String, String> consumerFactory,
                                 Map<String, Object> adminConfig,
                                 DlqReasonClassifier classifier,
                                 RecordProcessingListener listener,
                                 Sleeper sleeper) {
        this.props = props;
        this.clientId = clientId;
        this.mapper = mapper;
        this.producerFactory = producerFactory;
        this.consumerFactory = consumerFactory;
        this.adminConfig = adminConfig;

        CustomizableThreadFactory threads = new CustomizableThreadFactory("evbus-handler-");
        threads.setDaemon(true);
        this.attemptExecutor = Executors.newCachedThreadPool(threads);

        this.processor = new RecordProcessor(
                mapper,
                RetryPolicy.from(props.getConsumer().getRetry()),
                new KafkaDeadLetterSink(this::template, mapper, props.getProducer().getSendTimeout()),
                props.getDlq().getSuffix(),
                clientId,
                classifier != null ? classifier : new DefaultDlqReasonClassifier(),
                listener,
                sleeper,
                attemptExecutor,
                Clock.systemUTC()
        );
    }

    @Override
    public String name() {
        return "kafka";
    }

    /**
     * Establish the producer ahead of the first publish.
     */
    @Override
    public void start() {
        ensureOpen();
        try {
            template().execute(producer -> null);
        } catch (KafkaException e) {
            throw new BusTransportException("Cannot create Kafka producer for brokers=" + props.brokers(), e);
        }
        log.info("Kafka transport started brokers={} clientId={}", props.brokers(), clientId);
    }

    @Override
    public void publish(String topic, JsonNode payload) {
        ensureOpen();
        String value;
        try {
            value = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BusTransportException("Cannot serialize payload for topic=" + topic, e);
        }

        ProducerRecord<String, String> rec = new ProducerRecord<>(topic, value);
        TracePropagator.outboundHeaders()
                .forEach((k, v) -> rec.headers().add(k, v.getBytes(StandardCharsets.UTF_8)));

        KafkaSends.sendAndWait(template(), rec, props.getProducer().getSendTimeout());
        log.debug("Published topic={}", topic);
    }

    @Override
    public ConsumerRegistration subscribe(String topic, MessageHandler handler) {
        ensureOpen();
        String groupId = TopicNames.consumerGroup(clientId, topic);
        if (!registry.register(topic, handler)) {
            log.debug("Handler already registered topic={} handler={}", topic, handler);
        }
        containers.computeIfAbsent(topic, t -> {
            ConcurrentMessageListenerContainer<String, String> c = createContainer(t, groupId);
            c.start();
            log.info("Consuming topic={} groupId={} concurrency={}", t, groupId, props.getConsumer().getConcurrency());
            return c;
        });
        return new ConsumerRegistration(topic, groupId);
    }

    private ConcurrentMessageListenerContainer<String, String> createContainer(String topic, String groupId) {
        ContainerProperties cp = new ContainerProperties(topic);
        cp.setGroupId(groupId);
        cp.setClientId(groupId);
        cp.setAckMode(ContainerProperties.AckMode.RECORD);
        cp.setShutdownTimeout(props.getConsumer().getShutdownTimeout().toMillis());
        // once stopping, the rest of a polled batch stays uncommitted
        cp.setStopImmediate(true);
        cp.setMessageListener((MessageListener<String, String>) rec ->
                processor.process(InboundRecord.from(rec), registry.get(topic)));

        ConcurrentMessageListenerContainer<String, String> c = new ConcurrentMessageListenerContainer<>(consumerFactory, cp);
        c.setConcurrency(props.getConsumer().getConcurrency());
        c.setBeanName("evbus-" + topic);
        // only an aborted (interrupted) record reaches the error handler: leave it uncommitted and stop
        c.setCommonErrorHandler(new CommonContainerStoppingErrorHandler());
        return c;
    }

    /**
     * Broker reachability through a short-lived admin client, bounded by {@code evbus.kafka.health-timeout}.
     */
    @Override
    public BusHealth health() {
        Duration timeout = props.getHealthTimeout();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("transport", name());
        details.put("brokers", props.brokers());

        AdminClient admin = null;
        try {
            admin = AdminClient.create(adminConfig);
            DescribeClusterResult cluster = admin.describeCluster(
                    new DescribeClusterOptions().timeoutMs((int) Math.min(Integer.MAX_VALUE, timeout.toMillis())));
            String clusterId = cluster.clusterId().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Collection<Node> nodes = cluster.nodes().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            details.put("clusterId", clusterId);
            details.put("nodeCount", nodes.size());
            return BusHealth.up(details);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return down(details, e);
        } catch (ExecutionException e) {
            return down(details, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException | KafkaException e) {
            return down(details, e);
        } finally {
            if (admin != null) {
                admin.close(Duration.ofMillis(Math.max(100, timeout.toMillis())));
            }
        }
    }

    private static BusHealth down(Map<String, Object> details, Throwable error) {
        String msg = error.getMessage();
        details.put("error", msg != null ? msg : error.getClass().getName());
        log.warn("Kafka health check failed brokers={} error={}", details.get("brokers"), error.toString());
        return new BusHealth(false, details);
    }

    /**
     * Stop consuming (waiting for in-flight records up to the shutdown timeout), then close the producer.
     *
     * <p>A consumer thread still busy after the timeout finds the processor stopped: its record aborts
     * uncommitted instead of being retried, dead-lettered or skipped. Handlers stay registered, so
     * such a thread never sees an empty handler list.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        containers.forEach((topic, c) -> {
            try {
                c.stop();
            } catch (RuntimeException e) {
                log.warn("Failed to stop consumer topic={} error={}", topic, e.toString());
            }
        });
        processor.stop();
        containers.clear();
        attemptExecutor.shutdownNow();

        producerLock.lock();
        try {
            producerClosed = true;
            if (template != null) {
                producerFactory.reset();
                template = null;
            }
        } finally {
            producerLock.unlock();
        }
        log.info("Kafka transport closed clientId={}", clientId);
    }

    KafkaTemplate<String, String> template() {
        KafkaTemplate<String, String> t = template;
        if (t != null) return t;
        producerLock.lock();
        try {
            // draining consumers may still dead-letter after close() began; only a closed producer refuses
            if (producerClosed) throw new BusTransportException("Kafka transport is closed");
            if (template == null) {
                template = new KafkaTemplate<>(producerFactory);
                log.debug("Kafka producer template created clientId={}", clientId);
            }
            return template;
        } finally {
            producerLock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed.get()) throw new BusTransportException("Kafka transport is closed");
    }

    /**
     * Listener container of a subscribed topic, or {@code null}.
     */
    public MessageListenerContainer getListenerContainer(String topic) {
        return containers.get(topic);
    }

    RecordProcessor processor() {
        return processor;
    }

    HandlerRegistry registry() {
        return registry;
    }

    boolean isProducerCreated() {
        return template != null;
    }
}
