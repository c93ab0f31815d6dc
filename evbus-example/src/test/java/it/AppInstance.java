package it;

import com.demo.app.DemoAppApplication;
import com.myorg.evbus.kafka.KafkaDurableTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.test.utils.ContainerTestUtils;

/**
 * Start the demo app on a random port in durable mode against the test broker.
 */
public class AppInstance implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AppInstance.class);

    private final ConfigurableApplicationContext ctx;
    private final int port;

    public AppInstance(String bootstrapServers, String appName) {
        String[] args = new String[] {
                "--server.port=0",
                "--spring.application.name=" + appName,
                "--evbus.mode=durable",
                "--evbus.kafka.bootstrap-servers=" + bootstrapServers,
                "--evbus.kafka.consumer.retry.backoff=50ms",
                "--evbus.kafka.consumer.retry.max-backoff=200ms",
                "--management.endpoints.web.exposure.include=health,metrics",
        };
        this.ctx = new SpringApplicationBuilder(DemoAppApplication.class).run(args);
        this.port = Integer.parseInt(ctx.getEnvironment().getProperty("local.server.port"));
        log.info("IT app started: name={} port={}", appName, port);
    }

    public int port() {
        return port;
    }

    public String url(String path) {
        return "http://localhost:" + port + path;
    }

    public <T> T getBean(Class<T> type) {
        return ctx.getBean(type);
    }

    /**
     * Consumers start at the log end: wait until they own partitions before publishing.
     */
    public void awaitAssignment(String topic, int partitions) {
        MessageListenerContainer container = ctx.getBean(KafkaDurableTransport.class).getListenerContainer(topic);
        if (container == null) throw new IllegalStateException("No consumer for topic " + topic);
        ContainerTestUtils.waitForAssignment(container, partitions);
    }

    @Override
    public void close() {
        ctx.close();
    }
}
