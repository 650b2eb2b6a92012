package io.osquerymcp.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;

/**
 * Keeps the JVM alive in stdio mode, where no web server thread does so.
 *
 * <p>Blocks the main thread until the application context closes.
 */
@Component
@ConditionalOnProperty(name = "osquery.transport", havingValue = "stdio")
public class StdioKeepAlive implements ApplicationRunner, ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(StdioKeepAlive.class);

    private final CountDownLatch closed = new CountDownLatch(1);

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        log.info("Serving MCP over stdio");
        closed.await();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        closed.countDown();
    }
}
