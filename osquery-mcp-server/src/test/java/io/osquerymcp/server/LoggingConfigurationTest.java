package io.osquerymcp.server;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/**
 * Logging must stay off stdout from the very first line, before Spring takes over
 * logging, because stdout is the JSON-RPC stream in stdio mode.
 */
class LoggingConfigurationTest {

    private PrintStream originalOut;
    private PrintStream originalErr;
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    @BeforeEach
    void captureConsole() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreConsole() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    @DisplayName("the plain logback.xml is on the classpath")
    void plainConfigurationPresent() {
        assertNotNull(getClass().getClassLoader().getResource("logback.xml"));
        assertNull(getClass().getClassLoader().getResource("logback-spring.xml"));
    }

    @Test
    @DisplayName("startup logging goes to stderr and never to stdout")
    void startupLoggingOnStderr() throws Exception {
        URL config = getClass().getClassLoader().getResource("logback.xml");
        LoggerContext context = new LoggerContext();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(config);

        try {
            Logger log = context.getLogger(OsQueryMcpServerApplication.class);
            log.info("Starting OpenSearch query MCP server with {} transport...", "stdio");

            assertEquals("", stdout.toString(StandardCharsets.UTF_8));
            assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("with stdio transport"));
        } finally {
            context.stop();
        }
    }
}
