package com.largomodo.boxpicker;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for logging infrastructure integration.
 * <p>
 * Verifies:
 * - Verbose flag enables DEBUG level logging
 * - MDC context carries the request filename in batch mode
 * - Rejected and failed requests are reported at WARN and ERROR
 */
class BoxPickerLoggingTest {

    @TempDir
    Path tempDir;

    private ListAppender<ILoggingEvent> listAppender;
    private Logger rootLogger;
    private Level originalLevel;

    @BeforeEach
    void setUp() {
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        originalLevel = rootLogger.getLevel();

        // MDC is read lazily from the event; capture it while still on the worker thread
        listAppender = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        listAppender.setContext(loggerContext);
        listAppender.start();
        rootLogger.addAppender(listAppender);
    }

    @AfterEach
    void tearDown() {
        listAppender.stop();
        rootLogger.detachAppender(listAppender);
        rootLogger.setLevel(originalLevel);
    }

    private int execute(String... args) {
        CommandLine cmd = BoxPicker.commandLine(new BoxPicker());
        cmd.setOut(new PrintWriter(new StringWriter()));
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    @Test
    void testVerboseFlagEnablesDebug() throws IOException {
        rootLogger.setLevel(Level.INFO);
        Path request = Files.writeString(tempDir.resolve("order.json"),
                "{\"items\": [{\"sku\": \"A\", \"dimensions\": {\"length\": 1, \"width\": 1, \"height\": 1}}]}");

        execute("-v", request.toString());

        assertEquals(Level.DEBUG, rootLogger.getLevel(),
                "Verbose flag should set root logger to DEBUG level");
        assertTrue(listAppender.list.stream()
                        .anyMatch(e -> e.getLevel() == Level.DEBUG && e.getFormattedMessage().contains("Packing 1 item(s)")),
                "Debug messages should be emitted once verbose is on");
    }

    @Test
    void testMdcContextInBatch() throws IOException {
        Path inputDir = Files.createDirectories(tempDir.resolve("input"));
        Files.writeString(inputDir.resolve("order-17.json"),
                "{\"items\": [{\"sku\": \"A\", \"dimensions\": {\"length\": 1, \"width\": 1, \"height\": 1}}]}");

        execute(inputDir.toString());

        ILoggingEvent processing = listAppender.list.stream()
                .filter(e -> e.getFormattedMessage().startsWith("Processing: "))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No 'Processing:' event logged"));
        assertEquals("order-17.json", processing.getMDCPropertyMap().get("request"));
    }

    @Test
    void testRejectedRequestLoggedAsWarning() throws IOException {
        Path inputDir = Files.createDirectories(tempDir.resolve("input"));
        Files.writeString(inputDir.resolve("empty.json"), "{\"items\": []}");

        execute(inputDir.toString());

        List<ILoggingEvent> warnings = listAppender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .filter(e -> e.getFormattedMessage().startsWith("REJECTED: "))
                .toList();
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getFormattedMessage().contains("validation_error"));
        assertTrue(listAppender.list.stream()
                .anyMatch(e -> e.getFormattedMessage().equals("Batch complete: 0 packed, 1 rejected, 0 failed")));
    }

    @Test
    void testUnreadableRequestLoggedAsError() throws IOException {
        Path inputDir = Files.createDirectories(tempDir.resolve("input"));
        Path request = Files.writeString(inputDir.resolve("locked.json"), "{}");
        boolean locked = request.toFile().setReadable(false);
        Assumptions.assumeTrue(locked && !Files.isReadable(request),
                "File permissions not enforced (running as root?)");

        execute(inputDir.toString());

        assertTrue(listAppender.list.stream()
                .anyMatch(e -> e.getLevel() == Level.ERROR && e.getFormattedMessage().startsWith("FAILED: locked.json")));
    }
}
