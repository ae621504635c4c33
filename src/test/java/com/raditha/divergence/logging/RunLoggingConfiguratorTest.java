package com.raditha.divergence.logging;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RunLoggingConfiguratorTest {

    private static final Logger logger = LoggerFactory.getLogger(RunLoggingConfiguratorTest.class);

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        RunLoggingConfigurator.close();
    }

    @Test
    void testRunLogReceivesDebugMessages() throws IOException {
        Path logFile = RunLoggingConfigurator.configure(tempDir.resolve("logs"), ConsoleVerbosity.QUIET);

        logger.debug("debug line for the run log");
        RunLoggingConfigurator.close();

        assertEquals(tempDir.resolve("logs/analyzer.log"), logFile);
        String content = Files.readString(logFile);
        assertTrue(content.contains("DEBUG"));
        assertTrue(content.contains("debug line for the run log"));
    }

    @Test
    void testEachRunStartsFresh() throws IOException {
        Path logs = tempDir.resolve("logs");
        RunLoggingConfigurator.configure(logs, ConsoleVerbosity.NORMAL);
        logger.info("first run");
        RunLoggingConfigurator.close();

        Path logFile = RunLoggingConfigurator.configure(logs, ConsoleVerbosity.NORMAL);
        logger.info("second run");
        RunLoggingConfigurator.close();

        String content = Files.readString(logFile);
        assertFalse(content.contains("first run"));
        assertTrue(content.contains("second run"));
    }

    @Test
    void testVerbosity() {
        assertEquals(ConsoleVerbosity.NORMAL, ConsoleVerbosity.of(false, false));
        assertEquals(ConsoleVerbosity.VERBOSE, ConsoleVerbosity.of(true, false));
        assertEquals(ConsoleVerbosity.QUIET, ConsoleVerbosity.of(false, true));
        assertEquals(Level.WARN, ConsoleVerbosity.QUIET.threshold());
        assertThrows(IllegalArgumentException.class, () -> ConsoleVerbosity.of(true, true));
    }
}
