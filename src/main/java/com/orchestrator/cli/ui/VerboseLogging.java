package com.orchestrator.cli.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.util.function.Supplier;
import org.slf4j.LoggerFactory;

/**
 * Raises the root log level to DEBUG for the duration of one command and restores it afterwards.
 */
public final class VerboseLogging {

    private VerboseLogging() {
    }

    public static String around(boolean verbose, Supplier<String> command) {
        if (!verbose) {
            return command.get();
        }
        Logger rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level originalLevel = rootLogger.getLevel();
        rootLogger.setLevel(Level.DEBUG);
        try {
            return Ansi.color(Ansi.PURPLE, "-- Verbose mode enabled --") + "\n" + command.get()
                    + "\n" + Ansi.color(Ansi.PURPLE, "-- Verbose mode disabled --");
        } finally {
            rootLogger.setLevel(originalLevel);
        }
    }
}
