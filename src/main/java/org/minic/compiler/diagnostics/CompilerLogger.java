package org.minic.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front-end logger with an integer verbosity that is checked before anything reaches SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * <p>
 * The verbosity is process-wide. It is set by the lowering entry point from
 * {@code minic.lowering.verbosity} or {@link org.minic.compiler.api.IAstLowering#setVerbosity(int)}.
 */
public final class CompilerLogger {

    /** Failures that abort lowering. */
    public static final int ERROR = 0;
    /** Diagnostics of type {@link Diagnostic.Type#WARNING}. */
    public static final int WARN  = 1;
    /** Default verbosity; no front-end messages are emitted at this level. */
    public static final int INFO  = 2;
    /** Per-unit summaries and AST dumps. */
    public static final int DEBUG = 3;
    /** Per-production progress. */
    public static final int TRACE = 4;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);
    private static volatile int level = INFO;

    private CompilerLogger() {}

    /**
     * Sets the verbosity. Values outside ERROR..TRACE are clamped.
     * @param newLevel The new level.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity.
     */
    public static int getLevel() { return level; }

    /**
     * @param messageLevel The level to test.
     * @return {@code true} if a message at that level is passed on to SLF4J.
     */
    public static boolean isEnabled(int messageLevel) { return level >= messageLevel; }

    public static void error(String msg) { emit(ERROR, msg); }

    public static void warn(String msg) { emit(WARN, msg); }

    public static void debug(String msg) { emit(DEBUG, msg); }

    public static void trace(String msg) { emit(TRACE, msg); }

    private static void emit(int messageLevel, String msg) {
        if (!isEnabled(messageLevel)) {
            return;
        }
        switch (messageLevel) {
            case ERROR -> logger.error(msg);
            case WARN -> logger.warn(msg);
            case DEBUG -> logger.debug(msg);
            default -> logger.trace(msg);
        }
    }
}
