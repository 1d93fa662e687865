package org.minic.compiler.diagnostics;

import org.minic.compiler.api.CompilerErrorCode;

/**
 * Represents a single diagnostic message (error or warning)
 * that occurs while lowering a compile unit.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code, or {@link CompilerErrorCode#UNKNOWN_ERROR} if none applies.
 * @param message The diagnostic message.
 * @param fileName The name of the compile unit where the issue occurred.
 * @param lineNumber The line number of the issue, -1 if unknown.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents lowering from producing a tree. */
        ERROR,
        /** A warning that does not prevent lowering. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s (%s)", type, fileName, lineNumber, message, code);
    }
}
