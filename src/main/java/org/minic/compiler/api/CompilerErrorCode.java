package org.minic.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during lowering.
 * This decouples the test logic from the message texts.
 */
public enum CompilerErrorCode {
    // region Lowering Errors
    /** A concrete syntax tree shape reached a handler that cannot classify it, or a node factory contract failed. */
    INTERNAL_INVARIANT_VIOLATION,
    /** An integer literal could not be parsed as an unsigned 32-bit value in its radix. */
    MALFORMED_INTEGER_LITERAL,
    /** The input nests deeper than the recursive tree passes can follow on the current thread stack. */
    NESTING_TOO_DEEP,
    // endregion

    // region Lowering Warnings
    /** An integer literal is a valid unsigned 32-bit value but above the largest {@code int}; it wraps to a negative value. */
    LITERAL_EXCEEDS_INT_RANGE,
    // endregion

    // region Validation Errors
    /** The optional post-lowering validation found a structurally invalid tree. */
    AST_VALIDATION_FAILED,
    // endregion

    // region General Errors
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
