package org.minic.compiler.frontend.lowering;

import org.minic.compiler.api.CompilerErrorCode;

/**
 * Raised when a concrete syntax tree cannot be lowered.
 * It aborts the whole transformation; the lowering entry point turns it into a diagnostic.
 */
public class LoweringException extends RuntimeException {

	private final CompilerErrorCode code;
	private final int line;

	/**
	 * @param code The error code.
	 * @param message The error message.
	 * @param line The line of the offending production, or -1 if unknown.
	 */
	public LoweringException(CompilerErrorCode code, String message, int line) {
		this(code, message, line, null);
	}

	/**
	 * @param code The error code.
	 * @param message The error message.
	 * @param line The line of the offending production, or -1 if unknown.
	 * @param cause The underlying failure.
	 */
	public LoweringException(CompilerErrorCode code, String message, int line, Throwable cause) {
		super(message, cause);
		this.code = code;
		this.line = line;
	}

	public CompilerErrorCode getCode() {
		return code;
	}

	public int getLine() {
		return line;
	}
}
