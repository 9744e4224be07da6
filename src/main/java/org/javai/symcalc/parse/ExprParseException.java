package org.javai.symcalc.parse;

/**
 * Exception thrown when expression text cannot be parsed.
 * Carries the character offset of the token that caused the failure.
 */
public class ExprParseException extends RuntimeException {

	private final int position;

	public ExprParseException(String message, int position) {
		super(message);
		this.position = position;
	}

	public ExprParseException(String message, int position, Throwable cause) {
		super(message, cause);
		this.position = position;
	}

	/**
	 * Offset of the offending token in the input, or -1 when not tied to a token.
	 */
	public int position() {
		return position;
	}
}
