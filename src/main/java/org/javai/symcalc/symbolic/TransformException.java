package org.javai.symcalc.symbolic;

/**
 * Exception thrown when a symbolic transformation cannot be carried out: a
 * differentiation or integration shape that is not implemented, a division by zero
 * found while simplifying, or an equation the solver does not recognise.
 */
public class TransformException extends RuntimeException {

	public TransformException(String message) {
		super(message);
	}

	public TransformException(String message, Throwable cause) {
		super(message, cause);
	}
}
