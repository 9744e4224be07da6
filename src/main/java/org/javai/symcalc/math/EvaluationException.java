package org.javai.symcalc.math;

/**
 * Exception thrown when a tree cannot be evaluated to a number.
 */
public class EvaluationException extends RuntimeException {

	/**
	 * Classifies why evaluation failed.
	 */
	public enum Kind {
		UNDEFINED_VARIABLE,
		DIVISION_BY_ZERO,
		DOMAIN,
		ARITY,
		UNKNOWN_FUNCTION
	}

	private final Kind kind;

	public EvaluationException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public Kind kind() {
		return kind;
	}

	public static EvaluationException undefinedVariable(String name) {
		return new EvaluationException(Kind.UNDEFINED_VARIABLE, "Undefined variable: " + name);
	}

	public static EvaluationException divisionByZero() {
		return new EvaluationException(Kind.DIVISION_BY_ZERO, "Division by zero");
	}

	public static EvaluationException domain(String message) {
		return new EvaluationException(Kind.DOMAIN, message);
	}

	public static EvaluationException arity(String functionName, int actual) {
		return new EvaluationException(Kind.ARITY,
				"Function " + functionName + " expects 1 argument, got " + actual);
	}

	public static EvaluationException unknownFunction(String functionName) {
		return new EvaluationException(Kind.UNKNOWN_FUNCTION, "Unknown function: " + functionName);
	}
}
