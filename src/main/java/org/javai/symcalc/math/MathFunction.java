package org.javai.symcalc.math;

/**
 * The single-argument functions an expression may call by name.
 * Each constant knows its source name and how to evaluate itself,
 * including the domain checks for the logarithms and the square root.
 */
public enum MathFunction {

	SIN("sin") {
		@Override
		public double apply(double argument) {
			return Math.sin(argument);
		}
	},
	COS("cos") {
		@Override
		public double apply(double argument) {
			return Math.cos(argument);
		}
	},
	TAN("tan") {
		@Override
		public double apply(double argument) {
			return Math.tan(argument);
		}
	},
	LOG("log") {
		@Override
		public double apply(double argument) {
			if (argument <= 0) {
				throw EvaluationException.domain("Log of non-positive number: " + argument);
			}
			return Math.log10(argument);
		}
	},
	LN("ln") {
		@Override
		public double apply(double argument) {
			if (argument <= 0) {
				throw EvaluationException.domain("Natural log of non-positive number: " + argument);
			}
			return Math.log(argument);
		}
	},
	SQRT("sqrt") {
		@Override
		public double apply(double argument) {
			if (argument < 0) {
				throw EvaluationException.domain("Square root of negative number: " + argument);
			}
			return Math.sqrt(argument);
		}
	},
	ABS("abs") {
		@Override
		public double apply(double argument) {
			return Math.abs(argument);
		}
	};

	private final String functionName;

	MathFunction(String functionName) {
		this.functionName = functionName;
	}

	/**
	 * Name used for this function in expression text.
	 */
	public String functionName() {
		return functionName;
	}

	/**
	 * Evaluates the function.
	 *
	 * @throws EvaluationException if the argument lies outside the function's domain
	 */
	public abstract double apply(double argument);
}
