package org.javai.symcalc.symbolic;

import java.util.Map;
import java.util.Objects;
import org.javai.symcalc.math.EvaluationException;
import org.javai.symcalc.math.FunctionRegistry;
import org.javai.symcalc.math.MathFunction;

/**
 * Computes the numeric value of a symbolic expression.
 */
public class SymbolicEvaluator implements SymbolicVisitor<Double> {

	private final Map<String, Double> bindings;
	private final FunctionRegistry functions;

	public SymbolicEvaluator(Map<String, Double> bindings, FunctionRegistry functions) {
		this.bindings = bindings != null ? bindings : Map.of();
		this.functions = Objects.requireNonNull(functions, "functions must not be null");
	}

	@Override
	public Double visitNumber(SymbolicExpression.NumberExpr expr) {
		return expr.value();
	}

	@Override
	public Double visitVariable(SymbolicExpression.VariableExpr expr) {
		Double value = bindings.get(expr.name());
		if (value == null) {
			throw EvaluationException.undefinedVariable(expr.name());
		}
		return value;
	}

	@Override
	public Double visitBinary(SymbolicExpression.BinaryExpr expr) {
		double left = expr.left().accept(this);
		double right = expr.right().accept(this);

		return switch (expr.op()) {
			case ADD -> left + right;
			case SUBTRACT -> left - right;
			case MULTIPLY -> left * right;
			case DIVIDE -> {
				if (right == 0) {
					throw EvaluationException.divisionByZero();
				}
				yield left / right;
			}
			case POWER -> Math.pow(left, right);
		};
	}

	@Override
	public Double visitUnary(SymbolicExpression.UnaryExpr expr) {
		double value = expr.operand().accept(this);

		return switch (expr.op()) {
			case POS -> value;
			case NEG -> -value;
			default -> expr.op().function()
					.orElseThrow(() -> new IllegalStateException("No function for " + expr.op()))
					.apply(value);
		};
	}

	@Override
	public Double visitFunction(SymbolicExpression.FunctionExpr expr) {
		if (expr.arguments().size() != 1) {
			throw EvaluationException.arity(expr.name(), expr.arguments().size());
		}
		double argument = expr.arguments().get(0).accept(this);
		MathFunction function = functions.lookup(expr.name())
				.orElseThrow(() -> EvaluationException.unknownFunction(expr.name()));
		return function.apply(argument);
	}
}
