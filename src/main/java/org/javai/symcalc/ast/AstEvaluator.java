package org.javai.symcalc.ast;

import java.util.Map;
import java.util.Objects;
import org.javai.symcalc.math.EvaluationException;
import org.javai.symcalc.math.FunctionRegistry;
import org.javai.symcalc.math.MathFunction;

/**
 * Computes the numeric value of an AST.
 */
public class AstEvaluator implements AstNodeVisitor<Double> {

	private final Map<String, Double> bindings;
	private final FunctionRegistry functions;

	public AstEvaluator(Map<String, Double> bindings, FunctionRegistry functions) {
		this.bindings = bindings != null ? bindings : Map.of();
		this.functions = Objects.requireNonNull(functions, "functions must not be null");
	}

	@Override
	public Double visitNumber(AstNode.NumberNode node) {
		return node.value();
	}

	@Override
	public Double visitVariable(AstNode.VariableNode node) {
		Double value = bindings.get(node.name());
		if (value == null) {
			throw EvaluationException.undefinedVariable(node.name());
		}
		return value;
	}

	@Override
	public Double visitBinary(AstNode.BinaryOpNode node) {
		double left = node.left().accept(this);
		double right = node.right().accept(this);

		return switch (node.op()) {
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
	public Double visitUnary(AstNode.UnaryOpNode node) {
		double value = node.operand().accept(this);

		return switch (node.op()) {
			case PLUS -> value;
			case MINUS -> -value;
			default -> node.op().function()
					.orElseThrow(() -> new IllegalStateException("No function for " + node.op()))
					.apply(value);
		};
	}

	@Override
	public Double visitFunction(AstNode.FunctionNode node) {
		if (node.arguments().size() != 1) {
			throw EvaluationException.arity(node.name(), node.arguments().size());
		}
		double argument = node.arguments().get(0).accept(this);
		MathFunction function = functions.lookup(node.name())
				.orElseThrow(() -> EvaluationException.unknownFunction(node.name()));
		return function.apply(argument);
	}
}
