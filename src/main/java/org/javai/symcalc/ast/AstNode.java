package org.javai.symcalc.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.symcalc.math.FunctionRegistry;
import org.javai.symcalc.math.MathFunction;

/**
 * A node of the numeric expression tree produced by the parser.
 * <p>
 * The set of node kinds is closed. Nodes are immutable records; operations over the tree are
 * written as {@link AstNodeVisitor}s so that a new node kind cannot be added without every
 * operation being updated.
 */
public sealed interface AstNode {

	<R> R accept(AstNodeVisitor<R> visitor);

	/**
	 * Evaluates the tree with the given variable bindings using the standard functions.
	 *
	 * @throws org.javai.symcalc.math.EvaluationException if a variable is unbound, a division by
	 *         zero occurs, a function argument is outside its domain, or a call is malformed
	 */
	default double evaluate(Map<String, Double> bindings) {
		return accept(new AstEvaluator(bindings, FunctionRegistry.standard()));
	}

	default double evaluate() {
		return evaluate(Map.of());
	}

	/**
	 * Returns a deep copy of this tree.
	 */
	default AstNode copy() {
		return accept(AstCopier.INSTANCE);
	}

	enum BinaryOperator {
		ADD("+"),
		SUBTRACT("-"),
		MULTIPLY("*"),
		DIVIDE("/"),
		POWER("^");

		private final String symbol;

		BinaryOperator(String symbol) {
			this.symbol = symbol;
		}

		public String symbol() {
			return symbol;
		}
	}

	enum UnaryOperator {
		PLUS(null),
		MINUS(null),
		SIN(MathFunction.SIN),
		COS(MathFunction.COS),
		TAN(MathFunction.TAN),
		LOG10(MathFunction.LOG),
		LN(MathFunction.LN),
		SQRT(MathFunction.SQRT),
		ABS(MathFunction.ABS);

		private final MathFunction function;

		UnaryOperator(MathFunction function) {
			this.function = function;
		}

		/**
		 * The function this operator applies, empty for the sign operators.
		 */
		public Optional<MathFunction> function() {
			return Optional.ofNullable(function);
		}
	}

	record NumberNode(double value) implements AstNode {

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitNumber(this);
		}

		@Override
		public String toString() {
			return AstPrinter.print(this);
		}
	}

	record VariableNode(String name) implements AstNode {

		public VariableNode {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitVariable(this);
		}

		@Override
		public String toString() {
			return AstPrinter.print(this);
		}
	}

	record BinaryOpNode(BinaryOperator op, AstNode left, AstNode right) implements AstNode {

		public BinaryOpNode {
			Objects.requireNonNull(op, "op must not be null");
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitBinary(this);
		}

		@Override
		public String toString() {
			return AstPrinter.print(this);
		}
	}

	record UnaryOpNode(UnaryOperator op, AstNode operand) implements AstNode {

		public UnaryOpNode {
			Objects.requireNonNull(op, "op must not be null");
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitUnary(this);
		}

		@Override
		public String toString() {
			return AstPrinter.print(this);
		}
	}

	record FunctionNode(String name, List<AstNode> arguments) implements AstNode {

		public FunctionNode {
			Objects.requireNonNull(name, "name must not be null");
			arguments = List.copyOf(arguments);
		}

		@Override
		public <R> R accept(AstNodeVisitor<R> visitor) {
			return visitor.visitFunction(this);
		}

		@Override
		public String toString() {
			return AstPrinter.print(this);
		}
	}
}
