package org.javai.symcalc.symbolic;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.symcalc.math.FunctionRegistry;
import org.javai.symcalc.math.MathFunction;
import org.javai.symcalc.symbolic.rewrite.Differentiator;
import org.javai.symcalc.symbolic.rewrite.Integrator;
import org.javai.symcalc.symbolic.rewrite.Simplifier;

/**
 * A node of the symbolic expression tree.
 * <p>
 * Nodes are permanently immutable once constructed, so transformations may embed the same
 * subtree in several places of their output without copying it. Every transformation returns
 * a new tree and leaves its input untouched, including when it fails.
 */
public sealed interface SymbolicExpression {

	<R> R accept(SymbolicVisitor<R> visitor);

	/**
	 * Whether the subtree contains no variable at all.
	 */
	boolean isConstant();

	/**
	 * Whether the node is literally the number zero (or a sign applied to it).
	 * Not an algebraic equivalence check.
	 */
	boolean isZero();

	/**
	 * Whether the node is literally the number one.
	 */
	boolean isOne();

	/**
	 * @throws TransformException if a node in the tree has no differentiation rule
	 */
	default SymbolicExpression differentiate(String variable) {
		return Differentiator.differentiate(this, variable);
	}

	/**
	 * @throws TransformException if the tree is not one of the recognised integrable shapes
	 */
	default SymbolicExpression integrate(String variable) {
		return Integrator.integrate(this, variable);
	}

	/**
	 * @throws TransformException if simplification meets a division by zero or a constant outside a function's domain
	 */
	default SymbolicExpression simplify() {
		return Simplifier.simplify(this);
	}

	/**
	 * @throws org.javai.symcalc.math.EvaluationException if the tree cannot be evaluated
	 */
	default double evaluate(Map<String, Double> bindings) {
		return accept(new SymbolicEvaluator(bindings, FunctionRegistry.standard()));
	}

	default double evaluate() {
		return evaluate(Map.of());
	}

	/**
	 * Returns a deep copy of this tree.
	 */
	default SymbolicExpression copy() {
		return accept(SymbolicCopier.INSTANCE);
	}

	// Factories

	static NumberExpr number(double value) {
		return new NumberExpr(value);
	}

	static VariableExpr variable(String name) {
		return new VariableExpr(name);
	}

	static BinaryExpr add(SymbolicExpression left, SymbolicExpression right) {
		return new BinaryExpr(BinaryOperator.ADD, left, right);
	}

	static BinaryExpr subtract(SymbolicExpression left, SymbolicExpression right) {
		return new BinaryExpr(BinaryOperator.SUBTRACT, left, right);
	}

	static BinaryExpr multiply(SymbolicExpression left, SymbolicExpression right) {
		return new BinaryExpr(BinaryOperator.MULTIPLY, left, right);
	}

	static BinaryExpr divide(SymbolicExpression left, SymbolicExpression right) {
		return new BinaryExpr(BinaryOperator.DIVIDE, left, right);
	}

	static BinaryExpr power(SymbolicExpression base, SymbolicExpression exponent) {
		return new BinaryExpr(BinaryOperator.POWER, base, exponent);
	}

	static UnaryExpr unary(UnaryOperator op, SymbolicExpression operand) {
		return new UnaryExpr(op, operand);
	}

	static UnaryExpr negate(SymbolicExpression operand) {
		return new UnaryExpr(UnaryOperator.NEG, operand);
	}

	static FunctionExpr function(String name, SymbolicExpression... arguments) {
		return new FunctionExpr(name, Arrays.asList(arguments));
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
		POS(null),
		NEG(null),
		SIN(MathFunction.SIN),
		COS(MathFunction.COS),
		TAN(MathFunction.TAN),
		LOG(MathFunction.LOG),
		LN(MathFunction.LN),
		SQRT(MathFunction.SQRT),
		ABS(MathFunction.ABS);

		private final MathFunction function;

		UnaryOperator(MathFunction function) {
			this.function = function;
		}

		public Optional<MathFunction> function() {
			return Optional.ofNullable(function);
		}

		/**
		 * The operator applying the named function, if there is one.
		 */
		public static Optional<UnaryOperator> forFunctionName(String name) {
			for (UnaryOperator op : values()) {
				if (op.function != null && op.function.functionName().equals(name)) {
					return Optional.of(op);
				}
			}
			return Optional.empty();
		}
	}

	record NumberExpr(double value) implements SymbolicExpression {

		@Override
		public <R> R accept(SymbolicVisitor<R> visitor) {
			return visitor.visitNumber(this);
		}

		@Override
		public boolean isConstant() {
			return true;
		}

		@Override
		public boolean isZero() {
			return value == 0.0;
		}

		@Override
		public boolean isOne() {
			return value == 1.0;
		}

		@Override
		public String toString() {
			return SymbolicPrinter.DEFAULT.print(this);
		}
	}

	record VariableExpr(String name) implements SymbolicExpression {

		public VariableExpr {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public <R> R accept(SymbolicVisitor<R> visitor) {
			return visitor.visitVariable(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public boolean isZero() {
			return false;
		}

		@Override
		public boolean isOne() {
			return false;
		}

		@Override
		public String toString() {
			return SymbolicPrinter.DEFAULT.print(this);
		}
	}

	record BinaryExpr(BinaryOperator op, SymbolicExpression left, SymbolicExpression right)
			implements SymbolicExpression {

		public BinaryExpr {
			Objects.requireNonNull(op, "op must not be null");
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public <R> R accept(SymbolicVisitor<R> visitor) {
			return visitor.visitBinary(this);
		}

		@Override
		public boolean isConstant() {
			return left.isConstant() && right.isConstant();
		}

		@Override
		public boolean isZero() {
			return false;
		}

		@Override
		public boolean isOne() {
			return false;
		}

		public boolean is(BinaryOperator expected) {
			return op == expected;
		}

		@Override
		public String toString() {
			return SymbolicPrinter.DEFAULT.print(this);
		}
	}

	record UnaryExpr(UnaryOperator op, SymbolicExpression operand) implements SymbolicExpression {

		public UnaryExpr {
			Objects.requireNonNull(op, "op must not be null");
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public <R> R accept(SymbolicVisitor<R> visitor) {
			return visitor.visitUnary(this);
		}

		@Override
		public boolean isConstant() {
			return operand.isConstant();
		}

		@Override
		public boolean isZero() {
			return (op == UnaryOperator.POS || op == UnaryOperator.NEG) && operand.isZero();
		}

		@Override
		public boolean isOne() {
			return false;
		}

		@Override
		public String toString() {
			return SymbolicPrinter.DEFAULT.print(this);
		}
	}

	record FunctionExpr(String name, List<SymbolicExpression> arguments) implements SymbolicExpression {

		public FunctionExpr {
			Objects.requireNonNull(name, "name must not be null");
			arguments = List.copyOf(arguments);
		}

		@Override
		public <R> R accept(SymbolicVisitor<R> visitor) {
			return visitor.visitFunction(this);
		}

		@Override
		public boolean isConstant() {
			return arguments.stream().allMatch(SymbolicExpression::isConstant);
		}

		@Override
		public boolean isZero() {
			return false;
		}

		@Override
		public boolean isOne() {
			return false;
		}

		@Override
		public String toString() {
			return SymbolicPrinter.DEFAULT.print(this);
		}
	}
}
