package org.javai.symcalc.symbolic;

import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.symcalc.math.NumberFormatter;

/**
 * Renders symbolic expressions for display.
 * <p>
 * Output is fully parenthesised infix like the AST's, except for products involving a
 * literal number, which collapse into coefficient form:
 * <ul>
 * <li>{@code 2 * 3} prints as {@code 6}</li>
 * <li>{@code 2 * x} and {@code x * 2} print as {@code 2x}</li>
 * <li>{@code 1 * x} prints as {@code x}, {@code -1 * x} as {@code -x}</li>
 * <li>{@code 3 * (x + 1)} prints as {@code 3((x + 1))}; only variables, function calls and
 * unary nodes are juxtaposed without parentheses</li>
 * </ul>
 */
public final class SymbolicPrinter implements SymbolicVisitor<String> {

	public static final SymbolicPrinter DEFAULT = new SymbolicPrinter(NumberFormatter.DEFAULT);

	private final NumberFormatter formatter;

	public SymbolicPrinter(NumberFormatter formatter) {
		this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
	}

	public String print(SymbolicExpression expr) {
		return expr.accept(this);
	}

	@Override
	public String visitNumber(SymbolicExpression.NumberExpr expr) {
		return formatter.format(expr.value());
	}

	@Override
	public String visitVariable(SymbolicExpression.VariableExpr expr) {
		return expr.name();
	}

	@Override
	public String visitBinary(SymbolicExpression.BinaryExpr expr) {
		if (expr.is(SymbolicExpression.BinaryOperator.MULTIPLY)) {
			return printProduct(expr.left(), expr.right());
		}
		return "(" + expr.left().accept(this) + " " + expr.op().symbol() + " " + expr.right().accept(this) + ")";
	}

	@Override
	public String visitUnary(SymbolicExpression.UnaryExpr expr) {
		String operand = expr.operand().accept(this);
		return switch (expr.op()) {
			case POS -> "+" + operand;
			case NEG -> "-" + operand;
			default -> expr.op().function().orElseThrow().functionName() + "(" + operand + ")";
		};
	}

	@Override
	public String visitFunction(SymbolicExpression.FunctionExpr expr) {
		return expr.arguments().stream()
				.map(argument -> argument.accept(this))
				.collect(Collectors.joining(", ", expr.name() + "(", ")"));
	}

	private String printProduct(SymbolicExpression left, SymbolicExpression right) {
		if (left instanceof SymbolicExpression.NumberExpr l && right instanceof SymbolicExpression.NumberExpr r) {
			return formatter.formatCoefficient(l.value() * r.value());
		}
		if (left instanceof SymbolicExpression.NumberExpr l && !right.isConstant()) {
			return withCoefficient(l.value(), right);
		}
		if (right instanceof SymbolicExpression.NumberExpr r && !left.isConstant()) {
			return withCoefficient(r.value(), left);
		}
		return "(" + left.accept(this) + " * " + right.accept(this) + ")";
	}

	private String withCoefficient(double coefficient, SymbolicExpression term) {
		String text = term.accept(this);
		if (coefficient == 1.0) {
			return text;
		}
		if (coefficient == -1.0) {
			return "-" + text;
		}
		boolean juxtaposable = term instanceof SymbolicExpression.VariableExpr
				|| term instanceof SymbolicExpression.FunctionExpr
				|| term instanceof SymbolicExpression.UnaryExpr;
		return formatter.formatCoefficient(coefficient) + (juxtaposable ? text : "(" + text + ")");
	}
}
