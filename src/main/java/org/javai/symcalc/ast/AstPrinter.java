package org.javai.symcalc.ast;

import java.util.stream.Collectors;
import org.javai.symcalc.math.NumberFormatter;

/**
 * Renders an AST as fully parenthesised infix text.
 * Numbers print losslessly, so the output parses back to an equal tree.
 */
public final class AstPrinter implements AstNodeVisitor<String> {

	private static final AstPrinter INSTANCE = new AstPrinter();

	private AstPrinter() {
	}

	public static String print(AstNode node) {
		return node.accept(INSTANCE);
	}

	@Override
	public String visitNumber(AstNode.NumberNode node) {
		return NumberFormatter.lossless(node.value());
	}

	@Override
	public String visitVariable(AstNode.VariableNode node) {
		return node.name();
	}

	@Override
	public String visitBinary(AstNode.BinaryOpNode node) {
		return "(" + node.left().accept(this) + " " + node.op().symbol() + " " + node.right().accept(this) + ")";
	}

	@Override
	public String visitUnary(AstNode.UnaryOpNode node) {
		String operand = node.operand().accept(this);
		return switch (node.op()) {
			case PLUS -> "+" + operand;
			case MINUS -> "-" + operand;
			default -> node.op().function().orElseThrow().functionName() + "(" + operand + ")";
		};
	}

	@Override
	public String visitFunction(AstNode.FunctionNode node) {
		return node.arguments().stream()
				.map(argument -> argument.accept(this))
				.collect(Collectors.joining(", ", node.name() + "(", ")"));
	}
}
