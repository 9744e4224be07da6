package org.javai.symcalc.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.symcalc.ast.AstNode;
import org.javai.symcalc.ast.AstNode.BinaryOperator;
import org.javai.symcalc.ast.AstNode.UnaryOperator;
import org.javai.symcalc.math.FunctionRegistry;

/**
 * Recursive-descent parser for infix expressions.
 * <p>
 * Grammar, lowest to highest precedence:
 * <pre>
 * expression := term
 * term       := factor (('+' | '-') factor)*
 * factor     := power (('*' | '/') power | power)*      -- juxtaposition multiplies
 * power      := primary ('^' power)?                    -- right associative
 * primary    := NUMBER | VARIABLE | function | '(' expression ')' | ('+' | '-') primary
 * function   := FUNCTION '(' (expression (',' expression)*)? ')'
 * </pre>
 * A factor chain continues without an explicit operator whenever the next token can start
 * a factor, so {@code 2x}, {@code 3(x + 1)} and {@code x sin(x)} are products.
 * <p>
 * Parentheses, prefix signs, function calls, {@code ^} and each link of a {@code + - * /}
 * chain count as one level of nesting, and together may not exceed
 * {@link ParserOptions#maxNestingDepth()}. A flat sum of n terms counts as n - 1 levels.
 * <p>
 * Errors are not recovered from: the first problem aborts the parse with an
 * {@link ExprParseException} carrying the offending token's position.
 */
public class ExprParser {

	private final ExprLexer lexer;
	private final ParserOptions options;
	private ExprToken current;
	private int depth;

	public ExprParser(String expression) {
		this(expression, FunctionRegistry.standard(), ParserOptions.defaults());
	}

	public ExprParser(String expression, FunctionRegistry functions, ParserOptions options) {
		this.lexer = new ExprLexer(expression, functions);
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * Parses the whole input into an AST.
	 *
	 * @return the root of the parsed tree
	 * @throws ExprParseException on the first syntax error, or when tokens remain after a complete expression
	 */
	public AstNode parse() {
		lexer.reset();
		depth = 0;
		advance();

		AstNode result = parseExpression();
		expect(ExprToken.TokenType.EOF, "Expected end of input");
		return result;
	}

	private AstNode parseExpression() {
		return parseTerm();
	}

	private AstNode parseTerm() {
		int entryDepth = depth;
		AstNode left = parseFactor();

		while (current.isType(ExprToken.TokenType.PLUS) || current.isType(ExprToken.TokenType.MINUS)) {
			BinaryOperator op = current.isType(ExprToken.TokenType.PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
			descend(current.position());
			advance();
			AstNode right = parseFactor();
			left = new AstNode.BinaryOpNode(op, left, right);
		}

		depth = entryDepth;
		return left;
	}

	private AstNode parseFactor() {
		int entryDepth = depth;
		AstNode left = parsePower();

		while (current.isType(ExprToken.TokenType.MULTIPLY) || current.isType(ExprToken.TokenType.DIVIDE)
				|| current.startsFactor()) {
			// each link nests the chain built so far one level deeper
			descend(current.position());
			BinaryOperator op;
			if (current.isType(ExprToken.TokenType.MULTIPLY)) {
				op = BinaryOperator.MULTIPLY;
				advance();
			} else if (current.isType(ExprToken.TokenType.DIVIDE)) {
				op = BinaryOperator.DIVIDE;
				advance();
			} else {
				// implicit multiplication
				op = BinaryOperator.MULTIPLY;
			}

			AstNode right = parsePower();
			left = new AstNode.BinaryOpNode(op, left, right);
		}

		depth = entryDepth;
		return left;
	}

	private AstNode parsePower() {
		AstNode base = parsePrimary();

		if (current.isType(ExprToken.TokenType.POWER)) {
			int operatorPosition = current.position();
			advance();
			descend(operatorPosition);
			AstNode exponent = parsePower();
			depth--;
			return new AstNode.BinaryOpNode(BinaryOperator.POWER, base, exponent);
		}

		return base;
	}

	private AstNode parsePrimary() {
		ExprToken token = current;

		return switch (token.type()) {
			case NUMBER -> {
				advance();
				yield new AstNode.NumberNode(parseNumber(token));
			}
			case VARIABLE -> {
				advance();
				yield new AstNode.VariableNode(token.value());
			}
			case FUNCTION -> parseFunction();
			case LPAREN -> {
				advance();
				descend(token.position());
				AstNode inner = parseExpression();
				depth--;
				expect(ExprToken.TokenType.RPAREN, "Expected closing parenthesis");
				advance();
				yield inner;
			}
			case PLUS, MINUS -> {
				UnaryOperator op = token.isType(ExprToken.TokenType.PLUS) ? UnaryOperator.PLUS : UnaryOperator.MINUS;
				advance();
				descend(token.position());
				AstNode operand = parsePrimary();
				depth--;
				yield new AstNode.UnaryOpNode(op, operand);
			}
			case EOF -> throw new ExprParseException(
					"Unexpected end of input at position " + token.position(), token.position());
			case INVALID -> throw new ExprParseException(
					"Invalid character '" + token.value() + "' at position " + token.position(), token.position());
			default -> throw new ExprParseException(
					"Unexpected token '" + token.value() + "' at position " + token.position(), token.position());
		};
	}

	private AstNode parseFunction() {
		ExprToken nameToken = current;
		advance();

		expect(ExprToken.TokenType.LPAREN, "Expected '(' after function name '" + nameToken.value() + "'");
		advance();
		descend(nameToken.position());

		List<AstNode> arguments = new ArrayList<>();
		if (!current.isType(ExprToken.TokenType.RPAREN)) {
			arguments.add(parseExpression());
			while (current.isType(ExprToken.TokenType.COMMA)) {
				advance();
				arguments.add(parseExpression());
			}
		}

		depth--;
		expect(ExprToken.TokenType.RPAREN, "Expected closing parenthesis");
		advance();
		return new AstNode.FunctionNode(nameToken.value(), arguments);
	}

	private double parseNumber(ExprToken token) {
		String text = token.value();
		int exponentIndex = Math.max(text.indexOf('e'), text.indexOf('E'));
		if (exponentIndex >= 0 && !hasDigitAfter(text, exponentIndex)) {
			// a dangling exponent marker contributes nothing to the value
			text = text.substring(0, exponentIndex);
		}
		try {
			return Double.parseDouble(text);
		} catch (NumberFormatException e) {
			throw new ExprParseException(
					"Invalid number '" + token.value() + "' at position " + token.position(), token.position(), e);
		}
	}

	private static boolean hasDigitAfter(String text, int index) {
		for (int i = index + 1; i < text.length(); i++) {
			if (Character.isDigit(text.charAt(i))) {
				return true;
			}
		}
		return false;
	}

	private void descend(int position) {
		if (++depth > options.maxNestingDepth()) {
			throw new ExprParseException("Expression nesting exceeds maximum depth of "
					+ options.maxNestingDepth() + " at position " + position, position);
		}
	}

	private void advance() {
		current = lexer.nextToken();
	}

	private void expect(ExprToken.TokenType type, String message) {
		if (!current.isType(type)) {
			String found = current.isType(ExprToken.TokenType.EOF) ? "end of input" : "'" + current.value() + "'";
			throw new ExprParseException(
					message + " at position " + current.position() + ", found " + found, current.position());
		}
	}
}
