package org.javai.symcalc.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.symcalc.math.FunctionRegistry;

/**
 * Streams tokens from infix expression text.
 * <p>
 * The lexer never throws: a character it does not recognise becomes an
 * {@link ExprToken.TokenType#INVALID} token and the parser decides what to do with it.
 * Once the input is exhausted every further call to {@link #nextToken()} returns EOF.
 */
public class ExprLexer {

	private final String input;
	private final FunctionRegistry functions;
	private int pos = 0;

	public ExprLexer(String input) {
		this(input, FunctionRegistry.standard());
	}

	public ExprLexer(String input, FunctionRegistry functions) {
		this.input = input != null ? input : "";
		this.functions = Objects.requireNonNull(functions, "functions must not be null");
	}

	/**
	 * Tokenizes the remaining input.
	 *
	 * @return list of tokens, always terminated by a single EOF token
	 */
	public List<ExprToken> tokenize() {
		List<ExprToken> tokens = new ArrayList<>();
		ExprToken token;
		do {
			token = nextToken();
			tokens.add(token);
		} while (token.type() != ExprToken.TokenType.EOF);
		return tokens;
	}

	/**
	 * Scans the next token.
	 */
	public ExprToken nextToken() {
		skipWhitespace();
		if (isAtEnd()) {
			return new ExprToken(ExprToken.TokenType.EOF, "", pos);
		}

		int start = pos;
		char c = peek();
		if (isDigit(c) || c == '.') {
			return scanNumber();
		}
		if (isIdentifierStart(c)) {
			return scanIdentifier();
		}

		advance();
		return switch (c) {
			case '+' -> new ExprToken(ExprToken.TokenType.PLUS, "+", start);
			case '-' -> new ExprToken(ExprToken.TokenType.MINUS, "-", start);
			case '*' -> new ExprToken(ExprToken.TokenType.MULTIPLY, "*", start);
			case '/' -> new ExprToken(ExprToken.TokenType.DIVIDE, "/", start);
			case '^' -> new ExprToken(ExprToken.TokenType.POWER, "^", start);
			case '(' -> new ExprToken(ExprToken.TokenType.LPAREN, "(", start);
			case ')' -> new ExprToken(ExprToken.TokenType.RPAREN, ")", start);
			case ',' -> new ExprToken(ExprToken.TokenType.COMMA, ",", start);
			default -> new ExprToken(ExprToken.TokenType.INVALID, String.valueOf(c), start);
		};
	}

	/**
	 * Rewinds to the start of the input so the same text can be scanned again.
	 */
	public void reset() {
		pos = 0;
	}

	/**
	 * Current scan offset.
	 */
	public int position() {
		return pos;
	}

	private ExprToken scanNumber() {
		int start = pos;
		boolean seenDecimalPoint = false;

		while (!isAtEnd()) {
			char c = peek();
			if (isDigit(c)) {
				advance();
			} else if (c == '.' && !seenDecimalPoint) {
				seenDecimalPoint = true;
				advance();
			} else if (c == 'e' || c == 'E') {
				// exponent: consumed greedily even when no digits follow
				advance();
				if (!isAtEnd() && (peek() == '+' || peek() == '-')) {
					advance();
				}
				while (!isAtEnd() && isDigit(peek())) {
					advance();
				}
				break;
			} else {
				break;
			}
		}

		return new ExprToken(ExprToken.TokenType.NUMBER, input.substring(start, pos), start);
	}

	private ExprToken scanIdentifier() {
		int start = pos;
		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		ExprToken.TokenType type = functions.contains(value)
				? ExprToken.TokenType.FUNCTION
				: ExprToken.TokenType.VARIABLE;
		return new ExprToken(type, value, start);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return input.charAt(pos);
	}

	private void advance() {
		pos++;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
