package org.javai.symcalc.parse;

/**
 * A token of the infix expression language.
 *
 * @param type the token type
 * @param value the literal text of the token (empty for {@link TokenType#EOF})
 * @param position the character offset of the token in the input string
 */
public record ExprToken(TokenType type, String value, int position) {

	public enum TokenType {
		NUMBER,        // 3, 2.5, .5, 1e-3
		VARIABLE,      // any identifier not in the function registry
		FUNCTION,      // registered function names: sin, cos, ...
		PLUS,          // +
		MINUS,         // -
		MULTIPLY,      // *
		DIVIDE,        // /
		POWER,         // ^
		LPAREN,        // (
		RPAREN,        // )
		COMMA,         // ,
		EOF,           // end of input
		INVALID        // any other character
	}

	@Override
	public String toString() {
		return switch (type) {
			case NUMBER, VARIABLE, FUNCTION, INVALID -> type + "(" + value + ")@" + position;
			default -> type + "@" + position;
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	/**
	 * Whether this token can begin a factor, which is what triggers implicit multiplication.
	 */
	public boolean startsFactor() {
		return switch (type) {
			case NUMBER, VARIABLE, FUNCTION, LPAREN -> true;
			default -> false;
		};
	}
}
