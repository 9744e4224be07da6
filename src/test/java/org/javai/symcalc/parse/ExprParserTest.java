package org.javai.symcalc.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.javai.symcalc.ast.AstNode;
import org.javai.symcalc.ast.AstNode.BinaryOpNode;
import org.javai.symcalc.ast.AstNode.BinaryOperator;
import org.javai.symcalc.ast.AstNode.FunctionNode;
import org.javai.symcalc.ast.AstNode.NumberNode;
import org.javai.symcalc.ast.AstNode.UnaryOpNode;
import org.javai.symcalc.ast.AstNode.UnaryOperator;
import org.javai.symcalc.ast.AstNode.VariableNode;
import org.javai.symcalc.math.FunctionRegistry;
import org.javai.symcalc.math.MathFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExprParserTest {

	private static AstNode parse(String text) {
		return new ExprParser(text).parse();
	}

	private static AstNode num(double value) {
		return new NumberNode(value);
	}

	private static AstNode var(String name) {
		return new VariableNode(name);
	}

	private static AstNode bin(BinaryOperator op, AstNode left, AstNode right) {
		return new BinaryOpNode(op, left, right);
	}

	@Nested
	@DisplayName("precedence and associativity")
	class Precedence {

		@Test
		void multiplicationBindsTighterThanAddition() {
			assertThat(parse("1 + 2 * 3")).isEqualTo(
					bin(BinaryOperator.ADD, num(1), bin(BinaryOperator.MULTIPLY, num(2), num(3))));
		}

		@Test
		void subtractionIsLeftAssociative() {
			assertThat(parse("a - b - c")).isEqualTo(
					bin(BinaryOperator.SUBTRACT, bin(BinaryOperator.SUBTRACT, var("a"), var("b")), var("c")));
		}

		@Test
		void divisionIsLeftAssociative() {
			assertThat(parse("8 / 4 / 2").evaluate()).isEqualTo(1.0);
		}

		@Test
		void powerIsRightAssociative() {
			assertThat(parse("2 ^ 3 ^ 2")).isEqualTo(
					bin(BinaryOperator.POWER, num(2), bin(BinaryOperator.POWER, num(3), num(2))));
			assertThat(parse("2^3^2").evaluate()).isEqualTo(512.0);
		}

		@Test
		void powerBindsTighterThanMultiplication() {
			assertThat(parse("2 * x ^ 2")).isEqualTo(
					bin(BinaryOperator.MULTIPLY, num(2), bin(BinaryOperator.POWER, var("x"), num(2))));
		}

		@Test
		void parenthesesOverridePrecedence() {
			assertThat(parse("(1 + 2) * 3").evaluate()).isEqualTo(9.0);
		}

		@Test
		@DisplayName("a prefix sign applies to the primary, so -x^2 is (-x)^2")
		void unarySignBindsTighterThanPower() {
			assertThat(parse("-x^2")).isEqualTo(
					bin(BinaryOperator.POWER, new UnaryOpNode(UnaryOperator.MINUS, var("x")), num(2)));
		}

		@Test
		void repeatedSigns() {
			assertThat(parse("--3")).isEqualTo(
					new UnaryOpNode(UnaryOperator.MINUS, new UnaryOpNode(UnaryOperator.MINUS, num(3))));
			assertThat(parse("+x")).isEqualTo(new UnaryOpNode(UnaryOperator.PLUS, var("x")));
		}
	}

	@Nested
	@DisplayName("implicit multiplication")
	class ImplicitMultiplication {

		@Test
		void numberTimesVariable() {
			assertThat(parse("2x")).isEqualTo(bin(BinaryOperator.MULTIPLY, num(2), var("x")));
		}

		@Test
		void numberTimesParenthesised() {
			assertThat(parse("3(x + 1)")).isEqualTo(
					bin(BinaryOperator.MULTIPLY, num(3), bin(BinaryOperator.ADD, var("x"), num(1))));
		}

		@Test
		void variableTimesFunction() {
			assertThat(parse("x sin(x)")).isEqualTo(
					bin(BinaryOperator.MULTIPLY, var("x"), new FunctionNode("sin", List.of(var("x")))));
		}

		@Test
		void juxtapositionHasProductPrecedence() {
			assertThat(parse("2x^2 + 1").evaluate(Map.of("x", 3.0))).isEqualTo(19.0);
		}

		@Test
		void minusAfterFactorIsSubtraction() {
			assertThat(parse("x -1")).isEqualTo(bin(BinaryOperator.SUBTRACT, var("x"), num(1)));
		}

		@Test
		void unregisteredNameFollowedByParenthesisMultiplies() {
			AstNode ast = new ExprParser("cos(x)", FunctionRegistry.of(MathFunction.SIN), ParserOptions.defaults())
					.parse();

			assertThat(ast).isEqualTo(bin(BinaryOperator.MULTIPLY, var("cos"), var("x")));
		}
	}

	@Nested
	@DisplayName("functions")
	class Functions {

		@Test
		void singleArgument() {
			assertThat(parse("sqrt(16)")).isEqualTo(new FunctionNode("sqrt", List.of(num(16))));
		}

		@Test
		void multipleArguments() {
			assertThat(parse("sin(x, 2)")).isEqualTo(new FunctionNode("sin", List.of(var("x"), num(2))));
		}

		@Test
		void noArguments() {
			assertThat(parse("abs()")).isEqualTo(new FunctionNode("abs", List.of()));
		}

		@Test
		void nestedCalls() {
			assertThat(parse("ln(abs(-2))").evaluate()).isEqualTo(Math.log(2));
		}

		@Test
		void missingParenthesisAfterName() {
			assertThatThrownBy(() -> parse("sin x"))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Expected '(' after function name 'sin' at position 4, found 'x'");
		}
	}

	@Nested
	@DisplayName("numbers")
	class Numbers {

		@Test
		void scientificNotation() {
			assertThat(parse("1.5e3")).isEqualTo(num(1500));
		}

		@Test
		void danglingExponentIsIgnored() {
			assertThat(parse("2e")).isEqualTo(num(2));
		}

		@Test
		void leadingDecimalPoint() {
			assertThat(parse(".25")).isEqualTo(num(0.25));
		}
	}

	@Nested
	@DisplayName("errors")
	class Errors {

		@Test
		void emptyInput() {
			assertThatThrownBy(() -> parse(""))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Unexpected end of input at position 0");
		}

		@Test
		void danglingOperator() {
			assertThatThrownBy(() -> parse("2 +"))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Unexpected end of input at position 3")
					.extracting(e -> ((ExprParseException) e).position())
					.isEqualTo(3);
		}

		@Test
		void unclosedParenthesis() {
			assertThatThrownBy(() -> parse("(x + 1"))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Expected closing parenthesis at position 6, found end of input");
		}

		@Test
		void strayClosingParenthesis() {
			assertThatThrownBy(() -> parse("x + 1)"))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Expected end of input at position 5, found ')'");
		}

		@Test
		void invalidCharacterAtStart() {
			assertThatThrownBy(() -> parse("$x"))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Invalid character '$' at position 0");
		}

		@Test
		void invalidCharacterAfterOperand() {
			assertThatThrownBy(() -> parse("x $ y"))
					.isInstanceOf(ExprParseException.class)
					.hasMessageContaining("position 2");
		}

		@Test
		void unexpectedToken() {
			assertThatThrownBy(() -> parse("* 2"))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Unexpected token '*' at position 0");
		}

		@Test
		void trailingComma() {
			assertThatThrownBy(() -> parse("sin(x,)"))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Unexpected token ')' at position 6");
		}
	}

	@Nested
	@DisplayName("nesting depth")
	class NestingDepth {

		private AstNode parseWithDepth(String text, int depth) {
			return new ExprParser(text, FunctionRegistry.standard(), new ParserOptions(depth)).parse();
		}

		@Test
		void withinLimitParses() {
			assertThat(parseWithDepth("((x))", 2)).isEqualTo(var("x"));
		}

		@Test
		void parenthesesBeyondLimitFail() {
			assertThatThrownBy(() -> parseWithDepth("(((x)))", 2))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Expression nesting exceeds maximum depth of 2 at position 2");
		}

		@Test
		void powerChainCountsTowardsLimit() {
			assertThatThrownBy(() -> parseWithDepth("2^2^2^2", 2))
					.isInstanceOf(ExprParseException.class)
					.hasMessageContaining("maximum depth of 2");
		}

		@Test
		void signsCountTowardsLimit() {
			assertThatThrownBy(() -> parseWithDepth("---x", 2))
					.isInstanceOf(ExprParseException.class);
		}

		@Test
		void deeplyNestedInputFailsWithoutOverflowingTheStack() {
			String text = "(".repeat(100_000) + "x" + ")".repeat(100_000);

			assertThatThrownBy(() -> parse(text))
					.isInstanceOf(ExprParseException.class)
					.hasMessageContaining("maximum depth of " + ParserOptions.DEFAULT_MAX_NESTING_DEPTH);
		}

		@Test
		void siblingGroupsDoNotAccumulate() {
			assertThat(parseWithDepth("(x) + (y) + (z)", 3)).isNotNull();
		}

		@Test
		void shortChainWithinLimitParses() {
			assertThat(parseWithDepth("x + y - z", 2))
					.isEqualTo(bin(BinaryOperator.SUBTRACT, bin(BinaryOperator.ADD, var("x"), var("y")), var("z")));
		}

		@Test
		void chainLinksCountTowardsLimit() {
			assertThatThrownBy(() -> parseWithDepth("x + y - z", 1))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Expression nesting exceeds maximum depth of 1 at position 6");
		}

		@Test
		void longFlatSumFailsAtFirstLinkBeyondLimit() {
			String text = "x" + "+x".repeat(200_000);

			assertThatThrownBy(() -> parse(text))
					.isInstanceOf(ExprParseException.class)
					.hasMessage("Expression nesting exceeds maximum depth of 256 at position 513");
		}

		@Test
		void longProductsFail() {
			assertThatThrownBy(() -> parse("x" + "*x".repeat(300)))
					.isInstanceOf(ExprParseException.class)
					.hasMessageContaining("maximum depth of 256");
			assertThatThrownBy(() -> parse("x" + " x".repeat(300)))
					.isInstanceOf(ExprParseException.class)
					.hasMessageContaining("maximum depth of 256");
		}

		@Test
		void sumOfTermsAtLimitParses() {
			AstNode sum = parse("1" + "+1".repeat(ParserOptions.DEFAULT_MAX_NESTING_DEPTH));

			assertThat(sum.evaluate(Map.of())).isEqualTo(257.0);
		}
	}

	@Nested
	@DisplayName("round trip")
	class RoundTrip {

		@Test
		void printedTreeParsesBackToEqualTree() {
			List<String> inputs = List.of(
					"x^2 + 3x - 5",
					"sin(x) * cos(x) / 2",
					"-x^2",
					"--3 + +y",
					"2^3^2",
					"sqrt(abs(x - 0.125))",
					"f1 + sin(x, y)",
					"1.5e-3 * x",
					"ln(x) / (x + 1)^2");

			for (String text : inputs) {
				AstNode ast = parse(text);

				assertThat(parse(ast.toString())).as(text).isEqualTo(ast);
			}
		}
	}

	@Test
	void parseCanBeRepeated() {
		ExprParser parser = new ExprParser("x + 1");

		assertThat(parser.parse()).isEqualTo(parser.parse());
	}
}
