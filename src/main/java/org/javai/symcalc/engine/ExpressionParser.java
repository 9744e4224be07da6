package org.javai.symcalc.engine;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.symcalc.ast.AstEvaluator;
import org.javai.symcalc.ast.AstNode;
import org.javai.symcalc.math.EvaluationException;
import org.javai.symcalc.math.FunctionRegistry;
import org.javai.symcalc.parse.ExprParseException;
import org.javai.symcalc.parse.ExprParser;
import org.javai.symcalc.parse.ParserOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the most recently parsed expression for callers that parse once and evaluate many
 * times, such as plotters sampling a function.
 * <p>
 * Parse failures are reported through the boolean returned by {@link #parse(String)} and
 * {@link #getError()}; they never escape as exceptions.
 */
public class ExpressionParser {

	private static final Logger logger = LoggerFactory.getLogger(ExpressionParser.class);

	private final FunctionRegistry functions;
	private final ParserOptions options;

	private AstNode ast;
	private CasError lastError;

	/**
	 * Uses the configuration bundled at {@link EngineConfigLoader#DEFAULT_RESOURCE}.
	 */
	public ExpressionParser() {
		this(new EngineConfigLoader().loadDefaults());
	}

	public ExpressionParser(EngineConfig config) {
		this(FunctionRegistry.standard(), config.parserOptions());
	}

	public ExpressionParser(FunctionRegistry functions, ParserOptions options) {
		this.functions = Objects.requireNonNull(functions, "functions must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * Parses {@code expression}, replacing any previously held tree.
	 *
	 * @return true on success; on failure the held tree is cleared and {@link #getError()} describes the problem
	 */
	public boolean parse(String expression) {
		try {
			ast = new ExprParser(expression, functions, options).parse();
			lastError = null;
			logger.debug("Parsed '{}' as {}", expression, ast);
			return true;
		} catch (ExprParseException e) {
			ast = null;
			lastError = CasError.parse(e);
			logger.debug("Failed to parse '{}': {}", expression, e.getMessage());
			return false;
		}
	}

	public ParserOptions options() {
		return options;
	}

	public boolean hasError() {
		return lastError != null;
	}

	/**
	 * Message of the last parse failure, empty after a successful parse.
	 */
	public String getError() {
		return lastError != null ? lastError.message() : "";
	}

	public Optional<CasError> lastError() {
		return Optional.ofNullable(lastError);
	}

	public Optional<AstNode> ast() {
		return Optional.ofNullable(ast);
	}

	public Optional<AstNode> cloneAst() {
		return ast().map(AstNode::copy);
	}

	/**
	 * Evaluates the held tree.
	 */
	public CasResult<Double> evaluate(Map<String, Double> bindings) {
		if (ast == null) {
			return CasResult.failure(CasError.of(CasError.Kind.EVALUATION, "No expression parsed"));
		}
		try {
			return CasResult.success(ast.accept(new AstEvaluator(bindings, functions)));
		} catch (EvaluationException e) {
			return CasResult.failure(CasError.evaluation(e));
		}
	}

	public CasResult<Double> evaluate() {
		return evaluate(Map.of());
	}

	@Override
	public String toString() {
		return ast != null ? ast.toString() : "No expression parsed";
	}
}
