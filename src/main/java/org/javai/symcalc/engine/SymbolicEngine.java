package org.javai.symcalc.engine;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.javai.symcalc.ast.AstEvaluator;
import org.javai.symcalc.ast.AstNode;
import org.javai.symcalc.math.EvaluationException;
import org.javai.symcalc.math.FunctionRegistry;
import org.javai.symcalc.parse.ExprParseException;
import org.javai.symcalc.parse.ExprParser;
import org.javai.symcalc.symbolic.AstToSymbolicConverter;
import org.javai.symcalc.symbolic.SymbolicEvaluator;
import org.javai.symcalc.symbolic.SymbolicExpression;
import org.javai.symcalc.symbolic.SymbolicPrinter;
import org.javai.symcalc.symbolic.TransformException;
import org.javai.symcalc.symbolic.rewrite.Differentiator;
import org.javai.symcalc.symbolic.rewrite.EquationSolver;
import org.javai.symcalc.symbolic.rewrite.Factorizer;
import org.javai.symcalc.symbolic.rewrite.Integrator;
import org.javai.symcalc.symbolic.rewrite.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to the symbolic engine.
 * <p>
 * The engine can be used in two ways. Stateless operations take the tree to work on and
 * return a {@link CasResult}:
 *
 * <pre>
 * SymbolicEngine engine = new SymbolicEngine();
 * CasResult&lt;AstNode&gt; ast = engine.parse("x^2 + 3x");
 * CasResult&lt;SymbolicExpression&gt; expr = engine.convertToSymbolic(ast.orElseThrow());
 * CasResult&lt;SymbolicExpression&gt; derivative = engine.differentiate(expr.orElseThrow(), "x");
 * </pre>
 *
 * Alternatively an expression can be held by the engine and operated on repeatedly:
 *
 * <pre>
 * if (engine.parseFromString("sin(x)")) {
 *     CasResult&lt;SymbolicExpression&gt; derivative = engine.differentiate("x");
 *     derivative.value().map(engine::simplify).ifPresent(simplified -&gt; ...);
 * }
 * </pre>
 *
 * No operation lets a parse, evaluation or transformation failure escape as an exception;
 * every failure is returned as a {@link CasResult.Failure} for that call alone. Trees
 * produced by {@link #parse(String)} are bounded in depth by
 * {@link EngineConfig#maxNestingDepth()}; trees assembled by hand are taken as given.
 * <p>
 * The no-argument constructor reads {@link EngineConfigLoader#DEFAULT_RESOURCE} from the
 * classpath.
 */
public class SymbolicEngine {

	private static final Logger logger = LoggerFactory.getLogger(SymbolicEngine.class);

	private final EngineConfig config;
	private final FunctionRegistry functions;
	private final SymbolicPrinter printer;

	private SymbolicExpression expression;
	private CasError lastError;

	public SymbolicEngine() {
		this(new EngineConfigLoader().loadDefaults());
	}

	public SymbolicEngine(EngineConfig config) {
		this(config, FunctionRegistry.standard());
	}

	public SymbolicEngine(EngineConfig config, FunctionRegistry functions) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.functions = Objects.requireNonNull(functions, "functions must not be null");
		this.printer = new SymbolicPrinter(config.numberFormatter());
	}

	public EngineConfig config() {
		return config;
	}

	// ------------------------------------------------------------------
	// Stateless operations
	// ------------------------------------------------------------------

	public CasResult<AstNode> parse(String text) {
		try {
			AstNode ast = new ExprParser(text, functions, config.parserOptions()).parse();
			logger.debug("Parsed '{}' as {}", text, ast);
			return CasResult.success(ast);
		} catch (ExprParseException e) {
			logger.debug("Failed to parse '{}': {}", text, e.getMessage());
			return CasResult.failure(CasError.parse(e));
		}
	}

	public CasResult<Double> evaluate(AstNode ast, Map<String, Double> bindings) {
		Objects.requireNonNull(ast, "ast must not be null");
		try {
			return CasResult.success(ast.accept(new AstEvaluator(bindings, functions)));
		} catch (EvaluationException e) {
			logger.debug("Failed to evaluate {}: {}", ast, e.getMessage());
			return CasResult.failure(CasError.evaluation(e));
		}
	}

	public CasResult<Double> evaluate(SymbolicExpression expr, Map<String, Double> bindings) {
		Objects.requireNonNull(expr, "expr must not be null");
		try {
			return CasResult.success(expr.accept(new SymbolicEvaluator(bindings, functions)));
		} catch (EvaluationException e) {
			logger.debug("Failed to evaluate {}: {}", expr, e.getMessage());
			return CasResult.failure(CasError.evaluation(e));
		}
	}

	public CasResult<SymbolicExpression> convertToSymbolic(AstNode ast) {
		return transform("Conversion", ast, () -> AstToSymbolicConverter.convert(ast));
	}

	public CasResult<SymbolicExpression> differentiate(SymbolicExpression expr, String variable) {
		Objects.requireNonNull(variable, "variable must not be null");
		return transform("Differentiation", expr, () -> Differentiator.differentiate(required(expr), variable));
	}

	public CasResult<SymbolicExpression> integrate(SymbolicExpression expr, String variable) {
		Objects.requireNonNull(variable, "variable must not be null");
		return transform("Integration", expr, () -> Integrator.integrate(required(expr), variable));
	}

	public CasResult<SymbolicExpression> simplify(SymbolicExpression expr) {
		return transform("Simplification", expr, () -> Simplifier.simplify(required(expr)));
	}

	public CasResult<SymbolicExpression> solve(SymbolicExpression expr, String variable) {
		Objects.requireNonNull(variable, "variable must not be null");
		return transform("Solving", expr, () -> EquationSolver.solve(required(expr), variable));
	}

	public CasResult<List<SymbolicExpression>> factor(SymbolicExpression expr) {
		return transform("Factoring", expr, () -> Factorizer.factor(required(expr)));
	}

	/**
	 * Renders an expression using the configured number of significant digits.
	 */
	public String toDisplayString(SymbolicExpression expr) {
		return printer.print(expr);
	}

	/**
	 * Parses {@code text} and reports its derivative and integral with respect to {@code variable}.
	 * Only a parse failure fails the analysis as a whole.
	 */
	public CasResult<ExpressionAnalysis> analyze(String text, String variable) {
		Objects.requireNonNull(variable, "variable must not be null");
		CasResult<AstNode> parsed = parse(text);
		if (parsed instanceof CasResult.Failure<AstNode> failure) {
			return CasResult.failure(failure.cause());
		}
		CasResult<SymbolicExpression> converted = convertToSymbolic(parsed.orElseThrow());
		if (converted instanceof CasResult.Failure<SymbolicExpression> failure) {
			return CasResult.failure(failure.cause());
		}

		SymbolicExpression expr = converted.orElseThrow();
		ExpressionAnalysis.Step derivative = step(differentiate(expr, variable));
		ExpressionAnalysis.Step integral = step(integrate(expr, variable));
		return CasResult.success(new ExpressionAnalysis(text, variable, expr, derivative, integral));
	}

	public CasResult<ExpressionAnalysis> analyze(String text) {
		return analyze(text, config.defaultVariable());
	}

	private ExpressionAnalysis.Step step(CasResult<SymbolicExpression> raw) {
		if (raw instanceof CasResult.Failure<SymbolicExpression> failure) {
			return ExpressionAnalysis.Step.failed(null, failure.cause());
		}
		SymbolicExpression result = raw.orElseThrow();
		CasResult<SymbolicExpression> simplified = simplify(result);
		if (simplified instanceof CasResult.Failure<SymbolicExpression> failure) {
			return ExpressionAnalysis.Step.failed(result, failure.cause());
		}
		return ExpressionAnalysis.Step.succeeded(result, simplified.orElseThrow());
	}

	// ------------------------------------------------------------------
	// Held expression
	// ------------------------------------------------------------------

	/**
	 * Parses {@code text} and holds the result for subsequent operations.
	 *
	 * @return false if the text does not parse; {@link #getError()} then describes why
	 */
	public boolean parseFromString(String text) {
		CasResult<AstNode> parsed = parse(text);
		if (parsed instanceof CasResult.Failure<AstNode> failure) {
			expression = null;
			lastError = failure.cause();
			return false;
		}
		return parseFromAst(parsed.orElseThrow());
	}

	/**
	 * Converts {@code ast} and holds the result for subsequent operations.
	 */
	public boolean parseFromAst(AstNode ast) {
		CasResult<SymbolicExpression> converted = convertToSymbolic(ast);
		if (converted instanceof CasResult.Failure<SymbolicExpression> failure) {
			expression = null;
			lastError = failure.cause();
			return false;
		}
		expression = converted.orElseThrow();
		lastError = null;
		return true;
	}

	public boolean hasExpression() {
		return expression != null;
	}

	public Optional<SymbolicExpression> expression() {
		return Optional.ofNullable(expression);
	}

	/**
	 * Message of the last failed {@code parseFrom...} call, empty otherwise.
	 */
	public String getError() {
		return lastError != null ? lastError.message() : "";
	}

	public CasResult<SymbolicExpression> differentiate(String variable) {
		return withHeld("differentiate", expr -> differentiate(expr, variable));
	}

	public CasResult<SymbolicExpression> differentiate() {
		return differentiate(config.defaultVariable());
	}

	public CasResult<SymbolicExpression> integrate(String variable) {
		return withHeld("integrate", expr -> integrate(expr, variable));
	}

	public CasResult<SymbolicExpression> integrate() {
		return integrate(config.defaultVariable());
	}

	public CasResult<SymbolicExpression> simplify() {
		return withHeld("simplify", this::simplify);
	}

	public CasResult<SymbolicExpression> solve(String variable) {
		return withHeld("solve", expr -> solve(expr, variable));
	}

	public CasResult<SymbolicExpression> solve() {
		return solve(config.defaultVariable());
	}

	public CasResult<List<SymbolicExpression>> factor() {
		return withHeld("factor", this::factor);
	}

	public CasResult<Double> evaluate(Map<String, Double> bindings) {
		if (expression == null) {
			return CasResult.failure(CasError.of(CasError.Kind.EVALUATION, "No expression to evaluate"));
		}
		return evaluate(expression, bindings);
	}

	@Override
	public String toString() {
		return expression != null ? toDisplayString(expression) : "No expression";
	}

	// ------------------------------------------------------------------

	private <S, T> CasResult<T> transform(String operation, S input, Supplier<T> action) {
		try {
			T result = action.get();
			logger.debug("{} of {} gave {}", operation, input, result);
			return CasResult.success(result);
		} catch (TransformException e) {
			logger.debug("{} of {} failed: {}", operation, input, e.getMessage());
			return CasResult.failure(CasError.transform(e));
		}
	}

	private static SymbolicExpression required(SymbolicExpression expr) {
		if (expr == null) {
			throw new TransformException("No expression given");
		}
		return expr;
	}

	private <T> CasResult<T> withHeld(String operation, Function<SymbolicExpression, CasResult<T>> action) {
		if (expression == null) {
			logger.debug("Cannot {}: no expression held", operation);
			return CasResult.failure(CasError.transform("No expression to " + operation));
		}
		return action.apply(expression);
	}
}
