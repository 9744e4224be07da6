package org.javai.symcalc.math;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup of the function names recognised by the lexer and the evaluators.
 * <p>
 * The registry is built once and handed to the components that need it; it carries
 * no mutable state, so a single instance may be shared freely.
 */
public final class FunctionRegistry {

	private static final FunctionRegistry STANDARD = new FunctionRegistry(MathFunction.values());

	private final Map<String, MathFunction> functions;

	private FunctionRegistry(MathFunction... functions) {
		Map<String, MathFunction> byName = new LinkedHashMap<>();
		for (MathFunction function : functions) {
			Objects.requireNonNull(function, "function must not be null");
			byName.put(function.functionName(), function);
		}
		this.functions = Collections.unmodifiableMap(byName);
	}

	/**
	 * The registry of all built-in functions: sin, cos, tan, log, ln, sqrt, abs.
	 */
	public static FunctionRegistry standard() {
		return STANDARD;
	}

	/**
	 * A registry restricted to the given functions.
	 */
	public static FunctionRegistry of(MathFunction... functions) {
		if (functions == null || functions.length == 0) {
			throw new IllegalArgumentException("At least one function is required");
		}
		return new FunctionRegistry(Arrays.copyOf(functions, functions.length));
	}

	public boolean contains(String name) {
		return name != null && functions.containsKey(name);
	}

	public Optional<MathFunction> lookup(String name) {
		return name == null ? Optional.empty() : Optional.ofNullable(functions.get(name));
	}

	public Set<String> names() {
		return functions.keySet();
	}

	@Override
	public String toString() {
		return "FunctionRegistry" + functions.keySet();
	}
}
