package org.javai.symcalc.engine;

import org.javai.symcalc.math.NumberFormatter;
import org.javai.symcalc.parse.ParserOptions;

/**
 * Settings shared by the engine facades.
 *
 * @param defaultVariable variable used by operations called without one
 * @param maxNestingDepth parser limit on nested parentheses, signs, calls and powers
 * @param significantDigits digits kept when numbers are displayed
 */
public record EngineConfig(String defaultVariable, int maxNestingDepth, int significantDigits) {

	public static final String DEFAULT_VARIABLE = "x";

	public EngineConfig {
		if (defaultVariable == null || !defaultVariable.matches("[A-Za-z_][A-Za-z0-9_]*")) {
			throw new EngineConfigException("default-variable must be an identifier, got: " + defaultVariable);
		}
		if (maxNestingDepth < 1) {
			throw new EngineConfigException("max-nesting-depth must be positive, got: " + maxNestingDepth);
		}
		if (significantDigits < 1 || significantDigits > 17) {
			throw new EngineConfigException("significant-digits must be between 1 and 17, got: " + significantDigits);
		}
	}

	public static EngineConfig defaults() {
		return new EngineConfig(DEFAULT_VARIABLE, ParserOptions.DEFAULT_MAX_NESTING_DEPTH,
				NumberFormatter.DEFAULT_SIGNIFICANT_DIGITS);
	}

	public ParserOptions parserOptions() {
		return new ParserOptions(maxNestingDepth);
	}

	public NumberFormatter numberFormatter() {
		return new NumberFormatter(significantDigits);
	}
}
