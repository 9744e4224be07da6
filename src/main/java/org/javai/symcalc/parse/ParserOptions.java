package org.javai.symcalc.parse;

/**
 * Tuning knobs for {@link ExprParser}.
 *
 * @param maxNestingDepth how deeply parentheses, prefix signs, function calls and
 *                        operator chains may nest
 */
public record ParserOptions(int maxNestingDepth) {

	public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

	public ParserOptions {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
		}
	}

	public static ParserOptions defaults() {
		return new ParserOptions(DEFAULT_MAX_NESTING_DEPTH);
	}
}
