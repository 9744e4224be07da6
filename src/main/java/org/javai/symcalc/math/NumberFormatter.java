package org.javai.symcalc.math;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Renders doubles for display.
 * <p>
 * {@link #format(double)} follows the conventions of C's {@code %g}: the value is rounded
 * to a fixed number of significant digits, printed in plain notation when its decimal
 * exponent lies in {@code [-5, digits)} and in scientific notation ({@code 1.5e+07})
 * otherwise, with trailing zeros removed.
 */
public final class NumberFormatter {

	public static final int DEFAULT_SIGNIFICANT_DIGITS = 6;

	public static final NumberFormatter DEFAULT = new NumberFormatter(DEFAULT_SIGNIFICANT_DIGITS);

	private final int significantDigits;
	private final MathContext mathContext;

	public NumberFormatter(int significantDigits) {
		if (significantDigits < 1 || significantDigits > 17) {
			throw new IllegalArgumentException("significantDigits must be between 1 and 17, got " + significantDigits);
		}
		this.significantDigits = significantDigits;
		this.mathContext = new MathContext(significantDigits, RoundingMode.HALF_EVEN);
	}

	public int significantDigits() {
		return significantDigits;
	}

	/**
	 * Formats a value rounded to this formatter's significant digits.
	 */
	public String format(double value) {
		String special = special(value);
		if (special != null) {
			return special;
		}
		if (value == 0.0) {
			return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
		}

		BigDecimal rounded = new BigDecimal(value).round(mathContext);
		int exponent = rounded.precision() - rounded.scale() - 1;
		if (exponent < -4 || exponent >= significantDigits) {
			String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
			int magnitude = Math.abs(exponent);
			return mantissa + "e" + (exponent < 0 ? "-" : "+") + (magnitude < 10 ? "0" : "") + magnitude;
		}
		return rounded.stripTrailingZeros().toPlainString();
	}

	/**
	 * Formats a multiplicative coefficient: whole numbers print without a fraction
	 * regardless of magnitude, anything else as {@link #format(double)}.
	 */
	public String formatCoefficient(double value) {
		if (Double.isFinite(value) && Math.floor(value) == value && Math.abs(value) < 9.0e18) {
			return Long.toString((long) value);
		}
		return format(value);
	}

	/**
	 * Formats a value without losing precision, so that parsing the text yields the same double.
	 * Never uses an exponent, which keeps the text within the expression grammar.
	 */
	public static String lossless(double value) {
		String special = special(value);
		if (special != null) {
			return special;
		}
		if (Math.rint(value) == value && Math.abs(value) < 1.0e15) {
			return Long.toString((long) value);
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

	private static String special(double value) {
		if (Double.isNaN(value)) {
			return "nan";
		}
		if (Double.isInfinite(value)) {
			return value > 0 ? "inf" : "-inf";
		}
		return null;
	}
}
