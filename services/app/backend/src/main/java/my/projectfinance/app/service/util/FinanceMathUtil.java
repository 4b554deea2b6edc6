package my.projectfinance.app.service.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

public final class FinanceMathUtil {
	public static final int MONEY_SCALE = 2;
	public static final int DIVISION_SCALE = 10;
	public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
	private static final MathContext GROWTH_CONTEXT = MathContext.DECIMAL128;

	private FinanceMathUtil() {
	}

	public static BigDecimal money(BigDecimal value) {
		return value == null ? BigDecimal.ZERO.setScale(MONEY_SCALE) : value.setScale(MONEY_SCALE, ROUNDING);
	}

	public static BigDecimal times(BigDecimal amount, double factor) {
		return money(amount.multiply(BigDecimal.valueOf(factor)));
	}

	public static BigDecimal dividedBy(BigDecimal amount, double divisor) {
		return amount.divide(BigDecimal.valueOf(divisor), MONEY_SCALE, ROUNDING);
	}

	/**
	 * Level payment that retires {@code presentValue} over {@code periods} at {@code rate} per period.
	 */
	public static BigDecimal pmt(double rate, int periods, BigDecimal presentValue) {
		if (periods <= 0) {
			return money(BigDecimal.ZERO);
		}
		if (rate == 0.0) {
			return presentValue.divide(BigDecimal.valueOf(periods), MONEY_SCALE, ROUNDING);
		}
		BigDecimal r = BigDecimal.valueOf(rate);
		BigDecimal growth = BigDecimal.ONE.add(r).pow(periods, GROWTH_CONTEXT);
		return presentValue.multiply(r).multiply(growth)
				.divide(growth.subtract(BigDecimal.ONE), MONEY_SCALE, ROUNDING);
	}

	/**
	 * Present value at index {@code from} of {@code values[from..to]}, discounting value {@code k} by
	 * {@code (1 + rate)^(k - from)}.
	 */
	public static BigDecimal npv(List<BigDecimal> values, int from, int to, double rate) {
		return npvBetween(values, from, from, to, rate);
	}

	public static BigDecimal npvBetween(List<BigDecimal> values, int anchor, int from, int to, double rate) {
		BigDecimal total = BigDecimal.ZERO;
		if (from > to) {
			return total;
		}
		BigDecimal step = BigDecimal.ONE.add(BigDecimal.valueOf(rate));
		BigDecimal factor = step.pow(from - anchor, GROWTH_CONTEXT);
		for (int k = from; k <= to && k < values.size(); k++) {
			total = total.add(values.get(k).divide(factor, DIVISION_SCALE, ROUNDING));
			factor = factor.multiply(step, GROWTH_CONTEXT);
		}
		return total;
	}

	public static double ratio(BigDecimal numerator, BigDecimal denominator) {
		return numerator.divide(denominator, DIVISION_SCALE, ROUNDING).doubleValue();
	}

	public static boolean isPositive(BigDecimal value) {
		return value != null && value.signum() > 0;
	}
}
