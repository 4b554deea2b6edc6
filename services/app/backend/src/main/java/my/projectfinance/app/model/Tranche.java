package my.projectfinance.app.model;

import my.projectfinance.app.service.util.FinanceMathUtil;

import java.math.BigDecimal;

/**
 * One debt instrument. Rates are per period; tenor and grace are counted in periods
 * from first drawdown.
 */
public record Tranche(String id,
					  Currency currency,
					  BigDecimal principal,
					  double rate,
					  int tenorPeriods,
					  int gracePeriods,
					  AmortizationStyle amortizationStyle,
					  Double targetDscr,
					  double balloonFraction,
					  boolean capitalizeGraceInterest,
					  int priority) {
	public Tranche {
		if (id == null || id.isBlank()) {
			throw new DebtConfigurationException("Tranche id is required");
		}
		if (currency == null) {
			throw new DebtConfigurationException("Tranche currency is required", id);
		}
		if (amortizationStyle == null) {
			throw new DebtConfigurationException("Tranche amortization style is required", id);
		}
		if (!FinanceMathUtil.isPositive(principal)) {
			throw new DebtConfigurationException("principal must be positive (got " + principal + ")", id);
		}
		principal = FinanceMathUtil.money(principal);
		if (!(rate >= 0) || Double.isInfinite(rate)) {
			throw new DebtConfigurationException("rate must not be negative (got " + rate + ")", id);
		}
		if (tenorPeriods < 1) {
			throw new DebtConfigurationException("tenor_periods must be at least 1 (got " + tenorPeriods + ")", id);
		}
		if (gracePeriods < 0 || gracePeriods >= tenorPeriods) {
			throw new DebtConfigurationException("grace_periods must be in [0, " + tenorPeriods + ") (got "
					+ gracePeriods + ")", id);
		}
		if (!(balloonFraction >= 0) || balloonFraction >= 1) {
			throw new DebtConfigurationException("balloon_fraction must be in [0, 1) (got " + balloonFraction + ")", id);
		}
		if (amortizationStyle == AmortizationStyle.SCULPTED && (targetDscr == null || !(targetDscr > 0))) {
			throw new DebtConfigurationException("target_dscr must be positive for sculpted amortization", id);
		}
	}

	public static Tranche annuity(String id, Currency currency, BigDecimal principal, double rate, int tenorPeriods,
								  int gracePeriods) {
		return new Tranche(id, currency, principal, rate, tenorPeriods, gracePeriods,
				AmortizationStyle.ANNUITY, null, 0.0, false, 1);
	}

	public static Tranche sculpted(String id, Currency currency, BigDecimal principal, double rate, int tenorPeriods,
								   int gracePeriods, double targetDscr) {
		return new Tranche(id, currency, principal, rate, tenorPeriods, gracePeriods,
				AmortizationStyle.SCULPTED, targetDscr, 0.0, false, 1);
	}

	public Tranche withPrincipal(BigDecimal value) {
		return new Tranche(id, currency, value, rate, tenorPeriods, gracePeriods, amortizationStyle, targetDscr,
				balloonFraction, capitalizeGraceInterest, priority);
	}

	public Tranche withBalloonFraction(double value) {
		return new Tranche(id, currency, principal, rate, tenorPeriods, gracePeriods, amortizationStyle, targetDscr,
				value, capitalizeGraceInterest, priority);
	}

	public Tranche withCapitalizedGraceInterest(boolean value) {
		return new Tranche(id, currency, principal, rate, tenorPeriods, gracePeriods, amortizationStyle, targetDscr,
				balloonFraction, value, priority);
	}

	public Tranche withPriority(int value) {
		return new Tranche(id, currency, principal, rate, tenorPeriods, gracePeriods, amortizationStyle, targetDscr,
				balloonFraction, capitalizeGraceInterest, value);
	}

	public Tranche asAnnuity() {
		return new Tranche(id, currency, principal, rate, tenorPeriods, gracePeriods, AmortizationStyle.ANNUITY,
				targetDscr, balloonFraction, capitalizeGraceInterest, priority);
	}

	public boolean isSculpted() {
		return amortizationStyle == AmortizationStyle.SCULPTED;
	}

	public BigDecimal balloonAmount() {
		return FinanceMathUtil.times(principal, balloonFraction);
	}

	public int amortizingPeriods() {
		return tenorPeriods - gracePeriods;
	}
}
