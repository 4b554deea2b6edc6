package my.projectfinance.app.model;

import java.math.BigDecimal;

/**
 * Sizing rules for splitting a debt quantum (in base currency) across a domestic, a hard-currency commercial and a
 * development-finance (DFI) tranche. Shares are fractions of the quantum; rates are per period.
 */
public record DebtMix(BigDecimal debtTotal,
					  double domesticMaxShare,
					  double dfiMaxShare,
					  double commercialMinShare,
					  double domesticRate,
					  double commercialRate,
					  double dfiRate,
					  int tenorPeriods,
					  int interestOnlyPeriods,
					  AmortizationStyle amortizationStyle,
					  Double targetDscr) {
	public DebtMix {
		amortizationStyle = amortizationStyle == null ? AmortizationStyle.ANNUITY : amortizationStyle;
	}
}
