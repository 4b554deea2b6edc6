package my.projectfinance.app.service;

import my.projectfinance.app.model.BalloonAssessment;
import my.projectfinance.app.model.CurrencyConversion;
import my.projectfinance.app.model.FinancingConstraints;
import my.projectfinance.app.model.Schedule;
import my.projectfinance.app.model.TrancheSchedule;
import my.projectfinance.app.service.util.FinanceMathUtil;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

import java.util.List;
import java.util.Locale;

@Service
public class BalloonAssessor {
	private static final double MATERIALITY_FRACTION = 0.01;
	private static final List<String> MITIGATION_OPTIONS = List.of(
			"Refinancing commitment from lender",
			"Cash sweep mechanism to reduce balloon",
			"Equity injection commitment at maturity",
			"Extend amortization period",
			"Increase DSCR target (more aggressive principal repayment)"
	);
	private static final List<String> RESTRUCTURING_OPTIONS = List.of(
			"Extend tenor (reduce periodic debt service, more principal repaid)",
			"Increase DSCR target significantly",
			"Reduce debt quantum",
			"Switch to annuity amortization"
	);

	public BalloonAssessment assess(Schedule schedule, CurrencyConversion conversion, FinancingConstraints constraints,
									int startPeriod) {
		BigDecimal balloon = BigDecimal.ZERO;
		BigDecimal principal = BigDecimal.ZERO;
		for (TrancheSchedule trancheSchedule : schedule.tranches()) {
			int maturity = trancheSchedule.maturityPeriod() - startPeriod;
			balloon = balloon.add(conversion.toBase(trancheSchedule.tranche().currency(), Math.max(maturity, 0),
					trancheSchedule.finalBalance()));
			principal = principal.add(conversion.toBase(trancheSchedule.tranche().currency(), 0,
					trancheSchedule.tranche().principal()));
		}
		return assess(balloon, principal, constraints);
	}

	public BalloonAssessment assess(BigDecimal balloon, BigDecimal principal, FinancingConstraints constraints) {
		FinancingConstraints limits = constraints == null ? FinancingConstraints.defaults() : constraints;
		double fraction = FinanceMathUtil.isPositive(principal)
				? FinanceMathUtil.ratio(balloon.max(BigDecimal.ZERO), principal)
				: 0.0;
		if (fraction < MATERIALITY_FRACTION) {
			return new BalloonAssessment(balloon, fraction, true, false, List.of(), "No material balloon payment");
		}
		if (fraction <= limits.warnBalloonFraction()) {
			return new BalloonAssessment(balloon, fraction, true, false, List.of(),
					String.format(Locale.ROOT, "Small balloon (%s) - acceptable", percent(fraction)));
		}
		if (fraction <= limits.maxBalloonFraction()) {
			if (!limits.refinancingEnabled()) {
				return new BalloonAssessment(balloon, fraction, true, true, MITIGATION_OPTIONS,
						String.format(Locale.ROOT, "Balloon %s requires mitigation - refinancing disabled",
								percent(fraction)));
			}
			if (fraction <= limits.maxRefinanceFraction()) {
				return new BalloonAssessment(balloon, fraction, true, true, MITIGATION_OPTIONS,
						String.format(Locale.ROOT, "Balloon %s can be refinanced (max %s)",
								percent(fraction), percent(limits.maxRefinanceFraction())));
			}
			return new BalloonAssessment(balloon, fraction, false, true, MITIGATION_OPTIONS,
					String.format(Locale.ROOT, "Balloon %s exceeds refinancing limit %s",
							percent(fraction), percent(limits.maxRefinanceFraction())));
		}
		return new BalloonAssessment(balloon, fraction, false, true, RESTRUCTURING_OPTIONS,
				String.format(Locale.ROOT, "Balloon %s exceeds maximum %s - not acceptable",
						percent(fraction), percent(limits.maxBalloonFraction())));
	}

	private String percent(double fraction) {
		return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
	}
}
