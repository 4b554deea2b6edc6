package my.projectfinance.app.service;

import my.projectfinance.app.model.CovenantMetric;
import my.projectfinance.app.model.CovenantThreshold;
import my.projectfinance.app.model.CurrencyConversion;
import my.projectfinance.app.model.DebtConfigurationException;
import my.projectfinance.app.model.FinancingConstraints;
import my.projectfinance.app.model.StructuringInput;
import my.projectfinance.app.model.Tranche;
import my.projectfinance.app.model.ValidationPolicy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks a structure before it is scheduled. Consistency errors always fail; financing-constraint findings are
 * returned as warnings, or fail too under {@link ValidationPolicy#STRICT}.
 */
public class StructureValidator {
	private final FinancingConstraints constraints;
	private final ValidationPolicy policy;

	public StructureValidator(FinancingConstraints constraints, ValidationPolicy policy) {
		this.constraints = constraints == null ? FinancingConstraints.defaults() : constraints;
		this.policy = policy == null ? ValidationPolicy.PERMISSIVE : policy;
	}

	public List<String> validate(StructuringInput input, double hurdleRate, List<CovenantThreshold> covenants) {
		if (input == null) {
			throw new DebtConfigurationException("Debt structure is empty");
		}
		if (input.tranches().isEmpty()) {
			throw new DebtConfigurationException("At least one tranche is required");
		}
		if (!(hurdleRate > -1.0) || Double.isInfinite(hurdleRate)) {
			throw new DebtConfigurationException("hurdle rate must be greater than -1 (got " + hurdleRate + ")");
		}
		Set<String> ids = new HashSet<>();
		for (Tranche tranche : input.tranches()) {
			if (!ids.add(tranche.id())) {
				throw new DebtConfigurationException("Duplicate tranche id " + tranche.id(), tranche.id());
			}
			if (tranche.tenorPeriods() > input.cfads().size()) {
				throw new DebtConfigurationException("CFADS series covers " + input.cfads().size()
						+ " periods but tranche " + tranche.id() + " has a tenor of " + tranche.tenorPeriods(),
						tranche.id(), input.startPeriod() + input.cfads().size());
			}
		}
		new CurrencyConversion(input.baseCurrency(), input.exchangeRates())
				.requireCoverage(input.tranches(), input.startPeriod());

		List<String> warnings = new ArrayList<>();
		String firstOffender = null;
		Double dscrCovenant = dscrMinimum(covenants);
		for (Tranche tranche : input.tranches()) {
			int before = warnings.size();
			if (tranche.rate() > constraints.maxInterestRate()) {
				warnings.add(String.format(Locale.ROOT, "Tranche %s rate %.4f exceeds max %.4f",
						tranche.id(), tranche.rate(), constraints.maxInterestRate()));
			}
			if (tranche.tenorPeriods() > constraints.maxTenorPeriods()) {
				warnings.add(String.format(Locale.ROOT, "Tranche %s tenor %d exceeds max %d periods",
						tranche.id(), tranche.tenorPeriods(), constraints.maxTenorPeriods()));
			}
			if (tranche.balloonFraction() > constraints.maxBalloonFraction()) {
				warnings.add(String.format(Locale.ROOT, "Tranche %s balloon fraction %.4f exceeds max %.4f",
						tranche.id(), tranche.balloonFraction(), constraints.maxBalloonFraction()));
			}
			if (tranche.isSculpted()) {
				double target = tranche.targetDscr();
				if (target < 1.0) {
					warnings.add(String.format(Locale.ROOT,
							"Tranche %s sculpts to target DSCR %.2f below 1.00x", tranche.id(), target));
				} else if (dscrCovenant != null && target < dscrCovenant) {
					warnings.add(String.format(Locale.ROOT,
							"Tranche %s sculpts to target DSCR %.2f below the DSCR covenant %.2f",
							tranche.id(), target, dscrCovenant));
				}
			}
			if (firstOffender == null && warnings.size() > before) {
				firstOffender = tranche.id();
			}
		}
		if (policy == ValidationPolicy.STRICT && !warnings.isEmpty()) {
			throw new DebtConfigurationException("Structure violates financing constraints: "
					+ String.join("; ", warnings), firstOffender);
		}
		return List.copyOf(warnings);
	}

	private Double dscrMinimum(List<CovenantThreshold> covenants) {
		if (covenants == null) {
			return null;
		}
		Double minimum = null;
		for (CovenantThreshold threshold : covenants) {
			if (threshold.metric() == CovenantMetric.DSCR) {
				minimum = minimum == null ? threshold.minimum() : Math.max(minimum, threshold.minimum());
			}
		}
		return minimum;
	}
}
