package my.projectfinance.app.model;

public record FinancingConstraints(double maxInterestRate,
								   int maxTenorPeriods,
								   double maxBalloonFraction,
								   double warnBalloonFraction,
								   boolean refinancingEnabled,
								   double maxRefinanceFraction) {
	public static FinancingConstraints defaults() {
		return new FinancingConstraints(0.25, 25, 0.10, 0.05, false, 0.15);
	}

	public FinancingConstraints {
		if (warnBalloonFraction > maxBalloonFraction) {
			throw new DebtConfigurationException("warn balloon fraction must not exceed max balloon fraction");
		}
	}
}
