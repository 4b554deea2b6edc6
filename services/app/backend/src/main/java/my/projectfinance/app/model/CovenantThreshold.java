package my.projectfinance.app.model;

public record CovenantThreshold(CovenantMetric metric, double minimum, Double warning) {
	public CovenantThreshold {
		if (metric == null) {
			throw new DebtConfigurationException("covenant metric is required");
		}
		if (Double.isNaN(minimum) || Double.isInfinite(minimum)) {
			throw new DebtConfigurationException("covenant minimum for " + metric + " must be finite");
		}
		if (warning != null && warning < minimum) {
			throw new DebtConfigurationException("covenant warning level for " + metric
					+ " must not be below its minimum");
		}
	}

	public static CovenantThreshold minimum(CovenantMetric metric, double minimum) {
		return new CovenantThreshold(metric, minimum, null);
	}
}
