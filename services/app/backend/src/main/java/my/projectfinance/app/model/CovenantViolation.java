package my.projectfinance.app.model;

public record CovenantViolation(CovenantMetric metric,
								int period,
								double actual,
								double threshold,
								double shortfall,
								CovenantSeverity severity) {
}
