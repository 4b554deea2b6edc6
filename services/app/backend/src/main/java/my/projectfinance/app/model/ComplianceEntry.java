package my.projectfinance.app.model;

public record ComplianceEntry(int period,
							  CovenantMetric metric,
							  double actual,
							  double minimum,
							  boolean pass,
							  double buffer,
							  CovenantSeverity severity) {
}
