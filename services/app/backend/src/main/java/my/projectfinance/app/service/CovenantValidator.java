package my.projectfinance.app.service;

import my.projectfinance.app.model.ComplianceEntry;
import my.projectfinance.app.model.ComplianceReport;
import my.projectfinance.app.model.CovenantMetric;
import my.projectfinance.app.model.CovenantSeverity;
import my.projectfinance.app.model.CovenantThreshold;
import my.projectfinance.app.model.CovenantViolation;
import my.projectfinance.app.model.CoverageMetrics;
import my.projectfinance.app.model.PeriodCoverage;

import java.util.ArrayList;
import java.util.List;

public class CovenantValidator {
	private static final double CRITICAL_DSCR = 1.0;

	private final List<CovenantThreshold> thresholds;

	public CovenantValidator(List<CovenantThreshold> thresholds) {
		this.thresholds = thresholds == null ? List.of() : List.copyOf(thresholds);
	}

	public ComplianceReport validate(CoverageMetrics metrics) {
		List<ComplianceEntry> entries = new ArrayList<>();
		List<CovenantViolation> violations = new ArrayList<>();
		List<CovenantViolation> warnings = new ArrayList<>();
		if (metrics == null) {
			return new ComplianceReport(entries, violations, warnings);
		}
		for (PeriodCoverage coverage : metrics.periods()) {
			for (CovenantThreshold threshold : thresholds) {
				CovenantMetric metric = threshold.metric();
				double actual = coverage.value(metric);
				boolean pass = actual >= threshold.minimum();
				double buffer = actual - threshold.minimum();
				CovenantSeverity severity = severity(threshold, actual, pass);
				entries.add(new ComplianceEntry(coverage.period(), metric, actual, threshold.minimum(), pass, buffer,
						severity));
				if (!pass) {
					violations.add(new CovenantViolation(metric, coverage.period(), actual, threshold.minimum(),
							threshold.minimum() - actual, severity));
				} else if (severity == CovenantSeverity.WARNING) {
					warnings.add(new CovenantViolation(metric, coverage.period(), actual, threshold.warning(),
							threshold.warning() - actual, severity));
				}
			}
		}
		return new ComplianceReport(entries, violations, warnings);
	}

	private CovenantSeverity severity(CovenantThreshold threshold, double actual, boolean pass) {
		if (!pass) {
			if (threshold.metric() == CovenantMetric.DSCR && actual < CRITICAL_DSCR) {
				return CovenantSeverity.CRITICAL;
			}
			return CovenantSeverity.BREACH;
		}
		if (threshold.warning() != null && actual < threshold.warning()) {
			return CovenantSeverity.WARNING;
		}
		return CovenantSeverity.OK;
	}
}
