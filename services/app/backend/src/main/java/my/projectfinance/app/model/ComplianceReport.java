package my.projectfinance.app.model;

import java.util.ArrayList;
import java.util.List;

public record ComplianceReport(List<ComplianceEntry> entries,
							   List<CovenantViolation> violations,
							   List<CovenantViolation> warnings) {
	public ComplianceReport {
		entries = List.copyOf(entries);
		violations = List.copyOf(violations);
		warnings = List.copyOf(warnings);
	}

	public boolean compliant() {
		return violations.isEmpty();
	}

	public int violationCount() {
		return violations.size();
	}

	public List<Integer> violationPeriods(CovenantMetric metric) {
		List<Integer> periods = new ArrayList<>();
		for (CovenantViolation violation : violations) {
			if (violation.metric() == metric && !periods.contains(violation.period())) {
				periods.add(violation.period());
			}
		}
		return periods;
	}
}
