package my.projectfinance.app.model;

import java.util.List;

public record StructuringResult(Schedule schedule,
								CoverageMetrics metrics,
								ComplianceReport compliance,
								BalloonAssessment balloon,
								List<IdcResult> idc,
								List<String> warnings,
								List<String> notes) {
	public StructuringResult {
		idc = idc == null ? List.of() : List.copyOf(idc);
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
		notes = notes == null ? List.of() : List.copyOf(notes);
	}
}
