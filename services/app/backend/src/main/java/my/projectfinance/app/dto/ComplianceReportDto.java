package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ComplianceReportDto(
		@JsonProperty("compliant") boolean compliant,
		@JsonProperty("violation_count") int violationCount,
		@JsonProperty("violations") List<CovenantViolationDto> violations,
		@JsonProperty("warnings") List<CovenantViolationDto> warnings,
		@JsonProperty("entries") List<ComplianceEntryDto> entries
) {
}
