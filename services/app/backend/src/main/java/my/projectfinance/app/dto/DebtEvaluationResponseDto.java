package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DebtEvaluationResponseDto(
		@JsonProperty("schedule") ScheduleDto schedule,
		@JsonProperty("metrics") CoverageMetricsDto metrics,
		@JsonProperty("compliance") ComplianceReportDto compliance,
		@JsonProperty("balloon") BalloonAssessmentDto balloon,
		@JsonProperty("idc") List<IdcResultDto> idc,
		@JsonProperty("warnings") List<String> warnings,
		@JsonProperty("notes") List<String> notes
) {
}
