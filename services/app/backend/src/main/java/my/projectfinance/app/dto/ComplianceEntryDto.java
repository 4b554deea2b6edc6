package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.projectfinance.app.model.CovenantMetric;
import my.projectfinance.app.model.CovenantSeverity;

public record ComplianceEntryDto(
		@JsonProperty("period") int period,
		@JsonProperty("metric") CovenantMetric metric,
		@JsonProperty("actual") Double actual,
		@JsonProperty("minimum") double minimum,
		@JsonProperty("pass") boolean pass,
		@JsonProperty("buffer") Double buffer,
		@JsonProperty("severity") CovenantSeverity severity
) {
}
