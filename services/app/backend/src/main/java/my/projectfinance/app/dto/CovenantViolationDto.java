package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.projectfinance.app.model.CovenantMetric;
import my.projectfinance.app.model.CovenantSeverity;

public record CovenantViolationDto(
		@JsonProperty("metric") CovenantMetric metric,
		@JsonProperty("period") int period,
		@JsonProperty("actual") Double actual,
		@JsonProperty("threshold") double threshold,
		@JsonProperty("shortfall") Double shortfall,
		@JsonProperty("severity") CovenantSeverity severity
) {
}
