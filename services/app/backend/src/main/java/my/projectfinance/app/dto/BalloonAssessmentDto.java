package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record BalloonAssessmentDto(
		@JsonProperty("amount") BigDecimal amount,
		@JsonProperty("fraction") double fraction,
		@JsonProperty("feasible") boolean feasible,
		@JsonProperty("mitigation_required") boolean mitigationRequired,
		@JsonProperty("mitigation_options") List<String> mitigationOptions,
		@JsonProperty("notes") String notes
) {
}
