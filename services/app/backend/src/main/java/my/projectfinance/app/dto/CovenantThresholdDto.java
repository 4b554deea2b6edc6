package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import my.projectfinance.app.model.CovenantMetric;

public record CovenantThresholdDto(
		@JsonProperty("metric") @NotNull CovenantMetric metric,
		@JsonProperty("minimum") @NotNull Double minimum,
		@JsonProperty("warning") Double warning
) {
}
