package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SeriesStatisticsDto(
		@JsonProperty("min") Double min,
		@JsonProperty("max") Double max,
		@JsonProperty("mean") Double mean,
		@JsonProperty("median") Double median,
		@JsonProperty("count") int count
) {
}
