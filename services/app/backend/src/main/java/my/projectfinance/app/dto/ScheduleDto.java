package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ScheduleDto(
		@JsonProperty("tranches") List<TrancheScheduleDto> tranches,
		@JsonProperty("periods") List<ConsolidatedPeriodDto> periods
) {
}
