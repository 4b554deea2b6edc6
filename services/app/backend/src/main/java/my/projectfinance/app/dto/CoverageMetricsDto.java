package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CoverageMetricsDto(
		@JsonProperty("periods") List<PeriodCoverageDto> periods,
		@JsonProperty("dscr") SeriesStatisticsDto dscr,
		@JsonProperty("llcr") SeriesStatisticsDto llcr,
		@JsonProperty("plcr") SeriesStatisticsDto plcr,
		@JsonProperty("hurdle_rate") double hurdleRate,
		@JsonProperty("maturity_period") int maturityPeriod,
		@JsonProperty("project_end_period") int projectEndPeriod
) {
}
