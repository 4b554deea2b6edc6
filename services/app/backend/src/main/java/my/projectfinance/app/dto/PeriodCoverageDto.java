package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record PeriodCoverageDto(
		@JsonProperty("period") int period,
		@JsonProperty("opening_balance") BigDecimal openingBalance,
		@JsonProperty("dscr") Double dscr,
		@JsonProperty("llcr") Double llcr,
		@JsonProperty("plcr") Double plcr
) {
}
