package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record ConsolidatedPeriodDto(
		@JsonProperty("period") int period,
		@JsonProperty("cfads") BigDecimal cfads,
		@JsonProperty("opening_balance") BigDecimal openingBalance,
		@JsonProperty("total_service") BigDecimal totalService,
		@JsonProperty("closing_balance") BigDecimal closingBalance
) {
}
