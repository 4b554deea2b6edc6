package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record ScheduleEntryDto(
		@JsonProperty("period") int period,
		@JsonProperty("opening_balance") BigDecimal openingBalance,
		@JsonProperty("interest") BigDecimal interest,
		@JsonProperty("capitalized_interest") BigDecimal capitalizedInterest,
		@JsonProperty("principal_paid") BigDecimal principalPaid,
		@JsonProperty("total_service") BigDecimal totalService,
		@JsonProperty("closing_balance") BigDecimal closingBalance,
		@JsonProperty("cfads_allocation") BigDecimal cfadsAllocation,
		@JsonProperty("dscr") Double dscr
) {
}
