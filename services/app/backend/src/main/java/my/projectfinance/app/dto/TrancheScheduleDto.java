package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.projectfinance.app.model.AmortizationStyle;
import my.projectfinance.app.model.Currency;

import java.math.BigDecimal;
import java.util.List;

public record TrancheScheduleDto(
		@JsonProperty("tranche_id") String trancheId,
		@JsonProperty("currency") Currency currency,
		@JsonProperty("amortization_style") AmortizationStyle amortizationStyle,
		@JsonProperty("principal") BigDecimal principal,
		@JsonProperty("fallback_applied") boolean fallbackApplied,
		@JsonProperty("final_balance") BigDecimal finalBalance,
		@JsonProperty("entries") List<ScheduleEntryDto> entries
) {
}
