package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import my.projectfinance.app.model.AmortizationStyle;
import my.projectfinance.app.model.Currency;

import java.math.BigDecimal;
import java.util.List;

public record MixRequestDto(
		@JsonProperty("debt_total") @NotNull @Positive BigDecimal debtTotal,
		@JsonProperty("base_currency") @NotNull Currency baseCurrency,
		@JsonProperty("exchange_rates") List<Double> exchangeRates,
		@JsonProperty("domestic_max_share") @DecimalMin("0.0") @DecimalMax("1.0") Double domesticMaxShare,
		@JsonProperty("dfi_max_share") @DecimalMin("0.0") @DecimalMax("1.0") Double dfiMaxShare,
		@JsonProperty("commercial_min_share") @DecimalMin("0.0") @DecimalMax("1.0") Double commercialMinShare,
		@JsonProperty("domestic_rate") @NotNull @PositiveOrZero Double domesticRate,
		@JsonProperty("commercial_rate") @NotNull @PositiveOrZero Double commercialRate,
		@JsonProperty("dfi_rate") @NotNull @PositiveOrZero Double dfiRate,
		@JsonProperty("tenor_periods") @NotNull @Min(1) Integer tenorPeriods,
		@JsonProperty("interest_only_periods") @Min(0) Integer interestOnlyPeriods,
		@JsonProperty("amortization_style") AmortizationStyle amortizationStyle,
		@JsonProperty("target_dscr") @Positive Double targetDscr
) {
}
