package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import my.projectfinance.app.model.AmortizationStyle;
import my.projectfinance.app.model.Currency;

import java.math.BigDecimal;

public record TrancheRequestDto(
		@JsonProperty("id") @NotBlank String id,
		@JsonProperty("currency") @NotNull Currency currency,
		@JsonProperty("principal") @NotNull @Positive BigDecimal principal,
		@JsonProperty("rate") @NotNull @PositiveOrZero Double rate,
		@JsonProperty("tenor_periods") @NotNull @Min(1) Integer tenorPeriods,
		@JsonProperty("grace_periods") @Min(0) Integer gracePeriods,
		@JsonProperty("amortization_style") @NotNull AmortizationStyle amortizationStyle,
		@JsonProperty("target_dscr") @Positive Double targetDscr,
		@JsonProperty("balloon_fraction") @PositiveOrZero Double balloonFraction,
		@JsonProperty("capitalize_grace_interest") Boolean capitalizeGraceInterest,
		@JsonProperty("priority") Integer priority
) {
}
