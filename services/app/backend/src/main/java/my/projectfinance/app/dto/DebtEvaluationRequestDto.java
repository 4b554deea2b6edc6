package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import my.projectfinance.app.model.AllocationPolicy;
import my.projectfinance.app.model.Currency;
import my.projectfinance.app.model.SculptFallback;
import my.projectfinance.app.model.ValidationPolicy;

import java.math.BigDecimal;
import java.util.List;

public record DebtEvaluationRequestDto(
		@JsonProperty("base_currency") @NotNull Currency baseCurrency,
		@JsonProperty("cfads") @NotEmpty List<@NotNull BigDecimal> cfads,
		@JsonProperty("exchange_rates") List<Double> exchangeRates,
		@JsonProperty("tranches") @NotEmpty List<@Valid TrancheRequestDto> tranches,
		@JsonProperty("construction_drawdowns") List<Double> constructionDrawdowns,
		@JsonProperty("hurdle_rate") Double hurdleRate,
		@JsonProperty("allocation_policy") AllocationPolicy allocationPolicy,
		@JsonProperty("validation_policy") ValidationPolicy validationPolicy,
		@JsonProperty("sculpt_fallback") SculptFallback sculptFallback,
		@JsonProperty("covenants") List<@Valid CovenantThresholdDto> covenants
) {
}
