package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RefinancingRequestDto(
		@JsonProperty("structure") @NotNull @Valid DebtEvaluationRequestDto structure,
		@JsonProperty("refinancing_period") @NotNull @Min(1) Integer refinancingPeriod,
		@JsonProperty("candidate_tranches") @NotEmpty List<@Valid TrancheRequestDto> candidateTranches
) {
}
