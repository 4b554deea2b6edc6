package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record MixResponseDto(
		@JsonProperty("domestic_amount") BigDecimal domesticAmount,
		@JsonProperty("commercial_amount") BigDecimal commercialAmount,
		@JsonProperty("dfi_amount") BigDecimal dfiAmount,
		@JsonProperty("tranches") List<TrancheRequestDto> tranches
) {
}
