package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record IdcResultDto(
		@JsonProperty("tranche_id") String trancheId,
		@JsonProperty("drawdowns") List<BigDecimal> drawdowns,
		@JsonProperty("interest") List<BigDecimal> interest,
		@JsonProperty("total_capitalized") BigDecimal totalCapitalized,
		@JsonProperty("operating_principal") BigDecimal operatingPrincipal
) {
}
