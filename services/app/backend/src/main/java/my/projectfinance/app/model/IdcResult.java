package my.projectfinance.app.model;

import java.math.BigDecimal;
import java.util.List;

public record IdcResult(String trancheId,
						List<BigDecimal> drawdowns,
						List<BigDecimal> interest,
						BigDecimal totalCapitalized,
						BigDecimal operatingPrincipal) {
	public IdcResult {
		drawdowns = List.copyOf(drawdowns);
		interest = List.copyOf(interest);
	}
}
