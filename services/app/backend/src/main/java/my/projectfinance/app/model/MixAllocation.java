package my.projectfinance.app.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Amounts per tranche in base currency, and the tranches built from them. Tranches sized at zero are left out.
 */
public record MixAllocation(BigDecimal domesticAmount,
							BigDecimal commercialAmount,
							BigDecimal dfiAmount,
							List<Tranche> tranches) {
	public MixAllocation {
		tranches = List.copyOf(tranches);
	}
}
