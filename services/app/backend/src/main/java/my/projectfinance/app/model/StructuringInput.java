package my.projectfinance.app.model;

import java.util.List;

/**
 * A debt structure to evaluate. {@code startPeriod} labels the first CFADS value; it is non-zero only when a
 * structure is evaluated from a refinancing date onward.
 */
public record StructuringInput(List<Tranche> tranches,
							   CfadsSeries cfads,
							   Currency baseCurrency,
							   ExchangeRateSeries exchangeRates,
							   ConstructionPhase construction,
							   int startPeriod) {
	public StructuringInput {
		tranches = tranches == null ? List.of() : List.copyOf(tranches);
		if (cfads == null) {
			throw new DebtConfigurationException("CFADS series is required");
		}
		if (baseCurrency == null) {
			throw new DebtConfigurationException("base currency is required");
		}
		exchangeRates = exchangeRates == null ? new ExchangeRateSeries(null) : exchangeRates;
		if (startPeriod < 0) {
			throw new DebtConfigurationException("start period must not be negative");
		}
	}

	public static StructuringInput of(List<Tranche> tranches, CfadsSeries cfads, Currency baseCurrency) {
		return new StructuringInput(tranches, cfads, baseCurrency, null, null, 0);
	}

	public StructuringInput withExchangeRates(ExchangeRateSeries value) {
		return new StructuringInput(tranches, cfads, baseCurrency, value, construction, startPeriod);
	}

	public StructuringInput withConstruction(ConstructionPhase value) {
		return new StructuringInput(tranches, cfads, baseCurrency, exchangeRates, value, startPeriod);
	}
}
