package my.projectfinance.app.model;

import my.projectfinance.app.service.util.FinanceMathUtil;

import java.math.BigDecimal;
import java.util.Collection;

public record CurrencyConversion(Currency baseCurrency, ExchangeRateSeries exchangeRates) {
	public CurrencyConversion {
		if (baseCurrency == null) {
			throw new DebtConfigurationException("base currency is required");
		}
		exchangeRates = exchangeRates == null ? new ExchangeRateSeries(null) : exchangeRates;
	}

	public BigDecimal toBase(Currency currency, int period, BigDecimal amount) {
		if (currency == baseCurrency) {
			return amount;
		}
		return FinanceMathUtil.times(amount, requireRate(period));
	}

	public BigDecimal fromBase(Currency currency, int period, BigDecimal amount) {
		if (currency == baseCurrency) {
			return amount;
		}
		return FinanceMathUtil.dividedBy(amount, requireRate(period));
	}

	public void requireCoverage(Collection<Tranche> tranches, int periodOffset) {
		for (Tranche tranche : tranches) {
			if (tranche.currency() == baseCurrency) {
				continue;
			}
			for (int period = 0; period < tranche.tenorPeriods(); period++) {
				if (!exchangeRates.hasRate(period)) {
					throw new DebtConfigurationException("Exchange rate missing or not positive for "
							+ tranche.currency() + " tranche " + tranche.id() + " in period " + (periodOffset + period),
							tranche.id(), periodOffset + period);
				}
			}
		}
	}

	private double requireRate(int period) {
		if (!exchangeRates.hasRate(period)) {
			throw new DebtConfigurationException("Exchange rate missing or not positive in period " + period, null,
					period);
		}
		return exchangeRates.rate(period);
	}
}
