package my.projectfinance.app.model;

import java.util.List;

/**
 * Base-currency units per one unit of the non-base currency, one rate per period.
 */
public record ExchangeRateSeries(List<Double> rates) {
	public ExchangeRateSeries {
		rates = rates == null ? List.of() : List.copyOf(rates);
	}

	public static ExchangeRateSeries of(double... values) {
		Double[] boxed = new Double[values.length];
		for (int i = 0; i < values.length; i++) {
			boxed[i] = values[i];
		}
		return new ExchangeRateSeries(List.of(boxed));
	}

	public static ExchangeRateSeries flat(double rate, int periods) {
		Double[] boxed = new Double[periods];
		for (int i = 0; i < periods; i++) {
			boxed[i] = rate;
		}
		return new ExchangeRateSeries(List.of(boxed));
	}

	public boolean hasRate(int period) {
		if (period < 0 || period >= rates.size()) {
			return false;
		}
		Double rate = rates.get(period);
		return rate != null && rate > 0 && !rate.isInfinite();
	}

	public double rate(int period) {
		return rates.get(period);
	}

	public ExchangeRateSeries from(int period) {
		if (period >= rates.size()) {
			return new ExchangeRateSeries(List.of());
		}
		return new ExchangeRateSeries(rates.subList(period, rates.size()));
	}
}
