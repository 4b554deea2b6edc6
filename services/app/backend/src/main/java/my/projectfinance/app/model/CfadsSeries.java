package my.projectfinance.app.model;

import my.projectfinance.app.service.util.FinanceMathUtil;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public record CfadsSeries(List<BigDecimal> values) {
	public CfadsSeries {
		if (values == null || values.isEmpty()) {
			throw new DebtConfigurationException("CFADS series must not be empty");
		}
		List<BigDecimal> normalized = new ArrayList<>();
		for (int i = 0; i < values.size(); i++) {
			BigDecimal value = values.get(i);
			if (value == null) {
				throw new DebtConfigurationException("CFADS value missing", null, i);
			}
			normalized.add(FinanceMathUtil.money(value));
		}
		values = List.copyOf(normalized);
	}

	public static CfadsSeries of(double... amounts) {
		List<BigDecimal> values = new ArrayList<>();
		for (double amount : amounts) {
			if (Double.isNaN(amount) || Double.isInfinite(amount)) {
				throw new DebtConfigurationException("CFADS value not finite", null, values.size());
			}
			values.add(BigDecimal.valueOf(amount));
		}
		return new CfadsSeries(values);
	}

	public BigDecimal get(int period) {
		return values.get(period);
	}

	public int size() {
		return values.size();
	}

	public CfadsSeries from(int period) {
		if (period < 0 || period >= values.size()) {
			throw new DebtConfigurationException("CFADS series has no periods from " + period, null, period);
		}
		return new CfadsSeries(values.subList(period, values.size()));
	}
}
