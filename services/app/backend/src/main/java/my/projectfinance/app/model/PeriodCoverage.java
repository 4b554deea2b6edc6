package my.projectfinance.app.model;

import java.math.BigDecimal;

public record PeriodCoverage(int period,
							 BigDecimal openingBalance,
							 double dscr,
							 double llcr,
							 double plcr) {
	public double value(CovenantMetric metric) {
		return switch (metric) {
			case DSCR -> dscr;
			case LLCR -> llcr;
			case PLCR -> plcr;
		};
	}
}
