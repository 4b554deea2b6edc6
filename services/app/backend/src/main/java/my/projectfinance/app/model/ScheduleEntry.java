package my.projectfinance.app.model;

import my.projectfinance.app.service.util.FinanceMathUtil;

import java.math.BigDecimal;

public record ScheduleEntry(int period,
							BigDecimal openingBalance,
							BigDecimal interest,
							BigDecimal capitalizedInterest,
							BigDecimal principalPaid,
							BigDecimal totalService,
							BigDecimal closingBalance,
							BigDecimal cfadsAllocation) {
	public BigDecimal cashInterest() {
		return interest.subtract(capitalizedInterest);
	}

	public double dscr() {
		if (totalService.signum() <= 0) {
			return Double.POSITIVE_INFINITY;
		}
		if (cfadsAllocation.signum() <= 0) {
			return 0.0;
		}
		return FinanceMathUtil.ratio(cfadsAllocation, totalService);
	}
}
