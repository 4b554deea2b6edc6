package my.projectfinance.app.model;

import java.math.BigDecimal;

/**
 * One period of the schedule summed across tranches, in base currency. Balances include balloons left unpaid
 * by tranches that matured earlier.
 */
public record ConsolidatedPeriod(int period,
								 BigDecimal cfads,
								 BigDecimal openingBalance,
								 BigDecimal totalService,
								 BigDecimal closingBalance) {
}
