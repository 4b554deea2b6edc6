package my.projectfinance.app.model;

import java.math.BigDecimal;

/**
 * Raised when a sculpted tranche cannot reach its target DSCR in a period without
 * negative principal, or cannot retire its balance in the final period.
 * The period is 0-based and the shortfall is expressed in the tranche currency.
 */
public class InfeasibleSculptException extends RuntimeException {
	private final String trancheId;
	private final int period;
	private final BigDecimal shortfall;

	public InfeasibleSculptException(String trancheId, int period, BigDecimal shortfall, String reason) {
		super("Tranche " + trancheId + " cannot be sculpted in period " + period + ": " + reason
				+ " (shortfall " + shortfall.toPlainString() + ")");
		this.trancheId = trancheId;
		this.period = period;
		this.shortfall = shortfall;
	}

	public String getTrancheId() {
		return trancheId;
	}

	public int getPeriod() {
		return period;
	}

	public BigDecimal getShortfall() {
		return shortfall;
	}
}
