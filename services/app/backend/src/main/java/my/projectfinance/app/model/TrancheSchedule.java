package my.projectfinance.app.model;

import java.math.BigDecimal;
import java.util.List;

public record TrancheSchedule(Tranche tranche, List<ScheduleEntry> entries, boolean fallbackApplied) {
	public TrancheSchedule {
		entries = List.copyOf(entries);
	}

	public ScheduleEntry entryFor(int period) {
		for (ScheduleEntry entry : entries) {
			if (entry.period() == period) {
				return entry;
			}
		}
		return null;
	}

	public int maturityPeriod() {
		return entries.isEmpty() ? -1 : entries.get(entries.size() - 1).period();
	}

	public BigDecimal finalBalance() {
		return entries.isEmpty() ? tranche.principal() : entries.get(entries.size() - 1).closingBalance();
	}

	public BigDecimal totalPrincipalPaid() {
		BigDecimal total = BigDecimal.ZERO;
		for (ScheduleEntry entry : entries) {
			total = total.add(entry.principalPaid());
		}
		return total;
	}

	public BigDecimal totalCapitalizedInterest() {
		BigDecimal total = BigDecimal.ZERO;
		for (ScheduleEntry entry : entries) {
			total = total.add(entry.capitalizedInterest());
		}
		return total;
	}
}
