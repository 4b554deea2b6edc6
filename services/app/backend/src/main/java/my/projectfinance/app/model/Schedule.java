package my.projectfinance.app.model;

import java.util.List;

public record Schedule(List<TrancheSchedule> tranches, List<ConsolidatedPeriod> periods) {
	public Schedule {
		tranches = List.copyOf(tranches);
		periods = List.copyOf(periods);
	}

	public TrancheSchedule trancheSchedule(String trancheId) {
		for (TrancheSchedule schedule : tranches) {
			if (schedule.tranche().id().equals(trancheId)) {
				return schedule;
			}
		}
		return null;
	}

	public ConsolidatedPeriod period(int period) {
		for (ConsolidatedPeriod row : periods) {
			if (row.period() == period) {
				return row;
			}
		}
		return null;
	}

	public int firstPeriod() {
		return periods.isEmpty() ? 0 : periods.get(0).period();
	}

	public int maturityPeriod() {
		return periods.isEmpty() ? -1 : periods.get(periods.size() - 1).period();
	}
}
