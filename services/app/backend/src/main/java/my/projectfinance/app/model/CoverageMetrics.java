package my.projectfinance.app.model;

import java.util.ArrayList;
import java.util.List;

public record CoverageMetrics(List<PeriodCoverage> periods,
							  SeriesStatistics dscr,
							  SeriesStatistics llcr,
							  SeriesStatistics plcr,
							  double hurdleRate,
							  int maturityPeriod,
							  int projectEndPeriod) {
	public CoverageMetrics {
		periods = List.copyOf(periods);
	}

	public static CoverageMetrics of(List<PeriodCoverage> periods, double hurdleRate, int maturityPeriod,
									 int projectEndPeriod) {
		List<Double> dscr = new ArrayList<>();
		List<Double> llcr = new ArrayList<>();
		List<Double> plcr = new ArrayList<>();
		for (PeriodCoverage coverage : periods) {
			dscr.add(coverage.dscr());
			llcr.add(coverage.llcr());
			plcr.add(coverage.plcr());
		}
		return new CoverageMetrics(periods,
				SeriesStatistics.of(dscr),
				SeriesStatistics.of(llcr),
				SeriesStatistics.of(plcr),
				hurdleRate,
				maturityPeriod,
				projectEndPeriod);
	}

	public CoverageMetrics fromPeriod(int period) {
		List<PeriodCoverage> remaining = new ArrayList<>();
		for (PeriodCoverage coverage : periods) {
			if (coverage.period() >= period) {
				remaining.add(coverage);
			}
		}
		return of(remaining, hurdleRate, maturityPeriod, projectEndPeriod);
	}

	public PeriodCoverage period(int period) {
		for (PeriodCoverage coverage : periods) {
			if (coverage.period() == period) {
				return coverage;
			}
		}
		return null;
	}
}
