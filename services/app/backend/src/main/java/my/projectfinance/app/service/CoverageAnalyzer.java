package my.projectfinance.app.service;

import my.projectfinance.app.model.CfadsSeries;
import my.projectfinance.app.model.ConsolidatedPeriod;
import my.projectfinance.app.model.CoverageMetrics;
import my.projectfinance.app.model.DebtConfigurationException;
import my.projectfinance.app.model.PeriodCoverage;
import my.projectfinance.app.model.Schedule;
import my.projectfinance.app.service.util.FinanceMathUtil;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * DSCR, LLCR and PLCR per period while debt is outstanding. LLCR discounts CFADS through the final debt
 * maturity, PLCR through project end. The denominator of LLCR and PLCR is the opening (pre-repayment)
 * balance of the period.
 */
@Service
public class CoverageAnalyzer {
	public CoverageMetrics analyze(Schedule schedule, CfadsSeries cfads, double hurdleRate) {
		return analyze(schedule, cfads, hurdleRate, 0);
	}

	public CoverageMetrics analyze(Schedule schedule, CfadsSeries cfads, double hurdleRate, int startPeriod) {
		if (schedule == null || cfads == null) {
			throw new DebtConfigurationException("Schedule and CFADS series are required for coverage analysis");
		}
		if (!(hurdleRate > -1.0) || Double.isInfinite(hurdleRate)) {
			throw new DebtConfigurationException("hurdle rate must be greater than -1 (got " + hurdleRate + ")");
		}
		List<BigDecimal> values = cfads.values();
		int projectEnd = cfads.size() - 1;
		int maturity = Math.min(schedule.maturityPeriod() - startPeriod, projectEnd);
		List<PeriodCoverage> periods = new ArrayList<>();
		for (ConsolidatedPeriod row : schedule.periods()) {
			int t = row.period() - startPeriod;
			if (t < 0 || t > projectEnd || !FinanceMathUtil.isPositive(row.openingBalance())) {
				continue;
			}
			double dscr = dscr(values.get(t), row.totalService());
			BigDecimal loanLife = FinanceMathUtil.npv(values, t, maturity, hurdleRate);
			BigDecimal tail = FinanceMathUtil.npvBetween(values, t, maturity + 1, projectEnd, hurdleRate);
			double llcr = FinanceMathUtil.ratio(loanLife, row.openingBalance());
			double plcr = FinanceMathUtil.ratio(loanLife.add(tail.max(BigDecimal.ZERO)), row.openingBalance());
			periods.add(new PeriodCoverage(row.period(), row.openingBalance(), dscr, llcr, plcr));
		}
		return CoverageMetrics.of(periods, hurdleRate, startPeriod + maturity, startPeriod + projectEnd);
	}

	static double dscr(BigDecimal cfads, BigDecimal service) {
		if (service.signum() <= 0) {
			return Double.POSITIVE_INFINITY;
		}
		if (cfads.signum() <= 0) {
			return 0.0;
		}
		return FinanceMathUtil.ratio(cfads, service);
	}
}
