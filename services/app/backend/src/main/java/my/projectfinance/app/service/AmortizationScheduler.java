package my.projectfinance.app.service;

import my.projectfinance.app.model.AmortizationStyle;
import my.projectfinance.app.model.DebtConfigurationException;
import my.projectfinance.app.model.InfeasibleSculptException;
import my.projectfinance.app.model.ScheduleEntry;
import my.projectfinance.app.model.Tranche;
import my.projectfinance.app.model.TrancheSchedule;
import my.projectfinance.app.service.util.FinanceMathUtil;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Service
public class AmortizationScheduler {
	public TrancheSchedule schedule(Tranche tranche, List<BigDecimal> allocation) {
		return schedule(tranche, allocation, 0);
	}

	public TrancheSchedule schedule(Tranche tranche, List<BigDecimal> allocation, int periodOffset) {
		if (tranche == null) {
			throw new DebtConfigurationException("Tranche is required");
		}
		int required = tranche.amortizationStyle() == AmortizationStyle.SCULPTED ? tranche.tenorPeriods() : 0;
		if (allocation == null ? required > 0 : allocation.size() < required) {
			throw new DebtConfigurationException("CFADS allocation must cover the tenor of tranche " + tranche.id(),
					tranche.id());
		}
		TrancheAmortization amortization = start(tranche, periodOffset);
		while (amortization.isActive()) {
			int index = amortization.nextIndex();
			BigDecimal available = allocation == null || index >= allocation.size()
					? BigDecimal.ZERO
					: allocation.get(index);
			amortization.next(available);
		}
		return amortization.toSchedule(false);
	}

	public TrancheAmortization start(Tranche tranche, int periodOffset) {
		return new TrancheAmortization(tranche, periodOffset);
	}

	/**
	 * Period-by-period amortization of a single tranche. Each instance belongs to one evaluation.
	 */
	public static final class TrancheAmortization implements TrancheAllocator.AllocationTarget {
		private final Tranche tranche;
		private final int periodOffset;
		private final List<ScheduleEntry> entries = new ArrayList<>();
		private BigDecimal balance;
		private BigDecimal levelPayment = BigDecimal.ZERO;
		private int index;

		private TrancheAmortization(Tranche tranche, int periodOffset) {
			this.tranche = tranche;
			this.periodOffset = periodOffset;
			this.balance = tranche.principal();
		}

		@Override
		public Tranche tranche() {
			return tranche;
		}

		@Override
		public BigDecimal openingBalance() {
			return balance;
		}

		@Override
		public BigDecimal settle(BigDecimal allocation) {
			return next(allocation).totalService();
		}

		public boolean isActive() {
			return index < tranche.tenorPeriods();
		}

		public int nextIndex() {
			return index;
		}

		public ScheduleEntry next(BigDecimal allocation) {
			if (!isActive()) {
				throw new IllegalStateException("Tranche " + tranche.id() + " has already matured");
			}
			int period = periodOffset + index;
			BigDecimal opening = balance;
			BigDecimal interest = FinanceMathUtil.times(opening, tranche.rate());
			BigDecimal capitalized = BigDecimal.ZERO.setScale(FinanceMathUtil.MONEY_SCALE);
			BigDecimal principal = BigDecimal.ZERO.setScale(FinanceMathUtil.MONEY_SCALE);
			BigDecimal balloon = tranche.balloonAmount();
			if (index < tranche.gracePeriods()) {
				if (tranche.capitalizeGraceInterest()) {
					capitalized = interest;
				}
			} else {
				if (index == tranche.gracePeriods()) {
					levelPayment = FinanceMathUtil.pmt(tranche.rate(), tranche.amortizingPeriods(),
							opening.subtract(balloon)).add(FinanceMathUtil.times(balloon, tranche.rate()));
				}
				BigDecimal amortizable = opening.subtract(balloon).max(BigDecimal.ZERO);
				boolean finalPeriod = index == tranche.tenorPeriods() - 1;
				if (finalPeriod) {
					principal = amortizable;
					if (tranche.isSculpted()) {
						BigDecimal service = interest.add(principal);
						if (service.compareTo(allocation) > 0) {
							throw new InfeasibleSculptException(tranche.id(), period, service.subtract(allocation),
									"final balance cannot be retired from available cash");
						}
					}
				} else if (tranche.isSculpted()) {
					BigDecimal solved = FinanceMathUtil.dividedBy(allocation, tranche.targetDscr()).subtract(interest);
					if (solved.signum() < 0) {
						throw new InfeasibleSculptException(tranche.id(), period, solved.negate(),
								"cash available cannot cover interest at target DSCR " + tranche.targetDscr());
					}
					principal = solved.min(amortizable);
				} else {
					principal = levelPayment.subtract(interest).max(BigDecimal.ZERO).min(amortizable);
				}
			}
			BigDecimal closing = opening.subtract(principal).add(capitalized);
			BigDecimal service = interest.subtract(capitalized).add(principal);
			ScheduleEntry entry = new ScheduleEntry(period, opening, interest, capitalized, principal, service,
					closing, FinanceMathUtil.money(allocation));
			entries.add(entry);
			balance = closing;
			index += 1;
			return entry;
		}

		public TrancheSchedule toSchedule(boolean fallbackApplied) {
			return new TrancheSchedule(tranche, entries, fallbackApplied);
		}
	}
}
