package my.projectfinance.app.service;

import my.projectfinance.app.model.AllocationPolicy;
import my.projectfinance.app.model.CurrencyConversion;
import my.projectfinance.app.model.Tranche;
import my.projectfinance.app.model.TrancheAllocation;

import my.projectfinance.app.service.util.FinanceMathUtil;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits one period of base-currency CFADS across the tranches that are still amortizing and hands each
 * tranche its share in its own currency.
 */
public class TrancheAllocator {
	private final AllocationPolicy policy;

	public TrancheAllocator(AllocationPolicy policy) {
		this.policy = policy == null ? AllocationPolicy.PRO_RATA : policy;
	}

	public List<TrancheAllocation> allocate(int period,
											int relativePeriod,
											BigDecimal cfads,
											List<? extends AllocationTarget> targets,
											CurrencyConversion conversion) {
		if (targets == null || targets.isEmpty()) {
			return List.of();
		}
		if (policy == AllocationPolicy.WATERFALL) {
			return allocateWaterfall(period, relativePeriod, cfads, targets, conversion);
		}
		return allocateProRata(period, relativePeriod, cfads, targets, conversion);
	}

	public List<BigDecimal> proRataShares(BigDecimal cfads, List<BigDecimal> weights) {
		if (weights == null || weights.isEmpty()) {
			return List.of();
		}
		BigDecimal totalWeight = BigDecimal.ZERO;
		for (BigDecimal weight : weights) {
			totalWeight = totalWeight.add(safeWeight(weight));
		}
		List<BigDecimal> shares = new ArrayList<>();
		BigDecimal assigned = BigDecimal.ZERO;
		for (int i = 0; i < weights.size(); i++) {
			if (i == weights.size() - 1) {
				shares.add(cfads.subtract(assigned));
				break;
			}
			BigDecimal share = totalWeight.signum() > 0
					? cfads.multiply(safeWeight(weights.get(i))).divide(totalWeight, FinanceMathUtil.MONEY_SCALE,
					FinanceMathUtil.ROUNDING)
					: cfads.divide(BigDecimal.valueOf(weights.size()), FinanceMathUtil.MONEY_SCALE,
					FinanceMathUtil.ROUNDING);
			shares.add(share);
			assigned = assigned.add(share);
		}
		return shares;
	}

	private BigDecimal safeWeight(BigDecimal weight) {
		return weight == null || weight.signum() < 0 ? BigDecimal.ZERO : weight;
	}

	private List<TrancheAllocation> allocateProRata(int period,
													int relativePeriod,
													BigDecimal cfads,
													List<? extends AllocationTarget> targets,
													CurrencyConversion conversion) {
		List<BigDecimal> weights = new ArrayList<>();
		boolean anyOutstanding = false;
		for (AllocationTarget target : targets) {
			BigDecimal balance = conversion.toBase(target.tranche().currency(), relativePeriod,
					target.openingBalance());
			weights.add(balance.max(BigDecimal.ZERO));
			anyOutstanding |= balance.signum() > 0;
		}
		if (!anyOutstanding) {
			weights.clear();
			for (AllocationTarget target : targets) {
				weights.add(conversion.toBase(target.tranche().currency(), relativePeriod, target.tranche().principal()));
			}
		}
		List<BigDecimal> shares = proRataShares(cfads, weights);
		List<TrancheAllocation> allocations = new ArrayList<>();
		for (int i = 0; i < targets.size(); i++) {
			AllocationTarget target = targets.get(i);
			BigDecimal baseAmount = shares.get(i);
			BigDecimal trancheAmount = conversion.fromBase(target.tranche().currency(), relativePeriod, baseAmount);
			target.settle(trancheAmount);
			allocations.add(new TrancheAllocation(target.tranche().id(), period, baseAmount, trancheAmount));
		}
		return allocations;
	}

	private List<TrancheAllocation> allocateWaterfall(int period,
													  int relativePeriod,
													  BigDecimal cfads,
													  List<? extends AllocationTarget> targets,
													  CurrencyConversion conversion) {
		List<AllocationTarget> ordered = new ArrayList<>(targets);
		ordered.sort(Comparator.comparingInt(target -> target.tranche().priority()));
		List<TrancheAllocation> allocations = new ArrayList<>();
		BigDecimal residual = cfads;
		for (AllocationTarget target : ordered) {
			Tranche tranche = target.tranche();
			BigDecimal trancheAmount = conversion.fromBase(tranche.currency(), relativePeriod, residual);
			BigDecimal service = target.settle(trancheAmount);
			allocations.add(new TrancheAllocation(tranche.id(), period, residual, trancheAmount));
			residual = residual.subtract(conversion.toBase(tranche.currency(), relativePeriod, service));
		}
		return allocations;
	}

	/**
	 * A tranche that can receive cash for the current period. {@link #settle(BigDecimal)} consumes the allocation in
	 * tranche currency and returns the debt service paid, also in tranche currency.
	 */
	public interface AllocationTarget {
		Tranche tranche();

		BigDecimal openingBalance();

		BigDecimal settle(BigDecimal allocation);
	}
}
