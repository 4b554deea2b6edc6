package my.projectfinance.app.service;

import my.projectfinance.app.model.ConstructionPhase;
import my.projectfinance.app.model.DebtConfigurationException;
import my.projectfinance.app.model.IdcResult;
import my.projectfinance.app.model.Tranche;
import my.projectfinance.app.service.util.FinanceMathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Service
public class InterestDuringConstructionCalculator {
	private static final Logger logger = LoggerFactory.getLogger(InterestDuringConstructionCalculator.class);
	private static final double FRACTION_TOLERANCE = 1e-9;

	public IdcResult capitalize(Tranche tranche, ConstructionPhase construction) {
		if (construction == null || construction.periods() == 0) {
			return new IdcResult(tranche.id(), List.of(), List.of(), FinanceMathUtil.money(BigDecimal.ZERO),
					tranche.principal());
		}
		double drawnFraction = 0.0;
		for (int i = 0; i < construction.periods(); i++) {
			Double fraction = construction.drawdownFractions().get(i);
			if (fraction == null || fraction < 0) {
				throw new DebtConfigurationException("Construction drawdown fraction must not be negative", tranche.id(), i);
			}
			drawnFraction += fraction;
		}
		if (drawnFraction > 1.0 + FRACTION_TOLERANCE) {
			throw new DebtConfigurationException("Construction drawdowns exceed the commitment of tranche "
					+ tranche.id() + " (" + drawnFraction + ")", tranche.id());
		}
		if (drawnFraction < 1.0 - FRACTION_TOLERANCE) {
			logger.warn("Tranche {} draws only {} of its commitment during construction", tranche.id(), drawnFraction);
		}
		List<BigDecimal> drawdowns = new ArrayList<>();
		List<BigDecimal> interest = new ArrayList<>();
		BigDecimal balance = BigDecimal.ZERO;
		BigDecimal total = FinanceMathUtil.money(BigDecimal.ZERO);
		for (Double fraction : construction.drawdownFractions()) {
			BigDecimal drawn = FinanceMathUtil.times(tranche.principal(), fraction);
			balance = balance.add(drawn);
			BigDecimal accrued = FinanceMathUtil.times(balance, tranche.rate());
			balance = balance.add(accrued);
			total = total.add(accrued);
			drawdowns.add(drawn);
			interest.add(accrued);
		}
		return new IdcResult(tranche.id(), drawdowns, interest, total, tranche.principal().add(total));
	}
}
