package my.projectfinance.app.service;

import my.projectfinance.app.model.ConsolidatedPeriod;
import my.projectfinance.app.model.CurrencyConversion;
import my.projectfinance.app.model.DebtConfigurationException;
import my.projectfinance.app.model.EngineSettings;
import my.projectfinance.app.model.RefinancingComparison;
import my.projectfinance.app.model.StructuringInput;
import my.projectfinance.app.model.StructuringResult;
import my.projectfinance.app.model.Tranche;
import my.projectfinance.app.service.util.FinanceMathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-runs the structuring pipeline from a refinancing period with a replacement tranche set. Candidate
 * principals are weights: they are rescaled so the new tranches together refinance exactly the balance
 * outstanding at the refinancing period.
 */
@Service
public class RefinancingEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(RefinancingEvaluator.class);

	private final DebtStructuringEngine engine;

	public RefinancingEvaluator(DebtStructuringEngine engine) {
		this.engine = engine;
	}

	public RefinancingComparison compare(StructuringInput input,
										 StructuringResult original,
										 int refinancingPeriod,
										 List<Tranche> candidates,
										 EngineSettings settings) {
		if (candidates == null || candidates.isEmpty()) {
			throw new DebtConfigurationException("At least one candidate tranche is required for refinancing");
		}
		int relative = refinancingPeriod - input.startPeriod();
		int maturity = original.schedule().maturityPeriod();
		if (refinancingPeriod <= original.schedule().firstPeriod() || refinancingPeriod > maturity + 1) {
			throw new DebtConfigurationException("Refinancing period " + refinancingPeriod + " must be after period "
					+ original.schedule().firstPeriod() + " and no later than " + (maturity + 1), null,
					refinancingPeriod);
		}
		if (relative >= input.cfads().size()) {
			throw new DebtConfigurationException("No CFADS remain from refinancing period " + refinancingPeriod, null,
					refinancingPeriod);
		}
		ConsolidatedPeriod previous = original.schedule().period(refinancingPeriod - 1);
		BigDecimal balance = previous == null ? BigDecimal.ZERO : previous.closingBalance();
		if (!FinanceMathUtil.isPositive(balance)) {
			throw new DebtConfigurationException("No debt outstanding to refinance at period " + refinancingPeriod,
					null, refinancingPeriod);
		}

		StructuringInput alternativeInput = new StructuringInput(
				rescale(candidates, balance, new CurrencyConversion(input.baseCurrency(),
						input.exchangeRates().from(relative)), refinancingPeriod),
				input.cfads().from(relative),
				input.baseCurrency(),
				input.exchangeRates().from(relative),
				null,
				refinancingPeriod);
		StructuringResult alternative = engine.evaluate(alternativeInput, settings);
		logger.info("Refinanced {} at period {} with {} tranche(s)", balance, refinancingPeriod, candidates.size());
		return new RefinancingComparison(refinancingPeriod,
				balance,
				original.metrics().fromPeriod(refinancingPeriod),
				original.balloon(),
				alternative);
	}

	private List<Tranche> rescale(List<Tranche> candidates, BigDecimal balance, CurrencyConversion conversion,
								  int refinancingPeriod) {
		conversion.requireCoverage(candidates, refinancingPeriod);
		BigDecimal weightTotal = BigDecimal.ZERO;
		for (Tranche candidate : candidates) {
			weightTotal = weightTotal.add(conversion.toBase(candidate.currency(), 0, candidate.principal()));
		}
		List<Tranche> scaled = new ArrayList<>();
		BigDecimal assigned = BigDecimal.ZERO;
		for (int i = 0; i < candidates.size(); i++) {
			Tranche candidate = candidates.get(i);
			BigDecimal baseShare;
			if (i == candidates.size() - 1) {
				baseShare = balance.subtract(assigned);
			} else {
				baseShare = balance.multiply(conversion.toBase(candidate.currency(), 0, candidate.principal()))
						.divide(weightTotal, FinanceMathUtil.MONEY_SCALE, FinanceMathUtil.ROUNDING);
				assigned = assigned.add(baseShare);
			}
			scaled.add(candidate.withPrincipal(conversion.fromBase(candidate.currency(), 0, baseShare)));
		}
		return scaled;
	}
}
