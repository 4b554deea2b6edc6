package my.projectfinance.app.service;

import my.projectfinance.app.model.AmortizationStyle;
import my.projectfinance.app.model.Currency;
import my.projectfinance.app.model.CurrencyConversion;
import my.projectfinance.app.model.DebtConfigurationException;
import my.projectfinance.app.model.DebtMix;
import my.projectfinance.app.model.ExchangeRateSeries;
import my.projectfinance.app.model.MixAllocation;
import my.projectfinance.app.model.Tranche;
import my.projectfinance.app.service.util.FinanceMathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a debt quantum into domestic, commercial and DFI tranches. Domestic and DFI are sized up to their caps;
 * commercial debt takes the rest and is topped up to its minimum share by pulling from domestic first, then DFI.
 */
@Service
public class TrancheMixSolver {
	private static final Logger logger = LoggerFactory.getLogger(TrancheMixSolver.class);

	public static final String DOMESTIC_ID = "DOMESTIC";
	public static final String COMMERCIAL_ID = "COMMERCIAL";
	public static final String DFI_ID = "DFI";

	public MixAllocation solve(DebtMix mix, Currency baseCurrency, ExchangeRateSeries exchangeRates) {
		validate(mix);
		BigDecimal total = FinanceMathUtil.money(mix.debtTotal());
		BigDecimal domestic = FinanceMathUtil.times(total, mix.domesticMaxShare()).min(total);
		BigDecimal dfi = FinanceMathUtil.times(total, mix.dfiMaxShare())
				.min(total.subtract(domestic).max(BigDecimal.ZERO));
		BigDecimal commercial = total.subtract(domestic).subtract(dfi).max(BigDecimal.ZERO);

		BigDecimal commercialFloor = FinanceMathUtil.times(total, mix.commercialMinShare());
		if (commercial.compareTo(commercialFloor) < 0) {
			BigDecimal need = commercialFloor.subtract(commercial);
			BigDecimal fromDomestic = need.min(domestic);
			domestic = domestic.subtract(fromDomestic);
			need = need.subtract(fromDomestic);
			if (need.signum() > 0) {
				BigDecimal fromDfi = need.min(dfi);
				dfi = dfi.subtract(fromDfi);
			}
			commercial = total.subtract(domestic).subtract(dfi);
			logger.debug("Commercial tranche raised to its floor of {}", commercialFloor);
		}

		CurrencyConversion conversion = new CurrencyConversion(baseCurrency, exchangeRates);
		List<Tranche> tranches = new ArrayList<>();
		addTranche(tranches, DOMESTIC_ID, Currency.DOMESTIC, domestic, mix.domesticRate(), 1, mix, conversion);
		addTranche(tranches, COMMERCIAL_ID, Currency.HARD_CURRENCY, commercial, mix.commercialRate(), 2, mix,
				conversion);
		addTranche(tranches, DFI_ID, Currency.HARD_CURRENCY, dfi, mix.dfiRate(), 3, mix, conversion);
		logger.info("Sized debt of {} as domestic={}, commercial={}, dfi={}", total, domestic, commercial, dfi);
		return new MixAllocation(domestic, commercial, dfi, tranches);
	}

	private void addTranche(List<Tranche> tranches, String id, Currency currency, BigDecimal baseAmount, double rate,
							int priority, DebtMix mix, CurrencyConversion conversion) {
		if (baseAmount.signum() <= 0) {
			return;
		}
		AmortizationStyle style = mix.amortizationStyle();
		tranches.add(new Tranche(id,
				currency,
				conversion.fromBase(currency, 0, baseAmount),
				rate,
				mix.tenorPeriods(),
				mix.interestOnlyPeriods(),
				style,
				style == AmortizationStyle.SCULPTED ? mix.targetDscr() : null,
				0.0,
				false,
				priority));
	}

	private void validate(DebtMix mix) {
		if (mix == null) {
			throw new DebtConfigurationException("Debt mix is required");
		}
		if (!FinanceMathUtil.isPositive(mix.debtTotal())) {
			throw new DebtConfigurationException("debt_total must be positive (got " + mix.debtTotal() + ")");
		}
		requireShare("domestic_max_share", mix.domesticMaxShare());
		requireShare("dfi_max_share", mix.dfiMaxShare());
		requireShare("commercial_min_share", mix.commercialMinShare());
	}

	private void requireShare(String name, double value) {
		if (!(value >= 0.0 && value <= 1.0)) {
			throw new DebtConfigurationException(name + " must be in [0, 1] (got " + value + ")");
		}
	}
}
