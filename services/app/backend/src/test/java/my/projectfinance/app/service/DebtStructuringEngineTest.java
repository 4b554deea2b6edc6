package my.projectfinance.app.service;

import my.projectfinance.app.model.AmortizationStyle;
import my.projectfinance.app.model.CfadsSeries;
import my.projectfinance.app.model.ConsolidatedPeriod;
import my.projectfinance.app.model.ConstructionPhase;
import my.projectfinance.app.model.CovenantMetric;
import my.projectfinance.app.model.CovenantThreshold;
import my.projectfinance.app.model.Currency;
import my.projectfinance.app.model.EngineSettings;
import my.projectfinance.app.model.ExchangeRateSeries;
import my.projectfinance.app.model.InfeasibleSculptException;
import my.projectfinance.app.model.SculptFallback;
import my.projectfinance.app.model.StructuringInput;
import my.projectfinance.app.model.StructuringResult;
import my.projectfinance.app.model.Tranche;
import my.projectfinance.app.model.TrancheSchedule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DebtStructuringEngineTest {
	private final DebtStructuringEngine engine = new DebtStructuringEngine(
			new AmortizationScheduler(),
			new CoverageAnalyzer(),
			new BalloonAssessor(),
			new InterestDuringConstructionCalculator());

	private final StructuringInput infeasibleSculpt = StructuringInput.of(
			List.of(Tranche.sculpted("B", Currency.DOMESTIC, BigDecimal.valueOf(800_000), 0.10, 4, 0, 1.25)),
			CfadsSeries.of(200_000.0, 220_000.0, 50_000.0, 240_000.0),
			Currency.DOMESTIC);

	@Test
	void propagatesInfeasibleSculptWithoutFallback() {
		assertThatThrownBy(() -> engine.evaluate(infeasibleSculpt, EngineSettings.defaults(0.10)))
				.isInstanceOfSatisfying(InfeasibleSculptException.class,
						ex -> assertThat(ex.getPeriod()).isEqualTo(2));
	}

	@Test
	void fallsBackToAnnuityWhenConfigured() {
		StructuringResult result = engine.evaluate(infeasibleSculpt,
				EngineSettings.defaults(0.10).withSculptFallback(SculptFallback.ANNUITY));

		TrancheSchedule schedule = result.schedule().trancheSchedule("B");
		assertThat(schedule.fallbackApplied()).isTrue();
		assertThat(schedule.tranche().amortizationStyle()).isEqualTo(AmortizationStyle.ANNUITY);
		assertThat(schedule.finalBalance()).isEqualByComparingTo("0");
		assertThat(result.notes()).singleElement().asString().contains("B").contains("period 2");
	}

	@Test
	void proRataAllocationsSumToCfadsEachPeriod() {
		StructuringInput input = StructuringInput.of(List.of(
						Tranche.sculpted("A", Currency.DOMESTIC, BigDecimal.valueOf(500_000), 0.08, 4, 0, 1.25),
						Tranche.sculpted("B", Currency.DOMESTIC, BigDecimal.valueOf(300_000), 0.08, 4, 0, 1.25)),
				CfadsSeries.of(400_000.0, 400_000.0, 400_000.0, 400_000.0),
				Currency.DOMESTIC);

		StructuringResult result = engine.evaluate(input, EngineSettings.defaults(0.10));

		for (int period = 0; period < 4; period++) {
			BigDecimal allocated = BigDecimal.ZERO;
			for (TrancheSchedule schedule : result.schedule().tranches()) {
				allocated = allocated.add(schedule.entryFor(period).cfadsAllocation());
			}
			assertThat(allocated).isEqualByComparingTo("400000");
		}
		assertThat(result.schedule().trancheSchedule("A").entryFor(0).cfadsAllocation())
				.isEqualByComparingTo("250000");
		assertThat(result.schedule().trancheSchedule("A").entryFor(0).dscr()).isCloseTo(1.25, within(1e-9));
	}

	@Test
	void consolidatesForeignTranchesInBaseCurrency() {
		StructuringInput input = StructuringInput.of(List.of(
						Tranche.annuity("LOCAL", Currency.DOMESTIC, BigDecimal.valueOf(1_000), 0.05, 3, 0),
						Tranche.annuity("HARD", Currency.HARD_CURRENCY, BigDecimal.valueOf(500), 0.05, 3, 0)),
				CfadsSeries.of(1_000.0, 1_000.0, 1_000.0),
				Currency.DOMESTIC)
				.withExchangeRates(ExchangeRateSeries.flat(2.0, 3));

		StructuringResult result = engine.evaluate(input, EngineSettings.defaults(0.10));

		ConsolidatedPeriod first = result.schedule().period(0);
		assertThat(first.openingBalance()).isEqualByComparingTo("2000");
		BigDecimal localService = result.schedule().trancheSchedule("LOCAL").entryFor(0).totalService();
		BigDecimal hardService = result.schedule().trancheSchedule("HARD").entryFor(0).totalService();
		assertThat(first.totalService()).isEqualByComparingTo(localService.add(hardService.multiply(BigDecimal.valueOf(2))));
		assertThat(result.balloon().notes()).isEqualTo("No material balloon payment");
	}

	@Test
	void capitalizesConstructionInterestIntoOperatingPrincipal() {
		StructuringInput input = StructuringInput.of(
						List.of(Tranche.annuity("A", Currency.DOMESTIC, BigDecimal.valueOf(1_000), 0.10, 3, 0)),
						CfadsSeries.of(600.0, 600.0, 600.0),
						Currency.DOMESTIC)
				.withConstruction(new ConstructionPhase(List.of(0.5, 0.5)));

		StructuringResult result = engine.evaluate(input, EngineSettings.defaults(0.10));

		assertThat(result.idc()).singleElement()
				.satisfies(idc -> assertThat(idc.totalCapitalized()).isEqualByComparingTo("155"));
		assertThat(result.schedule().trancheSchedule("A").entryFor(0).openingBalance())
				.isEqualByComparingTo("1155");
	}

	@Test
	void reportsCovenantBreachesAndStructureWarnings() {
		StructuringInput input = StructuringInput.of(
				List.of(Tranche.sculpted("S", Currency.DOMESTIC, BigDecimal.valueOf(500_000), 0.08, 4, 0, 1.25)),
				CfadsSeries.of(200_000.0, 200_000.0, 200_000.0, 200_000.0),
				Currency.DOMESTIC);
		EngineSettings settings = EngineSettings.defaults(0.10)
				.withCovenants(List.of(new CovenantThreshold(CovenantMetric.DSCR, 1.30, 1.40)));

		StructuringResult result = engine.evaluate(input, settings);

		assertThat(result.compliance().violationPeriods(CovenantMetric.DSCR)).containsExactly(0, 1, 2);
		assertThat(result.compliance().compliant()).isFalse();
		assertThat(result.warnings()).singleElement().asString().contains("DSCR covenant");
		assertThat(result.metrics().dscr().min()).isCloseTo(1.25, within(1e-9));
	}

	@Test
	void balloonOfEarlierMaturingTrancheStaysInConsolidatedBalance() {
		StructuringInput input = StructuringInput.of(List.of(
						Tranche.annuity("A", Currency.DOMESTIC, BigDecimal.valueOf(1_000_000), 0.08, 3, 0)
								.withBalloonFraction(0.2),
						Tranche.annuity("B", Currency.DOMESTIC, BigDecimal.valueOf(1_000_000), 0.08, 6, 0)),
				CfadsSeries.of(600_000.0, 600_000.0, 600_000.0, 600_000.0, 600_000.0, 600_000.0, 600_000.0,
						600_000.0, 600_000.0),
				Currency.DOMESTIC);

		StructuringResult result = engine.evaluate(input, EngineSettings.defaults(0.10));

		List<ConsolidatedPeriod> periods = result.schedule().periods();
		assertThat(periods).hasSize(6);
		for (int t = 0; t < periods.size() - 1; t++) {
			assertThat(periods.get(t + 1).openingBalance()).isEqualByComparingTo(periods.get(t).closingBalance());
		}
		TrancheSchedule longer = result.schedule().trancheSchedule("B");
		assertThat(result.schedule().period(3).openingBalance())
				.isEqualByComparingTo(longer.entryFor(3).openingBalance().add(new BigDecimal("200000.00")));
		assertThat(result.schedule().period(3).totalService()).isEqualByComparingTo(longer.entryFor(3).totalService());
		assertThat(result.schedule().period(5).closingBalance()).isEqualByComparingTo("200000");
		assertThat(result.metrics().period(5).openingBalance())
				.isEqualByComparingTo(longer.entryFor(5).openingBalance().add(new BigDecimal("200000.00")));
	}
}
