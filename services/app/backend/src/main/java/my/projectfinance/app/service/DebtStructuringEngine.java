package my.projectfinance.app.service;

import my.projectfinance.app.model.BalloonAssessment;
import my.projectfinance.app.model.CfadsSeries;
import my.projectfinance.app.model.ComplianceReport;
import my.projectfinance.app.model.ConsolidatedPeriod;
import my.projectfinance.app.model.CoverageMetrics;
import my.projectfinance.app.model.CurrencyConversion;
import my.projectfinance.app.model.EngineSettings;
import my.projectfinance.app.model.IdcResult;
import my.projectfinance.app.model.InfeasibleSculptException;
import my.projectfinance.app.model.SculptFallback;
import my.projectfinance.app.model.Schedule;
import my.projectfinance.app.model.ScheduleEntry;
import my.projectfinance.app.model.StructuringInput;
import my.projectfinance.app.model.StructuringResult;
import my.projectfinance.app.model.Tranche;
import my.projectfinance.app.model.TrancheSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class DebtStructuringEngine {
	private static final Logger logger = LoggerFactory.getLogger(DebtStructuringEngine.class);

	private final AmortizationScheduler scheduler;
	private final CoverageAnalyzer coverageAnalyzer;
	private final BalloonAssessor balloonAssessor;
	private final InterestDuringConstructionCalculator idcCalculator;

	public DebtStructuringEngine(AmortizationScheduler scheduler,
								 CoverageAnalyzer coverageAnalyzer,
								 BalloonAssessor balloonAssessor,
								 InterestDuringConstructionCalculator idcCalculator) {
		this.scheduler = scheduler;
		this.coverageAnalyzer = coverageAnalyzer;
		this.balloonAssessor = balloonAssessor;
		this.idcCalculator = idcCalculator;
	}

	public StructuringResult evaluate(StructuringInput input, EngineSettings settings) {
		StructureValidator validator = new StructureValidator(settings.constraints(), settings.validationPolicy());
		List<String> warnings = validator.validate(input, settings.hurdleRate(), settings.covenants());
		for (String warning : warnings) {
			logger.warn("Structure warning: {}", warning);
		}

		List<IdcResult> idc = new ArrayList<>();
		List<Tranche> tranches = new ArrayList<>();
		for (Tranche tranche : input.tranches()) {
			if (input.construction() == null || input.construction().periods() == 0) {
				tranches.add(tranche);
				continue;
			}
			IdcResult result = idcCalculator.capitalize(tranche, input.construction());
			idc.add(result);
			tranches.add(tranche.withPrincipal(result.operatingPrincipal()));
		}

		CurrencyConversion conversion = new CurrencyConversion(input.baseCurrency(), input.exchangeRates());
		TrancheAllocator allocator = new TrancheAllocator(settings.allocationPolicy());
		List<String> notes = new ArrayList<>();
		Schedule schedule = buildSchedule(tranches, input.cfads(), conversion, allocator, settings.sculptFallback(),
				input.startPeriod(), notes);

		CoverageMetrics metrics = coverageAnalyzer.analyze(schedule, input.cfads(), settings.hurdleRate(),
				input.startPeriod());
		ComplianceReport compliance = new CovenantValidator(settings.covenants()).validate(metrics);
		BalloonAssessment balloon = balloonAssessor.assess(schedule, conversion, settings.constraints(),
				input.startPeriod());

		logger.info("Evaluated {} tranche(s) from period {} to maturity {}: min DSCR={}, min LLCR={}, violations={}",
				tranches.size(), input.startPeriod(), schedule.maturityPeriod(), metrics.dscr().min(),
				metrics.llcr().min(), compliance.violationCount());
		return new StructuringResult(schedule, metrics, compliance, balloon, idc, warnings, notes);
	}

	Schedule buildSchedule(List<Tranche> tranches,
						   CfadsSeries cfads,
						   CurrencyConversion conversion,
						   TrancheAllocator allocator,
						   SculptFallback fallback,
						   int startPeriod,
						   List<String> notes) {
		List<Tranche> working = new ArrayList<>(tranches);
		Set<String> fallbackIds = new HashSet<>();
		while (true) {
			try {
				return simulate(working, cfads, conversion, allocator, startPeriod, fallbackIds);
			} catch (InfeasibleSculptException ex) {
				if (fallback != SculptFallback.ANNUITY || fallbackIds.contains(ex.getTrancheId())) {
					throw ex;
				}
				logger.warn("Falling back to annuity amortization: {}", ex.getMessage());
				notes.add("Tranche " + ex.getTrancheId() + " rescheduled as annuity after infeasible sculpt in period "
						+ ex.getPeriod());
				fallbackIds.add(ex.getTrancheId());
				for (int i = 0; i < working.size(); i++) {
					if (working.get(i).id().equals(ex.getTrancheId())) {
						working.set(i, working.get(i).asAnnuity());
					}
				}
			}
		}
	}

	private Schedule simulate(List<Tranche> tranches,
							  CfadsSeries cfads,
							  CurrencyConversion conversion,
							  TrancheAllocator allocator,
							  int startPeriod,
							  Set<String> fallbackIds) {
		List<AmortizationScheduler.TrancheAmortization> amortizations = new ArrayList<>();
		int horizon = 0;
		for (Tranche tranche : tranches) {
			amortizations.add(scheduler.start(tranche, startPeriod));
			horizon = Math.max(horizon, tranche.tenorPeriods());
		}
		for (int t = 0; t < horizon; t++) {
			List<AmortizationScheduler.TrancheAmortization> active = new ArrayList<>();
			for (AmortizationScheduler.TrancheAmortization amortization : amortizations) {
				if (amortization.isActive()) {
					active.add(amortization);
				}
			}
			allocator.allocate(startPeriod + t, t, cfads.get(t), active, conversion);
		}

		List<TrancheSchedule> schedules = new ArrayList<>();
		for (AmortizationScheduler.TrancheAmortization amortization : amortizations) {
			schedules.add(amortization.toSchedule(fallbackIds.contains(amortization.tranche().id())));
		}
		List<ConsolidatedPeriod> periods = new ArrayList<>();
		for (int t = 0; t < horizon; t++) {
			int period = startPeriod + t;
			BigDecimal opening = BigDecimal.ZERO;
			BigDecimal service = BigDecimal.ZERO;
			BigDecimal closing = BigDecimal.ZERO;
			for (TrancheSchedule schedule : schedules) {
				ScheduleEntry entry = schedule.entryFor(period);
				if (entry == null) {
					// Matured with a balloon outstanding: the balance stays owed until the structure matures.
					BigDecimal unpaid = carriedBalance(schedule, conversion, t, startPeriod);
					opening = opening.add(unpaid);
					closing = closing.add(unpaid);
					continue;
				}
				opening = opening.add(conversion.toBase(schedule.tranche().currency(), t, entry.openingBalance()));
				service = service.add(conversion.toBase(schedule.tranche().currency(), t, entry.totalService()));
				closing = closing.add(conversion.toBase(schedule.tranche().currency(), t, entry.closingBalance()));
			}
			periods.add(new ConsolidatedPeriod(period, cfads.get(t), opening, service, closing));
		}
		return new Schedule(schedules, periods);
	}

	private BigDecimal carriedBalance(TrancheSchedule schedule, CurrencyConversion conversion, int t,
									  int startPeriod) {
		BigDecimal unpaid = schedule.finalBalance();
		if (unpaid.signum() == 0) {
			return unpaid;
		}
		int ratePeriod = conversion.exchangeRates().hasRate(t) ? t : schedule.maturityPeriod() - startPeriod;
		return conversion.toBase(schedule.tranche().currency(), ratePeriod, unpaid);
	}
}
