package my.projectfinance.app.service;

import my.projectfinance.app.dto.BalloonAssessmentDto;
import my.projectfinance.app.dto.ComplianceEntryDto;
import my.projectfinance.app.dto.ComplianceReportDto;
import my.projectfinance.app.dto.ConsolidatedPeriodDto;
import my.projectfinance.app.dto.CovenantThresholdDto;
import my.projectfinance.app.dto.CovenantViolationDto;
import my.projectfinance.app.dto.CoverageMetricsDto;
import my.projectfinance.app.dto.DebtEvaluationRequestDto;
import my.projectfinance.app.dto.DebtEvaluationResponseDto;
import my.projectfinance.app.dto.IdcResultDto;
import my.projectfinance.app.dto.MixRequestDto;
import my.projectfinance.app.dto.MixResponseDto;
import my.projectfinance.app.dto.PeriodCoverageDto;
import my.projectfinance.app.dto.RefinancingRequestDto;
import my.projectfinance.app.dto.RefinancingResponseDto;
import my.projectfinance.app.dto.ScheduleDto;
import my.projectfinance.app.dto.ScheduleEntryDto;
import my.projectfinance.app.dto.SeriesStatisticsDto;
import my.projectfinance.app.dto.TrancheRequestDto;
import my.projectfinance.app.dto.TrancheScheduleDto;
import my.projectfinance.app.model.BalloonAssessment;
import my.projectfinance.app.model.CfadsSeries;
import my.projectfinance.app.model.ComplianceEntry;
import my.projectfinance.app.model.ComplianceReport;
import my.projectfinance.app.model.ConsolidatedPeriod;
import my.projectfinance.app.model.ConstructionPhase;
import my.projectfinance.app.model.CovenantThreshold;
import my.projectfinance.app.model.CovenantViolation;
import my.projectfinance.app.model.CoverageMetrics;
import my.projectfinance.app.model.DebtMix;
import my.projectfinance.app.model.EngineSettings;
import my.projectfinance.app.model.ExchangeRateSeries;
import my.projectfinance.app.model.IdcResult;
import my.projectfinance.app.model.MixAllocation;
import my.projectfinance.app.model.PeriodCoverage;
import my.projectfinance.app.model.RefinancingComparison;
import my.projectfinance.app.model.ScheduleEntry;
import my.projectfinance.app.model.SeriesStatistics;
import my.projectfinance.app.model.StructuringInput;
import my.projectfinance.app.model.StructuringResult;
import my.projectfinance.app.model.Tranche;
import my.projectfinance.app.model.TrancheSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class DebtStructuringService {
	private static final Logger logger = LoggerFactory.getLogger(DebtStructuringService.class);

	private final DebtStructuringEngine engine;
	private final RefinancingEvaluator refinancingEvaluator;
	private final TrancheMixSolver mixSolver;
	private final EngineSettings defaultSettings;

	public DebtStructuringService(DebtStructuringEngine engine,
								  RefinancingEvaluator refinancingEvaluator,
								  TrancheMixSolver mixSolver,
								  EngineSettings defaultEngineSettings) {
		this.engine = engine;
		this.refinancingEvaluator = refinancingEvaluator;
		this.mixSolver = mixSolver;
		this.defaultSettings = defaultEngineSettings;
	}

	public DebtEvaluationResponseDto evaluate(DebtEvaluationRequestDto request) {
		if (request == null) {
			throw new IllegalArgumentException("Request body is required");
		}
		StructuringInput input = toInput(request);
		EngineSettings settings = resolveSettings(request);
		logger.debug("Evaluating {} tranche(s) over {} CFADS period(s)", input.tranches().size(), input.cfads().size());
		return toDto(engine.evaluate(input, settings));
	}

	public RefinancingResponseDto refinance(RefinancingRequestDto request) {
		if (request == null || request.structure() == null) {
			throw new IllegalArgumentException("Request body is required");
		}
		StructuringInput input = toInput(request.structure());
		EngineSettings settings = resolveSettings(request.structure());
		StructuringResult original = engine.evaluate(input, settings);
		RefinancingComparison comparison = refinancingEvaluator.compare(input, original,
				request.refinancingPeriod(), toTranches(request.candidateTranches()), settings);
		return new RefinancingResponseDto(comparison.refinancingPeriod(),
				comparison.refinancedBalance(),
				toDto(comparison.originalMetrics()),
				toDto(comparison.originalBalloon()),
				toDto(comparison.alternative()));
	}

	public MixResponseDto solveMix(MixRequestDto request) {
		if (request == null) {
			throw new IllegalArgumentException("Request body is required");
		}
		DebtMix mix = new DebtMix(request.debtTotal(),
				valueOr(request.domesticMaxShare(), 0.0),
				valueOr(request.dfiMaxShare(), 0.0),
				valueOr(request.commercialMinShare(), 0.0),
				valueOr(request.domesticRate(), 0.0),
				valueOr(request.commercialRate(), 0.0),
				valueOr(request.dfiRate(), 0.0),
				request.tenorPeriods() == null ? 0 : request.tenorPeriods(),
				request.interestOnlyPeriods() == null ? 0 : request.interestOnlyPeriods(),
				request.amortizationStyle(),
				request.targetDscr());
		MixAllocation allocation = mixSolver.solve(mix, request.baseCurrency(),
				new ExchangeRateSeries(request.exchangeRates()));
		List<TrancheRequestDto> tranches = new ArrayList<>();
		for (Tranche tranche : allocation.tranches()) {
			tranches.add(new TrancheRequestDto(tranche.id(),
					tranche.currency(),
					tranche.principal(),
					tranche.rate(),
					tranche.tenorPeriods(),
					tranche.gracePeriods(),
					tranche.amortizationStyle(),
					tranche.targetDscr(),
					tranche.balloonFraction(),
					tranche.capitalizeGraceInterest(),
					tranche.priority()));
		}
		return new MixResponseDto(allocation.domesticAmount(), allocation.commercialAmount(), allocation.dfiAmount(),
				tranches);
	}

	EngineSettings resolveSettings(DebtEvaluationRequestDto request) {
		EngineSettings settings = defaultSettings;
		if (request.hurdleRate() != null) {
			settings = settings.withHurdleRate(request.hurdleRate());
		}
		if (request.allocationPolicy() != null) {
			settings = settings.withAllocationPolicy(request.allocationPolicy());
		}
		if (request.validationPolicy() != null) {
			settings = settings.withValidationPolicy(request.validationPolicy());
		}
		if (request.sculptFallback() != null) {
			settings = settings.withSculptFallback(request.sculptFallback());
		}
		if (request.covenants() != null) {
			List<CovenantThreshold> covenants = new ArrayList<>();
			for (CovenantThresholdDto covenant : request.covenants()) {
				covenants.add(new CovenantThreshold(covenant.metric(), covenant.minimum(), covenant.warning()));
			}
			settings = settings.withCovenants(covenants);
		}
		return settings;
	}

	private StructuringInput toInput(DebtEvaluationRequestDto request) {
		ConstructionPhase construction = request.constructionDrawdowns() == null
				? null
				: new ConstructionPhase(request.constructionDrawdowns());
		return new StructuringInput(toTranches(request.tranches()),
				new CfadsSeries(request.cfads()),
				request.baseCurrency(),
				new ExchangeRateSeries(request.exchangeRates()),
				construction,
				0);
	}

	private List<Tranche> toTranches(List<TrancheRequestDto> requests) {
		List<Tranche> tranches = new ArrayList<>();
		if (requests == null) {
			return tranches;
		}
		for (TrancheRequestDto request : requests) {
			tranches.add(new Tranche(request.id(),
					request.currency(),
					request.principal(),
					valueOr(request.rate(), 0.0),
					request.tenorPeriods() == null ? 0 : request.tenorPeriods(),
					request.gracePeriods() == null ? 0 : request.gracePeriods(),
					request.amortizationStyle(),
					request.targetDscr(),
					valueOr(request.balloonFraction(), 0.0),
					Boolean.TRUE.equals(request.capitalizeGraceInterest()),
					request.priority() == null ? 1 : request.priority()));
		}
		return tranches;
	}

	private DebtEvaluationResponseDto toDto(StructuringResult result) {
		List<TrancheScheduleDto> tranches = new ArrayList<>();
		for (TrancheSchedule schedule : result.schedule().tranches()) {
			tranches.add(toDto(schedule));
		}
		List<ConsolidatedPeriodDto> periods = new ArrayList<>();
		for (ConsolidatedPeriod period : result.schedule().periods()) {
			periods.add(new ConsolidatedPeriodDto(period.period(), period.cfads(), period.openingBalance(),
					period.totalService(), period.closingBalance()));
		}
		List<IdcResultDto> idc = new ArrayList<>();
		for (IdcResult entry : result.idc()) {
			idc.add(new IdcResultDto(entry.trancheId(), entry.drawdowns(), entry.interest(),
					entry.totalCapitalized(), entry.operatingPrincipal()));
		}
		return new DebtEvaluationResponseDto(new ScheduleDto(tranches, periods),
				toDto(result.metrics()),
				toDto(result.compliance()),
				toDto(result.balloon()),
				idc,
				result.warnings(),
				result.notes());
	}

	private TrancheScheduleDto toDto(TrancheSchedule schedule) {
		List<ScheduleEntryDto> entries = new ArrayList<>();
		for (ScheduleEntry entry : schedule.entries()) {
			entries.add(new ScheduleEntryDto(entry.period(),
					entry.openingBalance(),
					entry.interest(),
					entry.capitalizedInterest(),
					entry.principalPaid(),
					entry.totalService(),
					entry.closingBalance(),
					entry.cfadsAllocation(),
					finiteOrNull(entry.dscr())));
		}
		Tranche tranche = schedule.tranche();
		return new TrancheScheduleDto(tranche.id(), tranche.currency(), tranche.amortizationStyle(),
				tranche.principal(), schedule.fallbackApplied(), schedule.finalBalance(), entries);
	}

	private CoverageMetricsDto toDto(CoverageMetrics metrics) {
		List<PeriodCoverageDto> periods = new ArrayList<>();
		for (PeriodCoverage coverage : metrics.periods()) {
			periods.add(new PeriodCoverageDto(coverage.period(),
					coverage.openingBalance(),
					finiteOrNull(coverage.dscr()),
					finiteOrNull(coverage.llcr()),
					finiteOrNull(coverage.plcr())));
		}
		return new CoverageMetricsDto(periods,
				toDto(metrics.dscr()),
				toDto(metrics.llcr()),
				toDto(metrics.plcr()),
				metrics.hurdleRate(),
				metrics.maturityPeriod(),
				metrics.projectEndPeriod());
	}

	private SeriesStatisticsDto toDto(SeriesStatistics statistics) {
		return new SeriesStatisticsDto(statistics.min(), statistics.max(), statistics.mean(), statistics.median(),
				statistics.count());
	}

	private ComplianceReportDto toDto(ComplianceReport report) {
		List<ComplianceEntryDto> entries = new ArrayList<>();
		for (ComplianceEntry entry : report.entries()) {
			entries.add(new ComplianceEntryDto(entry.period(),
					entry.metric(),
					finiteOrNull(entry.actual()),
					entry.minimum(),
					entry.pass(),
					finiteOrNull(entry.buffer()),
					entry.severity()));
		}
		return new ComplianceReportDto(report.compliant(),
				report.violationCount(),
				toViolationDtos(report.violations()),
				toViolationDtos(report.warnings()),
				entries);
	}

	private List<CovenantViolationDto> toViolationDtos(List<CovenantViolation> violations) {
		List<CovenantViolationDto> result = new ArrayList<>();
		for (CovenantViolation violation : violations) {
			result.add(new CovenantViolationDto(violation.metric(),
					violation.period(),
					finiteOrNull(violation.actual()),
					violation.threshold(),
					finiteOrNull(violation.shortfall()),
					violation.severity()));
		}
		return result;
	}

	private BalloonAssessmentDto toDto(BalloonAssessment balloon) {
		if (balloon == null) {
			return null;
		}
		return new BalloonAssessmentDto(balloon.amount(), balloon.fraction(), balloon.feasible(),
				balloon.mitigationRequired(), balloon.mitigationOptions(), balloon.notes());
	}

	private Double finiteOrNull(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return null;
		}
		return value;
	}

	private double valueOr(Double value, double fallback) {
		return value == null ? fallback : value;
	}
}
