package my.projectfinance.app.service;

import my.projectfinance.app.model.ComplianceEntry;
import my.projectfinance.app.model.ComplianceReport;
import my.projectfinance.app.model.CovenantMetric;
import my.projectfinance.app.model.CovenantSeverity;
import my.projectfinance.app.model.CovenantThreshold;
import my.projectfinance.app.model.CovenantViolation;
import my.projectfinance.app.model.CoverageMetrics;
import my.projectfinance.app.model.PeriodCoverage;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CovenantValidatorTest {
	private final CoverageMetrics metrics = CoverageMetrics.of(List.of(
			new PeriodCoverage(0, BigDecimal.valueOf(100), 1.10, 1.50, 1.80),
			new PeriodCoverage(1, BigDecimal.valueOf(80), 0.90, 1.15, 1.70),
			new PeriodCoverage(2, BigDecimal.valueOf(60), 1.32, 1.40, 1.90),
			new PeriodCoverage(3, BigDecimal.valueOf(30), Double.POSITIVE_INFINITY, 1.60, 2.10)), 0.10, 3, 5);

	@Test
	void classifiesSeverityPerPeriod() {
		CovenantValidator validator = new CovenantValidator(List.of(
				new CovenantThreshold(CovenantMetric.DSCR, 1.20, 1.35)));

		ComplianceReport report = validator.validate(metrics);

		assertThat(report.entries()).hasSize(4);
		assertThat(report.entries()).extracting(ComplianceEntry::severity).containsExactly(
				CovenantSeverity.BREACH, CovenantSeverity.CRITICAL, CovenantSeverity.WARNING, CovenantSeverity.OK);
		assertThat(report.compliant()).isFalse();
		assertThat(report.violationCount()).isEqualTo(2);
		assertThat(report.violationPeriods(CovenantMetric.DSCR)).containsExactly(0, 1);
		CovenantViolation critical = report.violations().get(1);
		assertThat(critical.shortfall()).isCloseTo(0.30, within(1e-12));
		assertThat(report.warnings()).singleElement()
				.satisfies(warning -> assertThat(warning.period()).isEqualTo(2));
	}

	@Test
	void llcrBreachIsNeverCritical() {
		CovenantValidator validator = new CovenantValidator(List.of(
				CovenantThreshold.minimum(CovenantMetric.LLCR, 1.20)));

		ComplianceReport report = validator.validate(metrics);

		assertThat(report.violations()).singleElement().satisfies(violation -> {
			assertThat(violation.metric()).isEqualTo(CovenantMetric.LLCR);
			assertThat(violation.period()).isEqualTo(1);
			assertThat(violation.severity()).isEqualTo(CovenantSeverity.BREACH);
		});
		assertThat(report.warnings()).isEmpty();
	}

	@Test
	void compliantWithoutThresholds() {
		ComplianceReport report = new CovenantValidator(null).validate(metrics);

		assertThat(report.compliant()).isTrue();
		assertThat(report.entries()).isEmpty();
	}
}
