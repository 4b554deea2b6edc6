package my.projectfinance.app.config;

import my.projectfinance.app.model.AllocationPolicy;
import my.projectfinance.app.model.CovenantMetric;
import my.projectfinance.app.model.EngineSettings;
import my.projectfinance.app.model.SculptFallback;
import my.projectfinance.app.model.ValidationPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EngineConfigTest {
	private final EngineConfig config = new EngineConfig();

	@Test
	void usesBuiltInDefaultsWithoutEngineProperties() {
		EngineSettings settings = config.defaultEngineSettings(new AppProperties(null));

		assertThat(settings.hurdleRate()).isEqualTo(0.10);
		assertThat(settings.allocationPolicy()).isEqualTo(AllocationPolicy.PRO_RATA);
		assertThat(settings.validationPolicy()).isEqualTo(ValidationPolicy.PERMISSIVE);
		assertThat(settings.covenants()).isEmpty();
	}

	@Test
	void mapsConfiguredEngineProperties() {
		AppProperties properties = new AppProperties(new AppProperties.Engine(
				0.08,
				AllocationPolicy.WATERFALL,
				ValidationPolicy.STRICT,
				SculptFallback.ANNUITY,
				new AppProperties.Constraints(0.20, null, 0.15, null,
						new AppProperties.Constraints.Refinancing(true, 0.12)),
				List.of(new AppProperties.Covenant(CovenantMetric.DSCR, 1.30, 1.35))));

		EngineSettings settings = config.defaultEngineSettings(properties);

		assertThat(settings.hurdleRate()).isEqualTo(0.08);
		assertThat(settings.allocationPolicy()).isEqualTo(AllocationPolicy.WATERFALL);
		assertThat(settings.sculptFallback()).isEqualTo(SculptFallback.ANNUITY);
		assertThat(settings.constraints().maxInterestRate()).isEqualTo(0.20);
		assertThat(settings.constraints().maxTenorPeriods()).isEqualTo(25);
		assertThat(settings.constraints().maxBalloonFraction()).isEqualTo(0.15);
		assertThat(settings.constraints().refinancingEnabled()).isTrue();
		assertThat(settings.constraints().maxRefinanceFraction()).isEqualTo(0.12);
		assertThat(settings.covenants()).singleElement()
				.satisfies(covenant -> assertThat(covenant.warning()).isEqualTo(1.35));
	}
}
