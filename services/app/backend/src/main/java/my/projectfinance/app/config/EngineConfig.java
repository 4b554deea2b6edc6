package my.projectfinance.app.config;

import my.projectfinance.app.model.CovenantThreshold;
import my.projectfinance.app.model.EngineSettings;
import my.projectfinance.app.model.FinancingConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class EngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);
	private static final double DEFAULT_HURDLE_RATE = 0.10;

	@Bean
	public EngineSettings defaultEngineSettings(AppProperties properties) {
		AppProperties.Engine engine = properties.engine();
		if (engine == null) {
			logger.info("No engine settings configured; using built-in defaults (hurdle rate={}).", DEFAULT_HURDLE_RATE);
			return EngineSettings.defaults(DEFAULT_HURDLE_RATE);
		}
		EngineSettings settings = new EngineSettings(
				engine.hurdleRate(),
				engine.allocationPolicy(),
				engine.validationPolicy(),
				engine.sculptFallback(),
				toConstraints(engine.constraints()),
				toCovenants(engine.covenants()));
		logger.info("Engine defaults: hurdle rate={}, allocation={}, validation={}, sculpt fallback={}, covenants={}",
				settings.hurdleRate(), settings.allocationPolicy(), settings.validationPolicy(),
				settings.sculptFallback(), settings.covenants().size());
		return settings;
	}

	private FinancingConstraints toConstraints(AppProperties.Constraints constraints) {
		FinancingConstraints defaults = FinancingConstraints.defaults();
		if (constraints == null) {
			return defaults;
		}
		AppProperties.Constraints.Refinancing refinancing = constraints.refinancing();
		return new FinancingConstraints(
				valueOr(constraints.maxInterestRate(), defaults.maxInterestRate()),
				constraints.maxTenorPeriods() == null ? defaults.maxTenorPeriods() : constraints.maxTenorPeriods(),
				valueOr(constraints.maxBalloonFraction(), defaults.maxBalloonFraction()),
				valueOr(constraints.warnBalloonFraction(), defaults.warnBalloonFraction()),
				refinancing != null && refinancing.enabled(),
				refinancing == null
						? defaults.maxRefinanceFraction()
						: valueOr(refinancing.maxRefinanceFraction(), defaults.maxRefinanceFraction()));
	}

	private List<CovenantThreshold> toCovenants(List<AppProperties.Covenant> covenants) {
		if (covenants == null) {
			return List.of();
		}
		List<CovenantThreshold> thresholds = new ArrayList<>();
		for (AppProperties.Covenant covenant : covenants) {
			thresholds.add(new CovenantThreshold(covenant.metric(), covenant.minimum(), covenant.warning()));
		}
		return thresholds;
	}

	private double valueOr(Double value, double fallback) {
		return value == null ? fallback : value;
	}
}
