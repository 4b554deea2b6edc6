package my.projectfinance.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import my.projectfinance.app.model.AllocationPolicy;
import my.projectfinance.app.model.CovenantMetric;
import my.projectfinance.app.model.SculptFallback;
import my.projectfinance.app.model.ValidationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Engine engine
) {
	public record Engine(
			@NotNull Double hurdleRate,
			AllocationPolicy allocationPolicy,
			ValidationPolicy validationPolicy,
			SculptFallback sculptFallback,
			Constraints constraints,
			List<@Valid Covenant> covenants
	) {
	}

	public record Constraints(
			Double maxInterestRate,
			Integer maxTenorPeriods,
			Double maxBalloonFraction,
			Double warnBalloonFraction,
			Refinancing refinancing
	) {
		public record Refinancing(
				boolean enabled,
				Double maxRefinanceFraction
		) {
		}
	}

	public record Covenant(
			@NotNull CovenantMetric metric,
			@NotNull Double minimum,
			Double warning
	) {
	}
}
