package my.projectfinance.app.model;

import java.util.List;

public record EngineSettings(double hurdleRate,
							 AllocationPolicy allocationPolicy,
							 ValidationPolicy validationPolicy,
							 SculptFallback sculptFallback,
							 FinancingConstraints constraints,
							 List<CovenantThreshold> covenants) {
	public EngineSettings {
		allocationPolicy = allocationPolicy == null ? AllocationPolicy.PRO_RATA : allocationPolicy;
		validationPolicy = validationPolicy == null ? ValidationPolicy.PERMISSIVE : validationPolicy;
		sculptFallback = sculptFallback == null ? SculptFallback.NONE : sculptFallback;
		constraints = constraints == null ? FinancingConstraints.defaults() : constraints;
		covenants = covenants == null ? List.of() : List.copyOf(covenants);
	}

	public static EngineSettings defaults(double hurdleRate) {
		return new EngineSettings(hurdleRate, null, null, null, null, null);
	}

	public EngineSettings withHurdleRate(double value) {
		return new EngineSettings(value, allocationPolicy, validationPolicy, sculptFallback, constraints, covenants);
	}

	public EngineSettings withAllocationPolicy(AllocationPolicy value) {
		return new EngineSettings(hurdleRate, value, validationPolicy, sculptFallback, constraints, covenants);
	}

	public EngineSettings withValidationPolicy(ValidationPolicy value) {
		return new EngineSettings(hurdleRate, allocationPolicy, value, sculptFallback, constraints, covenants);
	}

	public EngineSettings withSculptFallback(SculptFallback value) {
		return new EngineSettings(hurdleRate, allocationPolicy, validationPolicy, value, constraints, covenants);
	}

	public EngineSettings withCovenants(List<CovenantThreshold> value) {
		return new EngineSettings(hurdleRate, allocationPolicy, validationPolicy, sculptFallback, constraints, value);
	}
}
