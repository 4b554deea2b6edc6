package my.projectfinance.app.model;

import java.math.BigDecimal;
import java.util.List;

public record BalloonAssessment(BigDecimal amount,
								double fraction,
								boolean feasible,
								boolean mitigationRequired,
								List<String> mitigationOptions,
								String notes) {
	public BalloonAssessment {
		mitigationOptions = mitigationOptions == null ? List.of() : List.copyOf(mitigationOptions);
	}
}
