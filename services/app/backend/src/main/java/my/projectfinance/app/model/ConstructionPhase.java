package my.projectfinance.app.model;

import java.util.List;

/**
 * Fraction of each tranche's commitment drawn in each construction period, before the first operating period.
 */
public record ConstructionPhase(List<Double> drawdownFractions) {
	public ConstructionPhase {
		drawdownFractions = drawdownFractions == null ? List.of() : List.copyOf(drawdownFractions);
	}

	public int periods() {
		return drawdownFractions.size();
	}
}
