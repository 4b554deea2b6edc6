package my.projectfinance.app.model;

import java.math.BigDecimal;

public record RefinancingComparison(int refinancingPeriod,
									BigDecimal refinancedBalance,
									CoverageMetrics originalMetrics,
									BalloonAssessment originalBalloon,
									StructuringResult alternative) {
}
