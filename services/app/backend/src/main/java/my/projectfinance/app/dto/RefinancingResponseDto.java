package my.projectfinance.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record RefinancingResponseDto(
		@JsonProperty("refinancing_period") int refinancingPeriod,
		@JsonProperty("refinanced_balance") BigDecimal refinancedBalance,
		@JsonProperty("original_metrics") CoverageMetricsDto originalMetrics,
		@JsonProperty("original_balloon") BalloonAssessmentDto originalBalloon,
		@JsonProperty("alternative") DebtEvaluationResponseDto alternative
) {
}
