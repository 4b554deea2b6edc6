package my.projectfinance.app.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeriesStatisticsTest {
	@Test
	void ignoresNonFiniteValues() {
		SeriesStatistics statistics = SeriesStatistics.of(
				Arrays.asList(1.5, Double.POSITIVE_INFINITY, 1.1, null, 1.3, 2.0, Double.NaN));

		assertThat(statistics.count()).isEqualTo(4);
		assertThat(statistics.min()).isEqualTo(1.1);
		assertThat(statistics.max()).isEqualTo(2.0);
		assertThat(statistics.median()).isCloseTo(1.4, within(1e-12));
	}

	@Test
	void emptySeriesHasNoStatistics() {
		SeriesStatistics statistics = SeriesStatistics.of(List.of(Double.POSITIVE_INFINITY));

		assertThat(statistics.count()).isZero();
		assertThat(statistics.min()).isNull();
		assertThat(statistics.mean()).isNull();
	}
}
