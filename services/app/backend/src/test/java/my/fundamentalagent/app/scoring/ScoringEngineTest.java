package my.fundamentalagent.app.scoring;

import my.fundamentalagent.app.model.AnalysisErrorCode;
import my.fundamentalagent.app.model.InvestorStyle;
import my.fundamentalagent.app.model.Metric;
import my.fundamentalagent.app.model.MetricScore;
import my.fundamentalagent.app.model.Score;
import my.fundamentalagent.app.model.TickerSnapshot;
import my.fundamentalagent.app.support.TestSnapshots;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoringEngineTest {
	private final ScoringEngine engine = new ScoringEngine();

	@Test
	void sameSnapshotAndStyleAlwaysYieldSameScore() {
		TickerSnapshot snapshot = TestSnapshots.growth("AAPL");

		for (InvestorStyle style : List.of(InvestorStyle.GROWTH, InvestorStyle.VALUE, InvestorStyle.QUALITY)) {
			assertThat(engine.score(snapshot, style)).isEqualTo(engine.score(snapshot, style));
		}
	}

	@Test
	void strongGrowthProfileScoresAsBuy() {
		Score score = engine.score(TestSnapshots.growth("AAPL"), InvestorStyle.GROWTH);

		// 0.30 * 0.9 + 0.25 * 0.6 + 0.25 * (1 - 0.2 / 1.5) + 0.20 * 1.0
		assertThat(score.composite()).isCloseTo(0.836667d, within(1e-6));
		assertThat(score.composite()).isGreaterThanOrEqualTo(0.70d);
	}

	@Test
	void growthScenarioWithoutEarningsGrowthStillScoresAsBuy() {
		Score score = engine.score(TestSnapshots.of("AAPL", Map.of(
				Metric.ROE, 0.25d,
				Metric.REVENUE_GROWTH, 0.18d,
				Metric.PEG_RATIO, 1.2d)), InvestorStyle.GROWTH);

		assertThat(score.composite()).isGreaterThanOrEqualTo(0.70d);
		assertThat(component(score, Metric.EARNINGS_GROWTH).available()).isFalse();
	}

	@Test
	void redistributesWeightsOverAvailableMetrics() {
		Score score = engine.score(TestSnapshots.of("KO", Map.of(
				Metric.PE_RATIO, 20.0d,
				Metric.DEBT_TO_EQUITY, 1.15d,
				Metric.ROE, 0.125d)), InvestorStyle.VALUE);

		MetricScore pe = component(score, Metric.PE_RATIO);
		MetricScore pb = component(score, Metric.PB_RATIO);
		assertThat(pe.appliedWeight()).isCloseTo(0.35d / 0.75d, within(1e-12));
		assertThat(pb.appliedWeight()).isZero();
		assertThat(pb.baseWeight()).isEqualTo(0.25d);
		assertThat(pb.value()).isNull();
		assertThat(score.components().stream().mapToDouble(MetricScore::appliedWeight).sum())
				.isCloseTo(1.0d, within(1e-12));
	}

	@Test
	void droppingMetricThatMatchesCompositeLeavesCompositeUnchanged() {
		Map<Metric, Double> full = new EnumMap<>(Metric.class);
		full.put(Metric.REVENUE_GROWTH, 0.10d);
		full.put(Metric.EARNINGS_GROWTH, 0.125d);
		full.put(Metric.PEG_RATIO, 1.75d);
		full.put(Metric.ROE, 0.125d);
		Map<Metric, Double> withoutRoe = new EnumMap<>(full);
		withoutRoe.remove(Metric.ROE);

		double all = engine.score(TestSnapshots.of("X", full), InvestorStyle.GROWTH).composite();
		double partial = engine.score(TestSnapshots.of("X", withoutRoe), InvestorStyle.GROWTH).composite();

		assertThat(all).isCloseTo(0.5d, within(1e-9));
		assertThat(partial).isCloseTo(all, within(1e-9));
	}

	@Test
	void unsustainableYieldIsPenalized() {
		Score score = engine.score(TestSnapshots.highYield("HIYLD"), InvestorStyle.DIVIDEND);

		MetricScore yield = component(score, Metric.DIVIDEND_YIELD);
		MetricScore payout = component(score, Metric.PAYOUT_RATIO);
		assertThat(yield.subScore()).isCloseTo(1.0d - 0.07d / 0.12d, within(1e-9));
		assertThat(yield.subScore()).isLessThan(engine.subScore(Metric.DIVIDEND_YIELD, 0.06d));
		assertThat(payout.subScore()).isCloseTo(0.125d, within(1e-9));
		assertThat(score.composite()).isLessThan(0.70d);
	}

	@Test
	void nonPositiveValuationRatiosScoreZero() {
		Score score = engine.score(TestSnapshots.of("LOSS", Map.of(
				Metric.PE_RATIO, -12.0d,
				Metric.PB_RATIO, 0.8d)), InvestorStyle.VALUE);

		MetricScore pe = component(score, Metric.PE_RATIO);
		assertThat(pe.available()).isTrue();
		assertThat(pe.subScore()).isZero();
		assertThat(component(score, Metric.PB_RATIO).subScore()).isEqualTo(1.0d);
	}

	@Test
	void negativeShareholderEquityScoresZeroLeverage() {
		Score score = engine.score(TestSnapshots.of("NEGEQ", Map.of(Metric.DEBT_TO_EQUITY, -3.0d)),
				InvestorStyle.VALUE);

		assertThat(engine.subScore(Metric.DEBT_TO_EQUITY, -3.0d)).isZero();
		assertThat(component(score, Metric.DEBT_TO_EQUITY).available()).isTrue();
		assertThat(score.composite()).isZero();
	}

	@Test
	void debtFreeBalanceSheetScoresFullLeverage() {
		assertThat(engine.subScore(Metric.DEBT_TO_EQUITY, 0.0d)).isEqualTo(1.0d);
		assertThat(engine.subScore(Metric.DEBT_TO_EQUITY, 0.3d)).isEqualTo(1.0d);
	}

	@Test
	void qualityStyleTreatsNegativeCashFlowAsZero() {
		Score positive = engine.score(TestSnapshots.of("Q", Map.of(Metric.OPERATING_CASH_FLOW, 1.0e9d)),
				InvestorStyle.QUALITY);
		Score negative = engine.score(TestSnapshots.of("Q", Map.of(Metric.OPERATING_CASH_FLOW, -5.0e8d)),
				InvestorStyle.QUALITY);

		assertThat(positive.composite()).isCloseTo(1.0d, within(1e-12));
		assertThat(negative.composite()).isZero();
	}

	@Test
	void derivedMetricsFeedTheScore() {
		Score score = engine.score(TestSnapshots.of("DERIV", Map.of(
				Metric.PE_RATIO, 30.0d,
				Metric.EARNINGS_GROWTH, 0.20d)), InvestorStyle.GROWTH);

		assertThat(component(score, Metric.PEG_RATIO).value()).isCloseTo(1.5d, within(1e-9));
	}

	@Test
	void noRelevantMetricsIsInsufficientData() {
		TickerSnapshot snapshot = TestSnapshots.of("DIV", Map.of(Metric.DIVIDEND_YIELD, 0.03d));

		assertThatThrownBy(() -> engine.score(snapshot, InvestorStyle.GROWTH))
				.isInstanceOf(InsufficientDataException.class)
				.satisfies(ex -> {
					InsufficientDataException error = (InsufficientDataException) ex;
					assertThat(error.getCode()).isEqualTo(AnalysisErrorCode.INSUFFICIENT_DATA);
					assertThat(error.isRetryable()).isFalse();
				});
	}

	@Test
	void compositeStaysWithinUnitInterval() {
		Score best = engine.score(TestSnapshots.of("MAX", Map.of(
				Metric.REVENUE_GROWTH, 5.0d,
				Metric.EARNINGS_GROWTH, 5.0d,
				Metric.PEG_RATIO, 0.1d,
				Metric.ROE, 3.0d)), InvestorStyle.GROWTH);
		Score worst = engine.score(TestSnapshots.of("MIN", Map.of(
				Metric.REVENUE_GROWTH, -0.5d,
				Metric.EARNINGS_GROWTH, -0.9d,
				Metric.PEG_RATIO, -1.0d,
				Metric.ROE, -0.3d)), InvestorStyle.GROWTH);

		assertThat(best.composite()).isCloseTo(1.0d, within(1e-12)).isLessThanOrEqualTo(1.0d);
		assertThat(worst.composite()).isZero();
	}

	@Test
	void curveOverridesReplaceDefaults() {
		ScoringEngine custom = new ScoringEngine(Map.of(Metric.PE_RATIO, ScoringCurve.linear(40.0d, 20.0d)));

		assertThat(custom.subScore(Metric.PE_RATIO, 30.0d)).isCloseTo(0.5d, within(1e-9));
		assertThat(custom.subScore(Metric.ROE, 0.20d)).isEqualTo(1.0d);
	}

	@Test
	void weightTablesSumToOne() {
		for (InvestorStyle style : InvestorStyle.values()) {
			double total = StyleWeights.forStyle(style).values().stream().mapToDouble(Double::doubleValue).sum();
			assertThat(total).as(style.value()).isCloseTo(1.0d, within(1e-12));
		}
	}

	private static MetricScore component(Score score, Metric metric) {
		return score.components().stream()
				.filter(component -> component.metric() == metric)
				.findFirst()
				.orElseThrow();
	}
}
