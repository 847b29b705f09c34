package my.fundamentalagent.app.service;

import my.fundamentalagent.app.model.Action;
import my.fundamentalagent.app.model.ActionThresholds;
import my.fundamentalagent.app.model.AnalysisResult;
import my.fundamentalagent.app.model.AnalysisSource;
import my.fundamentalagent.app.model.MetricScore;
import my.fundamentalagent.app.model.Score;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic recommendation from a score alone. Total for every valid {@link Score}: it never
 * calls out and never throws.
 */
public class RuleBasedFallbackAnalyzer {
	static final int MAX_CITED_METRICS = 2;

	private final ActionThresholds thresholds;
	private final Clock clock;

	public RuleBasedFallbackAnalyzer(ActionThresholds thresholds, Clock clock) {
		this.thresholds = thresholds == null ? ActionThresholds.defaults() : thresholds;
		this.clock = clock;
	}

	public AnalysisResult fallback(Score score) {
		Action action = thresholds.actionFor(score.composite());
		return new AnalysisResult(action, score.composite(), reason(score, action), AnalysisSource.RULE_BASED,
				clock.instant(), score);
	}

	public ActionThresholds thresholds() {
		return thresholds;
	}

	String reason(Score score, Action action) {
		StringBuilder reason = new StringBuilder();
		reason.append(String.format(Locale.ROOT, "Rule-based %s analysis: composite score %.2f ", score.style().value(),
				score.composite()));
		reason.append(switch (action) {
			case BUY -> String.format(Locale.ROOT, "is at or above the buy threshold of %.2f.", thresholds.buy());
			case HOLD -> String.format(Locale.ROOT, "is between the sell threshold of %.2f and the buy threshold of %.2f.",
					thresholds.sell(), thresholds.buy());
			case SELL -> String.format(Locale.ROOT, "is below the sell threshold of %.2f.", thresholds.sell());
		});
		List<MetricScore> ranked = score.rankedContributions();
		if (ranked.isEmpty()) {
			return reason.toString();
		}
		List<String> cited = new ArrayList<>();
		for (MetricScore component : ranked.subList(0, Math.min(MAX_CITED_METRICS, ranked.size()))) {
			cited.add(String.format(Locale.ROOT, "%s %s (sub-score %.2f, weight %.2f)",
					component.metric().label(), component.metric().formatValue(component.value()),
					component.subScore(), component.appliedWeight()));
		}
		reason.append(cited.size() == 1 ? " Main driver: " : " Main drivers: ")
				.append(String.join("; ", cited))
				.append('.');
		return reason.toString();
	}
}
