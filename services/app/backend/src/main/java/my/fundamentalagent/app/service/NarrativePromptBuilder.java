package my.fundamentalagent.app.service;

import my.fundamentalagent.app.model.InvestorStyle;
import my.fundamentalagent.app.model.Metric;
import my.fundamentalagent.app.model.MetricScore;
import my.fundamentalagent.app.model.Score;
import my.fundamentalagent.app.model.TickerSnapshot;
import my.fundamentalagent.app.scoring.MetricNormalizer;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders the narrative prompt. The output depends only on the snapshot and the score, so the same
 * inputs always produce the same prompt text.
 */
@Component
public class NarrativePromptBuilder {
	public String build(TickerSnapshot snapshot, Score score) {
		InvestorStyle style = score.style();
		StringBuilder prompt = new StringBuilder();
		prompt.append("You are an equity analyst specialising in ").append(styleName(style)).append(" investing.\n");
		prompt.append("Task: write a single concise paragraph assessing ").append(snapshot.ticker())
				.append(" for a ").append(style.value()).append(" investor.\n\n");
		prompt.append("Focus: ").append(focus(style)).append("\n\n");

		prompt.append("Scored metrics (value, sub-score 0-1, applied weight):\n");
		Set<Metric> listed = EnumSet.noneOf(Metric.class);
		for (MetricScore component : score.components()) {
			Metric metric = component.metric();
			listed.add(metric);
			prompt.append("- ").append(metric.label()).append(": ").append(metric.formatValue(component.value()));
			if (component.available()) {
				prompt.append(String.format(Locale.ROOT, " (sub-score %.2f, weight %.2f)",
						component.subScore(), component.appliedWeight()));
			} else {
				prompt.append(" (not scored)");
			}
			prompt.append('\n');
		}

		Map<Metric, Double> metrics = MetricNormalizer.normalize(snapshot);
		StringBuilder other = new StringBuilder();
		for (Metric metric : Metric.values()) {
			if (listed.contains(metric) || !metrics.containsKey(metric)) {
				continue;
			}
			other.append("- ").append(metric.label()).append(": ").append(metric.formatValue(metrics.get(metric))).append('\n');
		}
		if (!other.isEmpty()) {
			prompt.append("\nOther figures:\n").append(other);
		}

		prompt.append(String.format(Locale.ROOT, "%nComposite %s score: %.2f (0 = weak, 1 = strong)%n%n",
				style.value(), score.composite()));
		prompt.append("Guardrails:\n");
		prompt.append("1. Do not invent figures that are not listed above.\n");
		prompt.append("2. Base the assessment only on the data provided.\n");
		prompt.append("3. Where a figure is N/A, state that there is not enough data to assess it.\n");
		prompt.append("4. Do not state a buy, hold or sell recommendation; explain the strengths and risks.\n");
		return prompt.toString();
	}

	private static String styleName(InvestorStyle style) {
		return switch (style) {
			case GROWTH -> "growth";
			case VALUE -> "value";
			case DIVIDEND -> "dividend income";
			case QUALITY -> "quality";
		};
	}

	private static String focus(InvestorStyle style) {
		return switch (style) {
			case GROWTH -> "judge the pace of revenue and earnings growth first, then whether the valuation (PEG) "
					+ "is justified by that growth, then profitability (ROE).";
			case VALUE -> "judge whether the price is low relative to earnings and book value, and whether the "
					+ "balance sheet is sound enough for the discount to close.";
			case DIVIDEND -> "judge whether the dividend is attractive and sustainable: a yield that is very high "
					+ "or a payout ratio near or above 100% is a warning sign, a long record of increases is a strength.";
			case QUALITY -> "judge the durability of the business: returns on equity, margins, leverage and "
					+ "whether operations generate cash.";
		};
	}
}
