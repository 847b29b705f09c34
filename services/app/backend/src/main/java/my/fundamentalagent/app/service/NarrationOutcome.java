package my.fundamentalagent.app.service;

/**
 * Result of the narrate step: either the model's text, or the reason no narrative is available.
 */
public record NarrationOutcome(String text, String unavailableReason) {
	public static NarrationOutcome llm(String text) {
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("Narrative text is required");
		}
		return new NarrationOutcome(text, null);
	}

	public static NarrationOutcome unavailable(String reason) {
		return new NarrationOutcome(null, reason == null || reason.isBlank() ? "unknown" : reason);
	}

	public boolean isAvailable() {
		return text != null;
	}
}
