package my.fundamentalagent.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisSource {
	LLM("llm"),
	RULE_BASED("rule_based");

	private final String value;

	AnalysisSource(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}
}
