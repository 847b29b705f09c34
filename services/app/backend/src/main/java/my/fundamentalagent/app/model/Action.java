package my.fundamentalagent.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Action {
	BUY("buy"),
	HOLD("hold"),
	SELL("sell");

	private final String value;

	Action(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}
}
