package my.fundamentalagent.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InvestorStyle {
	GROWTH("growth"),
	VALUE("value"),
	DIVIDEND("dividend"),
	QUALITY("quality");

	private final String value;

	InvestorStyle(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	@JsonCreator
	public static InvestorStyle fromValue(String raw) {
		if (raw == null || raw.isBlank()) {
			throw new IllegalArgumentException("Investor style is required");
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (InvestorStyle style : values()) {
			if (style.value.equals(normalized)) {
				return style;
			}
		}
		throw new IllegalArgumentException("Unknown investor style: " + raw);
	}
}
