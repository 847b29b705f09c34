package my.fundamentalagent.app.cache;

public enum CacheTier {
	RAW("raw"),
	RESULT("result");

	private final String value;

	CacheTier(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}
}
