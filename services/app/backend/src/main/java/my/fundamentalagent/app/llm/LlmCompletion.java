package my.fundamentalagent.app.llm;

public record LlmCompletion(String text, String model) {
}
