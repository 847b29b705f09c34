package my.fundamentalagent.app.api;

import my.fundamentalagent.app.dto.AnalysisDataDto;
import my.fundamentalagent.app.dto.AnalysisErrorDto;
import my.fundamentalagent.app.dto.AnalysisMetadataDto;
import my.fundamentalagent.app.dto.AnalysisResponseDto;
import my.fundamentalagent.app.dto.ScoreComponentDto;
import my.fundamentalagent.app.model.AnalysisError;
import my.fundamentalagent.app.model.AnalysisResult;
import my.fundamentalagent.app.model.MetricScore;
import my.fundamentalagent.app.service.AnalysisOutcome;
import my.fundamentalagent.app.service.AnalysisState;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class AnalysisResponseMapper {
	static final String AGENT_TYPE = "fundamental";
	static final String VERSION = "2.0.0";

	private final Clock clock;

	public AnalysisResponseMapper(Clock clock) {
		this.clock = clock;
	}

	public AnalysisResponseDto toResponse(AnalysisOutcome outcome, long processingTimeMs) {
		List<String> states = outcome.states().stream().map(AnalysisState::name).toList();
		AnalysisMetadataDto metadata = new AnalysisMetadataDto(outcome.cacheHit(), states, processingTimeMs);
		if (outcome.isSuccess()) {
			return new AnalysisResponseDto(AGENT_TYPE, VERSION, "success", clock.instant(),
					toData(outcome), null, metadata);
		}
		AnalysisError error = outcome.error();
		return new AnalysisResponseDto(AGENT_TYPE, VERSION, "error", clock.instant(), null,
				new AnalysisErrorDto(error.code().name(), error.message(), error.retryable()), metadata);
	}

	public HttpStatus statusFor(AnalysisOutcome outcome) {
		if (outcome.isSuccess()) {
			return HttpStatus.OK;
		}
		AnalysisError error = outcome.error();
		return switch (error.code()) {
			case TICKER_NOT_FOUND -> HttpStatus.NOT_FOUND;
			case INSUFFICIENT_DATA -> HttpStatus.UNPROCESSABLE_ENTITY;
			case MODEL_ERROR -> HttpStatus.BAD_GATEWAY;
			case INTERNAL_ERROR -> error.retryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
		};
	}

	private AnalysisDataDto toData(AnalysisOutcome outcome) {
		AnalysisResult result = outcome.result();
		List<ScoreComponentDto> components = result.score() == null
				? List.of()
				: result.score().components().stream().map(this::toComponent).toList();
		double composite = result.score() == null ? result.confidence() : result.score().composite();
		return new AnalysisDataDto(
				outcome.ticker(),
				outcome.style().value(),
				result.action().value(),
				result.confidence(),
				result.reason(),
				result.source().value(),
				result.generatedAt(),
				composite,
				components
		);
	}

	private ScoreComponentDto toComponent(MetricScore component) {
		return new ScoreComponentDto(
				component.metric().configKey(),
				component.metric().label(),
				component.value(),
				component.metric().formatValue(component.value()),
				component.subScore(),
				component.baseWeight(),
				component.appliedWeight()
		);
	}
}
