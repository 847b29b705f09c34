package my.fundamentalagent.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.fundamentalagent.app.dto.AnalysisResponseDto;
import my.fundamentalagent.app.dto.AnalyzeRequestDto;
import my.fundamentalagent.app.model.InvestorStyle;
import my.fundamentalagent.app.service.AnalysisOrchestrator;
import my.fundamentalagent.app.service.AnalysisOutcome;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analyze")
@Tag(name = "Fundamental Analysis")
public class AnalysisController {
	private static final String DEFAULT_STYLE = "growth";

	private final AnalysisOrchestrator orchestrator;
	private final AnalysisResponseMapper responseMapper;

	public AnalysisController(AnalysisOrchestrator orchestrator, AnalysisResponseMapper responseMapper) {
		this.orchestrator = orchestrator;
		this.responseMapper = responseMapper;
	}

	@PostMapping
	@Operation(summary = "Analyse a ticker for an investor style")
	public ResponseEntity<AnalysisResponseDto> analyze(@Valid @RequestBody AnalyzeRequestDto request) {
		return run(request.ticker(), request.style());
	}

	@GetMapping("/{ticker}")
	@Operation(summary = "Analyse a ticker for an investor style")
	public ResponseEntity<AnalysisResponseDto> analyzeTicker(@PathVariable("ticker") String ticker,
														@RequestParam(name = "style", required = false) String style) {
		return run(ticker, style);
	}

	private ResponseEntity<AnalysisResponseDto> run(String ticker, String style) {
		if (ticker == null || ticker.isBlank()) {
			throw new IllegalArgumentException("Ticker is required");
		}
		InvestorStyle investorStyle = InvestorStyle.fromValue(style == null || style.isBlank() ? DEFAULT_STYLE : style);
		long started = System.nanoTime();
		AnalysisOutcome outcome = orchestrator.analyze(ticker, investorStyle);
		long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
		return ResponseEntity.status(responseMapper.statusFor(outcome))
				.body(responseMapper.toResponse(outcome, elapsedMs));
	}
}
