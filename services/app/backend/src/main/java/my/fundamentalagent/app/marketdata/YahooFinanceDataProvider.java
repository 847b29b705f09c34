package my.fundamentalagent.app.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import my.fundamentalagent.app.model.AnnualFigure;
import my.fundamentalagent.app.model.Metric;
import my.fundamentalagent.app.model.TickerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads fundamentals from the Yahoo Finance {@code quoteSummary} endpoint and dividend events from the
 * monthly chart. Yahoo reports debt to equity as a percentage; it is converted to a plain ratio here.
 */
public class YahooFinanceDataProvider implements FinancialDataProvider {
	private static final Logger logger = LoggerFactory.getLogger(YahooFinanceDataProvider.class);
	public static final String DEFAULT_BASE_URL = "https://query1.finance.yahoo.com";
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(20);
	private static final String MODULES = "financialData,defaultKeyStatistics,summaryDetail,incomeStatementHistory";
	private static final int DIVIDEND_YEARS = 5;
	private static final int REVENUE_YEARS = 4;

	private final RestClient restClient;
	private final Clock clock;

	public YahooFinanceDataProvider(String baseUrl, Clock clock) {
		this(baseUrl, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, clock);
	}

	public YahooFinanceDataProvider(String baseUrl, Duration connectTimeout, Duration readTimeout, Clock clock) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.USER_AGENT, "Mozilla/5.0 (compatible; fundamental-agent)")
				.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.clock = clock;
	}

	@Override
	public TickerSnapshot fetchSnapshot(String ticker) {
		String symbol = TickerSnapshot.normalizeTicker(ticker);
		if (symbol.isEmpty()) {
			throw new IllegalArgumentException("Ticker is required");
		}
		JsonNode summary = fetchQuoteSummary(symbol);
		LocalDate asOf = LocalDate.now(clock.withZone(ZoneOffset.UTC));
		Map<Metric, Double> metrics = parseMetrics(summary);
		List<AnnualFigure> revenueHistory = parseRevenueHistory(summary);
		List<AnnualFigure> dividendHistory = fetchDividendHistory(symbol, asOf);
		logger.info("Fetched {} metrics for {} (revenue years={}, dividend years={}).",
				metrics.size(), symbol, revenueHistory.size(), dividendHistory.size());
		return new TickerSnapshot(symbol, asOf, metrics, dividendHistory, revenueHistory);
	}

	private JsonNode fetchQuoteSummary(String symbol) {
		JsonNode response;
		try {
			response = restClient.get()
					.uri("/v10/finance/quoteSummary/{symbol}?modules={modules}", symbol, MODULES)
					.retrieve()
					.body(JsonNode.class);
		} catch (RestClientResponseException ex) {
			int status = ex.getStatusCode().value();
			if (status == 404) {
				throw new TickerNotFoundException(symbol);
			}
			throw new DataProviderException("Yahoo Finance returned HTTP " + status + " for " + symbol,
					status, isRetryable(status), ex);
		} catch (ResourceAccessException ex) {
			throw new DataProviderException("Yahoo Finance unreachable: " + safeMessage(ex), null, true, ex);
		} catch (RestClientException ex) {
			throw new DataProviderException("Unreadable Yahoo Finance response for " + symbol + ": " + safeMessage(ex),
					null, false, ex);
		}
		if (response == null) {
			throw new DataProviderException("Empty Yahoo Finance response for " + symbol, null, true, null);
		}
		JsonNode quoteSummary = response.path("quoteSummary");
		JsonNode error = quoteSummary.path("error");
		if (!error.isMissingNode() && !error.isNull()) {
			String code = error.path("code").asText("");
			if ("Not Found".equalsIgnoreCase(code)) {
				throw new TickerNotFoundException(symbol);
			}
			throw new DataProviderException("Yahoo Finance error for " + symbol + ": "
					+ error.path("description").asText(code), null, false, null);
		}
		JsonNode result = quoteSummary.path("result");
		if (!result.isArray() || result.isEmpty()) {
			throw new TickerNotFoundException(symbol);
		}
		return result.get(0);
	}

	static Map<Metric, Double> parseMetrics(JsonNode summary) {
		JsonNode financial = summary.path("financialData");
		JsonNode keyStats = summary.path("defaultKeyStatistics");
		JsonNode detail = summary.path("summaryDetail");
		Map<Metric, Double> metrics = new EnumMap<>(Metric.class);
		put(metrics, Metric.ROE, raw(financial, "returnOnEquity"));
		Double debtToEquity = raw(financial, "debtToEquity");
		if (debtToEquity == null) {
			debtToEquity = raw(keyStats, "debtToEquity");
		}
		put(metrics, Metric.DEBT_TO_EQUITY, debtToEquity == null ? null : debtToEquity / 100.0d);
		put(metrics, Metric.PROFIT_MARGIN, firstNonNull(raw(financial, "profitMargins"), raw(keyStats, "profitMargins")));
		put(metrics, Metric.PE_RATIO, raw(detail, "trailingPE"));
		put(metrics, Metric.FORWARD_PE, firstNonNull(raw(keyStats, "forwardPE"), raw(detail, "forwardPE")));
		put(metrics, Metric.PB_RATIO, raw(keyStats, "priceToBook"));
		put(metrics, Metric.EPS, raw(keyStats, "trailingEps"));
		put(metrics, Metric.REVENUE_GROWTH, raw(financial, "revenueGrowth"));
		put(metrics, Metric.EARNINGS_GROWTH, raw(financial, "earningsGrowth"));
		put(metrics, Metric.PEG_RATIO, raw(keyStats, "pegRatio"));
		put(metrics, Metric.OPERATING_CASH_FLOW, raw(financial, "operatingCashflow"));
		put(metrics, Metric.DIVIDEND_YIELD, firstNonNull(raw(detail, "dividendYield"), raw(detail, "trailingAnnualDividendYield")));
		put(metrics, Metric.PAYOUT_RATIO, raw(detail, "payoutRatio"));
		return metrics;
	}

	static List<AnnualFigure> parseRevenueHistory(JsonNode summary) {
		JsonNode statements = summary.path("incomeStatementHistory").path("incomeStatementHistory");
		List<AnnualFigure> history = new ArrayList<>();
		if (!statements.isArray()) {
			return history;
		}
		for (JsonNode statement : statements) {
			Double endDate = raw(statement, "endDate");
			Double revenue = raw(statement, "totalRevenue");
			if (endDate == null || revenue == null) {
				continue;
			}
			int year = Instant.ofEpochSecond(endDate.longValue()).atZone(ZoneOffset.UTC).getYear();
			history.add(new AnnualFigure(year, revenue));
			if (history.size() == REVENUE_YEARS) {
				break;
			}
		}
		return history;
	}

	private List<AnnualFigure> fetchDividendHistory(String symbol, LocalDate asOf) {
		JsonNode response;
		try {
			response = restClient.get()
					.uri("/v8/finance/chart/{symbol}?range=10y&interval=1mo&events=div", symbol)
					.retrieve()
					.body(JsonNode.class);
		} catch (RestClientException ex) {
			logger.warn("Dividend history unavailable for {}: {}", symbol, safeMessage(ex));
			return List.of();
		}
		if (response == null) {
			return List.of();
		}
		JsonNode result = response.path("chart").path("result");
		if (!result.isArray() || result.isEmpty()) {
			return List.of();
		}
		return parseDividendHistory(result.get(0).path("events").path("dividends"), asOf);
	}

	/**
	 * Sums dividend events per calendar year. The running year is incomplete and is left out so it does
	 * not read as a cut; at most the last {@value #DIVIDEND_YEARS} complete years are kept.
	 */
	static List<AnnualFigure> parseDividendHistory(JsonNode dividends, LocalDate asOf) {
		if (dividends == null || !dividends.isObject()) {
			return List.of();
		}
		TreeMap<Integer, Double> perYear = new TreeMap<>();
		Iterator<JsonNode> events = dividends.elements();
		while (events.hasNext()) {
			JsonNode event = events.next();
			JsonNode date = event.path("date");
			JsonNode amount = event.path("amount");
			if (!date.isNumber() || !amount.isNumber()) {
				continue;
			}
			int year = Instant.ofEpochSecond(date.asLong()).atZone(ZoneOffset.UTC).getYear();
			if (year >= asOf.getYear()) {
				continue;
			}
			perYear.merge(year, amount.asDouble(), Double::sum);
		}
		List<AnnualFigure> history = new ArrayList<>();
		for (Map.Entry<Integer, Double> entry : perYear.descendingMap().entrySet()) {
			history.add(new AnnualFigure(entry.getKey(), entry.getValue()));
			if (history.size() == DIVIDEND_YEARS) {
				break;
			}
		}
		return history;
	}

	private static Double raw(JsonNode node, String field) {
		JsonNode value = node.path(field);
		if (value.isObject()) {
			value = value.path("raw");
		}
		if (!value.isNumber()) {
			return null;
		}
		double number = value.asDouble();
		return Double.isFinite(number) ? number : null;
	}

	private static Double firstNonNull(Double first, Double second) {
		return first != null ? first : second;
	}

	private static void put(Map<Metric, Double> metrics, Metric metric, Double value) {
		if (value != null) {
			metrics.put(metric, value);
		}
	}

	private static boolean isRetryable(int status) {
		return status == 408 || status == 429 || status >= 500;
	}

	private static String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
