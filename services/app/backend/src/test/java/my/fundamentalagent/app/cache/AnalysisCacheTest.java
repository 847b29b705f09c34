package my.fundamentalagent.app.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import my.fundamentalagent.app.model.Action;
import my.fundamentalagent.app.model.AnalysisResult;
import my.fundamentalagent.app.model.AnalysisSource;
import my.fundamentalagent.app.model.InvestorStyle;
import my.fundamentalagent.app.model.Score;
import my.fundamentalagent.app.model.TickerSnapshot;
import my.fundamentalagent.app.scoring.ScoringEngine;
import my.fundamentalagent.app.support.MutableClock;
import my.fundamentalagent.app.support.TestSnapshots;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalysisCacheTest {
	private static final Instant START = Instant.parse("2025-03-14T10:00:00Z");
	private static final LocalDate DAY = LocalDate.of(2025, 3, 14);
	private static final Duration RAW_TTL = Duration.ofHours(24);
	private static final Duration RESULT_TTL = Duration.ofHours(6);

	@TempDir
	Path tempDir;

	private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
	private MutableClock clock;
	private FileCacheStore store;
	private AnalysisCache cache;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(START);
		store = new FileCacheStore(tempDir, objectMapper);
		cache = new AnalysisCache(store, objectMapper, clock, RAW_TTL, RESULT_TTL);
	}

	@Test
	void returnsStoredSnapshot() {
		TickerSnapshot snapshot = TestSnapshots.highYield("KO");
		CacheKey key = CacheKey.raw("KO", DAY);

		cache.put(key, snapshot);

		assertThat(cache.get(key, TickerSnapshot.class)).contains(snapshot);
		assertThat(Files.exists(tempDir.resolve("raw").resolve(key.fileName()))).isTrue();
	}

	@Test
	void returnsStoredResultIncludingScore() {
		AnalysisResult result = result(Action.BUY, "first");
		CacheKey key = CacheKey.result("AAPL", InvestorStyle.GROWTH, DAY);

		cache.put(key, result);

		Optional<AnalysisResult> cached = cache.get(CacheKey.result("aapl", InvestorStyle.GROWTH, DAY), AnalysisResult.class);
		assertThat(cached).contains(result);
		assertThat(cache.get(CacheKey.result("AAPL", InvestorStyle.VALUE, DAY), AnalysisResult.class)).isEmpty();
	}

	@Test
	void missingEntryIsMiss() {
		assertThat(cache.get(CacheKey.raw("NONE", DAY), TickerSnapshot.class)).isEmpty();
	}

	@Test
	void entryExpiresAfterTierTtl() {
		CacheKey key = CacheKey.result("AAPL", InvestorStyle.GROWTH, DAY);
		cache.put(key, result(Action.HOLD, "stale soon"));

		clock.advance(RESULT_TTL.minusSeconds(1));
		assertThat(cache.get(key, AnalysisResult.class)).isPresent();

		clock.advance(Duration.ofSeconds(1));
		assertThat(cache.get(key, AnalysisResult.class)).isEmpty();
		assertThat(Files.exists(store.pathFor(key))).isTrue();
	}

	@Test
	void expiredReadKeepsEntryWrittenConcurrently() {
		CacheKey key = CacheKey.result("AAPL", InvestorStyle.GROWTH, DAY);
		cache.put(key, result(Action.HOLD, "stale"));
		CacheEntry<JsonNode> stale = store.read(key).orElseThrow();
		clock.advance(RESULT_TTL.plusMinutes(1));
		AnalysisCache writer = new AnalysisCache(store, objectMapper, clock, RAW_TTL, RESULT_TTL);
		CacheStore racingStore = new CacheStore() {
			@Override
			public Optional<CacheEntry<JsonNode>> read(CacheKey requested) {
				writer.put(requested, result(Action.BUY, "fresh"));
				return Optional.of(stale);
			}

			@Override
			public void write(CacheEntry<JsonNode> entry) {
				store.write(entry);
			}
		};
		AnalysisCache reader = new AnalysisCache(racingStore, objectMapper, clock, RAW_TTL, RESULT_TTL);

		assertThat(reader.get(key, AnalysisResult.class)).isEmpty();

		assertThat(writer.get(key, AnalysisResult.class)).get()
				.extracting(AnalysisResult::reason)
				.isEqualTo("fresh");
	}

	@Test
	void subSecondTtlSurvivesFileRoundTrip() {
		CacheKey key = CacheKey.raw("KO", DAY);
		cache.put(key, TestSnapshots.highYield("KO"), Duration.ofMillis(1500));

		assertThat(store.read(key)).get().extracting(CacheEntry::ttl).isEqualTo(Duration.ofMillis(1500));

		clock.advance(Duration.ofMillis(1200));
		assertThat(cache.get(key, TickerSnapshot.class)).isPresent();

		clock.advance(Duration.ofMillis(300));
		assertThat(cache.get(key, TickerSnapshot.class)).isEmpty();
	}

	@Test
	void explicitTtlOverridesTierDefault() {
		CacheKey key = CacheKey.raw("KO", DAY);
		cache.put(key, TestSnapshots.highYield("KO"), Duration.ofMinutes(5));

		clock.advance(Duration.ofMinutes(5));

		assertThat(cache.get(key, TickerSnapshot.class)).isEmpty();
	}

	@Test
	void laterWriteReplacesEarlierEntry() {
		CacheKey key = CacheKey.result("AAPL", InvestorStyle.GROWTH, DAY);
		cache.put(key, result(Action.BUY, "first"));
		cache.put(key, result(Action.SELL, "second"));

		assertThat(cache.get(key, AnalysisResult.class)).get()
				.extracting(AnalysisResult::reason)
				.isEqualTo("second");
	}

	@Test
	void corruptDocumentIsMiss() throws Exception {
		CacheKey key = CacheKey.raw("KO", DAY);
		Files.createDirectories(store.pathFor(key).getParent());
		Files.writeString(store.pathFor(key), "{\"tier\":\"raw\",\"ticker\":", StandardCharsets.UTF_8);

		assertThat(cache.get(key, TickerSnapshot.class)).isEmpty();
	}

	@Test
	void documentForAnotherKeyIsMiss() throws Exception {
		CacheKey stored = CacheKey.raw("KO", DAY);
		CacheKey requested = CacheKey.raw("PEP", DAY);
		cache.put(stored, TestSnapshots.highYield("KO"));
		Files.copy(store.pathFor(stored), store.pathFor(requested));

		assertThat(cache.get(requested, TickerSnapshot.class)).isEmpty();
	}

	@Test
	void writesLeaveNoTemporaryFiles() throws Exception {
		for (int i = 0; i < 5; i++) {
			cache.put(CacheKey.raw("T" + i, DAY), TestSnapshots.growth("T" + i));
		}

		try (Stream<Path> files = Files.list(tempDir.resolve("raw"))) {
			assertThat(files.map(path -> path.getFileName().toString()))
					.hasSize(5)
					.allMatch(name -> name.endsWith(".json"));
		}
	}

	@Test
	void concurrentWritersNeverExposePartialDocuments() throws Exception {
		CacheKey key = CacheKey.result("AAPL", InvestorStyle.GROWTH, DAY);
		ExecutorService pool = Executors.newFixedThreadPool(8);
		try {
			List<Callable<Optional<AnalysisResult>>> tasks = new ArrayList<>();
			for (int i = 0; i < 40; i++) {
				String reason = "writer-" + i;
				tasks.add(() -> {
					cache.put(key, result(Action.HOLD, reason));
					return cache.get(key, AnalysisResult.class);
				});
			}
			for (Future<Optional<AnalysisResult>> future : pool.invokeAll(tasks)) {
				assertThat(future.get()).isPresent();
				assertThat(future.get().get().reason()).startsWith("writer-");
			}
		} finally {
			pool.shutdownNow();
			pool.awaitTermination(5, TimeUnit.SECONDS);
		}
		assertThat(cache.get(key, AnalysisResult.class)).isPresent();
	}

	@Test
	void storageFailuresDegradeToMiss() {
		CacheStore failing = mock(CacheStore.class);
		when(failing.read(any())).thenThrow(new CacheStorageException("disk gone", null));
		doThrow(new CacheStorageException("disk full", null)).when(failing).write(any());
		AnalysisCache degraded = new AnalysisCache(failing, objectMapper, clock, RAW_TTL, RESULT_TTL);
		CacheKey key = CacheKey.raw("KO", DAY);

		degraded.put(key, TestSnapshots.highYield("KO"));

		assertThat(degraded.get(key, TickerSnapshot.class)).isEmpty();
	}

	@Test
	void inMemoryStoreBehavesLikeFileStore() {
		InMemoryCacheStore memory = new InMemoryCacheStore();
		AnalysisCache memoryCache = new AnalysisCache(memory, objectMapper, clock, RAW_TTL, RESULT_TTL);
		CacheKey key = CacheKey.raw("KO", DAY);
		TickerSnapshot snapshot = TestSnapshots.highYield("KO");

		memoryCache.put(key, snapshot);
		assertThat(memoryCache.get(key, TickerSnapshot.class)).contains(snapshot);

		clock.advance(RAW_TTL);
		assertThat(memoryCache.get(key, TickerSnapshot.class)).isEmpty();
		assertThat(memory.size()).isEqualTo(1);
	}

	@Test
	void rejectsNonPositiveTtl() {
		assertThatThrownBy(() -> new AnalysisCache(store, objectMapper, clock, Duration.ZERO, RESULT_TTL))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private AnalysisResult result(Action action, String reason) {
		Score score = new ScoringEngine().score(TestSnapshots.growth("AAPL"), InvestorStyle.GROWTH);
		return new AnalysisResult(action, score.composite(), reason, AnalysisSource.LLM, clock.instant(), score);
	}
}
