package com.study.webflux.retrieval.infrastructure.retrieval.adapter;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.study.webflux.retrieval.domain.retrieval.model.AdapterMetrics;
import com.study.webflux.retrieval.domain.retrieval.model.AdapterOutcome;
import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import com.study.webflux.retrieval.domain.retrieval.port.KnowledgeAdapter;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 어댑터 공통 골격입니다. 시간 예산을 적용하고 실패를 빈 결과로 바꾸며 어댑터별 지표를 집계합니다.
 *
 * <p>
 * 실패와 시간 초과는 {@link AdapterOutcome#failed()}로도 드러나 오케스트레이터가 서비스 실패율에 반영합니다.
 *
 * <p>
 * 지표 카운터는 최선 노력(best-effort) 방식이며 엄격하게 선형화되지 않습니다.
 */
public abstract class AbstractKnowledgeAdapter implements KnowledgeAdapter {

	protected static final String ADAPTER_VERSION = "1.0";
	private static final int LOG_QUERY_LENGTH = 50;

	protected final Logger log = LoggerFactory.getLogger(getClass());
	protected final Clock clock;

	private final SourceType sourceType;
	private volatile Duration timeout;

	private final LongAdder queriesProcessed = new LongAdder();
	private final LongAdder totalLatencyMillis = new LongAdder();
	private final LongAdder timeoutCount = new LongAdder();
	private final LongAdder errorCount = new LongAdder();

	protected AbstractKnowledgeAdapter(SourceType sourceType, Duration timeout, Clock clock) {
		if (sourceType == null) {
			throw new IllegalArgumentException("sourceType cannot be null");
		}
		this.sourceType = sourceType;
		this.timeout = requirePositive(timeout);
		this.clock = clock != null ? clock : Clock.systemUTC();
	}

	@Override
	public final Mono<List<Evidence>> search(String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters) {
		return searchWithOutcome(query, context, maxResults, filters).map(AdapterOutcome::evidence);
	}

	@Override
	public final Mono<AdapterOutcome> searchWithOutcome(String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters) {
		List<String> safeContext = context != null ? context : List.of();
		Map<String, Object> safeFilters = filters != null ? filters : Map.of();

		return Mono.defer(() -> {
			long startNanos = System.nanoTime();
			return Mono.defer(() -> doSearch(query, safeContext, maxResults, safeFilters))
				.subscribeOn(Schedulers.boundedElastic())
				.defaultIfEmpty(List.of())
				.timeout(timeout)
				.map(results -> {
					long latencyMillis = Duration.ofNanos(System.nanoTime() - startNanos)
						.toMillis();
					queriesProcessed.increment();
					totalLatencyMillis.add(latencyMillis);
					log.debug("{} search completed: query='{}', results={}, latencyMs={}",
						name(),
						abbreviate(query),
						results.size(),
						latencyMillis);
					return AdapterOutcome.succeeded(results);
				})
				.onErrorResume(TimeoutException.class, error -> {
					queriesProcessed.increment();
					timeoutCount.increment();
					log.warn("{} search timeout for query: {}...", name(), abbreviate(query));
					return Mono.just(AdapterOutcome.failure());
				})
				.onErrorResume(error -> {
					queriesProcessed.increment();
					errorCount.increment();
					log.error("{} search error: {}", name(), error.getMessage(), error);
					return Mono.just(AdapterOutcome.failure());
				});
		});
	}

	/**
	 * 실제 검색을 수행합니다. 블로킹 호출이 포함되어도 되며, 예외는 공통 골격이 빈 결과로 변환합니다.
	 */
	protected abstract Mono<List<Evidence>> doSearch(String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters);

	@Override
	public SourceType sourceType() {
		return sourceType;
	}

	@Override
	public Duration timeout() {
		return timeout;
	}

	@Override
	public void updateTimeout(Duration newTimeout) {
		this.timeout = requirePositive(newTimeout);
	}

	@Override
	public AdapterMetrics metrics() {
		long processed = queriesProcessed.sum();
		long denominator = Math.max(processed, 1);
		return new AdapterMetrics(name(),
			processed,
			(double) totalLatencyMillis.sum() / denominator,
			(double) timeoutCount.sum() / denominator,
			(double) errorCount.sum() / denominator,
			0.0);
	}

	protected static String abbreviate(String query) {
		if (query == null) {
			return "";
		}
		return query.length() > LOG_QUERY_LENGTH ? query.substring(0, LOG_QUERY_LENGTH) : query;
	}

	private static Duration requirePositive(Duration value) {
		if (value == null || value.isZero() || value.isNegative()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		return value;
	}
}
