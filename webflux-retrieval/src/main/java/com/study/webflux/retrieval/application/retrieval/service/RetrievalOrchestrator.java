package com.study.webflux.retrieval.application.retrieval.service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import org.springframework.util.DigestUtils;

import com.study.webflux.retrieval.domain.retrieval.exception.RetrievalServiceException;
import com.study.webflux.retrieval.domain.retrieval.exception.RetrievalValidationException;
import com.study.webflux.retrieval.domain.retrieval.model.AdapterMetrics;
import com.study.webflux.retrieval.domain.retrieval.model.AdapterOutcome;
import com.study.webflux.retrieval.domain.retrieval.model.AdapterStatistics;
import com.study.webflux.retrieval.domain.retrieval.model.CacheStats;
import com.study.webflux.retrieval.domain.retrieval.model.CacheStatsReport;
import com.study.webflux.retrieval.domain.retrieval.model.CachedRetrieval;
import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.QueryContext;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalMetadata;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalRequest;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalResponse;
import com.study.webflux.retrieval.domain.retrieval.model.ServiceHealth;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import com.study.webflux.retrieval.domain.retrieval.port.KnowledgeAdapter;
import com.study.webflux.retrieval.domain.retrieval.port.QuerySanitizer;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalCachePort;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalMetricsReporter;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalTracer;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalUseCase;
import com.study.webflux.retrieval.infrastructure.config.properties.RetrievalProperties;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 등록된 지식 어댑터에 질의를 동시에 전달하고 결과를 병합/정렬/캐시하는 통합 검색 서비스입니다.
 *
 * <p>
 * 파이프라인: 검증 → 정제 → 캐시 조회 → 팬아웃 → 하이브리드 정렬 → 임계값 필터 → 절단 → 캐시 저장.
 * 어댑터 호출은 각각 독립적인 시간 예산을 가지며, 실패한 어댑터는 빈 결과로 취급됩니다. 캐시 장애는 요청을
 * 실패시키지 않습니다.
 */
@Slf4j
public class RetrievalOrchestrator implements RetrievalUseCase {

	static final String PATTERN_QUERY_DELIMITER = " | ";
	static final int PATTERN_MAX_RESULTS = 10;
	private static final String CACHE_SCOPE_KEY = "_request";
	private static final int LOG_QUERY_LENGTH = 60;

	private final Object registryLock = new Object();
	private volatile Map<String, KnowledgeAdapter> adapters = Map.of();
	private volatile Set<String> defaultEnabledSources = Set.of();
	private volatile Duration adapterTimeout;

	private final RetrievalCachePort cache;
	private final QuerySanitizer sanitizer;
	private final RetrievalTracer tracer;
	private final RetrievalMetricsReporter metricsReporter;
	private final RetrievalServiceMetrics serviceMetrics;
	private final RetrievalRequestValidator validator = new RetrievalRequestValidator();
	private final HybridRanker ranker;
	private final RetrievalHealthEvaluator healthEvaluator;
	private final RetrievalProperties properties;
	private final Clock clock;

	/**
	 * @param cache
	 *            null이면 캐시를 사용하지 않습니다
	 * @param sanitizer
	 *            null이면 질의를 그대로 사용합니다
	 * @param tracer
	 *            null이면 추적하지 않습니다
	 */
	public RetrievalOrchestrator(List<KnowledgeAdapter> adapters,
		RetrievalCachePort cache,
		QuerySanitizer sanitizer,
		RetrievalTracer tracer,
		RetrievalMetricsReporter metricsReporter,
		RetrievalProperties properties,
		Clock clock) {
		this.cache = cache;
		this.sanitizer = sanitizer != null ? sanitizer : QuerySanitizer.passthrough();
		this.tracer = tracer != null ? tracer : RetrievalTracer.noop();
		this.metricsReporter = metricsReporter != null
			? metricsReporter
			: RetrievalMetricsReporter.noop();
		this.properties = properties;
		this.clock = clock;
		this.adapterTimeout = properties.getAdapterTimeout();
		this.serviceMetrics = new RetrievalServiceMetrics(properties.getSlo().getLatencyWindowSize());
		this.ranker = new HybridRanker(clock);
		this.healthEvaluator = new RetrievalHealthEvaluator(properties);

		if (adapters != null) {
			adapters.forEach(this::registerAdapter);
		}
		log.info("Unified retrieval service initialized with {} adapters: {}, cacheEnabled={}",
			this.adapters.size(),
			this.adapters.keySet(),
			cache != null);
	}

	/** 어댑터를 이름으로 등록합니다. 같은 이름이 있으면 교체합니다. */
	public void registerAdapter(KnowledgeAdapter adapter) {
		if (adapter == null) {
			throw new IllegalArgumentException("adapter cannot be null");
		}
		synchronized (registryLock) {
			Map<String, KnowledgeAdapter> updated = new LinkedHashMap<>(adapters);
			if (updated.put(adapter.name(), adapter) != null) {
				log.warn("Adapter '{}' was already registered and has been replaced", adapter.name());
			}
			adapters = Collections.unmodifiableMap(updated);
		}
	}

	public Set<String> registeredSources() {
		return adapters.keySet();
	}

	@Override
	public Mono<RetrievalResponse> search(RetrievalRequest request) {
		return tracer.trace("unified_retrieval_search", () -> Mono.defer(() -> doSearch(request)))
			.onErrorMap(error -> !(error instanceof RetrievalValidationException)
				&& !(error instanceof RetrievalServiceException),
				error -> {
					log.error("Unified search failed: {}", error.getMessage(), error);
					return new RetrievalServiceException("Search failed: " + error.getMessage(), error);
				});
	}

	private Mono<RetrievalResponse> doSearch(RetrievalRequest request) {
		long startNanos = System.nanoTime();
		Map<String, KnowledgeAdapter> registry = adapters;
		validator.validate(request, registry.keySet());

		String sanitizedQuery = sanitizer.sanitize(request.query());
		List<KnowledgeAdapter> targets = resolveTargets(request, registry);
		Map<String, Object> cacheScope = cacheScope(request, targets);

		Optional<CachedRetrieval> cached = lookupCache(sanitizedQuery, request.context(), cacheScope);
		if (cached.isPresent()) {
			return Mono.just(fromCache(cached.get(), request, startNanos));
		}

		Duration timeout = adapterTimeout;
		return Flux.fromIterable(targets)
			.flatMapSequential(adapter -> searchAdapter(adapter,
				sanitizedQuery,
				request.context(),
				request.maxResults(),
				request.filters(),
				timeout))
			.collectList()
			.map(results -> buildResponse(results,
				request,
				sanitizedQuery,
				targets,
				cacheScope,
				startNanos));
	}

	private Mono<AdapterResult> searchAdapter(KnowledgeAdapter adapter,
		String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters,
		Duration timeout) {
		return Mono.defer(() -> {
			long startNanos = System.nanoTime();
			// 블로킹 어댑터가 호출 스레드를 점유하면 timeout이 동작하지 않으므로 어댑터마다 워커에서 구독
			return Mono.defer(() -> adapter.searchWithOutcome(query, context, maxResults, filters))
				.subscribeOn(Schedulers.boundedElastic())
				.defaultIfEmpty(AdapterOutcome.succeeded(List.of()))
				.timeout(timeout)
				.map(outcome -> new AdapterResult(adapter,
					outcome.evidence(),
					elapsedMillis(startNanos),
					outcome.failed()))
				.onErrorResume(error -> {
					log.error("Adapter {} search failed: {}", adapter.name(), error.toString());
					return Mono.just(new AdapterResult(adapter, List.of(), elapsedMillis(startNanos), true));
				})
				.doOnNext(result -> {
					if (result.failed()) {
						serviceMetrics.recordAdapterFailure();
					}
					metricsReporter.recordAdapterCall(adapter.name(), result.latencyMs(), result.failed());
				});
		});
	}

	private RetrievalResponse buildResponse(List<AdapterResult> results,
		RetrievalRequest request,
		String sanitizedQuery,
		List<KnowledgeAdapter> targets,
		Map<String, Object> cacheScope,
		long startNanos) {
		List<Evidence> candidates = new ArrayList<>();
		Map<String, Long> sourceLatencies = new LinkedHashMap<>();
		for (AdapterResult result : results) {
			candidates.addAll(result.evidence());
			sourceLatencies.put(result.adapter().name(), result.latencyMs());
		}

		QueryContext queryContext = QueryContext.of(sanitizedQuery, request.context());
		Map<SourceType, Double> adapterWeights = new EnumMap<>(SourceType.class);
		for (KnowledgeAdapter adapter : targets) {
			adapterWeights.put(adapter.sourceType(), adapter.scoreWeight(queryContext));
		}

		List<Evidence> ranked = ranker.rank(candidates, request, adapterWeights);
		List<Evidence> finalEvidence = ranked.size() > request.maxResults()
			? ranked.subList(0, request.maxResults())
			: ranked;

		double avgRelevance = averageScore(finalEvidence);
		Map<String, Integer> sourceDistribution = sourceDistribution(finalEvidence);
		String cacheKey = cache != null ? responseCacheKey(sanitizedQuery) : null;

		long elapsedMs = elapsedMillis(startNanos);
		serviceMetrics.recordSearch(elapsedMs, finalEvidence.size(), avgRelevance);
		metricsReporter.recordSearch(elapsedMs, false, finalEvidence.size());
		finalEvidence.forEach(evidence -> metricsReporter.recordEvidenceScore(
			evidence.sourceType().value(), evidence.score()));

		if (cache != null) {
			Set<SourceType> sources = targets.stream()
				.map(KnowledgeAdapter::sourceType)
				.collect(Collectors.toCollection(LinkedHashSet::new));
			storeInCache(sanitizedQuery,
				request.context(),
				cacheScope,
				finalEvidence,
				new RetrievalMetadata(sourceLatencies,
					cacheKey,
					avgRelevance,
					sourceDistribution,
					candidates.size(),
					sources));
		}

		log.debug("Retrieved {} results from {} adapters in {}ms: query='{}'",
			finalEvidence.size(),
			targets.size(),
			elapsedMs,
			abbreviate(sanitizedQuery));

		return new RetrievalResponse(finalEvidence,
			candidates.size(),
			elapsedMs,
			sourceLatencies,
			false,
			cacheKey,
			avgRelevance,
			sourceDistribution);
	}

	private RetrievalResponse fromCache(CachedRetrieval cached, RetrievalRequest request, long startNanos) {
		List<Evidence> evidence = cached.evidence().size() > request.maxResults()
			? cached.evidence().subList(0, request.maxResults())
			: cached.evidence();
		RetrievalMetadata metadata = cached.metadata();
		long elapsedMs = elapsedMillis(startNanos);

		serviceMetrics.recordCacheHit(elapsedMs, evidence.size());
		metricsReporter.recordSearch(elapsedMs, true, evidence.size());
		log.debug("Cache hit: key={}, results={}", metadata.cacheKey(), evidence.size());

		return new RetrievalResponse(evidence,
			metadata.totalFound(),
			elapsedMs,
			metadata.sourceLatencies(),
			true,
			metadata.cacheKey(),
			averageScore(evidence),
			sourceDistribution(evidence));
	}

	private List<KnowledgeAdapter> resolveTargets(RetrievalRequest request,
		Map<String, KnowledgeAdapter> registry) {
		Set<String> requested = !request.enabledSources().isEmpty()
			? request.enabledSources()
			: defaultEnabledSources;
		if (requested.isEmpty()) {
			return List.copyOf(registry.values());
		}
		List<KnowledgeAdapter> targets = new ArrayList<>();
		for (String source : requested) {
			KnowledgeAdapter adapter = registry.get(source);
			if (adapter != null) {
				targets.add(adapter);
			} else {
				log.warn("Unknown adapter requested: {}", source);
			}
		}
		return targets;
	}

	/**
	 * 캐시 키에 포함되는 요청 범위입니다. 호출자 필터에 결과를 바꾸는 요청 옵션과 대상 소스를 더합니다.
	 */
	private static Map<String, Object> cacheScope(RetrievalRequest request, List<KnowledgeAdapter> targets) {
		Map<String, Object> scope = new TreeMap<>();
		scope.put("sources", targets.stream().map(KnowledgeAdapter::name).sorted().toList());
		scope.put("max_results", request.maxResults());
		scope.put("recency_bias", request.includeRecencyBias());
		scope.put("threshold", request.semanticSimilarityThreshold());
		scope.put("source_weights", new TreeMap<>(request.sourceWeights()));

		Map<String, Object> filters = new LinkedHashMap<>(request.filters());
		filters.put(CACHE_SCOPE_KEY, scope);
		return filters;
	}

	private Optional<CachedRetrieval> lookupCache(String query,
		List<String> context,
		Map<String, Object> filters) {
		if (cache == null) {
			return Optional.empty();
		}
		try {
			return cache.get(query, context, filters);
		} catch (RuntimeException e) {
			log.warn("Cache lookup failed, computing fresh result: {}", e.getMessage(), e);
			return Optional.empty();
		}
	}

	private void storeInCache(String query,
		List<String> context,
		Map<String, Object> filters,
		List<Evidence> evidence,
		RetrievalMetadata metadata) {
		try {
			cache.put(query, context, filters, evidence, metadata);
		} catch (RuntimeException e) {
			log.warn("Cache write failed, skipping cache: {}", e.getMessage(), e);
		}
	}

	@Override
	public Mono<RetrievalResponse> searchPatterns(List<String> symptoms, Map<String, Object> context) {
		return Mono.defer(() -> {
			if (symptoms == null || symptoms.isEmpty()) {
				return Mono.error(new RetrievalValidationException("Symptoms cannot be empty"));
			}
			List<String> contextValues = context == null
				? List.of()
				: context.values().stream().map(String::valueOf).toList();
			RetrievalRequest request = RetrievalRequest.of(String.join(PATTERN_QUERY_DELIMITER, symptoms))
				.withContext(contextValues)
				.withEnabledSources(SourceType.PATTERN.value())
				.withMaxResults(PATTERN_MAX_RESULTS)
				.withRecencyBias(false);
			return tracer.trace("unified_retrieval_search_patterns", () -> search(request));
		});
	}

	@Override
	public Mono<Boolean> invalidateCache(String sourceType) {
		return tracer.trace("unified_retrieval_invalidate_cache", () -> Mono.fromCallable(() -> {
			if (cache == null) {
				log.debug("Cache not enabled - nothing to invalidate");
				return true;
			}
			if (sourceType == null || sourceType.isBlank()) {
				int removed = cache.invalidateAll();
				log.info("Cache invalidated for source_type: all, removed={}", removed);
				return true;
			}
			Optional<SourceType> type = SourceType.fromValue(sourceType);
			if (type.isEmpty()) {
				log.warn("Cache invalidation rejected, unknown source_type: {}", sourceType);
				return false;
			}
			int removed = cache.invalidate(type.get());
			log.info("Cache invalidated for source_type: {}, removed={}", type.get().value(), removed);
			return true;
		}).onErrorResume(error -> {
			log.error("Cache invalidation failed: {}", error.getMessage(), error);
			return Mono.just(false);
		}));
	}

	@Override
	public Mono<CacheStatsReport> getCacheStats() {
		return Mono.fromCallable(() -> new CacheStatsReport(cache != null,
			cache != null ? cache.stats() : null,
			adapterMetrics(),
			serviceMetrics.snapshot(),
			clock.instant()));
	}

	@Override
	public Mono<ServiceHealth> healthCheck() {
		return Mono.fromCallable(() -> {
			CacheStats cacheStats = cache != null ? cache.stats() : null;
			return healthEvaluator.evaluate(serviceMetrics.snapshot(),
				cacheStats,
				adapterMetrics(),
				clock.instant());
		}).onErrorResume(error -> {
			log.error("Health check failed: {}", error.getMessage(), error);
			return Mono.just(ServiceHealth.unhealthy(properties.getServiceName(),
				clock.instant(),
				String.valueOf(error.getMessage())));
		});
	}

	@Override
	public Mono<Boolean> readyCheck() {
		return Mono.fromCallable(() -> !adapters.isEmpty());
	}

	@Override
	public Mono<Integer> cleanupCache() {
		return Mono.fromCallable(() -> {
			if (cache == null) {
				return 0;
			}
			int removed = cache.cleanupExpired();
			if (removed > 0) {
				log.debug("Cleaned up {} expired cache entries", removed);
			}
			return removed;
		});
	}

	@Override
	public Mono<AdapterStatistics> getAdapterStatistics() {
		return Mono.fromCallable(() -> {
			Map<String, AdapterMetrics> metrics = adapterMetrics();
			return new AdapterStatistics(clock.instant(), metrics.size(), metrics);
		});
	}

	/**
	 * 어댑터 시간 예산을 바꾸고, 요청에 소스가 지정되지 않았을 때 사용할 기본 소스를 제한합니다.
	 *
	 * @param enabledSources
	 *            비어 있거나 null이면 등록된 모든 어댑터
	 */
	@Override
	public Mono<Boolean> reconfigureAdapters(List<String> enabledSources, Duration timeout) {
		return Mono.fromCallable(() -> {
			if (timeout == null || timeout.isZero() || timeout.isNegative()) {
				log.warn("Adapter reconfiguration rejected, invalid timeout: {}", timeout);
				return false;
			}
			Set<String> requested = enabledSources == null
				? Set.of()
				: new LinkedHashSet<>(enabledSources);
			Map<String, KnowledgeAdapter> registry = adapters;
			List<String> unknown = requested.stream()
				.filter(source -> !registry.containsKey(source))
				.toList();
			if (!unknown.isEmpty()) {
				log.warn("Adapter reconfiguration rejected, unknown sources: {}", unknown);
				return false;
			}

			registry.values().forEach(adapter -> adapter.updateTimeout(timeout));
			adapterTimeout = timeout;
			defaultEnabledSources = Collections.unmodifiableSet(requested);
			log.info("Reconfigured adapters: enabled={}, timeout={}", requested, timeout);
			return true;
		}).onErrorResume(error -> {
			log.error("Adapter reconfiguration failed: {}", error.getMessage(), error);
			return Mono.just(false);
		});
	}

	private Map<String, AdapterMetrics> adapterMetrics() {
		Map<String, AdapterMetrics> metrics = new LinkedHashMap<>();
		adapters.forEach((name, adapter) -> metrics.put(name, adapter.metrics()));
		return metrics;
	}

	static String responseCacheKey(String sanitizedQuery) {
		String md5 = DigestUtils.md5DigestAsHex(sanitizedQuery.getBytes(StandardCharsets.UTF_8));
		return "search_" + md5.substring(0, 8);
	}

	private static double averageScore(List<Evidence> evidence) {
		return evidence.stream().mapToDouble(Evidence::score).sum() / Math.max(evidence.size(), 1);
	}

	private static Map<String, Integer> sourceDistribution(List<Evidence> evidence) {
		Map<String, Integer> distribution = new LinkedHashMap<>();
		evidence.forEach(item -> distribution.merge(item.sourceType().value(), 1, Integer::sum));
		return distribution;
	}

	private static long elapsedMillis(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
	}

	private static String abbreviate(String query) {
		return query.length() > LOG_QUERY_LENGTH ? query.substring(0, LOG_QUERY_LENGTH) : query;
	}

	private record AdapterResult(KnowledgeAdapter adapter, List<Evidence> evidence, long latencyMs,
		boolean failed) {
	}
}
