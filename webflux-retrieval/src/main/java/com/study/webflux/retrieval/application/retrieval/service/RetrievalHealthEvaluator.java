package com.study.webflux.retrieval.application.retrieval.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.AdapterHealth;
import com.study.webflux.retrieval.domain.retrieval.model.AdapterMetrics;
import com.study.webflux.retrieval.domain.retrieval.model.CacheStats;
import com.study.webflux.retrieval.domain.retrieval.model.HealthMetrics;
import com.study.webflux.retrieval.domain.retrieval.model.HealthStatus;
import com.study.webflux.retrieval.domain.retrieval.model.ServiceHealth;
import com.study.webflux.retrieval.domain.retrieval.model.ServiceMetrics;
import com.study.webflux.retrieval.infrastructure.config.properties.RetrievalProperties;

/**
 * 서비스 지표를 SLO와 비교해 헬스 상태를 판정합니다.
 *
 * <p>
 * p95 지연, 어댑터 실패율, 캐시 적중률 중 하나라도 기준을 벗어나면 degraded 입니다. 캐시 적중률은 검색이 한 건
 * 이상 처리된 뒤부터 판정합니다.
 */
public class RetrievalHealthEvaluator {

	private final RetrievalProperties properties;

	public RetrievalHealthEvaluator(RetrievalProperties properties) {
		this.properties = properties;
	}

	/**
	 * @param cacheStats
	 *            캐시가 꺼져 있으면 null
	 */
	public ServiceHealth evaluate(ServiceMetrics serviceMetrics,
		CacheStats cacheStats,
		Map<String, AdapterMetrics> adapterMetrics,
		Instant now) {
		RetrievalProperties.Slo slo = properties.getSlo();
		long totalSearches = serviceMetrics.searchesPerformed();
		double failureRate = (double) serviceMetrics.adapterFailures() / Math.max(totalSearches, 1)
			* 100.0;

		HealthStatus status = HealthStatus.HEALTHY;
		List<String> errors = new ArrayList<>();

		if (serviceMetrics.p95LatencyMs() > slo.getP95LatencyMs()) {
			status = HealthStatus.DEGRADED;
			errors.add(format("High p95 latency: %.1fms", serviceMetrics.p95LatencyMs()));
		}

		if (failureRate > slo.getMaxAdapterFailureRatePercent()) {
			status = HealthStatus.DEGRADED;
			errors.add(format("High adapter failure rate: %.1f%%", failureRate));
		}

		double cacheHitRate = 0.0;
		if (cacheStats != null) {
			cacheHitRate = cacheStats.hitRatePercent();
			if (totalSearches > 0 && cacheHitRate < slo.getMinCacheHitRatePercent()) {
				status = HealthStatus.DEGRADED;
				errors.add(format("Low cache hit rate: %.1f%%", cacheHitRate));
			}
		}

		Map<String, AdapterHealth> adapters = new LinkedHashMap<>();
		adapterMetrics.forEach((name, metrics) -> adapters.put(name,
			new AdapterHealth(metrics.errorRate() < slo.getAdapterErrorRate()
				? HealthStatus.HEALTHY
				: HealthStatus.DEGRADED, metrics)));

		HealthMetrics metrics = new HealthMetrics(totalSearches,
			serviceMetrics.avgLatencyMs(),
			serviceMetrics.p95LatencyMs(),
			failureRate,
			serviceMetrics.avgRelevanceScore(),
			cacheHitRate);

		return new ServiceHealth(properties.getServiceName(),
			status,
			now,
			properties.getVersion(),
			metrics,
			adapters,
			cacheStats != null,
			errors);
	}

	private static String format(String pattern, double value) {
		return String.format(Locale.ROOT, pattern, value);
	}
}
