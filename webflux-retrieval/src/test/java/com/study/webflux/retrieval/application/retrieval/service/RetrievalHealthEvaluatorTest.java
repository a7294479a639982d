package com.study.webflux.retrieval.application.retrieval.service;

import java.time.Instant;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.AdapterMetrics;
import com.study.webflux.retrieval.domain.retrieval.model.CacheStats;
import com.study.webflux.retrieval.domain.retrieval.model.HealthStatus;
import com.study.webflux.retrieval.domain.retrieval.model.ServiceHealth;
import com.study.webflux.retrieval.domain.retrieval.model.ServiceMetrics;
import com.study.webflux.retrieval.infrastructure.config.properties.RetrievalProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetrievalHealthEvaluatorTest {

	private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

	private final RetrievalHealthEvaluator evaluator = new RetrievalHealthEvaluator(new RetrievalProperties());

	private static ServiceMetrics metrics(long searches, double p95, long failures) {
		return new ServiceMetrics(searches, 0, p95 / 2, p95, failures, searches, 0.5);
	}

	@Test
	@DisplayName("검색 전에는 캐시 적중률이 0이어도 healthy")
	void noSearches_healthy() {
		ServiceHealth health = evaluator.evaluate(metrics(0, 0, 0), CacheStats.empty(), Map.of(), NOW);

		assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
		assertThat(health.errors()).isEmpty();
		assertThat(health.cacheEnabled()).isTrue();
		assertThat(health.service()).isEqualTo("unified_retrieval_service");
		assertThat(health.version()).isEqualTo("1.0.0");
	}

	@Test
	@DisplayName("p95 지연이 200ms를 넘으면 degraded")
	void highLatency_degraded() {
		ServiceHealth health = evaluator.evaluate(metrics(10, 250, 0), null, Map.of(), NOW);

		assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
		assertThat(health.errors()).containsExactly("High p95 latency: 250.0ms");
		assertThat(health.cacheEnabled()).isFalse();
	}

	@Test
	@DisplayName("어댑터 실패율이 10%를 넘으면 degraded")
	void highFailureRate_degraded() {
		ServiceHealth health = evaluator.evaluate(metrics(10, 50, 2), null, Map.of(), NOW);

		assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
		assertThat(health.errors()).containsExactly("High adapter failure rate: 20.0%");
		assertThat(health.metrics().adapterFailureRate()).isEqualTo(20.0);
	}

	@Test
	@DisplayName("검색 후 캐시 적중률이 30% 미만이면 degraded")
	void lowCacheHitRate_degraded() {
		ServiceHealth health = evaluator.evaluate(metrics(10, 50, 0), new CacheStats(1, 9, 5, 5000, 0), Map.of(),
			NOW);

		assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
		assertThat(health.errors()).containsExactly("Low cache hit rate: 10.0%");
	}

	@Test
	@DisplayName("어댑터 오류율이 0.1 이상이면 해당 어댑터만 degraded")
	void adapterHealth() {
		Map<String, AdapterMetrics> adapters = Map.of(
			"pattern", new AdapterMetrics("pattern", 10, 5.0, 0.0, 0.0, 0.0),
			"document", new AdapterMetrics("document", 10, 50.0, 0.0, 0.2, 0.0));

		ServiceHealth health = evaluator.evaluate(metrics(0, 0, 0), null, adapters, NOW);

		assertThat(health.adapters().get("pattern").status()).isEqualTo(HealthStatus.HEALTHY);
		assertThat(health.adapters().get("document").status()).isEqualTo(HealthStatus.DEGRADED);
		assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
	}
}
