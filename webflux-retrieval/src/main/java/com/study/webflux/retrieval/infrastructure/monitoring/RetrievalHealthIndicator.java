package com.study.webflux.retrieval.infrastructure.monitoring;

import lombok.RequiredArgsConstructor;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;

import com.study.webflux.retrieval.domain.retrieval.model.HealthStatus;
import com.study.webflux.retrieval.domain.retrieval.model.ServiceHealth;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalUseCase;
import reactor.core.publisher.Mono;

/**
 * 검색 서비스 헬스를 actuator {@code /actuator/health}에 노출합니다. degraded는 UP으로 두고 상세에 표시합니다.
 */
@Component("retrieval")
@RequiredArgsConstructor
public class RetrievalHealthIndicator implements ReactiveHealthIndicator {

	private final RetrievalUseCase retrievalUseCase;

	@Override
	public Mono<Health> health() {
		return retrievalUseCase.healthCheck()
			.map(this::toHealth)
			.onErrorResume(error -> Mono.just(Health.down(error).build()));
	}

	private Health toHealth(ServiceHealth serviceHealth) {
		Health.Builder builder = serviceHealth.status() == HealthStatus.UNHEALTHY
			? Health.down()
			: Health.up();
		return builder.withDetail("status", serviceHealth.status().value())
			.withDetail("searches", serviceHealth.metrics().totalSearches())
			.withDetail("p95LatencyMs", serviceHealth.metrics().p95LatencyMs())
			.withDetail("adapterFailureRate", serviceHealth.metrics().adapterFailureRate())
			.withDetail("cacheHitRate", serviceHealth.metrics().cacheHitRate())
			.withDetail("adapters", serviceHealth.adapters().keySet())
			.withDetail("errors", serviceHealth.errors())
			.build();
	}
}
