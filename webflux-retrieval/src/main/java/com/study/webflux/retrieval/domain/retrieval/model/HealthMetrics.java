package com.study.webflux.retrieval.domain.retrieval.model;

/** 헬스 체크 응답에 포함되는 SLO 관련 지표입니다. 비율 값은 백분율입니다. */
public record HealthMetrics(
	long totalSearches,
	double avgLatencyMs,
	double p95LatencyMs,
	double adapterFailureRate,
	double avgRelevanceScore,
	double cacheHitRate
) {
	public static HealthMetrics empty() {
		return new HealthMetrics(0, 0.0, 0.0, 0.0, 0.0, 0.0);
	}
}
