package com.study.webflux.retrieval.domain.retrieval.model;

/** 어댑터별 성능 지표 스냅샷입니다. 비율 값은 0~1 범위입니다. */
public record AdapterMetrics(
	String name,
	long queriesProcessed,
	double avgLatencyMs,
	double timeoutRate,
	double errorRate,
	double cacheHitRate
) {
}
