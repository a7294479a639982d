package com.study.webflux.retrieval.domain.retrieval.model;

/** 검색 서비스 전체 지표 스냅샷입니다. */
public record ServiceMetrics(
	long searchesPerformed,
	long cacheHits,
	double avgLatencyMs,
	double p95LatencyMs,
	long adapterFailures,
	long resultsReturned,
	double avgRelevanceScore
) {
}
