package com.study.webflux.retrieval.domain.retrieval.model;

import java.time.Instant;
import java.util.Map;

/** 캐시/어댑터/서비스 지표를 묶은 관리용 통계 보고서입니다. 캐시가 꺼져 있으면 {@code cacheStats}는 null입니다. */
public record CacheStatsReport(
	boolean cacheEnabled,
	CacheStats cacheStats,
	Map<String, AdapterMetrics> adapterStats,
	ServiceMetrics serviceMetrics,
	Instant timestamp
) {
	public CacheStatsReport {
		adapterStats = adapterStats == null ? Map.of() : Map.copyOf(adapterStats);
	}
}
