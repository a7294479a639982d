package com.study.webflux.retrieval.domain.retrieval.model;

/** 시맨틱 캐시 통계 스냅샷입니다. {@code invalidations}는 무효화로 제거된 엔트리 누적 수입니다. */
public record CacheStats(
	long hits,
	long misses,
	int entries,
	long memoryUsageBytes,
	long invalidations
) {

	public long totalRequests() {
		return hits + misses;
	}

	public double hitRatePercent() {
		return (double) hits / Math.max(totalRequests(), 1) * 100.0;
	}

	public static CacheStats empty() {
		return new CacheStats(0, 0, 0, 0, 0);
	}
}
