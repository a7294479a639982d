package com.study.webflux.retrieval.domain.retrieval.model;

import java.util.List;
import java.util.Map;

/** 통합 검색 응답입니다. {@code evidence}는 최종 순위 순서로 정렬되어 있습니다. */
public record RetrievalResponse(
	List<Evidence> evidence,
	int totalFound,
	long elapsedMs,
	Map<String, Long> sourceLatencies,
	boolean cacheHit,
	String cacheKey,
	double avgRelevanceScore,
	Map<String, Integer> sourceDistribution
) {
	public RetrievalResponse {
		evidence = evidence == null ? List.of() : List.copyOf(evidence);
		sourceLatencies = sourceLatencies == null ? Map.of() : Map.copyOf(sourceLatencies);
		sourceDistribution = sourceDistribution == null
			? Map.of()
			: Map.copyOf(sourceDistribution);
	}

	public boolean isEmpty() {
		return evidence.isEmpty();
	}
}
