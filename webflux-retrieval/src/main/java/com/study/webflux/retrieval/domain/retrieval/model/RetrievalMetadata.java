package com.study.webflux.retrieval.domain.retrieval.model;

import java.util.Map;
import java.util.Set;

/**
 * 캐시에 근거와 함께 저장되는 응답 메타데이터입니다.
 *
 * @param sources
 *            결과 생성에 참여한 소스 유형. 소스별 부분 무효화에 사용됩니다.
 */
public record RetrievalMetadata(
	Map<String, Long> sourceLatencies,
	String cacheKey,
	double avgRelevanceScore,
	Map<String, Integer> sourceDistribution,
	int totalFound,
	Set<SourceType> sources
) {
	public RetrievalMetadata {
		sourceLatencies = sourceLatencies == null ? Map.of() : Map.copyOf(sourceLatencies);
		sourceDistribution = sourceDistribution == null
			? Map.of()
			: Map.copyOf(sourceDistribution);
		sources = sources == null ? Set.of() : Set.copyOf(sources);
	}
}
