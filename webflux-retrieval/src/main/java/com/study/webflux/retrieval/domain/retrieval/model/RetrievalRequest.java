package com.study.webflux.retrieval.domain.retrieval.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 통합 검색 요청입니다.
 *
 * <p>
 * {@code enabledSources}가 비어 있으면 등록된 모든 어댑터를 대상으로 합니다. 소스 순서는 입력 순서를 유지하며, 동점 근거의 정렬 순서를 결정합니다.
 * 범위 검증은 오케스트레이터가 수행합니다.
 */
public record RetrievalRequest(
	String query,
	List<String> context,
	Map<String, Object> filters,
	Set<String> enabledSources,
	int maxResults,
	boolean includeRecencyBias,
	double semanticSimilarityThreshold,
	Map<String, Double> sourceWeights
) {
	public static final int DEFAULT_MAX_RESULTS = 8;
	public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.3;

	public RetrievalRequest {
		context = context == null ? List.of() : List.copyOf(context);
		filters = filters == null
			? Map.of()
			: Collections.unmodifiableMap(new LinkedHashMap<>(filters));
		enabledSources = enabledSources == null
			? Set.of()
			: Collections.unmodifiableSet(new LinkedHashSet<>(enabledSources));
		sourceWeights = sourceWeights == null
			? Map.of()
			: Collections.unmodifiableMap(new LinkedHashMap<>(sourceWeights));
	}

	public static RetrievalRequest of(String query) {
		return new RetrievalRequest(query, List.of(), Map.of(), Set.of(), DEFAULT_MAX_RESULTS,
			true, DEFAULT_SIMILARITY_THRESHOLD, Map.of());
	}

	public RetrievalRequest withContext(List<String> newContext) {
		return new RetrievalRequest(query, newContext, filters, enabledSources, maxResults,
			includeRecencyBias, semanticSimilarityThreshold, sourceWeights);
	}

	public RetrievalRequest withFilters(Map<String, Object> newFilters) {
		return new RetrievalRequest(query, context, newFilters, enabledSources, maxResults,
			includeRecencyBias, semanticSimilarityThreshold, sourceWeights);
	}

	public RetrievalRequest withEnabledSources(String... sources) {
		return new RetrievalRequest(query, context, filters, new LinkedHashSet<>(List.of(sources)),
			maxResults, includeRecencyBias, semanticSimilarityThreshold, sourceWeights);
	}

	public RetrievalRequest withMaxResults(int newMaxResults) {
		return new RetrievalRequest(query, context, filters, enabledSources, newMaxResults,
			includeRecencyBias, semanticSimilarityThreshold, sourceWeights);
	}

	public RetrievalRequest withRecencyBias(boolean enabled) {
		return new RetrievalRequest(query, context, filters, enabledSources, maxResults, enabled,
			semanticSimilarityThreshold, sourceWeights);
	}

	public RetrievalRequest withSimilarityThreshold(double threshold) {
		return new RetrievalRequest(query, context, filters, enabledSources, maxResults,
			includeRecencyBias, threshold, sourceWeights);
	}

	public RetrievalRequest withSourceWeights(Map<String, Double> weights) {
		return new RetrievalRequest(query, context, filters, enabledSources, maxResults,
			includeRecencyBias, semanticSimilarityThreshold, weights);
	}

	public double sourceWeight(SourceType sourceType) {
		Double weight = sourceWeights.get(sourceType.value());
		return weight != null ? weight : 1.0;
	}
}
