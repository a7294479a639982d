package com.study.webflux.retrieval.application.retrieval.dto;

import java.util.List;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.RetrievalResponse;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "통합 검색 Response")
public record RetrievalSearchResponse(
	List<EvidenceResponse> evidence,
	int totalFound,
	long elapsedMs,
	Map<String, Long> sourceLatencies,
	boolean cacheHit,
	String cacheKey,
	double avgRelevanceScore,
	Map<String, Integer> sourceDistribution
) {

	public static RetrievalSearchResponse from(RetrievalResponse response) {
		return new RetrievalSearchResponse(response.evidence().stream().map(EvidenceResponse::from).toList(),
			response.totalFound(),
			response.elapsedMs(),
			response.sourceLatencies(),
			response.cacheHit(),
			response.cacheKey(),
			response.avgRelevanceScore(),
			response.sourceDistribution());
	}
}
