package com.study.webflux.retrieval.application.retrieval.dto;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.RetrievalRequest;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "통합 검색 Request")
public record RetrievalSearchRequest(
	@Schema(description = "검색 질의", example = "connection refused on port 5432")
	@NotBlank String query,

	@Schema(description = "대화 맥락", example = "[\"the api pod restarted\"]")
	List<String> context,

	@Schema(description = "소스별 필터 (category, document_type, tags)")
	Map<String, Object> filters,

	@Schema(description = "검색할 소스. 비어 있으면 전체", example = "[\"pattern\", \"document\"]")
	List<String> enabledSources,

	@Schema(description = "최대 결과 수", example = "8")
	@Min(1) @Max(100) Integer maxResults,

	@Schema(description = "최신성 편향 적용 여부", example = "true")
	Boolean includeRecencyBias,

	@Schema(description = "최소 점수", example = "0.3")
	@DecimalMin("0.0") @DecimalMax("1.0") Double semanticSimilarityThreshold,

	@Schema(description = "소스 유형별 가중치", example = "{\"pattern\": 1.5}")
	Map<String, Double> sourceWeights
) {

	public RetrievalRequest toDomain() {
		return new RetrievalRequest(query,
			context,
			filters,
			enabledSources == null ? null : new LinkedHashSet<>(enabledSources),
			maxResults != null ? maxResults : RetrievalRequest.DEFAULT_MAX_RESULTS,
			includeRecencyBias == null || includeRecencyBias,
			semanticSimilarityThreshold != null
				? semanticSimilarityThreshold
				: RetrievalRequest.DEFAULT_SIMILARITY_THRESHOLD,
			sourceWeights);
	}
}
