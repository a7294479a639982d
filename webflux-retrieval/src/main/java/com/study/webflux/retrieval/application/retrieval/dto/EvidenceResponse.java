package com.study.webflux.retrieval.application.retrieval.dto;

import java.time.Instant;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "검색 근거")
public record EvidenceResponse(
	@Schema(description = "어댑터와 레코드 id", example = "PATTERN#pattern-2") String source,
	@Schema(description = "소스 유형", example = "pattern") String sourceType,
	String snippet,
	double score,
	String url,
	Instant timestamp,
	Map<String, Object> provenance,
	Integer rank,
	Double confidence,
	Double recencyBoost
) {

	public static EvidenceResponse from(Evidence evidence) {
		return new EvidenceResponse(evidence.source(),
			evidence.sourceType().value(),
			evidence.snippet(),
			evidence.score(),
			evidence.url(),
			evidence.timestamp(),
			evidence.provenance(),
			evidence.rank(),
			evidence.confidence(),
			evidence.recencyBoost());
	}
}
