package com.study.webflux.retrieval.domain.retrieval.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 검색 소스가 반환한 단일 근거입니다. 점수, 출처 정보, 스니펫을 함께 보관합니다.
 *
 * <p>
 * {@code rank}는 오케스트레이터가 최종 정렬을 마친 뒤에만 부여됩니다.
 */
public record Evidence(
	String source,
	SourceType sourceType,
	String snippet,
	double score,
	String url,
	Instant timestamp,
	Map<String, Object> provenance,
	Integer rank,
	Double confidence,
	Double recencyBoost
) {
	public static final int MAX_SNIPPET_LENGTH = 500;

	public Evidence {
		if (source == null || source.isBlank()) {
			throw new IllegalArgumentException("source cannot be null or blank");
		}
		if (sourceType == null) {
			throw new IllegalArgumentException("sourceType cannot be null");
		}
		if (timestamp == null) {
			throw new IllegalArgumentException("timestamp cannot be null");
		}
		if (Double.isNaN(score)) {
			throw new IllegalArgumentException("score cannot be NaN");
		}
		if (snippet == null) {
			snippet = "";
		}
		if (snippet.length() > MAX_SNIPPET_LENGTH) {
			snippet = snippet.substring(0, MAX_SNIPPET_LENGTH);
		}
		provenance = provenance == null
			? Map.of()
			: Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
	}

	public Evidence withScore(double newScore) {
		return new Evidence(source, sourceType, snippet, newScore, url, timestamp, provenance,
			rank, confidence, recencyBoost);
	}

	public Evidence withRank(int newRank) {
		return new Evidence(source, sourceType, snippet, score, url, timestamp, provenance,
			newRank, confidence, recencyBoost);
	}

	public boolean hasRecencyBoost() {
		return recencyBoost != null && recencyBoost != 0.0;
	}
}
