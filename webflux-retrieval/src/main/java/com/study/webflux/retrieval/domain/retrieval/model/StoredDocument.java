package com.study.webflux.retrieval.domain.retrieval.model;

import java.time.Instant;
import java.util.List;

/**
 * 문서 저장소(벡터 저장소, 키워드 인덱스)가 반환하는 원본 문서입니다.
 *
 * @param score
 *            저장소가 계산한 유사도. 없으면 null
 * @param lastModified
 *            마지막 수정 시각. 없으면 최신성 가산점을 받지 않습니다
 */
public record StoredDocument(
	String id,
	String content,
	Double score,
	String documentType,
	String url,
	List<String> tags,
	Instant lastModified
) {
	public StoredDocument {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id cannot be null or blank");
		}
		content = content == null ? "" : content;
		documentType = documentType == null || documentType.isBlank() ? "unknown" : documentType;
		tags = tags == null ? List.of() : List.copyOf(tags);
	}

	public StoredDocument withScore(double newScore) {
		return new StoredDocument(id, content, newScore, documentType, url, tags, lastModified);
	}
}
