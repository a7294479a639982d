package com.study.webflux.retrieval.domain.retrieval.model;

import java.util.List;

/** 캐시 적중 시 반환되는 근거와 메타데이터 묶음입니다. */
public record CachedRetrieval(
	List<Evidence> evidence,
	RetrievalMetadata metadata
) {
	public CachedRetrieval {
		evidence = evidence == null ? List.of() : List.copyOf(evidence);
	}
}
