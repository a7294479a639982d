package com.study.webflux.retrieval.domain.retrieval.port;

import java.util.List;

import com.study.webflux.retrieval.domain.retrieval.model.StoredDocument;
import reactor.core.publisher.Mono;

/** 키워드/텍스트 기반 문서 인덱스입니다. */
public interface DocumentIndex {

	/**
	 * @param documentType
	 *            문서 유형 필터. null이면 전체
	 * @param tags
	 *            태그 필터. 비어 있으면 전체, 값이 있으면 하나 이상 일치해야 합니다
	 */
	Mono<List<StoredDocument>> search(String query,
		String documentType,
		List<String> tags,
		int limit);
}
