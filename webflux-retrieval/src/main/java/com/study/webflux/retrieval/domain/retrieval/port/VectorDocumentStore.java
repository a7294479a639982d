package com.study.webflux.retrieval.domain.retrieval.port;

import java.util.List;

import com.study.webflux.retrieval.domain.retrieval.model.StoredDocument;
import reactor.core.publisher.Mono;

/** 임베딩 기반 유사도 검색을 제공하는 문서 저장소입니다. */
public interface VectorDocumentStore {

	Mono<List<StoredDocument>> similaritySearch(String query, int topK);
}
