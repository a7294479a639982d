package com.study.webflux.retrieval.infrastructure.document;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.retrieval.domain.retrieval.model.StoredDocument;
import com.study.webflux.retrieval.domain.retrieval.port.DocumentIndex;
import reactor.core.publisher.Mono;

/** 키워드 유사도 기반 인메모리 문서 인덱스입니다. */
@Slf4j
public class InMemoryDocumentIndex implements DocumentIndex {

	private final List<StoredDocument> documents;

	public InMemoryDocumentIndex(List<StoredDocument> documents) {
		this.documents = documents == null ? List.of() : List.copyOf(documents);
		log.info("InMemoryDocumentIndex loaded {} documents", this.documents.size());
	}

	/** 유형과 태그 필터를 먼저 적용한 뒤 키워드 유사도로 문서를 검색합니다. */
	@Override
	public Mono<List<StoredDocument>> search(String query,
		String documentType,
		List<String> tags,
		int limit) {
		return Mono.fromCallable(() -> {
			List<StoredDocument> candidates = documents.stream()
				.filter(document -> documentType == null || documentType.equals(document.documentType()))
				.filter(document -> tags == null || tags.isEmpty()
					|| document.tags().stream().anyMatch(tags::contains))
				.toList();
			return KeywordSimilaritySupport.rankDocumentsByQuery(query, candidates, limit);
		});
	}

	public int size() {
		return documents.size();
	}
}
