package com.study.webflux.retrieval.infrastructure.vectordb;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import com.study.webflux.retrieval.domain.retrieval.model.StoredDocument;
import com.study.webflux.retrieval.domain.retrieval.port.VectorDocumentStore;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI {@link VectorStore} 기반 문서 유사도 검색 어댑터입니다.
 *
 * <p>
 * 메타데이터 키: {@code document_type}(또는 {@code type}), {@code source_url}, {@code tags},
 * {@code last_modified}(epoch seconds 또는 ISO-8601).
 */
@Slf4j
public class SpringAiVectorDocumentStore implements VectorDocumentStore {

	private final VectorStore vectorStore;

	public SpringAiVectorDocumentStore(VectorStore vectorStore) {
		this.vectorStore = vectorStore;
	}

	@Override
	public Mono<List<StoredDocument>> similaritySearch(String query, int topK) {
		return Mono.fromCallable(() -> {
			SearchRequest request = SearchRequest.builder()
				.query(query)
				.topK(topK)
				.similarityThresholdAll()
				.build();

			List<Document> documents = vectorStore.similaritySearch(request);
			return documents == null
				? List.<StoredDocument>of()
				: documents.stream().map(this::toStoredDocument).toList();
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private StoredDocument toStoredDocument(Document document) {
		Map<String, Object> metadata = document.getMetadata();

		Object documentType = metadata.getOrDefault("document_type", metadata.get("type"));
		Object url = metadata.get("source_url");

		List<String> tags = List.of();
		Object tagsObj = metadata.get("tags");
		if (tagsObj instanceof List) {
			tags = ((List<?>) tagsObj).stream().map(String::valueOf).toList();
		}

		return new StoredDocument(document.getId(),
			document.getText(),
			document.getScore(),
			documentType != null ? documentType.toString() : null,
			url != null ? url.toString() : null,
			tags,
			parseLastModified(document.getId(), metadata.get("last_modified")));
	}

	private Instant parseLastModified(String documentId, Object value) {
		if (value instanceof Number) {
			return Instant.ofEpochSecond(((Number) value).longValue());
		}
		if (value instanceof String) {
			try {
				return Instant.parse((String) value);
			} catch (DateTimeParseException e) {
				log.warn("문서 ID={}의 last_modified 형식이 올바르지 않습니다: {}", documentId, value);
				return null;
			}
		}
		return null;
	}
}
