package com.study.webflux.retrieval.infrastructure.retrieval.seed;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.study.webflux.retrieval.domain.retrieval.model.StoredDocument;

/**
 * 클래스패스 JSON 리소스에서 인메모리 참조 테이블을 한 번 읽어 불변 목록으로 반환합니다.
 */
public class KnowledgeSeedLoader {

	private final ObjectMapper objectMapper;

	public KnowledgeSeedLoader() {
		this(new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
	}

	public KnowledgeSeedLoader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public List<SymptomPattern> loadPatterns(String resourcePath) {
		return load(resourcePath, new TypeReference<List<SymptomPattern>>() {
		});
	}

	public List<Playbook> loadPlaybooks(String resourcePath) {
		return load(resourcePath, new TypeReference<List<Playbook>>() {
		});
	}

	public List<StoredDocument> loadDocuments(String resourcePath) {
		return load(resourcePath, new TypeReference<List<StoredDocument>>() {
		});
	}

	private <T> List<T> load(String resourcePath, TypeReference<List<T>> type) {
		ClassPathResource resource = new ClassPathResource(resourcePath);
		if (!resource.exists()) {
			throw new IllegalStateException("Seed resource not found: " + resourcePath);
		}
		try (InputStream inputStream = resource.getInputStream()) {
			return List.copyOf(objectMapper.readValue(inputStream, type));
		} catch (IOException e) {
			throw new IllegalStateException("Failed to load seed resource: " + resourcePath, e);
		}
	}
}
