package com.study.webflux.retrieval.application.retrieval.service;

import java.util.Collection;
import java.util.List;

import com.study.webflux.retrieval.domain.retrieval.exception.RetrievalValidationException;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalRequest;

/** 검색 요청의 필수값과 범위를 검증합니다. */
public class RetrievalRequestValidator {

	public static final int MIN_RESULTS = 1;
	public static final int MAX_RESULTS = 100;

	public void validate(RetrievalRequest request, Collection<String> registeredSources) {
		if (request == null) {
			throw new RetrievalValidationException("Request cannot be null");
		}
		if (request.query() == null || request.query().isBlank()) {
			throw new RetrievalValidationException("Query cannot be empty");
		}
		if (request.maxResults() < MIN_RESULTS) {
			throw new RetrievalValidationException("max_results must be positive");
		}
		if (request.maxResults() > MAX_RESULTS) {
			throw new RetrievalValidationException("max_results cannot exceed " + MAX_RESULTS);
		}
		double threshold = request.semanticSimilarityThreshold();
		if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
			throw new RetrievalValidationException(
				"semantic_similarity_threshold must be between 0.0 and 1.0");
		}

		List<String> invalidSources = request.enabledSources().stream()
			.filter(source -> !registeredSources.contains(source))
			.toList();
		if (!invalidSources.isEmpty()) {
			throw new RetrievalValidationException(
				"Invalid sources: " + invalidSources + ". Valid: " + registeredSources);
		}
	}
}
