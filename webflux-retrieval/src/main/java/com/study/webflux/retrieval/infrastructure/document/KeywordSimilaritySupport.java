package com.study.webflux.retrieval.infrastructure.document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.study.webflux.retrieval.domain.retrieval.model.StoredDocument;

/**
 * 키워드 교집합 기반 유사도 계산과 상위 문서 추출을 위한 공통 유틸리티입니다.
 */
final class KeywordSimilaritySupport {

	private static final int MIN_MATCHED_TOKENS = 2;

	private KeywordSimilaritySupport() {
	}

	/**
	 * 문서 목록에서 query와의 유사도 점수를 계산해 관련도 순으로 정렬된 상위 문서를 반환합니다.
	 *
	 * <p>
	 * 점수는 질의 토큰 중 문서 본문에 등장한 비율(0~1)입니다. 여러 토큰으로 된 질의는 두 개 이상 겹치는
	 * 문서만 남기며, 흔한 단어 하나만 겹친 문서는 후보가 되지 않습니다.
	 */
	static List<StoredDocument> rankDocumentsByQuery(String query,
		List<StoredDocument> documents,
		int topK) {
		Set<String> queryWords = tokenize(query);
		if (queryWords.isEmpty()) {
			return List.of();
		}

		int minimumMatches = Math.min(MIN_MATCHED_TOKENS, queryWords.size());
		List<StoredDocument> sorted = new ArrayList<>();
		for (StoredDocument document : documents) {
			int matches = scoreByTokenIntersection(queryWords, document.content());
			if (matches >= minimumMatches) {
				sorted.add(document.withScore((double) matches / queryWords.size()));
			}
		}
		sorted.sort(Comparator.comparingDouble(StoredDocument::score).reversed());

		return sorted.size() > topK ? sorted.subList(0, topK) : sorted;
	}

	/**
	 * 공백 단위 토큰 교집합 크기를 유사도 점수로 계산합니다.
	 */
	static int scoreByTokenIntersection(Set<String> queryWords, String candidate) {
		Set<String> intersection = new HashSet<>(queryWords);
		intersection.retainAll(tokenize(candidate));
		return intersection.size();
	}

	static Set<String> tokenize(String text) {
		if (text == null || text.isBlank()) {
			return Set.of();
		}
		return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
			.filter(word -> !word.isEmpty())
			.collect(Collectors.toSet());
	}
}
