package com.study.webflux.retrieval.domain.retrieval.model;

import java.util.List;
import java.util.Locale;

/** 어댑터 가중치 계산에 사용하는 질의 형태 정보입니다. */
public record QueryContext(
	String query,
	List<String> context
) {
	public QueryContext {
		query = query == null ? "" : query;
		context = context == null ? List.of() : List.copyOf(context);
	}

	public static QueryContext of(String query, List<String> context) {
		return new QueryContext(query, context);
	}

	public String normalizedQuery() {
		return query.toLowerCase(Locale.ROOT);
	}

	public boolean queryContainsAny(List<String> terms) {
		String normalized = normalizedQuery();
		return terms.stream().anyMatch(normalized::contains);
	}
}
