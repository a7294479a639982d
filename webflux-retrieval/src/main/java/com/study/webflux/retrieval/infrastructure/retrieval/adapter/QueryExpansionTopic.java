package com.study.webflux.retrieval.infrastructure.retrieval.adapter;

import java.util.List;
import java.util.Locale;

/**
 * 질의 확장 토픽 그룹입니다. 트리거 문구 중 하나가 질의에 포함되면 확장어로 추가 검색합니다.
 */
public record QueryExpansionTopic(
	String name,
	List<String> triggers,
	List<String> expansions
) {
	public QueryExpansionTopic {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("topic name cannot be null or blank");
		}
		triggers = triggers == null ? List.of() : List.copyOf(triggers);
		expansions = expansions == null ? List.of() : List.copyOf(expansions);
	}

	public static QueryExpansionTopic connectivity() {
		return new QueryExpansionTopic("connectivity",
			List.of("connection refused",
				"cannot connect",
				"can't connect",
				"econnrefused",
				"port closed",
				"connection reset"),
			List.of("connection refused", "cannot connect", "port", "refused"));
	}

	public boolean matches(String query) {
		if (query == null) {
			return false;
		}
		String normalized = query.toLowerCase(Locale.ROOT);
		return triggers.stream()
			.map(trigger -> trigger.toLowerCase(Locale.ROOT))
			.anyMatch(normalized::contains);
	}
}
