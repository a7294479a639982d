package com.study.webflux.retrieval.infrastructure.retrieval.seed;

import java.util.List;

/** 절차형 플레이북 레코드입니다. */
public record Playbook(
	String id,
	String title,
	List<String> keywords,
	List<String> steps,
	String category,
	String difficulty,
	String estimatedTime
) {
	public Playbook {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("playbook id cannot be null or blank");
		}
		if (title == null || title.isBlank()) {
			throw new IllegalArgumentException("playbook title cannot be null or blank");
		}
		keywords = keywords == null ? List.of() : List.copyOf(keywords);
		steps = steps == null ? List.of() : List.copyOf(steps);
	}
}
