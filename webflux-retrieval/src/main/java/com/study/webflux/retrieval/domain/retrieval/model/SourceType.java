package com.study.webflux.retrieval.domain.retrieval.model;

import java.util.Locale;
import java.util.Optional;

/** 근거를 제공하는 지식 소스의 유형입니다. */
public enum SourceType {
	/** 문서/런북 저장소 */
	DOCUMENT("document"),

	/** 증상 → 원인 패턴 테이블 */
	PATTERN("pattern"),

	/** 절차형 플레이북 테이블 */
	PLAYBOOK("playbook");

	private final String value;

	SourceType(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}

	public static Optional<SourceType> fromValue(String value) {
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (SourceType type : values()) {
			if (type.value.equals(normalized)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
