package com.study.webflux.retrieval.infrastructure.retrieval.seed;

import java.util.List;

/** 증상 문구 → 원인 후보 매핑 레코드입니다. */
public record SymptomPattern(
	String id,
	List<String> symptoms,
	List<String> causes,
	double confidence,
	double successRate,
	String category
) {
	public SymptomPattern {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("pattern id cannot be null or blank");
		}
		if (confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
		}
		if (successRate < 0.0 || successRate > 1.0) {
			throw new IllegalArgumentException("successRate must be between 0.0 and 1.0");
		}
		symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
		causes = causes == null ? List.of() : List.copyOf(causes);
	}

	/** 신뢰도와 과거 해결 성공률을 반영한 점수 배율입니다. */
	public double reliabilityFactor() {
		return confidence * (0.5 + 0.5 * successRate);
	}
}
