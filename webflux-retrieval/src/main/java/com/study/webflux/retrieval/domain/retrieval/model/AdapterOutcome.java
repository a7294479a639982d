package com.study.webflux.retrieval.domain.retrieval.model;

import java.util.List;

/**
 * 어댑터 한 번 호출의 결과입니다. 실패나 시간 초과도 빈 근거와 {@code failed=true}로 표현됩니다.
 */
public record AdapterOutcome(
	List<Evidence> evidence,
	boolean failed
) {
	public AdapterOutcome {
		evidence = evidence == null ? List.of() : List.copyOf(evidence);
	}

	public static AdapterOutcome succeeded(List<Evidence> evidence) {
		return new AdapterOutcome(evidence, false);
	}

	public static AdapterOutcome failure() {
		return new AdapterOutcome(List.of(), true);
	}
}
