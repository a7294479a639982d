package com.study.webflux.retrieval.domain.retrieval.port;

/** 검색 전에 질의 텍스트를 정제하는 외부 협력자입니다. */
@FunctionalInterface
public interface QuerySanitizer {

	String sanitize(String text);

	static QuerySanitizer passthrough() {
		return text -> text;
	}
}
