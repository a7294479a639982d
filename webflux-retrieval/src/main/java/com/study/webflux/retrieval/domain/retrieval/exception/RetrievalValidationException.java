package com.study.webflux.retrieval.domain.retrieval.exception;

/** 잘못된 검색 요청(빈 질의, 범위를 벗어난 값, 미등록 소스)을 나타냅니다. 호출자에게 그대로 전파됩니다. */
public class RetrievalValidationException extends IllegalArgumentException {

	public RetrievalValidationException(String message) {
		super(message);
	}
}
