package com.study.webflux.retrieval.domain.retrieval.exception;

/** 검색 파이프라인 자체의 예기치 못한 실패입니다. */
public class RetrievalServiceException extends RuntimeException {

	public RetrievalServiceException(String message, Throwable cause) {
		super(message, cause);
	}
}
