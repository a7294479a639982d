package com.study.webflux.retrieval.domain.retrieval.port;

import java.util.function.Supplier;

import reactor.core.publisher.Mono;

/** 이름 붙은 구간을 감싸 관측 가능하게 만드는 외부 협력자입니다. */
public interface RetrievalTracer {

	<T> Mono<T> trace(String section, Supplier<Mono<T>> supplier);

	static RetrievalTracer noop() {
		return new RetrievalTracer() {
			@Override
			public <T> Mono<T> trace(String section, Supplier<Mono<T>> supplier) {
				return Mono.defer(supplier);
			}
		};
	}
}
