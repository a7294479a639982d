package com.study.webflux.retrieval.application.retrieval.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.study.webflux.retrieval.domain.retrieval.port.RetrievalUseCase;
import reactor.core.publisher.Mono;

/** 만료된 시맨틱 캐시 엔트리를 주기적으로 정리합니다. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticCacheCleanupScheduler {

	private final RetrievalUseCase retrievalUseCase;

	@Scheduled(fixedDelayString = "${retrieval.cache.cleanup-interval:PT5M}",
		initialDelayString = "${retrieval.cache.cleanup-interval:PT5M}")
	public void cleanupExpiredEntries() {
		retrievalUseCase.cleanupCache()
			.doOnSuccess(removed -> log.debug("캐시 정리 완료: removed={}", removed))
			.doOnError(error -> log.error("캐시 정리 실패, 이유={}", error.getMessage(), error))
			.onErrorResume(error -> Mono.empty())
			.subscribe();
	}
}
