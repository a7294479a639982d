package com.study.webflux.retrieval.domain.retrieval.port;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.AdapterStatistics;
import com.study.webflux.retrieval.domain.retrieval.model.CacheStatsReport;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalRequest;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalResponse;
import com.study.webflux.retrieval.domain.retrieval.model.ServiceHealth;
import reactor.core.publisher.Mono;

/** 통합 근거 검색 유스케이스입니다. */
public interface RetrievalUseCase {

	Mono<RetrievalResponse> search(RetrievalRequest request);

	/** 패턴 어댑터만 대상으로 증상 검색을 수행합니다. 최신성 편향은 적용하지 않습니다. */
	Mono<RetrievalResponse> searchPatterns(List<String> symptoms, Map<String, Object> context);

	/**
	 * @param sourceType
	 *            null이면 전체 무효화
	 */
	Mono<Boolean> invalidateCache(String sourceType);

	Mono<CacheStatsReport> getCacheStats();

	Mono<ServiceHealth> healthCheck();

	Mono<Boolean> readyCheck();

	Mono<Integer> cleanupCache();

	Mono<AdapterStatistics> getAdapterStatistics();

	Mono<Boolean> reconfigureAdapters(List<String> enabledSources, Duration timeout);
}
