package com.study.webflux.retrieval.domain.retrieval.port;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.study.webflux.retrieval.domain.retrieval.model.CacheStats;
import com.study.webflux.retrieval.domain.retrieval.model.CachedRetrieval;
import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalMetadata;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;

/** 정규화된 요청 내용을 키로 하는 TTL 기반 응답 캐시입니다. */
public interface RetrievalCachePort {

	/** 만료되지 않은 엔트리를 조회합니다. 만료된 엔트리는 조회 시점에 제거되고 miss로 처리됩니다. */
	Optional<CachedRetrieval> get(String query, List<String> context, Map<String, Object> filters);

	/** 기본 TTL로 저장합니다. */
	void put(String query,
		List<String> context,
		Map<String, Object> filters,
		List<Evidence> evidence,
		RetrievalMetadata metadata);

	void put(String query,
		List<String> context,
		Map<String, Object> filters,
		List<Evidence> evidence,
		RetrievalMetadata metadata,
		Duration ttl);

	/** 모든 엔트리를 제거하고 제거된 개수를 반환합니다. */
	int invalidateAll();

	/** 해당 소스가 결과 생성에 참여한 엔트리만 제거하고 제거된 개수를 반환합니다. */
	int invalidate(SourceType sourceType);

	/** 만료된 엔트리를 일괄 제거하고 제거된 개수를 반환합니다. */
	int cleanupExpired();

	CacheStats stats();

	String keyFor(String query, List<String> context, Map<String, Object> filters);
}
