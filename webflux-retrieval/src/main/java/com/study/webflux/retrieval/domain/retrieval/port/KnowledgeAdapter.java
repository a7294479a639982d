package com.study.webflux.retrieval.domain.retrieval.port;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.AdapterMetrics;
import com.study.webflux.retrieval.domain.retrieval.model.AdapterOutcome;
import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.QueryContext;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import reactor.core.publisher.Mono;

/**
 * 하나의 지식 소스에 대한 균일한 검색 계약입니다.
 */
public interface KnowledgeAdapter {

	/**
	 * 지식 소스를 검색합니다.
	 *
	 * <p>
	 * 내부 오류나 시간 예산 초과 시 에러를 내보내지 않고 빈 목록을 반환해야 합니다.
	 *
	 * @param query
	 *            정제된 검색 질의
	 * @param context
	 *            대화 맥락 문자열 목록
	 * @param maxResults
	 *            반환할 최대 근거 수
	 * @param filters
	 *            소스별 필터 (예: category, document_type)
	 * @return 점수 내림차순 근거 목록
	 */
	Mono<List<Evidence>> search(String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters);

	/**
	 * {@link #search}와 같지만 빈 결과가 실패로 인한 것인지 함께 알려줍니다. 오케스트레이터는 이 값으로
	 * 서비스 수준 어댑터 실패 수를 집계합니다.
	 */
	default Mono<AdapterOutcome> searchWithOutcome(String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters) {
		return search(query, context, maxResults, filters).map(AdapterOutcome::succeeded);
	}

	/** 가중치 계산과 분포 보고에 쓰이는 고정 식별자입니다. */
	SourceType sourceType();

	/** 등록/요청 시 사용하는 어댑터 이름입니다. */
	default String name() {
		return sourceType().value();
	}

	/** 질의 형태에 따라 이 어댑터 점수에 곱할 가중치입니다. */
	default double scoreWeight(QueryContext queryContext) {
		return 1.0;
	}

	AdapterMetrics metrics();

	Duration timeout();

	void updateTimeout(Duration timeout);
}
