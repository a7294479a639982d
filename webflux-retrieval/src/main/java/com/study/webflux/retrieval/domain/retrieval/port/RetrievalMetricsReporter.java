package com.study.webflux.retrieval.domain.retrieval.port;

/** 검색 파이프라인 지표를 외부 모니터링 시스템으로 내보내는 포트입니다. */
public interface RetrievalMetricsReporter {

	void recordSearch(long elapsedMillis, boolean cacheHit, int resultCount);

	void recordAdapterCall(String source, long latencyMillis, boolean failed);

	void recordEvidenceScore(String source, double score);

	static RetrievalMetricsReporter noop() {
		return new RetrievalMetricsReporter() {
			@Override
			public void recordSearch(long elapsedMillis, boolean cacheHit, int resultCount) {
			}

			@Override
			public void recordAdapterCall(String source, long latencyMillis, boolean failed) {
			}

			@Override
			public void recordEvidenceScore(String source, double score) {
			}
		};
	}
}
