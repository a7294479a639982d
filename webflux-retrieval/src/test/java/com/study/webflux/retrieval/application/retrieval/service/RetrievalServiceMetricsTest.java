package com.study.webflux.retrieval.application.retrieval.service;

import com.study.webflux.retrieval.domain.retrieval.model.ServiceMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RetrievalServiceMetricsTest {

	@Test
	@DisplayName("검색과 캐시 적중을 모두 누적 평균 지연에 반영")
	void averages() {
		RetrievalServiceMetrics metrics = new RetrievalServiceMetrics(100);

		metrics.recordSearch(100, 3, 0.6);
		metrics.recordSearch(200, 1, 0.4);
		metrics.recordCacheHit(0, 3);
		metrics.recordAdapterFailure();

		ServiceMetrics snapshot = metrics.snapshot();
		assertThat(snapshot.searchesPerformed()).isEqualTo(3);
		assertThat(snapshot.cacheHits()).isEqualTo(1);
		assertThat(snapshot.avgLatencyMs()).isCloseTo(100.0, within(1e-9));
		assertThat(snapshot.resultsReturned()).isEqualTo(7);
		assertThat(snapshot.avgRelevanceScore()).isCloseTo(0.5, within(1e-9));
		assertThat(snapshot.adapterFailures()).isEqualTo(1);
	}

	@Test
	@DisplayName("p95는 최근 윈도우의 95번째 백분위 값")
	void p95_overWindow() {
		RetrievalServiceMetrics metrics = new RetrievalServiceMetrics(20);
		for (long latency = 1; latency <= 20; latency++) {
			metrics.recordSearch(latency, 1, 0.5);
		}

		assertThat(metrics.snapshot().p95LatencyMs()).isEqualTo(19.0);

		for (int i = 0; i < 20; i++) {
			metrics.recordSearch(5, 1, 0.5);
		}
		assertThat(metrics.snapshot().p95LatencyMs()).isEqualTo(5.0);
	}

	@Test
	@DisplayName("기록이 없으면 0")
	void empty() {
		ServiceMetrics snapshot = new RetrievalServiceMetrics(10).snapshot();

		assertThat(snapshot.p95LatencyMs()).isZero();
		assertThat(snapshot.avgLatencyMs()).isZero();
	}

	@Test
	@DisplayName("윈도우 크기는 양수")
	void windowSize_positive() {
		assertThatThrownBy(() -> new RetrievalServiceMetrics(0)).isInstanceOf(IllegalArgumentException.class);
	}
}
