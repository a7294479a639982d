package com.study.webflux.retrieval.application.retrieval.service;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

import com.study.webflux.retrieval.domain.retrieval.model.ServiceMetrics;

/**
 * 검색 서비스 전체 지표입니다. 평균 지연과 평균 관련도는 누적 평균, p95는 최근 N건 윈도우로 계산합니다.
 */
public class RetrievalServiceMetrics {

	private final int windowSize;
	private final Deque<Long> latencyWindow = new ArrayDeque<>();

	private long searchesPerformed;
	private long cacheHits;
	private double avgLatencyMs;
	private long adapterFailures;
	private long resultsReturned;
	private double avgRelevanceScore;
	private long scoredSearches;

	public RetrievalServiceMetrics(int windowSize) {
		if (windowSize <= 0) {
			throw new IllegalArgumentException("windowSize must be positive");
		}
		this.windowSize = windowSize;
	}

	/** 캐시 미스 후 새로 계산한 검색을 기록합니다. */
	public synchronized void recordSearch(long latencyMs, int resultCount, double avgRelevance) {
		recordLatency(latencyMs);
		resultsReturned += resultCount;
		scoredSearches++;
		avgRelevanceScore += (avgRelevance - avgRelevanceScore) / scoredSearches;
	}

	public synchronized void recordCacheHit(long latencyMs, int resultCount) {
		cacheHits++;
		resultsReturned += resultCount;
		recordLatency(latencyMs);
	}

	public synchronized void recordAdapterFailure() {
		adapterFailures++;
	}

	public synchronized ServiceMetrics snapshot() {
		return new ServiceMetrics(searchesPerformed,
			cacheHits,
			avgLatencyMs,
			p95(),
			adapterFailures,
			resultsReturned,
			avgRelevanceScore);
	}

	private void recordLatency(long latencyMs) {
		searchesPerformed++;
		avgLatencyMs += (latencyMs - avgLatencyMs) / searchesPerformed;
		latencyWindow.addLast(latencyMs);
		if (latencyWindow.size() > windowSize) {
			latencyWindow.removeFirst();
		}
	}

	private double p95() {
		if (latencyWindow.isEmpty()) {
			return 0.0;
		}
		long[] sorted = latencyWindow.stream().mapToLong(Long::longValue).toArray();
		Arrays.sort(sorted);
		int index = (int) Math.ceil(0.95 * sorted.length) - 1;
		return sorted[Math.max(index, 0)];
	}
}
