package com.study.webflux.retrieval.infrastructure.monitoring;

import java.util.concurrent.TimeUnit;

import com.study.webflux.retrieval.domain.retrieval.port.RetrievalCachePort;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalMetricsReporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer를 사용하여 검색 지표를 Prometheus로 내보내는 Reporter입니다.
 */
public class MicrometerRetrievalMetricsReporter implements RetrievalMetricsReporter {

	private static final String METRIC_PREFIX = "retrieval";

	private final MeterRegistry meterRegistry;

	public MicrometerRetrievalMetricsReporter(MeterRegistry meterRegistry, RetrievalCachePort cache) {
		this.meterRegistry = meterRegistry;

		if (cache != null) {
			Gauge.builder(METRIC_PREFIX + ".cache.entries", cache, c -> c.stats().entries())
				.description("Number of live semantic cache entries")
				.register(meterRegistry);
		}
	}

	@Override
	public void recordSearch(long elapsedMillis, boolean cacheHit, int resultCount) {
		// 검색 전체 소요 시간
		Timer.builder(METRIC_PREFIX + ".search.duration")
			.tag("cache", cacheHit ? "hit" : "miss")
			.description("End-to-end retrieval time")
			.register(meterRegistry)
			.record(elapsedMillis, TimeUnit.MILLISECONDS);

		DistributionSummary.builder(METRIC_PREFIX + ".search.results")
			.description("Evidence returned per search")
			.register(meterRegistry)
			.record(resultCount);
	}

	@Override
	public void recordAdapterCall(String source, long latencyMillis, boolean failed) {
		Timer.builder(METRIC_PREFIX + ".adapter.duration")
			.tag("source", source)
			.description("Adapter search time")
			.register(meterRegistry)
			.record(latencyMillis, TimeUnit.MILLISECONDS);

		if (failed) {
			Counter.builder(METRIC_PREFIX + ".adapter.failures")
				.tag("source", source)
				.description("Adapter calls that timed out or failed")
				.register(meterRegistry)
				.increment();
		}
	}

	@Override
	public void recordEvidenceScore(String source, double score) {
		DistributionSummary.builder(METRIC_PREFIX + ".evidence.score")
			.tag("source", source)
			.description("Final ranked evidence score")
			.publishPercentiles(0.5, 0.75, 0.9, 0.95, 0.99)
			.register(meterRegistry)
			.record(score);
	}
}
