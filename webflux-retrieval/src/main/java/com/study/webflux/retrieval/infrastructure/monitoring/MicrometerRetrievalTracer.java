package com.study.webflux.retrieval.infrastructure.monitoring;

import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.retrieval.domain.retrieval.port.RetrievalTracer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import reactor.core.publisher.Mono;

/** 구간별 실행 시간을 {@code retrieval.section.duration} 타이머로 기록하는 트레이서입니다. */
@Slf4j
public class MicrometerRetrievalTracer implements RetrievalTracer {

	private final MeterRegistry meterRegistry;

	public MicrometerRetrievalTracer(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;
	}

	@Override
	public <T> Mono<T> trace(String section, Supplier<Mono<T>> supplier) {
		return Mono.defer(() -> {
			Timer.Sample sample = Timer.start(meterRegistry);
			return Mono.defer(supplier)
				.doOnEach(signal -> {
					if (signal.isOnComplete() || signal.isOnError()) {
						String status = signal.isOnError() ? "error" : "success";
						long nanos = sample.stop(Timer.builder("retrieval.section.duration")
							.tag("section", section)
							.tag("status", status)
							.description("Traced retrieval section time")
							.register(meterRegistry));
						log.debug("section={} status={} durationMs={}", section, status, nanos / 1_000_000);
					}
				});
		});
	}
}
