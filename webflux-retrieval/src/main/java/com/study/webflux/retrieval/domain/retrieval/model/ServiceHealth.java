package com.study.webflux.retrieval.domain.retrieval.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** 검색 서비스의 SLO 기반 헬스 상태입니다. */
public record ServiceHealth(
	String service,
	HealthStatus status,
	Instant timestamp,
	String version,
	HealthMetrics metrics,
	Map<String, AdapterHealth> adapters,
	boolean cacheEnabled,
	List<String> errors
) {
	public ServiceHealth {
		adapters = adapters == null ? Map.of() : Map.copyOf(adapters);
		errors = errors == null ? List.of() : List.copyOf(errors);
	}

	public static ServiceHealth unhealthy(String service, Instant timestamp, String error) {
		return new ServiceHealth(service, HealthStatus.UNHEALTHY, timestamp, null,
			HealthMetrics.empty(), Map.of(), false, List.of(error));
	}
}
