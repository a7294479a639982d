package com.study.webflux.retrieval.application.retrieval.dto;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.AdapterMetrics;
import com.study.webflux.retrieval.domain.retrieval.model.HealthMetrics;
import com.study.webflux.retrieval.domain.retrieval.model.ServiceHealth;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "검색 서비스 헬스 Response")
public record ServiceHealthResponse(
	String service,
	@Schema(description = "healthy, degraded, unhealthy", example = "healthy") String status,
	Instant timestamp,
	String version,
	HealthMetrics metrics,
	Map<String, AdapterHealthResponse> adapters,
	boolean cacheEnabled,
	List<String> errors
) {

	public static ServiceHealthResponse from(ServiceHealth health) {
		Map<String, AdapterHealthResponse> adapters = new LinkedHashMap<>();
		health.adapters().forEach((name, adapterHealth) -> adapters.put(name,
			new AdapterHealthResponse(adapterHealth.status().value(), adapterHealth.metrics())));
		return new ServiceHealthResponse(health.service(),
			health.status().value(),
			health.timestamp(),
			health.version(),
			health.metrics(),
			adapters,
			health.cacheEnabled(),
			health.errors());
	}

	public record AdapterHealthResponse(String status, AdapterMetrics metrics) {
	}
}
