package com.study.webflux.retrieval.domain.retrieval.model;

public record AdapterHealth(
	HealthStatus status,
	AdapterMetrics metrics
) {
}
