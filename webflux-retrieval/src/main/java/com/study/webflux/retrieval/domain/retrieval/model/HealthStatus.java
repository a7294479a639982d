package com.study.webflux.retrieval.domain.retrieval.model;

public enum HealthStatus {
	HEALTHY("healthy"),
	DEGRADED("degraded"),
	UNHEALTHY("unhealthy");

	private final String value;

	HealthStatus(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}
}
