package com.study.webflux.retrieval.domain.retrieval.model;

import java.time.Instant;
import java.util.Map;

public record AdapterStatistics(
	Instant timestamp,
	int totalAdapters,
	Map<String, AdapterMetrics> adapters
) {
	public AdapterStatistics {
		adapters = adapters == null ? Map.of() : Map.copyOf(adapters);
	}
}
