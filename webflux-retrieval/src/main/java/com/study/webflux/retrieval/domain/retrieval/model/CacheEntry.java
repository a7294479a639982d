package com.study.webflux.retrieval.domain.retrieval.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** 시맨틱 캐시 엔트리입니다. {@code expiresAt = createdAt + ttl} 이 항상 성립합니다. */
public record CacheEntry(
	String key,
	List<Evidence> evidence,
	RetrievalMetadata metadata,
	Instant createdAt,
	Instant expiresAt
) {
	public CacheEntry {
		if (key == null || key.isBlank()) {
			throw new IllegalArgumentException("key cannot be null or blank");
		}
		if (createdAt == null || expiresAt == null) {
			throw new IllegalArgumentException("createdAt and expiresAt are required");
		}
		if (expiresAt.isBefore(createdAt)) {
			throw new IllegalArgumentException("expiresAt cannot precede createdAt");
		}
		evidence = evidence == null ? List.of() : List.copyOf(evidence);
	}

	public static CacheEntry create(String key,
		List<Evidence> evidence,
		RetrievalMetadata metadata,
		Instant createdAt,
		Duration ttl) {
		return new CacheEntry(key, evidence, metadata, createdAt, createdAt.plus(ttl));
	}

	public boolean isExpired(Instant now) {
		return now.isAfter(expiresAt);
	}

	public boolean containsSource(SourceType sourceType) {
		return metadata != null && metadata.sources().contains(sourceType);
	}
}
