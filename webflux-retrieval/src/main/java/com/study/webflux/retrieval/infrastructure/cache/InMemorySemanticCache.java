package com.study.webflux.retrieval.infrastructure.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.study.webflux.retrieval.domain.retrieval.model.CacheEntry;
import com.study.webflux.retrieval.domain.retrieval.model.CacheStats;
import com.study.webflux.retrieval.domain.retrieval.model.CachedRetrieval;
import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalMetadata;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalCachePort;

/**
 * 프로세스 내 TTL 시맨틱 캐시입니다.
 *
 * <p>
 * 모든 조회/변경은 인스턴스 락 하나로 직렬화됩니다. 만료 엔트리는 조회 시점에 제거되고
 * {@link #cleanupExpired()}로 주기적으로 정리됩니다.
 */
@Slf4j
public class InMemorySemanticCache implements RetrievalCachePort {

	private static final int KEY_LENGTH = 16;

	private final Object lock = new Object();
	private final Map<String, CacheEntry> entries = new HashMap<>();

	private final Duration defaultTtl;
	private final long entrySizeBytes;
	private final Clock clock;
	private final ObjectMapper canonicalMapper;

	private long hits;
	private long misses;
	private long invalidations;

	public InMemorySemanticCache(Duration defaultTtl,
		long entrySizeBytes,
		Clock clock,
		ObjectMapper objectMapper) {
		if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
			throw new IllegalArgumentException("defaultTtl must be positive");
		}
		this.defaultTtl = defaultTtl;
		this.entrySizeBytes = entrySizeBytes;
		this.clock = clock;
		this.canonicalMapper = objectMapper.copy()
			.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
	}

	@Override
	public Optional<CachedRetrieval> get(String query, List<String> context, Map<String, Object> filters) {
		String key = keyFor(query, context, filters);
		synchronized (lock) {
			CacheEntry entry = entries.get(key);
			if (entry == null) {
				misses++;
				return Optional.empty();
			}
			if (entry.isExpired(clock.instant())) {
				entries.remove(key);
				misses++;
				log.debug("Cache entry expired: key={}", key);
				return Optional.empty();
			}
			hits++;
			return Optional.of(new CachedRetrieval(entry.evidence(), entry.metadata()));
		}
	}

	@Override
	public void put(String query,
		List<String> context,
		Map<String, Object> filters,
		List<Evidence> evidence,
		RetrievalMetadata metadata) {
		put(query, context, filters, evidence, metadata, defaultTtl);
	}

	@Override
	public void put(String query,
		List<String> context,
		Map<String, Object> filters,
		List<Evidence> evidence,
		RetrievalMetadata metadata,
		Duration ttl) {
		String key = keyFor(query, context, filters);
		Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
		synchronized (lock) {
			entries.put(key, CacheEntry.create(key, evidence, metadata, clock.instant(), effectiveTtl));
		}
		log.debug("Cached {} evidence: key={}, ttl={}", evidence.size(), key, effectiveTtl);
	}

	@Override
	public int invalidateAll() {
		synchronized (lock) {
			int removed = entries.size();
			entries.clear();
			invalidations += removed;
			return removed;
		}
	}

	@Override
	public int invalidate(SourceType sourceType) {
		if (sourceType == null) {
			return invalidateAll();
		}
		synchronized (lock) {
			int removed = 0;
			Iterator<CacheEntry> iterator = entries.values().iterator();
			while (iterator.hasNext()) {
				if (iterator.next().containsSource(sourceType)) {
					iterator.remove();
					removed++;
				}
			}
			invalidations += removed;
			return removed;
		}
	}

	@Override
	public int cleanupExpired() {
		Instant now = clock.instant();
		synchronized (lock) {
			int before = entries.size();
			entries.values().removeIf(entry -> entry.isExpired(now));
			return before - entries.size();
		}
	}

	@Override
	public CacheStats stats() {
		synchronized (lock) {
			return new CacheStats(hits,
				misses,
				entries.size(),
				(long) entries.size() * entrySizeBytes,
				invalidations);
		}
	}

	/**
	 * 정규화된 요청의 SHA-256 앞 16자리입니다. 질의는 소문자/trim, 맥락은 소문자/trim 후 정렬, 필터는 키 순으로 직렬화합니다.
	 */
	@Override
	public String keyFor(String query, List<String> context, Map<String, Object> filters) {
		String normalizedQuery = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
		List<String> normalizedContext = (context == null ? List.<String>of() : context).stream()
			.map(entry -> entry == null ? "" : entry.trim().toLowerCase(Locale.ROOT))
			.sorted()
			.toList();
		Map<String, Object> sortedFilters = filters == null ? Map.of() : new TreeMap<>(filters);

		String payload;
		try {
			payload = normalizedQuery
				+ "|" + canonicalMapper.writeValueAsString(normalizedContext)
				+ "|" + canonicalMapper.writeValueAsString(sortedFilters);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize cache key filters", e);
		}
		return sha256Hex(payload).substring(0, KEY_LENGTH);
	}

	static String sha256Hex(String value) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}
}
