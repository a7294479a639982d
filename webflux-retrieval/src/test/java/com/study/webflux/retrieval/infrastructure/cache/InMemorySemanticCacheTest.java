package com.study.webflux.retrieval.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.retrieval.domain.retrieval.model.CacheStats;
import com.study.webflux.retrieval.domain.retrieval.model.CachedRetrieval;
import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalMetadata;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import com.study.webflux.retrieval.fixture.EvidenceFixture;
import com.study.webflux.retrieval.fixture.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySemanticCacheTest {

	private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

	private MutableClock clock;
	private InMemorySemanticCache cache;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(NOW);
		cache = new InMemorySemanticCache(Duration.ofHours(1), 1000, clock, new ObjectMapper());
	}

	private static RetrievalMetadata metadata(SourceType... sources) {
		return new RetrievalMetadata(Map.of(), "search_abc", 0.5, Map.of(), 1, Set.of(sources));
	}

	private static List<Evidence> evidence() {
		return List.of(EvidenceFixture.create("PATTERN#1", SourceType.PATTERN, 0.5, NOW));
	}

	@Test
	@DisplayName("질의 대소문자/공백과 맥락 순서가 달라도 같은 키")
	void keyFor_normalizesQueryAndContext() {
		String key = cache.keyFor("  Connection Refused ", List.of("B ctx", "a ctx"), Map.of("x", 1, "a", 2));

		assertThat(key).hasSize(16).matches("[0-9a-f]+");
		assertThat(cache.keyFor("connection refused", List.of("a ctx", "b ctx"), Map.of("a", 2, "x", 1)))
			.isEqualTo(key);
		assertThat(cache.keyFor("connection refused", List.of("a ctx"), Map.of("a", 2, "x", 1)))
			.isNotEqualTo(key);
	}

	@Test
	@DisplayName("저장한 결과를 조회하면 hit, 없으면 miss")
	void putAndGet() {
		assertThat(cache.get("q", List.of(), Map.of())).isEmpty();

		cache.put("q", List.of(), Map.of(), evidence(), metadata(SourceType.PATTERN));
		Optional<CachedRetrieval> cached = cache.get("Q", List.of(), Map.of());

		assertThat(cached).isPresent();
		assertThat(cached.get().evidence()).hasSize(1);
		assertThat(cached.get().metadata().cacheKey()).isEqualTo("search_abc");
		CacheStats stats = cache.stats();
		assertThat(stats.hits()).isEqualTo(1);
		assertThat(stats.misses()).isEqualTo(1);
		assertThat(stats.entries()).isEqualTo(1);
		assertThat(stats.memoryUsageBytes()).isEqualTo(1000);
	}

	@Test
	@DisplayName("TTL이 지나면 조회 시 제거되고 miss")
	void get_expired_removed() {
		cache.put("q", List.of(), Map.of(), evidence(), metadata(SourceType.PATTERN), Duration.ofMinutes(1));

		clock.advance(Duration.ofMinutes(2));

		assertThat(cache.get("q", List.of(), Map.of())).isEmpty();
		assertThat(cache.stats().entries()).isZero();
		assertThat(cache.stats().misses()).isEqualTo(1);
	}

	@Test
	@DisplayName("정리 작업은 만료 엔트리만 제거")
	void cleanupExpired_removesOnlyExpired() {
		cache.put("short", List.of(), Map.of(), evidence(), metadata(), Duration.ofMinutes(1));
		cache.put("long", List.of(), Map.of(), evidence(), metadata());

		clock.advance(Duration.ofMinutes(5));

		assertThat(cache.cleanupExpired()).isEqualTo(1);
		assertThat(cache.get("long", List.of(), Map.of())).isPresent();
	}

	@Test
	@DisplayName("소스별 무효화는 해당 소스가 참여한 엔트리만 제거")
	void invalidate_bySource() {
		cache.put("pattern only", List.of(), Map.of(), evidence(), metadata(SourceType.PATTERN));
		cache.put("documents", List.of(), Map.of(), evidence(), metadata(SourceType.DOCUMENT));
		cache.put("both", List.of(), Map.of(), evidence(), metadata(SourceType.DOCUMENT, SourceType.PATTERN));

		assertThat(cache.invalidate(SourceType.PATTERN)).isEqualTo(2);

		assertThat(cache.get("documents", List.of(), Map.of())).isPresent();
		assertThat(cache.get("both", List.of(), Map.of())).isEmpty();
		assertThat(cache.stats().invalidations()).isEqualTo(2);
	}

	@Test
	@DisplayName("전체 무효화는 모든 엔트리를 제거하고 제거한 엔트리 수만큼 무효화 횟수를 센다")
	void invalidateAll() {
		cache.put("a", List.of(), Map.of(), evidence(), metadata(SourceType.PATTERN));
		cache.put("b", List.of(), Map.of(), evidence(), metadata(SourceType.PLAYBOOK));

		assertThat(cache.invalidate(null)).isEqualTo(2);
		assertThat(cache.stats().entries()).isZero();
		assertThat(cache.invalidate(null)).isZero();
		assertThat(cache.stats().invalidations()).isEqualTo(2);
	}
}
