package com.study.webflux.retrieval.domain.retrieval.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrievalRequestTest {

	@Test
	@DisplayName("기본 요청은 8건, 최신성 편향 적용, 임계값 0.3")
	void of_appliesDefaults() {
		RetrievalRequest request = RetrievalRequest.of("disk full");

		assertThat(request.maxResults()).isEqualTo(8);
		assertThat(request.includeRecencyBias()).isTrue();
		assertThat(request.semanticSimilarityThreshold()).isEqualTo(0.3);
		assertThat(request.enabledSources()).isEmpty();
		assertThat(request.context()).isEmpty();
	}

	@Test
	@DisplayName("요청한 소스 순서를 유지한다")
	void enabledSources_keepInsertionOrder() {
		RetrievalRequest request = RetrievalRequest.of("q").withEnabledSources("playbook", "pattern", "document");

		assertThat(request.enabledSources()).containsExactly("playbook", "pattern", "document");
	}

	@Test
	@DisplayName("호출자 가중치가 없으면 1.0")
	void sourceWeight_defaultsToOne() {
		RetrievalRequest request = RetrievalRequest.of("q").withSourceWeights(Map.of("pattern", 1.5));

		assertThat(request.sourceWeight(SourceType.PATTERN)).isEqualTo(1.5);
		assertThat(request.sourceWeight(SourceType.DOCUMENT)).isEqualTo(1.0);
	}

	@Test
	@DisplayName("소스 유형은 대소문자와 공백을 무시하고 해석한다")
	void sourceType_fromValue() {
		assertThat(SourceType.fromValue(" Pattern ")).contains(SourceType.PATTERN);
		assertThat(SourceType.fromValue("wiki")).isEmpty();
		assertThat(SourceType.fromValue(null)).isEmpty();
	}

	@Test
	@DisplayName("캐시 엔트리는 만료 시각이 생성 시각 + TTL")
	void cacheEntry_expiresAfterTtl() {
		Instant createdAt = Instant.parse("2024-05-01T00:00:00Z");
		CacheEntry entry = CacheEntry.create("key", List.of(), null, createdAt, Duration.ofMinutes(10));

		assertThat(entry.expiresAt()).isEqualTo(createdAt.plusSeconds(600));
		assertThat(entry.isExpired(createdAt.plusSeconds(600))).isFalse();
		assertThat(entry.isExpired(createdAt.plusSeconds(601))).isTrue();
		assertThat(entry.containsSource(SourceType.PATTERN)).isFalse();
	}

	@Test
	@DisplayName("만료 시각이 생성 시각보다 앞서면 예외")
	void cacheEntry_invalidExpiry_throws() {
		Instant createdAt = Instant.parse("2024-05-01T00:00:00Z");

		assertThatThrownBy(() -> new CacheEntry("key", List.of(), null, createdAt, createdAt.minusSeconds(1)))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("캐시 적중률은 요청이 없으면 0")
	void cacheStats_hitRate() {
		assertThat(CacheStats.empty().hitRatePercent()).isZero();
		assertThat(new CacheStats(3, 1, 2, 2000, 0).hitRatePercent()).isEqualTo(75.0);
	}
}
