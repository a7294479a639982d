package com.study.webflux.retrieval.application.retrieval.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalRequest;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import com.study.webflux.retrieval.fixture.EvidenceFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HybridRankerTest {

	private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

	private final HybridRanker ranker = new HybridRanker(Clock.fixed(NOW, ZoneOffset.UTC));

	private static Instant daysAgo(long days) {
		return NOW.minus(Duration.ofDays(days));
	}

	@Test
	@DisplayName("어댑터 가중치와 호출자 가중치를 곱한 뒤 최신성 가산점을 더한다")
	void rank_appliesWeightsAndBoost() {
		Evidence pattern = EvidenceFixture.withBoost("PATTERN#1", SourceType.PATTERN, 0.5, daysAgo(60), 0.1);
		RetrievalRequest request = RetrievalRequest.of("q")
			.withRecencyBias(false)
			.withSimilarityThreshold(0.0)
			.withSourceWeights(Map.of("pattern", 2.0));

		List<Evidence> ranked = ranker.rank(List.of(pattern), request, Map.of(SourceType.PATTERN, 1.3));

		assertThat(ranked.get(0).score()).isCloseTo(0.5 * 1.3 * 2.0 + 0.1, within(1e-9));
		assertThat(ranked.get(0).rank()).isEqualTo(1);
	}

	@Test
	@DisplayName("최종 점수는 1을 넘어도 재정규화하지 않는다")
	void rank_doesNotClamp() {
		Evidence evidence = EvidenceFixture.create("KB#1", SourceType.DOCUMENT, 0.9, daysAgo(1));
		RetrievalRequest request = RetrievalRequest.of("q");

		List<Evidence> ranked = ranker.rank(List.of(evidence), request, Map.of(SourceType.DOCUMENT, 1.3));

		assertThat(ranked.get(0).score()).isCloseTo(0.9 * 1.3 * 1.2, within(1e-9));
	}

	@Test
	@DisplayName("최신성 배율은 7일 1.2, 30일 1.1, 90일 1.0, 그 외 0.9")
	void recencyMultiplier_buckets() {
		assertThat(ranker.recencyMultiplier(EvidenceFixture.create("a", SourceType.DOCUMENT, 0.5, daysAgo(7))))
			.isEqualTo(1.2);
		assertThat(ranker.recencyMultiplier(EvidenceFixture.create("a", SourceType.DOCUMENT, 0.5, daysAgo(30))))
			.isEqualTo(1.1);
		assertThat(ranker.recencyMultiplier(EvidenceFixture.create("a", SourceType.DOCUMENT, 0.5, daysAgo(90))))
			.isEqualTo(1.0);
		assertThat(ranker.recencyMultiplier(EvidenceFixture.create("a", SourceType.DOCUMENT, 0.5, daysAgo(91))))
			.isEqualTo(0.9);
	}

	@Test
	@DisplayName("최신성 편향은 오래된 고득점 근거의 순위를 뒤집을 수 있다")
	void rank_recencyReorders() {
		Evidence old = EvidenceFixture.create("KB#old", SourceType.DOCUMENT, 0.6, daysAgo(365));
		Evidence fresh = EvidenceFixture.create("KB#fresh", SourceType.DOCUMENT, 0.5, daysAgo(1));

		List<Evidence> ranked = ranker.rank(List.of(old, fresh), RetrievalRequest.of("q"), Map.of());

		assertThat(ranked).extracting(Evidence::source).containsExactly("KB#fresh", "KB#old");
		assertThat(ranked).extracting(Evidence::rank).containsExactly(1, 2);
	}

	@Test
	@DisplayName("임계값 미만은 제외하고 남은 근거에 1부터 연속 순위를 매긴다")
	void rank_filtersByThreshold() {
		Evidence high = EvidenceFixture.create("A", SourceType.PATTERN, 0.8, daysAgo(60));
		Evidence low = EvidenceFixture.create("B", SourceType.PATTERN, 0.2, daysAgo(60));
		Evidence mid = EvidenceFixture.create("C", SourceType.PLAYBOOK, 0.5, daysAgo(60));

		List<Evidence> ranked = ranker.rank(List.of(high, low, mid), RetrievalRequest.of("q"), Map.of());

		assertThat(ranked).extracting(Evidence::source).containsExactly("A", "C");
		assertThat(ranked).extracting(Evidence::rank).containsExactly(1, 2);
		assertThat(ranked).allMatch(evidence -> evidence.score() >= 0.3);
	}

	@Test
	@DisplayName("동점은 입력 순서를 유지")
	void rank_stableForTies() {
		Evidence first = EvidenceFixture.create("first", SourceType.DOCUMENT, 0.5, daysAgo(60));
		Evidence second = EvidenceFixture.create("second", SourceType.PATTERN, 0.5, daysAgo(60));

		List<Evidence> ranked = ranker.rank(List.of(first, second), RetrievalRequest.of("q"), Map.of());

		assertThat(ranked).extracting(Evidence::source).containsExactly("first", "second");
	}
}
