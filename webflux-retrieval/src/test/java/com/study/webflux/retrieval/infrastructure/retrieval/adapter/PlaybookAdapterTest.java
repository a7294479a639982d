package com.study.webflux.retrieval.infrastructure.retrieval.adapter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.QueryContext;
import com.study.webflux.retrieval.infrastructure.retrieval.seed.Playbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PlaybookAdapterTest {

	private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

	private PlaybookAdapter adapter;

	@BeforeEach
	void setUp() {
		List<Playbook> playbooks = List.of(
			new Playbook("playbook-1", "Database Performance Troubleshooting",
				List.of("database", "performance", "slow", "query"),
				List.of("Check pool", "Analyze slow log", "Review indexes", "Monitor resources"),
				"database", "intermediate", "30-45 minutes"),
			new Playbook("playbook-2", "Network Connectivity Issues",
				List.of("network", "connectivity", "connection", "firewall"),
				List.of("Ping", "Telnet"),
				"network", "beginner", "15-30 minutes"));
		adapter = new PlaybookAdapter(playbooks, Duration.ofSeconds(1), Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@Test
	@DisplayName("제목 일치 0.4점과 키워드 일치마다 0.2점")
	void matchPlaybooks_titleAndKeywords() {
		List<PlaybookAdapter.ScoredPlaybook> matched = adapter.matchPlaybooks("slow database", List.of(), 5,
			Map.of());

		assertThat(matched).hasSize(1);
		assertThat(matched.get(0).playbook().id()).isEqualTo("playbook-1");
		assertThat(matched.get(0).score()).isCloseTo(0.4 + 0.2 + 0.2, within(1e-9));
	}

	@Test
	@DisplayName("맥락 키워드는 키워드마다 0.1점")
	void matchPlaybooks_contextKeyword() {
		List<PlaybookAdapter.ScoredPlaybook> matched = adapter.matchPlaybooks("help",
			List.of("firewall changed yesterday"), 5, Map.of());

		assertThat(matched).hasSize(1);
		assertThat(matched.get(0).score()).isCloseTo(0.1, within(1e-9));
	}

	@Test
	@DisplayName("category 필터가 다르면 점수 계산 전에 제외")
	void matchPlaybooks_categoryFilter() {
		List<PlaybookAdapter.ScoredPlaybook> matched = adapter.matchPlaybooks("slow database connection",
			List.of(), 5, Map.of("category", "network"));

		assertThat(matched).extracting(scored -> scored.playbook().id()).containsExactly("playbook-2");
	}

	@Test
	@DisplayName("근거에 단계 미리보기, URL, 고정 신뢰도를 담는다")
	void search_buildsEvidence() {
		StepVerifier.create(adapter.search("slow database", List.of(), 5, Map.of()))
			.assertNext(evidence -> {
				assertThat(evidence).hasSize(1);
				assertThat(evidence.get(0).source()).isEqualTo("PLAYBOOK#playbook-1");
				assertThat(evidence.get(0).snippet()).isEqualTo(
					"Playbook: Database Performance Troubleshooting - Steps: Check pool; Analyze slow log; "
						+ "Review indexes; ... (4 total steps)");
				assertThat(evidence.get(0).url()).isEqualTo("https://playbooks.example.com/playbook-1");
				assertThat(evidence.get(0).confidence()).isEqualTo(0.9);
				assertThat(evidence.get(0).recencyBoost()).isEqualTo(0.05);
				assertThat(evidence.get(0).provenance()).containsEntry("difficulty", "intermediate")
					.containsEntry("estimated_time", "30-45 minutes");
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("절차형 질의에는 1.1 가중치")
	void scoreWeight_proceduralTerms() {
		assertThat(adapter.scoreWeight(QueryContext.of("How do I fix this", List.of()))).isEqualTo(1.1);
		assertThat(adapter.scoreWeight(QueryContext.of("database is slow", List.of()))).isEqualTo(1.0);
	}
}
