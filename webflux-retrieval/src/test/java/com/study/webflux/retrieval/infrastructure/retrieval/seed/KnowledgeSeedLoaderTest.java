package com.study.webflux.retrieval.infrastructure.retrieval.seed;

import java.time.Instant;
import java.util.List;

import com.study.webflux.retrieval.domain.retrieval.model.StoredDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KnowledgeSeedLoaderTest {

	private final KnowledgeSeedLoader loader = new KnowledgeSeedLoader();

	@Test
	@DisplayName("기본 패턴 테이블을 읽는다")
	void loadPatterns() {
		List<SymptomPattern> patterns = loader.loadPatterns("seed/patterns.json");

		assertThat(patterns).extracting(SymptomPattern::id)
			.containsExactly("pattern-1", "pattern-2", "pattern-3");
		SymptomPattern connectivity = patterns.get(1);
		assertThat(connectivity.symptoms()).contains("connection refused");
		assertThat(connectivity.confidence()).isEqualTo(0.92);
		assertThat(connectivity.successRate()).isEqualTo(0.84);
	}

	@Test
	@DisplayName("기본 플레이북 테이블을 읽는다")
	void loadPlaybooks() {
		List<Playbook> playbooks = loader.loadPlaybooks("seed/playbooks.json");

		assertThat(playbooks).hasSize(8);
		assertThat(playbooks.get(0).estimatedTime()).isEqualTo("30-45 minutes");
		assertThat(playbooks).allMatch(playbook -> !playbook.steps().isEmpty());
	}

	@Test
	@DisplayName("문서 인덱스 시드를 읽고 수정 시각을 해석한다")
	void loadDocuments() {
		List<StoredDocument> documents = loader.loadDocuments("seed/documents.json");

		assertThat(documents).extracting(StoredDocument::id).contains("runbook-port-connectivity");
		assertThat(documents.get(0).lastModified()).isEqualTo(Instant.parse("2024-01-15T00:00:00Z"));
		assertThat(documents.get(0).score()).isNull();
		assertThat(documents.get(0).tags()).containsExactly("connectivity", "network");
	}

	@Test
	@DisplayName("리소스가 없으면 예외")
	void missingResource_throws() {
		assertThatThrownBy(() -> loader.loadPatterns("seed/missing.json"))
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("seed/missing.json");
	}
}
