package com.study.webflux.retrieval.infrastructure.retrieval.adapter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.QueryContext;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import com.study.webflux.retrieval.domain.retrieval.model.StoredDocument;
import com.study.webflux.retrieval.domain.retrieval.port.DocumentIndex;
import com.study.webflux.retrieval.domain.retrieval.port.VectorDocumentStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentAdapterTest {

	private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
	private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

	@Mock
	private VectorDocumentStore vectorStore;

	@Mock
	private DocumentIndex documentIndex;

	private DocumentAdapter adapter(VectorDocumentStore store, DocumentIndex index) {
		return new DocumentAdapter(store, index, List.of(QueryExpansionTopic.connectivity()), Duration.ofSeconds(2),
			CLOCK);
	}

	private static StoredDocument document(String id, Double score, Instant lastModified) {
		return new StoredDocument(id, "content " + id, score, "runbook", "https://kb.example.com/" + id, List.of(),
			lastModified);
	}

	@Test
	@DisplayName("저장소가 없고 토픽도 없으면 낮은 점수의 일반 문서 3건")
	void search_noStores_genericSeeds() {
		StepVerifier.create(adapter(null, null).search("zzz unknown thing", List.of(), 8, Map.of()))
			.assertNext(evidence -> {
				assertThat(evidence).extracting(e -> e.source())
					.containsExactly("KB#kb-doc-0", "KB#kb-doc-1", "KB#kb-doc-2");
				assertThat(evidence.get(0).score()).isEqualTo(0.2);
				assertThat(evidence.get(0).recencyBoost()).isZero();
				assertThat(evidence.get(0).timestamp()).isEqualTo(NOW);
				assertThat(evidence.get(0).provenance()).containsEntry("search_type", "seed");
				assertThat(evidence).allMatch(e -> e.sourceType() == SourceType.DOCUMENT);
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("토픽 시드는 7일 전 수정 문서로 최신성 가산점 0.2")
	void search_topicalSeed() {
		StepVerifier.create(adapter(null, null).search("How do we use a feature flag?", List.of(), 8, Map.of()))
			.assertNext(evidence -> {
				assertThat(evidence).hasSize(1);
				assertThat(evidence.get(0).source()).isEqualTo("KB#kb-feature-flags-101");
				assertThat(evidence.get(0).score()).isEqualTo(0.92);
				assertThat(evidence.get(0).confidence()).isEqualTo(0.92);
				assertThat(evidence.get(0).recencyBoost()).isEqualTo(0.2);
				assertThat(evidence.get(0).url()).isEqualTo("https://kb.example.com/feature-flags-101");
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("확장 토픽 질의는 확장어마다 벡터 검색 후 문서별 최고 점수만 남긴다")
	void search_vectorExpansion_mergesByMaxScore() {
		when(vectorStore.similaritySearch(anyString(), eq(5))).thenAnswer(invocation -> {
			String term = invocation.getArgument(0);
			if (term.equals("refused")) {
				return Mono.just(List.of(document("doc-a", 0.9, null)));
			}
			return Mono.just(List.of(document("doc-a", 0.5, null), document("doc-b", 0.6, null)));
		});

		StepVerifier.create(adapter(vectorStore, documentIndex).search("connection refused on db", List.of(), 5,
			Map.of()))
			.assertNext(evidence -> {
				assertThat(evidence).extracting(e -> e.source()).containsExactly("KB#doc-a", "KB#doc-b");
				assertThat(evidence.get(0).score()).isEqualTo(0.9);
				assertThat(evidence.get(0).provenance()).containsEntry("search_type", "semantic");
			})
			.verifyComplete();

		verify(vectorStore, times(5)).similaritySearch(anyString(), eq(5));
		verifyNoInteractions(documentIndex);
	}

	@Test
	@DisplayName("벡터 검색 결과가 없으면 문서 인덱스로 필터를 전달해 검색")
	void search_emptyVector_fallsBackToIndex() {
		when(vectorStore.similaritySearch(anyString(), anyInt())).thenReturn(Mono.just(List.of()));
		when(documentIndex.search("jvm heap", "runbook", List.of("memory"), 3))
			.thenReturn(Mono.just(List.of(document("runbook-jvm-heap", 0.5, NOW.minus(Duration.ofDays(45))))));

		StepVerifier.create(adapter(vectorStore, documentIndex).search("jvm heap", List.of(), 3,
			Map.of("document_type", "runbook", "tags", List.of("memory"))))
			.assertNext(evidence -> {
				assertThat(evidence).hasSize(1);
				assertThat(evidence.get(0).source()).isEqualTo("KB#runbook-jvm-heap");
				assertThat(evidence.get(0).recencyBoost()).isEqualTo(0.1);
				assertThat(evidence.get(0).provenance()).containsEntry("search_type", "keyword");
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("벡터 저장소 오류 시에도 인덱스로 폴백한다")
	void search_vectorError_fallsBackToIndex() {
		when(vectorStore.similaritySearch(anyString(), anyInt()))
			.thenReturn(Mono.error(new IllegalStateException("qdrant down")));
		when(documentIndex.search("jvm heap", null, List.of(), 3))
			.thenReturn(Mono.just(List.of(document("runbook-jvm-heap", 0.5, null))));

		StepVerifier.create(adapter(vectorStore, documentIndex).search("jvm heap", List.of(), 3, Map.of()))
			.assertNext(evidence -> assertThat(evidence).extracting(e -> e.source())
				.containsExactly("KB#runbook-jvm-heap"))
			.verifyComplete();
	}

	@Test
	@DisplayName("인덱스도 오류면 시드 문서로 폴백한다")
	void search_indexError_fallsBackToSeeds() {
		when(documentIndex.search(anyString(), isNull(), eq(List.of()), anyInt()))
			.thenReturn(Mono.error(new IllegalStateException("index broken")));

		StepVerifier.create(adapter(null, documentIndex).search("zzz", List.of(), 2, Map.of()))
			.assertNext(evidence -> assertThat(evidence).extracting(e -> e.source())
				.containsExactly("KB#kb-doc-0", "KB#kb-doc-1"))
			.verifyComplete();
	}

	@Test
	@DisplayName("확장어는 질의 뒤에 중복 없이 붙는다")
	void expandedTerms() {
		DocumentAdapter adapter = adapter(null, null);

		assertThat(adapter.expandedTerms("port closed"))
			.containsExactly("port closed", "connection refused", "cannot connect", "port", "refused");
		assertThat(adapter.expandedTerms("disk full")).containsExactly("disk full");
	}

	@Test
	@DisplayName("수정 30일 미만 0.2, 90일 미만 0.1, 그 외 0")
	void recencyBoost_thresholds() {
		DocumentAdapter adapter = adapter(null, null);

		assertThat(adapter.recencyBoost(NOW.minus(Duration.ofDays(29)))).isEqualTo(0.2);
		assertThat(adapter.recencyBoost(NOW.minus(Duration.ofDays(60)))).isEqualTo(0.1);
		assertThat(adapter.recencyBoost(NOW.minus(Duration.ofDays(120)))).isZero();
		assertThat(adapter.recencyBoost(null)).isZero();
	}

	@Test
	@DisplayName("점수가 없는 문서는 0.85로 간주하고 최대 개수로 자른다")
	void mergeByHighestScore_defaultsAndLimit() {
		List<StoredDocument> merged = DocumentAdapter.mergeByHighestScore(List.of(
			List.of(document("a", null, null), document("b", 0.4, null)),
			List.of(document("c", 0.95, null))), 2);

		assertThat(merged).extracting(StoredDocument::id).containsExactly("c", "a");
		assertThat(merged.get(1).score()).isEqualTo(0.85);
	}

	@Test
	@DisplayName("문서형 질의 1.2, 연결 장애 질의 1.3 가중치")
	void scoreWeight() {
		DocumentAdapter adapter = adapter(null, null);

		assertThat(adapter.scoreWeight(QueryContext.of("how to troubleshoot connection refused", List.of())))
			.isEqualTo(1.2);
		assertThat(adapter.scoreWeight(QueryContext.of("cannot connect to db", List.of()))).isEqualTo(1.3);
		assertThat(adapter.scoreWeight(QueryContext.of("disk full", List.of()))).isEqualTo(1.0);
	}
}
