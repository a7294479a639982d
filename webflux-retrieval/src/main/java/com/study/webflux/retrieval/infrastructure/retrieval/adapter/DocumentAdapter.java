package com.study.webflux.retrieval.infrastructure.retrieval.adapter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.QueryContext;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import com.study.webflux.retrieval.domain.retrieval.model.StoredDocument;
import com.study.webflux.retrieval.domain.retrieval.port.DocumentIndex;
import com.study.webflux.retrieval.domain.retrieval.port.VectorDocumentStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 문서/런북 저장소 검색 어댑터입니다.
 *
 * <p>
 * 벡터 저장소 → 키워드 문서 인덱스 → 내장 시드 문서 순서로 시도하며, 앞 단계가 없거나 비어 있으면 다음
 * 단계로 넘어갑니다. 확장 토픽에 걸린 질의는 확장어마다 벡터 검색을 수행하고 문서 id별 최고 점수만
 * 남깁니다.
 */
public class DocumentAdapter extends AbstractKnowledgeAdapter {

	static final double DEFAULT_DOCUMENT_SCORE = 0.85;
	static final double TROUBLESHOOTING_QUERY_WEIGHT = 1.2;
	static final double CONNECTIVITY_QUERY_WEIGHT = 1.3;
	static final double RECENT_BOOST = 0.2;
	static final double MODERATE_BOOST = 0.1;

	private static final Duration RECENT_AGE = Duration.ofDays(30);
	private static final Duration MODERATE_AGE = Duration.ofDays(90);
	private static final String DOCUMENT_TYPE_FILTER = "document_type";
	private static final String TAGS_FILTER = "tags";
	private static final List<String> TROUBLESHOOTING_TERMS = List.of("how to",
		"troubleshoot",
		"guide",
		"documentation");

	private final VectorDocumentStore vectorStore;
	private final DocumentIndex documentIndex;
	private final List<QueryExpansionTopic> expansionTopics;

	/**
	 * @param vectorStore
	 *            벡터 저장소. null이면 건너뜁니다
	 * @param documentIndex
	 *            키워드 문서 인덱스. null이면 건너뜁니다
	 */
	public DocumentAdapter(VectorDocumentStore vectorStore,
		DocumentIndex documentIndex,
		List<QueryExpansionTopic> expansionTopics,
		Duration timeout,
		Clock clock) {
		super(SourceType.DOCUMENT, timeout, clock);
		this.vectorStore = vectorStore;
		this.documentIndex = documentIndex;
		this.expansionTopics = expansionTopics == null ? List.of() : List.copyOf(expansionTopics);
		log.info("DocumentAdapter initialized: vectorStore={}, documentIndex={}, expansionTopics={}",
			vectorStore != null,
			documentIndex != null,
			this.expansionTopics.size());
	}

	@Override
	protected Mono<List<Evidence>> doSearch(String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters) {
		return searchVectorStore(query, maxResults).map(documents -> toEvidence(documents, "semantic"))
			.filter(evidence -> !evidence.isEmpty())
			.switchIfEmpty(Mono.defer(() -> searchDocumentIndex(query, maxResults, filters))
				.map(documents -> toEvidence(documents, "keyword"))
				.filter(evidence -> !evidence.isEmpty()))
			.switchIfEmpty(Mono.fromCallable(() -> toEvidence(
				DocumentSeeds.match(query, maxResults, clock.instant()), "seed")));
	}

	@Override
	public double scoreWeight(QueryContext queryContext) {
		if (queryContext.queryContainsAny(TROUBLESHOOTING_TERMS)) {
			return TROUBLESHOOTING_QUERY_WEIGHT;
		}
		if (QueryExpansionTopic.connectivity().matches(queryContext.query())) {
			return CONNECTIVITY_QUERY_WEIGHT;
		}
		return 1.0;
	}

	/** 질의 자체와 걸린 토픽의 확장어를 순서대로, 중복 없이 반환합니다. */
	List<String> expandedTerms(String query) {
		Set<String> terms = new LinkedHashSet<>();
		terms.add(query);
		expansionTopics.stream()
			.filter(topic -> topic.matches(query))
			.forEach(topic -> terms.addAll(topic.expansions()));
		return List.copyOf(terms);
	}

	double recencyBoost(Instant lastModified) {
		if (lastModified == null) {
			return 0.0;
		}
		Duration age = Duration.between(lastModified, clock.instant());
		if (age.compareTo(RECENT_AGE) < 0) {
			return RECENT_BOOST;
		}
		if (age.compareTo(MODERATE_AGE) < 0) {
			return MODERATE_BOOST;
		}
		return 0.0;
	}

	private Mono<List<StoredDocument>> searchVectorStore(String query, int maxResults) {
		if (vectorStore == null) {
			return Mono.empty();
		}
		return Flux.fromIterable(expandedTerms(query))
			.concatMap(term -> vectorStore.similaritySearch(term, maxResults)
				.onErrorResume(error -> {
					log.warn("Vector search failed for term '{}': {}", abbreviate(term), error.getMessage());
					return Mono.just(List.of());
				}))
			.collectList()
			.map(batches -> mergeByHighestScore(batches, maxResults))
			.onErrorResume(error -> {
				log.warn("Vector store unavailable, falling back to document index: {}",
					error.getMessage());
				return Mono.empty();
			});
	}

	private Mono<List<StoredDocument>> searchDocumentIndex(String query,
		int maxResults,
		Map<String, Object> filters) {
		if (documentIndex == null) {
			return Mono.empty();
		}
		Object documentType = filters.get(DOCUMENT_TYPE_FILTER);
		return documentIndex.search(query,
			documentType != null ? documentType.toString() : null,
			tagsFilter(filters.get(TAGS_FILTER)),
			maxResults)
			.map(documents -> documents.size() > maxResults
				? documents.subList(0, maxResults)
				: documents)
			.onErrorResume(error -> {
				log.warn("Document index search failed, falling back to seeds: {}", error.getMessage());
				return Mono.empty();
			});
	}

	static List<StoredDocument> mergeByHighestScore(List<List<StoredDocument>> batches, int maxResults) {
		Map<String, StoredDocument> merged = new LinkedHashMap<>();
		for (List<StoredDocument> batch : batches) {
			for (StoredDocument document : batch) {
				StoredDocument scored = document.score() != null
					? document
					: document.withScore(DEFAULT_DOCUMENT_SCORE);
				merged.merge(scored.id(), scored, (existing, candidate) -> candidate.score() > existing.score()
					? candidate
					: existing);
			}
		}
		List<StoredDocument> sorted = new ArrayList<>(merged.values());
		sorted.sort(Comparator.comparingDouble(StoredDocument::score).reversed());
		return sorted.size() > maxResults ? sorted.subList(0, maxResults) : sorted;
	}

	private List<Evidence> toEvidence(List<StoredDocument> documents, String searchType) {
		return documents.stream()
			.map(document -> toEvidence(document, searchType))
			.toList();
	}

	private Evidence toEvidence(StoredDocument document, String searchType) {
		double score = document.score() != null ? document.score() : DEFAULT_DOCUMENT_SCORE;
		double confidence = "seed".equals(searchType)
			? Math.min(DocumentSeeds.MAX_SEED_CONFIDENCE, score)
			: score;

		Map<String, Object> provenance = new LinkedHashMap<>();
		provenance.put("adapter", name());
		provenance.put("version", ADAPTER_VERSION);
		provenance.put("search_type", searchType);
		provenance.put("document_type", document.documentType());

		return new Evidence("KB#" + document.id(),
			SourceType.DOCUMENT,
			document.content(),
			score,
			document.url(),
			document.lastModified() != null ? document.lastModified() : clock.instant(),
			provenance,
			null,
			confidence,
			recencyBoost(document.lastModified()));
	}

	private static List<String> tagsFilter(Object value) {
		if (value == null) {
			return List.of();
		}
		if (value instanceof Collection) {
			return ((Collection<?>) value).stream().map(String::valueOf).toList();
		}
		return List.of(value.toString());
	}
}
