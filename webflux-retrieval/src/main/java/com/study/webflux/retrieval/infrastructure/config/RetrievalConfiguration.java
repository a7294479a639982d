package com.study.webflux.retrieval.infrastructure.config;

import java.time.Clock;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.retrieval.application.retrieval.service.RetrievalOrchestrator;
import com.study.webflux.retrieval.domain.retrieval.port.DocumentIndex;
import com.study.webflux.retrieval.domain.retrieval.port.KnowledgeAdapter;
import com.study.webflux.retrieval.domain.retrieval.port.QuerySanitizer;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalCachePort;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalMetricsReporter;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalTracer;
import com.study.webflux.retrieval.domain.retrieval.port.VectorDocumentStore;
import com.study.webflux.retrieval.infrastructure.cache.InMemorySemanticCache;
import com.study.webflux.retrieval.infrastructure.config.properties.RetrievalProperties;
import com.study.webflux.retrieval.infrastructure.document.InMemoryDocumentIndex;
import com.study.webflux.retrieval.infrastructure.monitoring.MicrometerRetrievalMetricsReporter;
import com.study.webflux.retrieval.infrastructure.monitoring.MicrometerRetrievalTracer;
import com.study.webflux.retrieval.infrastructure.retrieval.adapter.DocumentAdapter;
import com.study.webflux.retrieval.infrastructure.retrieval.adapter.PatternAdapter;
import com.study.webflux.retrieval.infrastructure.retrieval.adapter.PlaybookAdapter;
import com.study.webflux.retrieval.infrastructure.retrieval.adapter.QueryExpansionTopic;
import com.study.webflux.retrieval.infrastructure.retrieval.seed.KnowledgeSeedLoader;
import com.study.webflux.retrieval.infrastructure.vectordb.SpringAiVectorDocumentStore;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 검색 엔진 구성입니다. 어댑터, 캐시, 문서 저장소를 {@code retrieval.*} 설정에 따라 조립합니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RetrievalProperties.class)
public class RetrievalConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public KnowledgeSeedLoader knowledgeSeedLoader(ObjectMapper objectMapper) {
		return new KnowledgeSeedLoader(objectMapper);
	}

	@Bean
	public RetrievalCachePort retrievalCache(RetrievalProperties properties,
		Clock clock,
		ObjectMapper objectMapper) {
		RetrievalProperties.Cache cache = properties.getCache();
		return new InMemorySemanticCache(cache.getTtl(), cache.getEntrySizeBytes(), clock, objectMapper);
	}

	@Bean
	public RetrievalTracer retrievalTracer(MeterRegistry meterRegistry) {
		return new MicrometerRetrievalTracer(meterRegistry);
	}

	@Bean
	public RetrievalMetricsReporter retrievalMetricsReporter(MeterRegistry meterRegistry,
		RetrievalProperties properties,
		RetrievalCachePort retrievalCache) {
		return new MicrometerRetrievalMetricsReporter(meterRegistry,
			properties.getCache().isEnabled() ? retrievalCache : null);
	}

	@Bean
	@Order(1)
	@ConditionalOnProperty(name = "retrieval.adapters.document.enabled", havingValue = "true", matchIfMissing = true)
	public DocumentAdapter documentAdapter(RetrievalProperties properties,
		KnowledgeSeedLoader seedLoader,
		ObjectProvider<VectorStore> vectorStoreProvider,
		Clock clock) {
		return new DocumentAdapter(vectorDocumentStore(properties, vectorStoreProvider),
			documentIndex(properties, seedLoader),
			expansionTopics(properties),
			properties.adapterTimeout("document"),
			clock);
	}

	@Bean
	@Order(2)
	@ConditionalOnProperty(name = "retrieval.adapters.pattern.enabled", havingValue = "true", matchIfMissing = true)
	public PatternAdapter patternAdapter(RetrievalProperties properties,
		KnowledgeSeedLoader seedLoader,
		Clock clock) {
		return new PatternAdapter(seedLoader.loadPatterns(properties.getSeed().getPatterns()),
			properties.adapterTimeout("pattern"),
			clock);
	}

	@Bean
	@Order(3)
	@ConditionalOnProperty(name = "retrieval.adapters.playbook.enabled", havingValue = "true", matchIfMissing = true)
	public PlaybookAdapter playbookAdapter(RetrievalProperties properties,
		KnowledgeSeedLoader seedLoader,
		Clock clock) {
		return new PlaybookAdapter(seedLoader.loadPlaybooks(properties.getSeed().getPlaybooks()),
			properties.adapterTimeout("playbook"),
			clock);
	}

	@Bean
	public RetrievalOrchestrator retrievalOrchestrator(ObjectProvider<KnowledgeAdapter> knowledgeAdapters,
		RetrievalCachePort retrievalCache,
		ObjectProvider<QuerySanitizer> sanitizerProvider,
		RetrievalTracer retrievalTracer,
		RetrievalMetricsReporter retrievalMetricsReporter,
		RetrievalProperties properties,
		Clock clock) {
		return new RetrievalOrchestrator(knowledgeAdapters.orderedStream().toList(),
			properties.getCache().isEnabled() ? retrievalCache : null,
			sanitizerProvider.getIfAvailable(QuerySanitizer::passthrough),
			retrievalTracer,
			retrievalMetricsReporter,
			properties,
			clock);
	}

	private VectorDocumentStore vectorDocumentStore(RetrievalProperties properties,
		ObjectProvider<VectorStore> vectorStoreProvider) {
		if (!properties.getDocument().isVectorStoreEnabled()) {
			return null;
		}
		VectorStore vectorStore = vectorStoreProvider.getIfAvailable();
		if (vectorStore == null) {
			log.warn("retrieval.document.vector-store-enabled=true 이지만 VectorStore 빈이 없습니다");
			return null;
		}
		return new SpringAiVectorDocumentStore(vectorStore);
	}

	private DocumentIndex documentIndex(RetrievalProperties properties, KnowledgeSeedLoader seedLoader) {
		if (!properties.getDocument().isIndexEnabled()) {
			return null;
		}
		return new InMemoryDocumentIndex(seedLoader.loadDocuments(properties.getSeed().getDocuments()));
	}

	private List<QueryExpansionTopic> expansionTopics(RetrievalProperties properties) {
		List<RetrievalProperties.ExpansionTopic> configured = properties.getDocument().getExpansionTopics();
		if (configured.isEmpty()) {
			return List.of(QueryExpansionTopic.connectivity());
		}
		return configured.stream()
			.map(topic -> new QueryExpansionTopic(topic.getName(), topic.getTriggers(), topic.getExpansions()))
			.toList();
	}
}
