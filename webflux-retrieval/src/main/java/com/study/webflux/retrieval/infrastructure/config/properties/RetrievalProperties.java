package com.study.webflux.retrieval.infrastructure.config.properties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** {@code retrieval.*} 설정입니다. */
@Getter
@Setter
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {

	/** 헬스 체크 응답의 서비스 이름 */
	private String serviceName = "unified_retrieval_service";

	private String version = "1.0.0";

	/** 오케스트레이터가 어댑터 호출마다 적용하는 바깥 시간 예산 */
	private Duration adapterTimeout = Duration.ofSeconds(5);

	private Cache cache = new Cache();

	private Slo slo = new Slo();

	private Document document = new Document();

	private Seed seed = new Seed();

	/** 어댑터 이름(document, pattern, playbook)별 설정 */
	private Map<String, Adapter> adapters = new LinkedHashMap<>();

	public Adapter adapter(String name) {
		return adapters.getOrDefault(name, new Adapter());
	}

	/** 어댑터별 timeout이 없으면 공통 adapterTimeout을 사용합니다. */
	public Duration adapterTimeout(String name) {
		Duration timeout = adapter(name).getTimeout();
		return timeout != null ? timeout : adapterTimeout;
	}

	@Getter
	@Setter
	public static class Cache {
		private boolean enabled = true;
		private Duration ttl = Duration.ofHours(1);
		private Duration cleanupInterval = Duration.ofMinutes(5);
		private long entrySizeBytes = 1000;
	}

	@Getter
	@Setter
	public static class Slo {
		private long p95LatencyMs = 200;
		private double maxAdapterFailureRatePercent = 10.0;
		private double minCacheHitRatePercent = 30.0;
		private double adapterErrorRate = 0.1;
		private int latencyWindowSize = 1000;
	}

	@Getter
	@Setter
	public static class Adapter {
		private boolean enabled = true;
		private Duration timeout;
	}

	@Getter
	@Setter
	public static class Document {
		/** Spring AI VectorStore 사용 여부 */
		private boolean vectorStoreEnabled = false;

		/**
		 * 클래스패스 JSON 문서를 키워드 인덱스로 사용할지 여부. 끄면 저장소 없이 내장 시드 문서만 사용합니다.
		 */
		private boolean indexEnabled = false;

		private List<ExpansionTopic> expansionTopics = new ArrayList<>();
	}

	@Getter
	@Setter
	public static class ExpansionTopic {
		private String name;
		private List<String> triggers = new ArrayList<>();
		private List<String> expansions = new ArrayList<>();
	}

	@Getter
	@Setter
	public static class Seed {
		private String patterns = "seed/patterns.json";
		private String playbooks = "seed/playbooks.json";
		private String documents = "seed/documents.json";
	}
}
