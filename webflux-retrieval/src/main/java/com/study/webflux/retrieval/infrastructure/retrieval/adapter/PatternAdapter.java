package com.study.webflux.retrieval.infrastructure.retrieval.adapter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.QueryContext;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import com.study.webflux.retrieval.infrastructure.retrieval.seed.SymptomPattern;
import reactor.core.publisher.Mono;

/**
 * 증상 → 원인 패턴 테이블을 검색하는 어댑터입니다.
 *
 * <p>
 * 질의에 포함된 증상 문구마다 0.3, 증상 문구를 포함한 첫 번째 맥락 항목마다 0.2를 더한 뒤
 * {@code confidence × (0.5 + 0.5 × successRate)}로 보정합니다.
 */
public class PatternAdapter extends AbstractKnowledgeAdapter {

	static final double QUERY_SYMPTOM_SCORE = 0.3;
	static final double CONTEXT_SYMPTOM_SCORE = 0.2;
	static final double PATTERN_RECENCY_BOOST = 0.1;
	static final double FAILURE_QUERY_WEIGHT = 1.3;

	private static final List<String> FAILURE_TERMS = List.of("error",
		"issue",
		"problem",
		"symptom",
		"fail");

	private final List<SymptomPattern> patterns;

	public PatternAdapter(List<SymptomPattern> patterns, Duration timeout, Clock clock) {
		super(SourceType.PATTERN, timeout, clock);
		this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
		log.info("PatternAdapter initialized with {} patterns", this.patterns.size());
	}

	@Override
	protected Mono<List<Evidence>> doSearch(String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters) {
		return Mono.fromCallable(() -> matchPatterns(query, context, maxResults).stream()
			.map(this::toEvidence)
			.toList());
	}

	@Override
	public double scoreWeight(QueryContext queryContext) {
		return queryContext.queryContainsAny(FAILURE_TERMS) ? FAILURE_QUERY_WEIGHT : 1.0;
	}

	List<ScoredPattern> matchPatterns(String query, List<String> context, int maxResults) {
		String queryLower = query == null ? "" : query.toLowerCase(Locale.ROOT);
		List<String> contextLower = context.stream()
			.map(entry -> entry == null ? "" : entry.toLowerCase(Locale.ROOT))
			.toList();

		List<ScoredPattern> matched = new ArrayList<>();
		for (SymptomPattern pattern : patterns) {
			double matchScore = 0.0;
			int symptomMatches = 0;

			for (String symptom : pattern.symptoms()) {
				String symptomLower = symptom.toLowerCase(Locale.ROOT);
				if (queryLower.contains(symptomLower)) {
					matchScore += QUERY_SYMPTOM_SCORE;
					symptomMatches++;
				}
				for (String entry : contextLower) {
					if (entry.contains(symptomLower)) {
						matchScore += CONTEXT_SYMPTOM_SCORE;
						symptomMatches++;
						break;
					}
				}
			}

			if (symptomMatches > 0) {
				matched.add(new ScoredPattern(pattern, matchScore * pattern.reliabilityFactor()));
			}
		}

		matched.sort(Comparator.comparingDouble(ScoredPattern::score).reversed());
		return matched.size() > maxResults ? matched.subList(0, maxResults) : matched;
	}

	private Evidence toEvidence(ScoredPattern scored) {
		SymptomPattern pattern = scored.pattern();
		String snippet = "Pattern: " + String.join(" | ", pattern.symptoms())
			+ " → Common causes: " + String.join(", ", pattern.causes());

		Map<String, Object> provenance = new LinkedHashMap<>();
		provenance.put("adapter", name());
		provenance.put("version", ADAPTER_VERSION);
		provenance.put("pattern_id", pattern.id());
		provenance.put("category", pattern.category());
		provenance.put("success_rate", pattern.successRate());

		return new Evidence("PATTERN#" + pattern.id(),
			SourceType.PATTERN,
			snippet,
			scored.score(),
			null,
			clock.instant(),
			provenance,
			null,
			pattern.confidence(),
			PATTERN_RECENCY_BOOST);
	}

	record ScoredPattern(SymptomPattern pattern, double score) {
	}
}
