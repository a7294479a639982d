package com.study.webflux.retrieval.infrastructure.retrieval.adapter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.QueryContext;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;
import com.study.webflux.retrieval.infrastructure.retrieval.seed.Playbook;
import reactor.core.publisher.Mono;

/** 절차형 플레이북 테이블을 검색하는 어댑터입니다. */
public class PlaybookAdapter extends AbstractKnowledgeAdapter {

	static final double TITLE_MATCH_SCORE = 0.4;
	static final double QUERY_KEYWORD_SCORE = 0.2;
	static final double CONTEXT_KEYWORD_SCORE = 0.1;
	static final double PLAYBOOK_CONFIDENCE = 0.9;
	static final double PLAYBOOK_RECENCY_BOOST = 0.05;
	static final double PROCEDURAL_QUERY_WEIGHT = 1.1;
	static final String PLAYBOOK_URL_PREFIX = "https://playbooks.example.com/";

	private static final int STEP_PREVIEW_SIZE = 3;
	private static final String CATEGORY_FILTER = "category";
	private static final List<String> PROCEDURAL_TERMS = List.of("how",
		"steps",
		"procedure",
		"process",
		"fix");

	private final List<Playbook> playbooks;

	public PlaybookAdapter(List<Playbook> playbooks, Duration timeout, Clock clock) {
		super(SourceType.PLAYBOOK, timeout, clock);
		this.playbooks = playbooks == null ? List.of() : List.copyOf(playbooks);
		log.info("PlaybookAdapter initialized with {} playbooks", this.playbooks.size());
	}

	@Override
	protected Mono<List<Evidence>> doSearch(String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters) {
		return Mono.fromCallable(() -> matchPlaybooks(query, context, maxResults, filters).stream()
			.map(this::toEvidence)
			.toList());
	}

	@Override
	public double scoreWeight(QueryContext queryContext) {
		return queryContext.queryContainsAny(PROCEDURAL_TERMS) ? PROCEDURAL_QUERY_WEIGHT : 1.0;
	}

	List<ScoredPlaybook> matchPlaybooks(String query,
		List<String> context,
		int maxResults,
		Map<String, Object> filters) {
		String queryLower = query == null ? "" : query.toLowerCase(Locale.ROOT);
		List<String> queryTokens = Arrays.stream(queryLower.split("\\s+"))
			.filter(token -> !token.isEmpty())
			.toList();
		List<String> contextLower = context.stream()
			.map(entry -> entry == null ? "" : entry.toLowerCase(Locale.ROOT))
			.toList();
		Object categoryFilter = filters.get(CATEGORY_FILTER);

		List<ScoredPlaybook> matched = new ArrayList<>();
		for (Playbook playbook : playbooks) {
			if (categoryFilter != null && !categoryFilter.toString().equals(playbook.category())) {
				continue;
			}

			double matchScore = 0.0;
			int keywordMatches = 0;

			String titleLower = playbook.title().toLowerCase(Locale.ROOT);
			if (queryTokens.stream().anyMatch(titleLower::contains)) {
				matchScore += TITLE_MATCH_SCORE;
				keywordMatches++;
			}

			for (String keyword : playbook.keywords()) {
				String keywordLower = keyword.toLowerCase(Locale.ROOT);
				if (queryLower.contains(keywordLower)) {
					matchScore += QUERY_KEYWORD_SCORE;
					keywordMatches++;
				}
				for (String entry : contextLower) {
					if (entry.contains(keywordLower)) {
						matchScore += CONTEXT_KEYWORD_SCORE;
						keywordMatches++;
						break;
					}
				}
			}

			if (keywordMatches > 0) {
				matched.add(new ScoredPlaybook(playbook, matchScore));
			}
		}

		matched.sort(Comparator.comparingDouble(ScoredPlaybook::score).reversed());
		return matched.size() > maxResults ? matched.subList(0, maxResults) : matched;
	}

	private Evidence toEvidence(ScoredPlaybook scored) {
		Playbook playbook = scored.playbook();
		List<String> steps = playbook.steps();
		String stepsPreview = String.join("; ",
			steps.subList(0, Math.min(STEP_PREVIEW_SIZE, steps.size())));
		if (steps.size() > STEP_PREVIEW_SIZE) {
			stepsPreview += "; ... (" + steps.size() + " total steps)";
		}

		Map<String, Object> provenance = new LinkedHashMap<>();
		provenance.put("adapter", name());
		provenance.put("version", ADAPTER_VERSION);
		provenance.put("playbook_id", playbook.id());
		provenance.put("category", playbook.category());
		provenance.put("difficulty", playbook.difficulty());
		provenance.put("estimated_time", playbook.estimatedTime());

		return new Evidence("PLAYBOOK#" + playbook.id(),
			SourceType.PLAYBOOK,
			"Playbook: " + playbook.title() + " - Steps: " + stepsPreview,
			scored.score(),
			PLAYBOOK_URL_PREFIX + playbook.id(),
			clock.instant(),
			provenance,
			null,
			PLAYBOOK_CONFIDENCE,
			PLAYBOOK_RECENCY_BOOST);
	}

	record ScoredPlaybook(Playbook playbook, double score) {
	}
}
