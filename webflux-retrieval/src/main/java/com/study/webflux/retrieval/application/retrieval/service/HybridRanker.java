package com.study.webflux.retrieval.application.retrieval.service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.study.webflux.retrieval.domain.retrieval.model.Evidence;
import com.study.webflux.retrieval.domain.retrieval.model.RetrievalRequest;
import com.study.webflux.retrieval.domain.retrieval.model.SourceType;

/**
 * 어댑터 가중치, 호출자 가중치, 최신성 가산점/편향을 결합해 근거를 정렬합니다.
 *
 * <p>
 * 정렬은 안정 정렬이므로 동점 근거는 입력 순서(요청한 소스 순서, 어댑터 반환 순서)를 유지합니다.
 * 최종 점수는 [0, 1]로 재정규화하지 않습니다.
 */
public class HybridRanker {

	private static final Comparator<Evidence> BY_SCORE_DESC = Comparator.comparingDouble(Evidence::score)
		.reversed();

	private final Clock clock;

	public HybridRanker(Clock clock) {
		this.clock = clock;
	}

	/**
	 * 가중치 적용 → (선택) 최신성 편향 → 임계값 필터 순서로 처리하고 1부터 순위를 부여합니다.
	 *
	 * @param adapterWeights
	 *            질의 형태에 따른 어댑터별 가중치. 없으면 1.0
	 */
	public List<Evidence> rank(List<Evidence> candidates,
		RetrievalRequest request,
		Map<SourceType, Double> adapterWeights) {
		List<Evidence> ranked = applyWeights(candidates, request, adapterWeights);
		if (request.includeRecencyBias()) {
			ranked = applyRecencyBias(ranked);
		}
		List<Evidence> filtered = ranked.stream()
			.filter(evidence -> evidence.score() >= request.semanticSimilarityThreshold())
			.toList();
		return assignRanks(filtered);
	}

	List<Evidence> applyWeights(List<Evidence> candidates,
		RetrievalRequest request,
		Map<SourceType, Double> adapterWeights) {
		List<Evidence> weighted = new ArrayList<>(candidates.size());
		for (Evidence evidence : candidates) {
			double adapterWeight = adapterWeights.getOrDefault(evidence.sourceType(), 1.0);
			double callerWeight = request.sourceWeight(evidence.sourceType());
			double score = evidence.score() * adapterWeight * callerWeight;
			if (evidence.hasRecencyBoost()) {
				score += evidence.recencyBoost();
			}
			weighted.add(evidence.withScore(score));
		}
		weighted.sort(BY_SCORE_DESC);
		return assignRanks(weighted);
	}

	List<Evidence> applyRecencyBias(List<Evidence> evidence) {
		List<Evidence> biased = new ArrayList<>(evidence.size());
		for (Evidence item : evidence) {
			biased.add(item.withScore(item.score() * recencyMultiplier(item)));
		}
		biased.sort(BY_SCORE_DESC);
		return biased;
	}

	double recencyMultiplier(Evidence evidence) {
		long ageDays = Duration.between(evidence.timestamp(), clock.instant()).toDays();
		if (ageDays <= 7) {
			return 1.2;
		}
		if (ageDays <= 30) {
			return 1.1;
		}
		if (ageDays <= 90) {
			return 1.0;
		}
		return 0.9;
	}

	static List<Evidence> assignRanks(List<Evidence> ordered) {
		List<Evidence> ranked = new ArrayList<>(ordered.size());
		for (int i = 0; i < ordered.size(); i++) {
			ranked.add(ordered.get(i).withRank(i + 1));
		}
		return ranked;
	}
}
