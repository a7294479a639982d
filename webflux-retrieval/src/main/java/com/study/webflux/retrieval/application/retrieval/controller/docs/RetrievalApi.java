package com.study.webflux.retrieval.application.retrieval.controller.docs;

import com.study.webflux.retrieval.application.retrieval.dto.AdapterReconfigureRequest;
import com.study.webflux.retrieval.application.retrieval.dto.CacheInvalidationResponse;
import com.study.webflux.retrieval.application.retrieval.dto.PatternSearchRequest;
import com.study.webflux.retrieval.application.retrieval.dto.ReadinessResponse;
import com.study.webflux.retrieval.application.retrieval.dto.RetrievalSearchRequest;
import com.study.webflux.retrieval.application.retrieval.dto.RetrievalSearchResponse;
import com.study.webflux.retrieval.application.retrieval.dto.ServiceHealthResponse;
import com.study.webflux.retrieval.domain.retrieval.model.AdapterStatistics;
import com.study.webflux.retrieval.domain.retrieval.model.CacheStatsReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

@Tag(
	name = "근거 검색 API",
	description = "문서, 증상 패턴, 플레이북을 동시에 검색하고 순위를 매긴 근거를 반환합니다"
)
public interface RetrievalApi {

	@Operation(
		summary = "통합 근거 검색",
		description = "활성화된 소스를 동시에 검색하고 하이브리드 정렬, 임계값 필터, 결과 수 제한을 적용합니다"
	)
	@ApiResponse(responseCode = "200", description = "검색 성공")
	@ApiResponse(responseCode = "400", description = "질의가 비었거나 범위를 벗어난 요청")
	Mono<RetrievalSearchResponse> search(@Valid RetrievalSearchRequest request);

	@Operation(
		summary = "증상 패턴 검색",
		description = "증상 목록을 패턴 테이블에서만 검색합니다. 최신성 편향은 적용하지 않습니다"
	)
	@ApiResponse(responseCode = "200", description = "검색 성공")
	@ApiResponse(responseCode = "400", description = "증상이 비어 있음")
	Mono<RetrievalSearchResponse> searchPatterns(@Valid PatternSearchRequest request);

	@Operation(
		summary = "캐시 무효화",
		description = "sourceType이 없으면 전체, 있으면 해당 소스가 참여한 캐시 엔트리만 제거합니다"
	)
	Mono<CacheInvalidationResponse> invalidateCache(
		@Parameter(description = "document, pattern, playbook", example = "pattern") String sourceType);

	@Operation(summary = "만료된 캐시 엔트리 정리")
	Mono<Integer> cleanupCache();

	@Operation(summary = "캐시/어댑터/서비스 통계")
	Mono<CacheStatsReport> getCacheStats();

	@Operation(summary = "어댑터별 통계")
	Mono<AdapterStatistics> getAdapterStatistics();

	@Operation(
		summary = "어댑터 재구성",
		description = "어댑터 시간 예산을 바꾸고 기본 검색 소스를 제한합니다"
	)
	@ApiResponse(responseCode = "200", description = "재구성 성공")
	@ApiResponse(responseCode = "400", description = "알 수 없는 소스 또는 잘못된 시간 예산")
	Mono<Void> reconfigureAdapters(@Valid AdapterReconfigureRequest request);

	@Operation(summary = "SLO 기반 헬스 체크")
	Mono<ServiceHealthResponse> healthCheck();

	@Operation(summary = "요청 처리 준비 상태", description = "어댑터가 하나 이상 등록되어 있으면 준비 상태입니다")
	@ApiResponse(responseCode = "200", description = "준비됨")
	@ApiResponse(responseCode = "503", description = "등록된 어댑터 없음")
	Mono<ResponseEntity<ReadinessResponse>> readyCheck();
}
