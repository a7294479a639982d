package com.study.webflux.retrieval.application.retrieval.controller;

import java.time.Duration;

import lombok.RequiredArgsConstructor;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.retrieval.application.retrieval.controller.docs.RetrievalApi;
import com.study.webflux.retrieval.application.retrieval.dto.AdapterReconfigureRequest;
import com.study.webflux.retrieval.application.retrieval.dto.CacheInvalidationResponse;
import com.study.webflux.retrieval.application.retrieval.dto.PatternSearchRequest;
import com.study.webflux.retrieval.application.retrieval.dto.ReadinessResponse;
import com.study.webflux.retrieval.application.retrieval.dto.RetrievalSearchRequest;
import com.study.webflux.retrieval.application.retrieval.dto.RetrievalSearchResponse;
import com.study.webflux.retrieval.application.retrieval.dto.ServiceHealthResponse;
import com.study.webflux.retrieval.domain.retrieval.exception.RetrievalServiceException;
import com.study.webflux.retrieval.domain.retrieval.exception.RetrievalValidationException;
import com.study.webflux.retrieval.domain.retrieval.model.AdapterStatistics;
import com.study.webflux.retrieval.domain.retrieval.model.CacheStatsReport;
import com.study.webflux.retrieval.domain.retrieval.port.RetrievalUseCase;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/retrieval")
public class RetrievalController implements RetrievalApi {

	private final RetrievalUseCase retrievalUseCase;

	@PostMapping("/search")
	public Mono<RetrievalSearchResponse> search(@Valid @RequestBody RetrievalSearchRequest request) {
		return retrievalUseCase.search(request.toDomain())
			.map(RetrievalSearchResponse::from)
			.onErrorMap(RetrievalController::toResponseStatus);
	}

	@PostMapping("/patterns")
	public Mono<RetrievalSearchResponse> searchPatterns(@Valid @RequestBody PatternSearchRequest request) {
		return retrievalUseCase.searchPatterns(request.symptoms(), request.context())
			.map(RetrievalSearchResponse::from)
			.onErrorMap(RetrievalController::toResponseStatus);
	}

	@DeleteMapping("/cache")
	public Mono<CacheInvalidationResponse> invalidateCache(
		@RequestParam(required = false) String sourceType) {
		return retrievalUseCase.invalidateCache(sourceType)
			.map(invalidated -> new CacheInvalidationResponse(invalidated, sourceType));
	}

	@PostMapping("/cache/cleanup")
	public Mono<Integer> cleanupCache() {
		return retrievalUseCase.cleanupCache();
	}

	@GetMapping("/cache/stats")
	public Mono<CacheStatsReport> getCacheStats() {
		return retrievalUseCase.getCacheStats();
	}

	@GetMapping("/adapters")
	public Mono<AdapterStatistics> getAdapterStatistics() {
		return retrievalUseCase.getAdapterStatistics();
	}

	@PutMapping("/adapters")
	public Mono<Void> reconfigureAdapters(@Valid @RequestBody AdapterReconfigureRequest request) {
		return retrievalUseCase.reconfigureAdapters(request.enabledSources(),
			Duration.ofMillis(request.timeoutMs()))
			.flatMap(applied -> applied
				? Mono.<Void>empty()
				: Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
					"Adapter reconfiguration rejected")));
	}

	@GetMapping("/health")
	public Mono<ServiceHealthResponse> healthCheck() {
		return retrievalUseCase.healthCheck().map(ServiceHealthResponse::from);
	}

	@GetMapping("/ready")
	public Mono<ResponseEntity<ReadinessResponse>> readyCheck() {
		return retrievalUseCase.readyCheck()
			.map(ready -> ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
				.body(new ReadinessResponse(ready)));
	}

	private static Throwable toResponseStatus(Throwable error) {
		if (error instanceof RetrievalValidationException) {
			return new ResponseStatusException(HttpStatus.BAD_REQUEST, error.getMessage(), error);
		}
		if (error instanceof RetrievalServiceException) {
			return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, error.getMessage(), error);
		}
		return error;
	}
}
