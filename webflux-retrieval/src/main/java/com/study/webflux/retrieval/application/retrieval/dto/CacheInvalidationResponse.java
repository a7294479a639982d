package com.study.webflux.retrieval.application.retrieval.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "캐시 무효화 결과")
public record CacheInvalidationResponse(
	@Schema(description = "무효화 성공 여부") boolean invalidated,
	@Schema(description = "대상 소스 유형. null이면 전체", example = "pattern") String sourceType
) {
}
