package com.study.webflux.retrieval.application.retrieval.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "요청 처리 준비 상태")
public record ReadinessResponse(boolean ready) {
}
