package com.study.webflux.retrieval.application.retrieval.dto;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Schema(description = "어댑터 재구성 Request")
public record AdapterReconfigureRequest(
	@Schema(description = "기본 검색 소스. 비어 있으면 전체", example = "[\"pattern\", \"playbook\"]")
	List<String> enabledSources,

	@Schema(description = "어댑터 시간 예산(ms)", example = "3000")
	@NotNull @Positive Long timeoutMs
) {
}
