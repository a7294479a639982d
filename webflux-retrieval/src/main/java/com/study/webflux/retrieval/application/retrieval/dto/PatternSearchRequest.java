package com.study.webflux.retrieval.application.retrieval.dto;

import java.util.List;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;

@Schema(description = "증상 패턴 검색 Request")
public record PatternSearchRequest(
	@Schema(description = "관찰된 증상", example = "[\"connection refused\", \"port closed\"]")
	@NotEmpty List<String> symptoms,

	@Schema(description = "부가 맥락. 값만 맥락 문자열로 사용됩니다", example = "{\"service\": \"payments\"}")
	Map<String, Object> context
) {
}
