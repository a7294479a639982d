package com.study.webflux.retrieval.infrastructure.config;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.retrieval.infrastructure.config.properties.RetrievalProperties;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;

/** 서비스 이름과 버전은 {@code retrieval.*} 설정을 따릅니다. */
@Configuration
public class OpenApiConfiguration {

	@Bean
	public OpenAPI retrievalOpenApi(RetrievalProperties properties) {
		return new OpenAPI()
			.info(new Info()
				.title(properties.getServiceName())
				.description("문서, 증상 패턴, 플레이북 근거를 통합 검색하고 TTL 캐시로 재사용하는 API")
				.version(properties.getVersion()))
			.tags(List.of(
				new Tag().name("근거 검색 API")
					.description("통합 검색, 캐시 관리, 어댑터 구성, 헬스/준비 상태")));
	}
}
