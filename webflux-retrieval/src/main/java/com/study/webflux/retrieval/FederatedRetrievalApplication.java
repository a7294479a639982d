package com.study.webflux.retrieval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class FederatedRetrievalApplication {

	public static void main(String[] args) {
		SpringApplication.run(FederatedRetrievalApplication.class, args);
	}
}
