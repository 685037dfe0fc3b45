package com.company.querylog;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@OpenAPIDefinition(
        info = @Info(
                title = "Query Log Service API",
                version = "1.0.0",
                description = "DNS query-log ingestion, running statistics and searchable query log"
        )
)
public class QueryLogServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryLogServiceApplication.class, args);
    }
}
