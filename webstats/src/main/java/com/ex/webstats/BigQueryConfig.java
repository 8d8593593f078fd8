package com.ex.webstats;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;

import lombok.extern.slf4j.Slf4j;

// Credentials come from the environment (GOOGLE_APPLICATION_CREDENTIALS / workload identity)
@Slf4j
@Configuration
@EnableConfigurationProperties(WarehouseProps.class)
public class BigQueryConfig {

    @Bean
    BigQuery bigQuery(WarehouseProps props) {
        log.info("Creating BigQuery client: projectId={}, location={}", props.getProjectId(), props.getLocation());
        return BigQueryOptions.newBuilder()
                .setProjectId(props.getProjectId())
                .setLocation(props.getLocation())
                .build()
                .getService();
    }
}
