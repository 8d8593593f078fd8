package com.ex.webstats;

import java.time.ZoneId;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "webstats.warehouse")
public class WarehouseProps {
    @NotBlank private String projectId;
    @NotBlank private String location = "europe-north1";
    @NotBlank private String dataset = "umami_views";
    @NotBlank private String timezone = "Europe/Oslo";

    // USD per TiB scanned
    @Positive private double pricePerTerabyte = 6.25;

    // LIMIT on the combined session scan
    @Positive private int batchRowCap = 100_000;

    // rows kept per chart after client-side aggregation
    @Positive private int aggregateRowCap = 1000;

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public String eventTable() {
        return "`" + projectId + "." + dataset + ".event`";
    }

    public String sessionTable() {
        return "`" + projectId + "." + dataset + ".session`";
    }
}
