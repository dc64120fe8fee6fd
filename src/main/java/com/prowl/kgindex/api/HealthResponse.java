package com.prowl.kgindex.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    public static final String SERVICE_NAME = "kg-index-service";

    private String status;
    private String storage;
    private Instant timestamp;
    private String service;

    public static HealthResponse up() {
        return HealthResponse.builder()
            .status("UP")
            .storage("connected")
            .timestamp(Instant.now())
            .service(SERVICE_NAME)
            .build();
    }

    public static HealthResponse down(String reason) {
        return HealthResponse.builder()
            .status("DOWN")
            .storage(reason)
            .timestamp(Instant.now())
            .service(SERVICE_NAME)
            .build();
    }
}
