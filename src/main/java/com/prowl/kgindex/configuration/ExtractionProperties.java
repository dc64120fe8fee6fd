package com.prowl.kgindex.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Remote LLM used for entity/relation extraction. Leaving {@code apiKey} empty disables it
 * and extraction runs on the pattern-based fallback only.
 */
@Data
public class ExtractionProperties {

    private String apiKey;

    @NotBlank
    private String baseUrl = "https://openrouter.ai/api/v1";

    @NotBlank
    private String model = "deepseek/deepseek-chat-v3.1:free";

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.1;

    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    public boolean isRemoteEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }
}
