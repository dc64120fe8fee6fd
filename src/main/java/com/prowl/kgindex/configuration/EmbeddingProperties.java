package com.prowl.kgindex.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Remote embedding service. Leaving {@code apiKey} empty disables the remote strategy
 * and every vector comes from the hash fallback.
 */
@Data
public class EmbeddingProperties {

    private String apiKey;

    @NotBlank
    private String baseUrl = "https://openrouter.ai/api/v1";

    @NotBlank
    private String model = "text-embedding-3-small";

    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    public boolean isRemoteEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }
}
