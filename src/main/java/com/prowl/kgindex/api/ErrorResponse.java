package com.prowl.kgindex.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned for every failed request.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private boolean success;
    private int status;
    private String error;
    private String message;

    public static ErrorResponse of(int status, String error, String message) {
        return ErrorResponse.builder()
            .success(false)
            .status(status)
            .error(error)
            .message(message)
            .build();
    }
}
