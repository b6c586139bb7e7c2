package com.purchasingpower.contextgraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

    private int status;
    private String error;
    private String message;

    /** Offending field or node id, when known */
    private String subject;

    public static ApiError of(int status, String error, String message, String subject) {
        return ApiError.builder()
                .status(status)
                .error(error)
                .message(message)
                .subject(subject)
                .build();
    }
}
