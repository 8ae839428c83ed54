package org.lite.dispatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String code;
    private String message;
    private Map<String, Object> details;

    public static ErrorResponse fromError(String code, String message, Map<String, Object> details) {
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .build();
    }

    public static ErrorResponse fromErrorCode(ErrorCode errorCode, String message, int status) {
        return fromError(errorCode.name(), message, Map.of("status", status));
    }
}
