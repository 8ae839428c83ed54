package org.lite.dispatch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.enums.ScopeType;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitCheckRequest {
    @NotBlank
    private String key;
    @NotNull
    private ScopeType scope;
    @Positive
    @Builder.Default
    private long tokens = 1;
}
