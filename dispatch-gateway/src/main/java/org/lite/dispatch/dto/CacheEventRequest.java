package org.lite.dispatch.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.enums.CacheEventType;

/**
 * Response-cache activity reported by a caller that serves some requests without dispatching them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEventRequest {
    @NotNull
    private CacheEventType type;
    private String cacheKey;
    private String provider;
    private String model;
    private String userId;
    @PositiveOrZero
    private Double savedCost;
    @PositiveOrZero
    private Long savedTokens;
}
