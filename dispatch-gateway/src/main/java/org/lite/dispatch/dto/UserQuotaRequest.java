package org.lite.dispatch.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserQuotaRequest {
    @Positive
    private long maxRequests;
    @Positive
    private long windowMs;
    @PositiveOrZero
    private long burstSize;
    @Builder.Default
    private boolean enabled = true;
    /** Epoch millis after which the quota no longer applies. */
    private Long expiresAt;
}
