package org.lite.dispatch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Custom per-user limit overriding the user scope configuration.
 */
@Document(collection = "user_quotas")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserQuota {
    @Id
    private String userId;
    private long maxRequests;
    private long windowMs;
    private long burstSize;
    @Builder.Default
    private boolean enabled = true;
    private Long expiresAt;
    private long createdAt;
    private long updatedAt;

    public boolean isActive(long now) {
        return enabled && (expiresAt == null || expiresAt > now);
    }
}
