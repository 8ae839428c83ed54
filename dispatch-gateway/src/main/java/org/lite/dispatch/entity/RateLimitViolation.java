package org.lite.dispatch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.enums.ScopeType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "rate_limit_violations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@CompoundIndex(name = "scope_key_timestamp_idx", def = "{'scope': 1, 'key': 1, 'timestamp': -1}")
public class RateLimitViolation {
    @Id
    private String id;
    private ScopeType scope;
    private String key;
    private String configName;
    private long requested;
    private double available;
    private long limit;
    private long retryAfterMs;
    private long timestamp;
}
