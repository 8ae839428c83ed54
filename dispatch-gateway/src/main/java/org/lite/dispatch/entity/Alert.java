package org.lite.dispatch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.enums.AlertSeverity;
import org.lite.dispatch.enums.AlertState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "alerts")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@CompoundIndexes({
    @CompoundIndex(name = "rule_state_idx", def = "{'ruleId': 1, 'state': 1}"),
    @CompoundIndex(name = "state_started_idx", def = "{'state': 1, 'startedAt': -1}")
})
public class Alert {
    @Id
    private String id;
    private String ruleId;
    private String ruleName;
    private String metric;
    private AlertState state;
    private AlertSeverity severity;
    private long startedAt;
    private Long resolvedAt;
    private Long acknowledgedAt;
    private String acknowledgedBy;
    private double currentValue;
    private double thresholdValue;
    private String provider;
    private String model;
    private String message;
    private long updatedAt;

    public static Alert fromRule(AlertRule rule, String id, double value, String message, long now) {
        return Alert.builder()
                .id(id)
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .metric(rule.getMetric())
                .state(AlertState.FIRING)
                .severity(rule.getSeverity())
                .startedAt(now)
                .currentValue(value)
                .thresholdValue(rule.getThreshold())
                .provider(rule.getProvider())
                .model(rule.getModel())
                .message(message)
                .updatedAt(now)
                .build();
    }
}
