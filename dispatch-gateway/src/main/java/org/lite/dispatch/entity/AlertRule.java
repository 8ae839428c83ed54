package org.lite.dispatch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.enums.AlertSeverity;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;

@Document(collection = "alert_rules")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {
    @Id
    private String id;
    private String name;
    private String description;
    private String metric;
    private String operator;
    private double threshold;
    private long durationSeconds;
    private String provider;
    private String model;
    @Builder.Default
    private AlertSeverity severity = AlertSeverity.WARNING;
    @Builder.Default
    private boolean enabled = true;
    private Map<String, String> labels;
    private Map<String, String> annotations;
    @Builder.Default
    private boolean valid = true;
    private String validationError;
    private long createdAt;
    private long updatedAt;
}
