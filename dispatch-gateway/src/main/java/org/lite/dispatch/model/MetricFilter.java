package org.lite.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional scope for metric reads. A null field matches everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricFilter {
    private String provider;
    private String model;
    private String userId;

    public static MetricFilter none() {
        return new MetricFilter();
    }

    public static MetricFilter of(String provider, String model) {
        return MetricFilter.builder().provider(provider).model(model).build();
    }

    public boolean matches(String eventProvider, String eventModel, String eventUser) {
        return (provider == null || provider.equals(eventProvider))
                && (model == null || model.equals(eventModel))
                && (userId == null || userId.equals(eventUser));
    }
}
