package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * Registry entry for one provider/model pair. Entries are rebuilt on registry reload, never mutated.
 */
@Value
@Builder
public class ProviderCandidate {

    /** Deterministic ordering used to break ranking ties. */
    public static final Comparator<ProviderCandidate> BY_ID =
            Comparator.comparing(ProviderCandidate::getProviderId).thenComparing(ProviderCandidate::getModelId);

    String providerId;
    String modelId;
    ProviderCapabilities capabilities;
    ModelPricing pricing;

    public String key() {
        return providerId + "/" + modelId;
    }
}
