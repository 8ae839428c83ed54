package org.lite.dispatch.service;

import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.exception.ProviderRegistryException;
import org.lite.dispatch.model.ModelPricing;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.model.ProviderCapabilities;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Provider/model descriptors with capabilities and pricing. The candidate list is swapped as a
 * whole on reload so readers always see one consistent version.
 */
@Service
@Slf4j
public class ProviderRegistry {

    private volatile List<ProviderCandidate> candidates = List.of();
    private volatile List<String> loadErrors = List.of();

    public ProviderRegistry(DispatchProperties properties) {
        reload(properties.getProviders());
    }

    /**
     * Replaces the registry. Invalid entries are skipped and reported; returns the load errors.
     */
    public synchronized List<String> reload(List<DispatchProperties.ProviderEntry> entries) {
        List<ProviderCandidate> loaded = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (DispatchProperties.ProviderEntry entry : entries == null ? List.<DispatchProperties.ProviderEntry>of() : entries) {
            try {
                ProviderCandidate candidate = toCandidate(entry);
                if (!seen.add(candidate.key())) {
                    throw new ProviderRegistryException("Duplicate provider entry " + candidate.key());
                }
                loaded.add(candidate);
            } catch (ProviderRegistryException e) {
                log.error("Skipping provider entry: {}", e.getMessage());
                errors.add(e.getMessage());
            }
        }
        loaded.sort(ProviderCandidate.BY_ID);
        this.candidates = Collections.unmodifiableList(loaded);
        this.loadErrors = List.copyOf(errors);
        log.info("Provider registry loaded with {} candidates ({} rejected)", loaded.size(), errors.size());
        return this.loadErrors;
    }

    public List<ProviderCandidate> getCandidates() {
        return candidates;
    }

    public Optional<ProviderCandidate> find(String providerId, String modelId) {
        return candidates.stream()
                .filter(c -> c.getProviderId().equals(providerId) && c.getModelId().equals(modelId))
                .findFirst();
    }

    public Optional<ProviderCandidate> findByKey(String key) {
        return candidates.stream().filter(c -> c.key().equals(key)).findFirst();
    }

    public List<String> getLoadErrors() {
        return loadErrors;
    }

    private static ProviderCandidate toCandidate(DispatchProperties.ProviderEntry entry) {
        if (entry == null || isBlank(entry.getProviderId()) || isBlank(entry.getModelId())) {
            throw new ProviderRegistryException("Provider entry requires providerId and modelId");
        }
        // model ids may contain '/', provider ids may not, so "provider/model" keys stay unambiguous
        if (entry.getProviderId().indexOf('/') >= 0) {
            throw new ProviderRegistryException("Provider id must not contain '/': " + entry.getProviderId());
        }
        String key = entry.getProviderId() + "/" + entry.getModelId();
        if (entry.getInputPricePer1M() < 0 || entry.getOutputPricePer1M() < 0
                || Double.isNaN(entry.getInputPricePer1M()) || Double.isNaN(entry.getOutputPricePer1M())) {
            throw new ProviderRegistryException("Invalid pricing for " + key);
        }
        if (entry.getMaxContextTokens() <= 0 || entry.getMaxOutputTokens() <= 0) {
            throw new ProviderRegistryException("Token limits must be positive for " + key);
        }
        return ProviderCandidate.builder()
                .providerId(entry.getProviderId())
                .modelId(entry.getModelId())
                .capabilities(ProviderCapabilities.builder()
                        .vision(entry.isVision())
                        .toolUse(entry.isToolUse())
                        .maxContextTokens(entry.getMaxContextTokens())
                        .maxOutputTokens(entry.getMaxOutputTokens())
                        .build())
                .pricing(new ModelPricing(entry.getInputPricePer1M(), entry.getOutputPricePer1M()))
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
