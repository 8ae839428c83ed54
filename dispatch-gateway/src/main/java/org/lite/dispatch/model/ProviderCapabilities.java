package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProviderCapabilities {
    boolean vision;
    boolean toolUse;
    int maxContextTokens;
    int maxOutputTokens;
}
