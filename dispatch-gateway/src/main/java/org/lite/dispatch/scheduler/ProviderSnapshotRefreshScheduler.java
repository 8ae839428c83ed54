package org.lite.dispatch.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.service.ProviderRegistry;
import org.lite.dispatch.service.ProviderSnapshotService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps provider snapshots warm so routing rarely waits on a cold computation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderSnapshotRefreshScheduler {

    private final ProviderRegistry providerRegistry;
    private final ProviderSnapshotService snapshotService;

    @Scheduled(fixedDelayString = "${dispatch.router.snapshot-refresh-interval-ms:30000}")
    public void refreshSnapshots() {
        for (ProviderCandidate candidate : providerRegistry.getCandidates()) {
            try {
                snapshotService.refresh(candidate);
            } catch (RuntimeException e) {
                log.warn("Snapshot refresh for {} failed: {}", candidate.key(), e.getMessage());
            }
        }
    }
}
