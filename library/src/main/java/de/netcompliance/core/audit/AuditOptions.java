package de.netcompliance.core.audit;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

@Data
@Builder
public class AuditOptions {
    // devices audited at the same time, and therefore open sessions
    private int concurrency;
    private Duration deviceTimeout;
    private int maxRetries;
    private Duration retryDelay;
    // skip devices whose next_check_due lies in the future
    private boolean respectBackoff;
    // finished runs kept for findRun
    private int retainedRuns;

    public static AuditOptions ofDefault() {
        return AuditOptions.builder()
                .concurrency(10)
                .deviceTimeout(Duration.ofSeconds(120))
                .maxRetries(2)
                .retryDelay(Duration.ofSeconds(2))
                .respectBackoff(false)
                .retainedRuns(100)
                .build();
    }
}
