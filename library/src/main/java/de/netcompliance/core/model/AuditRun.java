package de.netcompliance.core.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Data
@Builder
public class AuditRun {
    private String id;
    private List<String> deviceIds;
    private List<String> ruleIds;
    private Instant startedAt;
    private volatile Instant finishedAt;
    private volatile AuditRunState state;
    private volatile Double complianceScore;
    private volatile String message;
    @Builder.Default
    private Map<String, DeviceAuditState> deviceStates = new ConcurrentHashMap<>();
    @Builder.Default
    private Map<String, Double> deviceScores = new ConcurrentHashMap<>();
    /**
     * Device id to rule id to whether every check of that rule passed on the device.
     */
    @Builder.Default
    private Map<String, Map<String, Boolean>> ruleResults = new ConcurrentHashMap<>();
    @Builder.Default
    private List<Finding> findings = new CopyOnWriteArrayList<>();

    public long getTotalChecks() {
        return findings.size();
    }

    public long getPassedChecks() {
        return findings.stream().filter(f -> f.getStatus() == FindingStatus.PASS).count();
    }

    /**
     * Fills {@link #complianceScore}, {@link #deviceScores} and {@link #ruleResults} from the
     * recorded findings.
     */
    public void computeScores() {
        complianceScore = score(findings);
        findings.stream()
                .collect(Collectors.groupingBy(Finding::getDeviceId))
                .forEach((deviceId, deviceFindings) -> {
                    var deviceScore = score(deviceFindings);
                    if (Objects.nonNull(deviceScore)) deviceScores.put(deviceId, deviceScore);
                    ruleResults.put(deviceId, deviceFindings.stream()
                            .collect(Collectors.groupingBy(Finding::getRuleId, LinkedHashMap::new,
                                    Collectors.collectingAndThen(Collectors.toList(), AuditRun::passed))));
                });
    }

    /**
     * A rule passes when all of its findings pass; an error counts as not passed.
     */
    public static boolean passed(final Collection<Finding> ruleFindings) {
        return !ruleFindings.isEmpty() && ruleFindings.stream().allMatch(f -> f.getStatus() == FindingStatus.PASS);
    }

    /**
     * 100 × passed / total, rounded to two decimals; {@code null} when there is nothing to score.
     */
    public static Double score(final Collection<Finding> findings) {
        if (findings.isEmpty()) return null;
        long passed = findings.stream().filter(f -> f.getStatus() == FindingStatus.PASS).count();
        return BigDecimal.valueOf(passed * 100L)
                .divide(BigDecimal.valueOf(findings.size()), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
