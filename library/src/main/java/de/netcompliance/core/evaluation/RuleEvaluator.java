package de.netcompliance.core.evaluation;

import de.netcompliance.core.connector.FetchResult;
import de.netcompliance.core.connector.VendorConnector;
import de.netcompliance.core.exception.ConnectorException;
import de.netcompliance.core.model.Check;
import de.netcompliance.core.model.ComparisonOperator;
import de.netcompliance.core.model.Finding;
import de.netcompliance.core.model.FindingStatus;
import de.netcompliance.core.model.Rule;
import de.netcompliance.infrastructure.utils.CanonicalForm;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the checks of rules against one device session.
 * <p>
 * Checks run in declared order and produce exactly one finding each. A path that does not exist
 * fails the check. A malformed path or a request the device rejects is an error of that check
 * alone. A failure that leaves the session unusable ends evaluation for the device: the failing
 * check and every check not yet attempted are recorded as errors.
 */
@Slf4j
public class RuleEvaluator {

    private final CheckComparator comparator;

    public RuleEvaluator() {
        this(new CheckComparator());
    }

    public RuleEvaluator(final CheckComparator comparator) {
        this.comparator = comparator;
    }

    public List<Finding> evaluate(final Rule rule, final VendorConnector connector, final EvaluationContext context) {
        var findings = new ArrayList<Finding>();
        evaluate(List.of(rule), connector, context, findings::add);
        return findings;
    }

    /**
     * Evaluates the rules in order. Rules that do not apply to the device's vendor contribute nothing.
     */
    public void evaluate(final List<Rule> rules,
                         final VendorConnector connector,
                         final EvaluationContext context,
                         final FindingSink sink) {
        var applicable = rules.stream()
                .filter(rule -> rule.appliesTo(context.getDevice().getVendor()))
                .toList();
        for (int r = 0; r < applicable.size(); r++) {
            var rule = applicable.get(r);
            for (int c = 0; c < rule.getChecks().size(); c++) {
                var check = rule.getChecks().get(c);
                Finding finding;
                try {
                    finding = evaluateCheck(rule, check, connector, context);
                } catch (ConnectorException e) {
                    if (e.isSessionFailure()) {
                        log.warn("Transport failure on {} during check '{}' of rule '{}': {}",
                                context.getDevice().getHostname(), check.getName(), rule.getName(), e.getMessage());
                        if (!sink.offer(error(rule, check, context, "Transport failure: " + e.getMessage()))) return;
                        abortRemaining(applicable, r, c + 1, context, sink, e);
                        return;
                    }
                    log.warn("Device {} rejected check '{}' of rule '{}': {}",
                            context.getDevice().getHostname(), check.getName(), rule.getName(), e.getMessage());
                    finding = error(rule, check, context, "Fetch failed: " + e.getMessage());
                } catch (IllegalArgumentException e) {
                    log.warn("Check '{}' of rule '{}' has an unusable target: {}", check.getName(), rule.getName(), e.getMessage());
                    finding = error(rule, check, context, "Invalid target: " + e.getMessage());
                }
                if (!sink.offer(finding)) return;
            }
        }
    }

    private Finding evaluateCheck(final Rule rule,
                                  final Check check,
                                  final VendorConnector connector,
                                  final EvaluationContext context) {
        var protocol = context.getDevice().protocol();
        var path = check.targetPath(protocol);
        if (Objects.isNull(path) || path.isBlank()) {
            return error(rule, check, context, "Check defines no target for %s devices".formatted(protocol));
        }

        FetchResult result = connector.fetch(path, check.targetFilter(protocol));
        if (!result.isFound()) {
            var passed = check.getOperator() == ComparisonOperator.NOT_EXISTS;
            return finding(rule, check, context)
                    .status(passed ? FindingStatus.PASS : FindingStatus.FAIL)
                    .message(passed ? successMessage(check) : "Path not found: " + path)
                    .build();
        }

        var actual = result.getValue().orElse(null);
        var rawValue = CanonicalForm.of(actual);
        try {
            var passed = comparator.matches(check.getOperator(), actual, check.getExpected());
            return finding(rule, check, context)
                    .status(passed ? FindingStatus.PASS : FindingStatus.FAIL)
                    .rawValue(rawValue)
                    .message(passed ? successMessage(check) : failureMessage(check, rawValue))
                    .build();
        } catch (RuntimeException e) {
            return finding(rule, check, context)
                    .status(FindingStatus.ERROR)
                    .rawValue(rawValue)
                    .message("Comparison failed: " + e.getMessage())
                    .build();
        }
    }

    private void abortRemaining(final List<Rule> rules,
                                final int ruleIndex,
                                final int nextCheckIndex,
                                final EvaluationContext context,
                                final FindingSink sink,
                                final ConnectorException cause) {
        var message = "Not evaluated: transport failure on %s: %s"
                .formatted(context.getDevice().getHostname(), cause.getMessage());
        for (int r = ruleIndex; r < rules.size(); r++) {
            var rule = rules.get(r);
            int from = r == ruleIndex ? nextCheckIndex : 0;
            for (int c = from; c < rule.getChecks().size(); c++) {
                if (!sink.offer(error(rule, rule.getChecks().get(c), context, message))) return;
            }
        }
    }

    private Finding error(final Rule rule, final Check check, final EvaluationContext context, final String message) {
        return finding(rule, check, context)
                .status(FindingStatus.ERROR)
                .message(message)
                .build();
    }

    private Finding.FindingBuilder finding(final Rule rule, final Check check, final EvaluationContext context) {
        return Finding.builder()
                .runId(context.getRunId())
                .deviceId(context.getDevice().getId())
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .checkName(check.getName())
                .severity(rule.getSeverity())
                .expected(check.getExpected())
                .timestamp(context.getClock().instant());
    }

    private String successMessage(final Check check) {
        return Objects.nonNull(check.getSuccessMessage()) ? check.getSuccessMessage() : "Check passed";
    }

    private String failureMessage(final Check check, final String rawValue) {
        if (Objects.nonNull(check.getErrorMessage())) return check.getErrorMessage();
        return "Expected value to %s '%s' but was '%s'".formatted(
                check.getOperator().getValue(), Objects.toString(check.getExpected(), ""), rawValue);
    }
}
