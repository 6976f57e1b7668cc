package de.netcompliance.core.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.netcompliance.core.model.ComparisonOperator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuditPayload implements StepPayload {
    private Compare compare;
    @Builder.Default
    private ComparisonOperator operator = ComparisonOperator.EQUALS;
    @Builder.Default
    private List<String> fields = new ArrayList<>();
    @Builder.Default
    @JsonProperty("pass_threshold")
    private double passThreshold = 100d;
    @JsonProperty("fail_on_mismatch")
    private boolean failOnMismatch;

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Compare {
        private Object expected;
        private Object actual;
    }
}
