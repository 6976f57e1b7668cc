package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Rule {
    private String id;
    private String name;
    private String description;
    @Builder.Default
    private Severity severity = Severity.MEDIUM;
    // empty means every vendor
    @Builder.Default
    private Set<VendorType> vendors = new LinkedHashSet<>();
    @Builder.Default
    private boolean enabled = true;
    @Builder.Default
    private List<Check> checks = new ArrayList<>();

    public boolean appliesTo(final VendorType vendor) {
        return Objects.isNull(vendors) || vendors.isEmpty() || vendors.contains(vendor);
    }
}
