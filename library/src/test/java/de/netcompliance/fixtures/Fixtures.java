package de.netcompliance.fixtures;

import de.netcompliance.core.model.Check;
import de.netcompliance.core.model.ComparisonOperator;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.Rule;
import de.netcompliance.core.model.Severity;
import de.netcompliance.core.model.VendorType;

import java.util.LinkedHashSet;
import java.util.List;

public final class Fixtures {

    public static Device device(final String id, final VendorType vendor) {
        return Device.builder()
                .id(id)
                .hostname(id + ".lab")
                .managementAddress("192.0.2.1")
                .vendor(vendor)
                .credentialRef("lab")
                .build();
    }

    public static Check check(final String name, final String path, final ComparisonOperator operator, final String expected) {
        return Check.builder()
                .name(name)
                .xpath(path)
                .path(path)
                .operator(operator)
                .expected(expected)
                .build();
    }

    public static Rule rule(final String id, final Check... checks) {
        return Rule.builder()
                .id(id)
                .name(id)
                .severity(Severity.HIGH)
                .vendors(new LinkedHashSet<>())
                .checks(List.of(checks))
                .build();
    }

    private Fixtures() {}
}
