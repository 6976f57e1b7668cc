package de.netcompliance.core.connector;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

@Value
@Builder
public class Credentials {
    String username;
    @ToString.Exclude
    String password;
}
