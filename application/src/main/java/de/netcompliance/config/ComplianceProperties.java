package de.netcompliance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties("netcompliance")
public class ComplianceProperties {

    private Audit audit = new Audit();
    private Workflow workflow = new Workflow();
    private Resources resources = new Resources();
    private Transport transport = new Transport();
    // credential reference to username/password
    private Map<String, Credential> credentials = new LinkedHashMap<>();

    @Data
    public static class Audit {
        private int concurrency = 10;
        private Duration deviceTimeout = Duration.ofSeconds(120);
        private int maxRetries = 2;
        private Duration retryDelay = Duration.ofSeconds(2);
        private boolean respectBackoff = false;
        private int retainedRuns = 100;
    }

    @Data
    public static class Workflow {
        private int parallelism = 4;
        private int retainedExecutions = 100;
    }

    @Data
    public static class Resources {
        private String devices = "classpath:devices.yml";
        private String rules = "classpath:rules.yml";
        private String workflows = "classpath*:workflows/*.yml";
    }

    @Data
    public static class Transport {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private Duration leaseTimeout = Duration.ofSeconds(60);
        // root namespace of model-path (Nokia SR OS) configuration
        private String modelPathNamespace = "urn:nokia.com:sros:ns:yang:sr:conf";
    }

    @Data
    public static class Credential {
        private String username;
        private String password;

        @Override
        public String toString() {
            return "Credential(username=" + username + ")";
        }
    }
}
