package de.netcompliance.core.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiCallPayload implements StepPayload {
    @Builder.Default
    private String method = "GET";
    private String url;
    @Builder.Default
    private Map<String, Object> headers = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();
    private Object body;
    private Auth auth;

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Auth {
        // basic | bearer
        private String type;
        private String username;
        private String password;
        private String token;
    }
}
