package de.netcompliance.util.yaml;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import de.netcompliance.util.yaml.exception.YamlLoadException;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneOffset;
import java.util.TimeZone;

/**
 * YAML reading for the inventory, rule and workflow resources of the application.
 */
public class YamlUtil {

    private static final YAMLMapper mapper = configuredMapper();

    private YamlUtil() {
    }

    public static <T> T load(final String content, final TypeReference<T> typeReference) {
        try {
            return mapper.readValue(content, typeReference);
        } catch (IOException ioe) {
            throw new YamlLoadException(ioe);
        }
    }

    public static <T> T load(final InputStream content, final TypeReference<T> typeReference) {
        try (content) {
            return mapper.readValue(content, typeReference);
        } catch (IOException ioe) {
            throw new YamlLoadException(ioe);
        }
    }

    private static YAMLMapper configuredMapper() {
        YAMLMapper mapper = new YAMLMapper();

        mapper
                // deserialization; unknown device and rule attributes are tolerated
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.FAIL_ON_IGNORED_PROPERTIES)
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                // time zone handling
                .setTimeZone(TimeZone.getTimeZone(ZoneOffset.UTC))
                // YAML specific
                .enable(JsonParser.Feature.ALLOW_COMMENTS)
                .enable(JsonParser.Feature.ALLOW_YAML_COMMENTS)
                // modules
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule());

        return mapper;
    }
}
