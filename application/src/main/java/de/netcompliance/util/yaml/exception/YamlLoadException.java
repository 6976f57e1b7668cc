package de.netcompliance.util.yaml.exception;

public class YamlLoadException extends RuntimeException {

    public YamlLoadException(final Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
