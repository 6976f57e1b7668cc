package de.netcompliance.infrastructure.validation;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class ValidationResult {

    private boolean invalid;
    private final List<Location> errorList = new ArrayList<>();
    private final List<Location> missingList = new ArrayList<>();
    private final List<Location> warningList = new ArrayList<>();

    public static ValidationResult empty() {
        return ValidationResult.builder().build();
    }

    public void merge(final ValidationResult otherResult) {
        if (otherResult.invalid) {
            setInvalid(true);
        }
        this.errorList.addAll(otherResult.errorList);
        this.missingList.addAll(otherResult.missingList);
        this.warningList.addAll(otherResult.warningList);
    }

    public void addError(final String location, final String message) {
        errorList.add(new Location(location, message));
        setInvalid(true);
    }

    public void addMissing(final String location, final String key) {
        missingList.add(new Location(location, key));
        setInvalid(true);
    }

    public void addWarning(final String location, final String message) {
        warningList.add(new Location(location, message));
    }

    /**
     * Errors first, then missing attributes; warnings are excluded.
     */
    public List<String> getMessages() {
        List<String> messages = new ArrayList<>();
        for (Location l : errorList) {
            messages.add(prefix(l) + l.detail);
        }
        for (Location l : missingList) {
            messages.add("Attribute " + prefix(l) + "'" + l.detail + "' is missing");
        }
        return messages;
    }

    public List<String> getWarnings() {
        List<String> messages = new ArrayList<>();
        for (Location l : warningList) {
            messages.add(prefix(l) + l.detail);
        }
        return messages;
    }

    private static String prefix(final Location l) {
        return l.location.isEmpty() ? "" : l.location + ": ";
    }

    protected record Location(String location, String detail) {}
}
