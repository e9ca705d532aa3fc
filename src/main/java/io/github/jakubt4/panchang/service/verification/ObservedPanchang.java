package io.github.jakubt4.panchang.service.verification;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Element texts extracted from the secondary source. Fields that could not be found are absent.
 */
public record ObservedPanchang(Map<PanchangField, String> fields) {

    public ObservedPanchang {
        fields = Collections.unmodifiableMap(fields.isEmpty()
                ? new EnumMap<>(PanchangField.class)
                : new EnumMap<>(fields));
    }

    public Optional<String> get(final PanchangField field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
