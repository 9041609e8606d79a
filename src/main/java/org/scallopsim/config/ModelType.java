package org.scallopsim.config;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The hydrodynamic models that can be selected with {@code scallop.model}.
 */
public enum ModelType {
    BOUNDARY_ELEMENT("boundary-element"),
    SLENDER_BODY("slender-body");

    private final String key;

    ModelType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * @param key The configuration value, case-insensitive.
     * @return the matching model type.
     * @throws IllegalArgumentException if no model has that key.
     */
    public static ModelType fromKey(String key) {
        for (ModelType type : values()) {
            if (type.key.equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown model '" + key + "', expected one of "
            + Arrays.stream(values()).map(ModelType::getKey).collect(Collectors.joining(", ")));
    }
}
