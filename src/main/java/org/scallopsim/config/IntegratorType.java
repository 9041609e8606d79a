package org.scallopsim.config;

import org.scallopsim.runtime.integration.AdamsBashforth2;
import org.scallopsim.runtime.integration.ExplicitEuler;
import org.scallopsim.runtime.integration.ITimeIntegrator;

import java.util.Arrays;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The time integrators that can be selected with {@code scallop.integrator}.
 */
public enum IntegratorType {
    EXPLICIT_EULER("explicit-euler", ExplicitEuler::new),
    ADAMS_BASHFORTH_2("adams-bashforth-2", AdamsBashforth2::new);

    private final String key;
    private final Supplier<ITimeIntegrator> factory;

    IntegratorType(String key, Supplier<ITimeIntegrator> factory) {
        this.key = key;
        this.factory = factory;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return a new integrator with no history.
     */
    public ITimeIntegrator create() {
        return factory.get();
    }

    /**
     * @param key The configuration value, case-insensitive.
     * @return the matching integrator type.
     * @throws IllegalArgumentException if no integrator has that key.
     */
    public static IntegratorType fromKey(String key) {
        for (IntegratorType type : values()) {
            if (type.key.equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown integrator '" + key + "', expected one of "
            + Arrays.stream(values()).map(IntegratorType::getKey).collect(Collectors.joining(", ")));
    }
}
