package org.scallopsim.config;

import com.typesafe.config.Config;
import org.scallopsim.runtime.ScallopParameters;
import org.scallopsim.runtime.Simulation;
import org.scallopsim.runtime.SlenderBodyParameters;
import org.scallopsim.runtime.hydrodynamics.BoundaryElementModel;
import org.scallopsim.runtime.hydrodynamics.IHydrodynamicModel;
import org.scallopsim.runtime.hydrodynamics.SlenderBodyModel;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Typed view of the {@code scallop} configuration block.
 *
 * <pre>
 * scallop {
 *   model = "boundary-element"
 *   integrator = "explicit-euler"
 *   kinematics { amplitude = 1.0, tilt = 1.0, period = 1.0 }
 *   filament { length = 1.0, segments = 100 }
 *   time { step = 0.002, duration = 1.0 }
 *   boundary-element { regularization = 0.01, quadrature-order = 6 }
 *   slender-body { radius = 0.01, order = 101 }
 *   output { file = "scallop_results.txt" }
 * }
 * </pre>
 *
 * @param model          Selected hydrodynamic model.
 * @param integrator     Selected time integrator.
 * @param parameters     Stroke, filament, time and boundary-element parameters.
 * @param slenderBody    Slender-body parameters.
 * @param outputFile     Trajectory output file.
 */
public record ScallopConfiguration(ModelType model,
                                   IntegratorType integrator,
                                   ScallopParameters parameters,
                                   SlenderBodyParameters slenderBody,
                                   Path outputFile) {

    /** Root path of the simulation settings. */
    public static final String ROOT_PATH = "scallop";

    /**
     * Reads and validates the {@code scallop} block.
     *
     * @param config The resolved application configuration.
     * @return the typed configuration.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static ScallopConfiguration fromConfig(Config config) {
        final Config root = config.getConfig(ROOT_PATH);
        final ScallopParameters parameters = new ScallopParameters(
            root.getDouble("kinematics.amplitude"),
            root.getDouble("kinematics.tilt"),
            root.getInt("filament.segments"),
            root.getDouble("filament.length"),
            root.getDouble("time.step"),
            root.getDouble("time.duration"),
            root.getDouble("kinematics.period"),
            root.getDouble("boundary-element.regularization"),
            root.getInt("boundary-element.quadrature-order"));
        final SlenderBodyParameters slenderBody = new SlenderBodyParameters(
            root.getDouble("slender-body.radius"),
            root.getInt("slender-body.order"));
        return new ScallopConfiguration(
            ModelType.fromKey(root.getString("model")),
            IntegratorType.fromKey(root.getString("integrator")),
            parameters,
            slenderBody,
            Paths.get(root.getString("output.file")));
    }

    /**
     * @return a new instance of the selected hydrodynamic model.
     */
    public IHydrodynamicModel createModel() {
        return switch (model) {
            case BOUNDARY_ELEMENT -> new BoundaryElementModel(parameters);
            case SLENDER_BODY -> new SlenderBodyModel(parameters, slenderBody);
        };
    }

    /**
     * @return a new simulation at {@code t = 0} with the selected model and integrator.
     */
    public Simulation createSimulation() {
        return new Simulation(createModel(), integrator.create(), parameters.timeStep(), parameters.duration());
    }
}
