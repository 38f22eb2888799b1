package org.redfx.quantumlab.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Simulator settings. Defaults live in the field initializers, {@link #validate()}
 * normalizes and checks them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SimulatorConfig {

    private static final Logger LOG = LogManager.getLogger(SimulatorConfig.class);

    public static final String DEFAULT_RESOURCE = "quantumlab.json";

    public static final String ENGINE_LOCAL = "local";
    public static final String ENGINE_ND4J = "nd4j";

    /** {@code local} (closed-form kernels) or {@code nd4j} (dense operator matrices). */
    public String engine = ENGINE_LOCAL;

    /** Sampler seed; {@code null} seeds from local entropy. */
    public Long seed = null;

    public int defaultShots = 1024;
    public double probabilityEpsilon = 1e-10;
    public double normalizationTolerance = 1e-9;
    public Vqe vqe = new Vqe();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Vqe {
        public int maxEvaluations = 2000;
        public double initialSimplexSize = 0.5;
        public double relativeThreshold = 1e-10;
        public double absoluteThreshold = 1e-12;
        public long initialPointSeed = 42L;
    }

    public static SimulatorConfig defaults() {
        SimulatorConfig cfg = new SimulatorConfig();
        cfg.validate();
        return cfg;
    }

    public static SimulatorConfig load(Path file) throws IOException {
        String json = Files.readString(file);
        if (json.isBlank()) {
            LOG.warn("Config file {} is empty. Falling back to defaults.", file);
            return defaults();
        }
        SimulatorConfig cfg = new ObjectMapper().readValue(json, SimulatorConfig.class);
        cfg.validate();
        return cfg;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when it is absent.
     */
    public static SimulatorConfig loadDefault() {
        try (InputStream in = SimulatorConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LOG.warn("No {} on the classpath. Falling back to defaults.", DEFAULT_RESOURCE);
                return defaults();
            }
            SimulatorConfig cfg = new ObjectMapper().readValue(in, SimulatorConfig.class);
            cfg.validate();
            return cfg;
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    public SimulatorConfig validate() {
        engine = engine == null ? ENGINE_LOCAL : engine.trim().toLowerCase(Locale.ROOT);
        if (!ENGINE_LOCAL.equals(engine) && !ENGINE_ND4J.equals(engine)) {
            throw new IllegalArgumentException("engine must be '" + ENGINE_LOCAL + "' or '" + ENGINE_ND4J + "', got '" + engine + "'");
        }
        if (defaultShots <= 0) {
            throw new IllegalArgumentException("defaultShots must be >= 1, got " + defaultShots);
        }
        if (!(probabilityEpsilon >= 0 && probabilityEpsilon < 1)) {
            throw new IllegalArgumentException("probabilityEpsilon must be in [0, 1), got " + probabilityEpsilon);
        }
        if (!(normalizationTolerance > 0)) {
            throw new IllegalArgumentException("normalizationTolerance must be > 0, got " + normalizationTolerance);
        }
        if (vqe == null) {
            vqe = new Vqe();
        }
        if (vqe.maxEvaluations <= 0) {
            throw new IllegalArgumentException("vqe.maxEvaluations must be >= 1, got " + vqe.maxEvaluations);
        }
        if (!(vqe.initialSimplexSize > 0)) {
            throw new IllegalArgumentException("vqe.initialSimplexSize must be > 0, got " + vqe.initialSimplexSize);
        }
        if (!(vqe.relativeThreshold >= 0) || !(vqe.absoluteThreshold >= 0)) {
            throw new IllegalArgumentException("vqe.relativeThreshold and vqe.absoluteThreshold must be >= 0, got "
                    + vqe.relativeThreshold + " and " + vqe.absoluteThreshold);
        }
        if (vqe.relativeThreshold == 0 && vqe.absoluteThreshold == 0) {
            throw new IllegalArgumentException("at least one of vqe.relativeThreshold and vqe.absoluteThreshold must be > 0");
        }
        return this;
    }
}
