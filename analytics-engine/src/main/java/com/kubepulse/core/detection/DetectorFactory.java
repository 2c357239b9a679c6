package com.kubepulse.core.detection;

import com.kubepulse.core.config.DetectorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from
 * {@link DetectorSettings}.
 *
 * <p>
 * This is the single point of extension when adding new engines: register
 * the engine name here and create the corresponding detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * @param settings detector settings; must not be {@code null}
     * @return a detector for the configured engine
     * @throws NullPointerException     if {@code settings} or its engine is
     *                                  {@code null}
     * @throws IllegalArgumentException if the engine is unknown
     */
    public static AnomalyDetector create(DetectorSettings settings) {
        return create(settings, Clock.systemUTC());
    }

    /**
     * @param settings detector settings; must not be {@code null}
     * @param clock    clock used to stamp predictions; must not be {@code null}
     * @return a detector for the configured engine
     * @throws NullPointerException     if an argument or the engine is {@code null}
     * @throws IllegalArgumentException if the engine is unknown
     */
    public static AnomalyDetector create(DetectorSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        Objects.requireNonNull(settings.getEngine(), "Detector engine must not be null");

        String engine = settings.getEngine().toLowerCase(Locale.ROOT);
        AnomalyDetector detector = switch (engine) {
            case StatisticalAnomalyDetector.ENGINE_NAME -> new StatisticalAnomalyDetector(settings, clock);
            default -> throw new IllegalArgumentException(
                    "Unknown detector engine: '" + settings.getEngine()
                            + "'. Supported engines: statistical");
        };
        LOG.info("Created {} anomaly detector: {}", engine, settings);
        return detector;
    }
}
