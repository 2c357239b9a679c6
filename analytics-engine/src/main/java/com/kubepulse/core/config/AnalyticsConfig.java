package com.kubepulse.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the analytics YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * detector:
 *   threshold: 2.0
 *   predictionHorizon: 1h
 * slos:
 *   - name: api-availability
 *     sli: availability
 *     target: 99.9
 *     window: 720h
 *     budgetPolicy:
 *       - threshold: 50.0
 *         action: notify
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify the detector settings
 * and every SLO.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsConfig {

    private DetectorSettings detector = DetectorSettings.defaults();

    private List<SloDefinition> slos = new ArrayList<>();

    public DetectorSettings getDetector() {
        return detector;
    }

    /**
     * @param detector detector settings; {@code null} restores the defaults
     */
    public void setDetector(DetectorSettings detector) {
        this.detector = detector != null ? detector : DetectorSettings.defaults();
    }

    /**
     * @return unmodifiable list of SLO definitions
     */
    public List<SloDefinition> getSlos() {
        return Collections.unmodifiableList(slos);
    }

    /**
     * Set the SLO list (used by SnakeYAML during deserialization).
     *
     * @param slos the SLO definitions
     */
    public void setSlos(List<SloDefinition> slos) {
        this.slos = slos != null ? new ArrayList<>(slos) : new ArrayList<>();
    }

    /**
     * Validate the detector settings and every SLO definition. Collects all
     * errors and throws a single exception if anything is invalid.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            detector.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < slos.size(); i++) {
            SloDefinition slo = slos.get(i);
            if (slo == null) {
                errors.add("SLO at index " + i + " is null");
                continue;
            }
            try {
                slo.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (slo.getName() != null && !names.add(slo.getName())) {
                errors.add("Duplicate SLO name: '" + slo.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analytics configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "AnalyticsConfig{detector=" + detector + ", slos=" + slos + '}';
    }
}
