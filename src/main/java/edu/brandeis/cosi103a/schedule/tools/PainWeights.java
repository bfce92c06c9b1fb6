package edu.brandeis.cosi103a.schedule.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Multiplier per {@link PainMetric}. Only metrics with a positive weight count toward a
 * schedule's score.
 */
public final class PainWeights {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EnumMap<PainMetric, Double> weights;

    private PainWeights(EnumMap<PainMetric, Double> weights) {
        this.weights = weights;
    }

    public static PainWeights defaults() {
        EnumMap<PainMetric, Double> weights = new EnumMap<>(PainMetric.class);
        for (PainMetric metric : PainMetric.values()) {
            weights.put(metric, metric.defaultWeight());
        }
        return new PainWeights(weights);
    }

    /**
     * Defaults overridden by the given keys.
     *
     * @throws IllegalArgumentException for an unknown metric key or a negative weight
     */
    public static PainWeights of(Map<String, Double> overrides) {
        EnumMap<PainMetric, Double> weights = new EnumMap<>(defaults().weights);
        overrides.forEach((key, value) -> {
            if (value == null || value < 0) {
                throw new IllegalArgumentException("Weight for " + key + " must be a non-negative number");
            }
            weights.put(PainMetric.fromKey(key), value);
        });
        return new PainWeights(weights);
    }

    /** Reads a JSON object of metric key to weight. */
    public static PainWeights load(Path file) throws IOException {
        Map<String, Double> overrides = MAPPER.readValue(file.toFile(), new TypeReference<Map<String, Double>>() { });
        return of(overrides);
    }

    public double weight(PainMetric metric) {
        return weights.get(metric);
    }

    public boolean isActive(PainMetric metric) {
        return weight(metric) > 0;
    }

    /** Active weights by key, in metric order. */
    public Map<String, Double> active() {
        Map<String, Double> active = new LinkedHashMap<>();
        weights.forEach((metric, weight) -> {
            if (weight > 0) {
                active.put(metric.key(), weight);
            }
        });
        return active;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(active());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize weights", e);
        }
    }
}
