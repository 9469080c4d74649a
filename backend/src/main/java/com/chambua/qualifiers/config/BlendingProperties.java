package com.chambua.qualifiers.config;

import com.chambua.qualifiers.model.Confederation;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tunable constants of the probability blend, bound from {@code qualifiers.blending.*}.
 *
 * <pre>
 * qualifiers.blending.form-weight=0.6
 * qualifiers.blending.historical-weight=0.4
 * qualifiers.blending.confederation-multipliers.OFC=0.7
 * qualifiers.blending.min-probability=0
 * qualifiers.blending.max-probability=100
 * </pre>
 *
 * The values have no documented derivation; only the order of the blend steps is fixed.
 */
@Component
@ConfigurationProperties(prefix = "qualifiers.blending")
public class BlendingProperties {

    private double formWeight = 0.6;
    private double historicalWeight = 0.4;
    private double minProbability = 0.0;
    private double maxProbability = 100.0;
    private String modelVersion = "form-historical-blend-v1";
    private Map<Confederation, Double> confederationMultipliers = defaultMultipliers();

    public static Map<Confederation, Double> defaultMultipliers() {
        Map<Confederation, Double> m = new EnumMap<>(Confederation.class);
        m.put(Confederation.UEFA, 1.0);
        m.put(Confederation.CONMEBOL, 1.0);
        m.put(Confederation.AFC, 0.95);
        m.put(Confederation.CAF, 0.95);
        m.put(Confederation.CONCACAF, 0.9);
        m.put(Confederation.OFC, 0.7);
        return m;
    }

    /** Missing confederations are neutral (1.0). */
    public double multiplierFor(Confederation confederation) {
        Double m = confederationMultipliers == null ? null : confederationMultipliers.get(confederation);
        return m == null ? 1.0 : m;
    }

    public double getFormWeight() { return formWeight; }
    public void setFormWeight(double formWeight) { this.formWeight = formWeight; }
    public double getHistoricalWeight() { return historicalWeight; }
    public void setHistoricalWeight(double historicalWeight) { this.historicalWeight = historicalWeight; }
    public double getMinProbability() { return minProbability; }
    public void setMinProbability(double minProbability) { this.minProbability = minProbability; }
    public double getMaxProbability() { return maxProbability; }
    public void setMaxProbability(double maxProbability) { this.maxProbability = maxProbability; }
    public String getModelVersion() { return modelVersion; }
    public void setModelVersion(String modelVersion) { this.modelVersion = modelVersion; }
    public Map<Confederation, Double> getConfederationMultipliers() { return confederationMultipliers; }
    public void setConfederationMultipliers(Map<Confederation, Double> confederationMultipliers) { this.confederationMultipliers = confederationMultipliers; }
}
