package ppi.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Predictors ordered by importance, most influential first. Scores only order
 * predictors within one ranking; they are not comparable across rankings.
 */
public final class FeatureRanking {

    private final Map<String, Double> scores;

    /** @param importance predictor to score; equal scores keep the map's iteration order */
    public FeatureRanking(Map<String, Double> importance) {
        if (importance == null || importance.isEmpty()) throw new IllegalArgumentException("importance required");
        List<Map.Entry<String, Double>> entries = new ArrayList<>(importance.entrySet());
        entries.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));
        Map<String, Double> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : entries) sorted.put(e.getKey(), e.getValue());
        this.scores = Collections.unmodifiableMap(sorted);
    }

    public Map<String, Double> asMap() {
        return scores;
    }

    public List<String> order() {
        return new ArrayList<>(scores.keySet());
    }

    public double scoreOf(String predictor) {
        Double v = scores.get(predictor);
        if (v == null) throw new IllegalArgumentException("predictor '" + predictor + "' not ranked");
        return v;
    }

    /** The {@code count} highest-ranked predictors (all of them if fewer). */
    public List<String> top(int count) {
        if (count < 1) throw new IllegalArgumentException("count must be positive");
        List<String> all = order();
        return new ArrayList<>(all.subList(0, Math.min(count, all.size())));
    }

    @Override
    public String toString() {
        return scores.toString();
    }
}
