package net.findmypaper.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Accumulated rank-weight points per paper title across one or more retrieval queries.
 *
 * <p>Points only ever grow. The map also records the highest total a single title could
 * have reached (the sum of every recorded query's result bound), which is the denominator
 * used to normalise points into a score in {@code (0, 1]}.</p>
 *
 * <p>Iteration order is the order in which titles were first surfaced.</p>
 */
public final class ScoreMap {

    private final Map<String, Integer> points = new LinkedHashMap<>();
    private long maxAttainablePoints;
    private int queryCount;

    /**
     * Registers one query with result bound {@code resultBound}, whether or not it surfaced anything.
     */
    public void recordQuery(int resultBound) {
        if (resultBound < 1) {
            throw new IllegalArgumentException("resultBound must be positive, got " + resultBound);
        }
        maxAttainablePoints += resultBound;
        queryCount++;
    }

    /**
     * Adds {@code weight} points to {@code title}, initialising unseen titles.
     */
    public void add(String title, int weight) {
        if (title == null) {
            throw new IllegalArgumentException("title must not be null");
        }
        if (weight < 0) {
            throw new IllegalArgumentException("weight must not be negative, got " + weight);
        }
        points.merge(title, weight, Integer::sum);
    }

    public int pointsFor(String title) {
        return points.getOrDefault(title, 0);
    }

    /**
     * Normalised score for {@code title}: its points over {@link #maxAttainablePoints()}.
     */
    public double normalizedScore(String title) {
        if (maxAttainablePoints == 0) {
            return 0.0;
        }
        return pointsFor(title) / (double) maxAttainablePoints;
    }

    public Set<String> titles() {
        return Collections.unmodifiableSet(points.keySet());
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(points);
    }

    public long maxAttainablePoints() {
        return maxAttainablePoints;
    }

    public int queryCount() {
        return queryCount;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
