package com.smurthy.ai.newsintel.clustering;

/**
 * An article that is labelled noise or scores as an outlier.
 *
 * @param noise true when the article carries the noise label, false when only its outlier score flagged it
 */
public record NoiseArticle(String id, double outlierScore, boolean noise) {
}
