package com.smurthy.ai.newsintel.clustering;

/**
 * Thrown when cluster results are requested before {@link TopicClusterer#fitPredict}.
 */
public class ClustererNotFittedException extends IllegalStateException {

    public ClustererNotFittedException() {
        super("Clusterer has not been fitted; call fitPredict first");
    }
}
