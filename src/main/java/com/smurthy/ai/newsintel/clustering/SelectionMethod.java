package com.smurthy.ai.newsintel.clustering;

/**
 * How HDBSCAN picks flat clusters out of the condensed tree.
 */
public enum SelectionMethod {
    /** Excess of mass: the most stable clusters, favouring a few large topics. */
    EOM,
    /** The leaves of the condensed tree: many small, homogeneous topics. */
    LEAF
}
