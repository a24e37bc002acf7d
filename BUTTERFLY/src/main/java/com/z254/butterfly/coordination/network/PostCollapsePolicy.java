package com.z254.butterfly.coordination.network;

/**
 * What the network wing does once collapse has been detected.
 */
public enum PostCollapsePolicy {
    /** Stop advancing generations; the collapsed state is held */
    FREEZE,
    /** Keep evolving past the threshold */
    CONTINUE
}
