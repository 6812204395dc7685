package com.bulge.bulgeCompositing.exception;

/**
 * Pipeline stage a failure is attributed to.
 */
public enum Stage {
    DECODE,
    RESOLVE,
    WARP,
    MASK,
    COMPOSITE,
    ENCODE
}
