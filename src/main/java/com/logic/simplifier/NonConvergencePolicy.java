package com.logic.simplifier;

/**
 * What to do when simplification hits the iteration cap without reaching a fixed point.
 * The last computed expression is the result in every case except FAIL.
 */
public enum NonConvergencePolicy {
    RETURN_LAST,
    WARN,
    FAIL
}
