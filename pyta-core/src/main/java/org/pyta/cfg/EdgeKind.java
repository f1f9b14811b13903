package org.pyta.cfg;

/**
 * Kind of a control-flow edge.
 */
public enum EdgeKind {
    /** Sequential flow, or a jump such as {@code break}. */
    UNCONDITIONAL,
    /** Taken when a branch or loop condition holds. */
    TRUE_BRANCH,
    /** Taken when a branch or loop condition does not hold. */
    FALSE_BRANCH,
    /** From the end of a loop body, or a {@code continue}, back to the loop header. */
    LOOP_BACK,
    /** From a protected block to an exception handler or {@code finally} block. */
    EXCEPTION
}
