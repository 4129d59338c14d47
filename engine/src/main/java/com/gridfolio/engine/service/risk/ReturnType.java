package com.gridfolio.engine.service.risk;

public enum ReturnType {
    /** ln(p_t / p_(t-1)); needs strictly positive prices. */
    LOG,
    /** p_t / p_(t-1) - 1; needs non-zero prices. */
    SIMPLE,
    /** p_t - p_(t-1); defined for zero and negative prices. */
    DIFFERENCE
}
