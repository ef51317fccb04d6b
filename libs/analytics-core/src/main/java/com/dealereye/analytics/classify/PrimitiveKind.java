package com.dealereye.analytics.classify;

/** Kind of geometric event reported by the perception pipeline. */
public enum PrimitiveKind {
    LINE_CROSSING,
    ZONE_ENTRY,
    ZONE_EXIT
}
