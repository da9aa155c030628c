package com.epinet.service.core.load;

public enum RunMode {
    /** Rebuild only the active hour bucket. */
    CURRENT_HOUR,
    /** Recent chunk first, then historical chunks, then retention trimming. */
    FULL_RANGE
}
