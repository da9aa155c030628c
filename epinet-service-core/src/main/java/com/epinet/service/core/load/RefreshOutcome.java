package com.epinet.service.core.load;

/** Result of a refresh request. Only {@link #STARTED} means a run was scheduled. */
public enum RefreshOutcome {
    STARTED,
    ALREADY_LOADING,
    THROTTLED,
    REJECTED
}
