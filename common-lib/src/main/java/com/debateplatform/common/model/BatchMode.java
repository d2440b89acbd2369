package com.debateplatform.common.model;

/** Scope of a batch cycle. */
public enum BatchMode {

    /** Every eligible pair lacking a valid cache entry. */
    FULL,
    /** Only pairs touched by the change feed since the last successful cycle. */
    INCREMENTAL
}
