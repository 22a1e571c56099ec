package com.github.salilvnair.j1ql.engine.session;

public enum ExecutionState {
    /** Posting the query (or the next cursor) and resolving the deferred url. */
    SUBMITTING,
    /** Fetching the deferred url until it stops reporting IN_PROGRESS. */
    POLLING,
    /** Accumulating the materialized page and choosing the next cursor. */
    PAGINATING,
    COMPLETED,
    FAILED
}
