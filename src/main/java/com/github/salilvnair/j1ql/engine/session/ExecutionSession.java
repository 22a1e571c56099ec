package com.github.salilvnair.j1ql.engine.session;

import com.github.salilvnair.j1ql.engine.error.StructuredError;
import com.github.salilvnair.j1ql.engine.model.ResultPage;
import com.github.salilvnair.j1ql.engine.normalize.NormalizedItem;
import com.github.salilvnair.j1ql.engine.transport.CancellationToken;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of a single execution. Never shared between executions.
 */
@Slf4j
@Getter
public class ExecutionSession {

    private final String query;
    private final boolean explicitLimit;
    private final boolean includeDeleted;
    private final CancellationToken cancellationToken;
    private final List<NormalizedItem> accumulated = new ArrayList<>();

    private ExecutionState state = ExecutionState.SUBMITTING;
    @Setter
    private String cursor;
    @Setter
    private String downloadUrl;
    @Setter
    private ResultPage currentPage;
    @Setter
    private boolean hasMore;
    private int pageCount;
    private int pollCount;
    private StructuredError error;

    public ExecutionSession(String query, boolean explicitLimit, boolean includeDeleted, CancellationToken cancellationToken) {
        this.query = query;
        this.explicitLimit = explicitLimit;
        this.includeDeleted = includeDeleted;
        this.cancellationToken = cancellationToken;
    }

    public void transitionTo(ExecutionState next) {
        log.debug("J1QL execution {} -> {} page={} polls={}", state, next, pageCount, pollCount);
        this.state = next;
    }

    public void fail(StructuredError structuredError) {
        this.error = structuredError;
        this.accumulated.clear();
        transitionTo(ExecutionState.FAILED);
    }

    public void appendPage(List<NormalizedItem> items) {
        accumulated.addAll(items);
        pageCount++;
    }

    public void recordPoll() {
        pollCount++;
    }

    public void startPolling(String url) {
        this.downloadUrl = url;
        this.currentPage = null;
        transitionTo(ExecutionState.POLLING);
    }
}
