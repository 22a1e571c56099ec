package com.github.salilvnair.j1ql.engine.model;

import com.github.salilvnair.j1ql.engine.transport.CancellationToken;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ExecutionOptions {

    @Builder.Default
    private CancellationToken cancellationToken = CancellationToken.create();
    /**
     * Null falls back to the client default.
     */
    private Boolean includeDeleted;

    public static ExecutionOptions defaults() {
        return ExecutionOptions.builder().build();
    }
}
