package com.github.salilvnair.j1ql.engine.core;

import com.github.salilvnair.j1ql.engine.model.ExecutionOptions;
import com.github.salilvnair.j1ql.engine.model.ExecutionResult;

/**
 * Runs one J1QL query to completion. Implementations never throw; every failure is returned in
 * {@link ExecutionResult#error()}.
 */
public interface J1qlQueryEngine {

    ExecutionResult execute(String query);

    ExecutionResult execute(String query, ExecutionOptions options);
}
