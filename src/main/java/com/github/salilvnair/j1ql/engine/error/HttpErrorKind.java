package com.github.salilvnair.j1ql.engine.error;

public enum HttpErrorKind {
    UNAUTHORIZED,
    INTERNAL_SERVER_ERROR,
    GENERIC
}
