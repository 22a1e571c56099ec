package com.github.salilvnair.j1ql.engine.exception;

import lombok.Getter;

@Getter
public class J1qlEngineException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;

    public J1qlEngineException(J1qlErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public J1qlEngineException(J1qlErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public J1qlEngineException(J1qlErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }
}
