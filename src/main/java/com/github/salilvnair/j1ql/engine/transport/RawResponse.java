package com.github.salilvnair.j1ql.engine.transport;

/**
 * Final outcome of one logical HTTP call, after retries.
 *
 * @param status   HTTP status of the last attempt
 * @param body     response body, may be empty
 * @param attempts number of attempts made
 */
public record RawResponse(int status, String body, int attempts) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
