package com.github.salilvnair.j1ql.engine.transport;

import java.util.Map;

/**
 * HTTP seam used by the query engine. Implementations apply their own retry policy for transient
 * statuses and return the last attempt's response instead of throwing for non-2xx statuses.
 */
public interface GraphQueryTransport {

    RawResponse post(String url, Map<String, String> headers, String body, CancellationToken token);

    RawResponse get(String url, Map<String, String> headers, CancellationToken token);
}
