package com.github.salilvnair.j1ql.engine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.j1ql.config.J1qlClientConfig;
import com.github.salilvnair.j1ql.engine.constants.J1qlConstants;
import com.github.salilvnair.j1ql.engine.core.J1qlQueryEngine;
import com.github.salilvnair.j1ql.engine.error.ErrorClassifier;
import com.github.salilvnair.j1ql.engine.error.StructuredError;
import com.github.salilvnair.j1ql.engine.exception.J1qlEngineException;
import com.github.salilvnair.j1ql.engine.exception.J1qlErrorCode;
import com.github.salilvnair.j1ql.engine.model.ExecutionOptions;
import com.github.salilvnair.j1ql.engine.model.ExecutionResult;
import com.github.salilvnair.j1ql.engine.model.ResultPage;
import com.github.salilvnair.j1ql.engine.normalize.NormalizedItem;
import com.github.salilvnair.j1ql.engine.normalize.ResultNormalizer;
import com.github.salilvnair.j1ql.engine.request.QueryV1RequestFactory;
import com.github.salilvnair.j1ql.engine.session.ExecutionSession;
import com.github.salilvnair.j1ql.engine.session.ExecutionState;
import com.github.salilvnair.j1ql.engine.transport.CancellationToken;
import com.github.salilvnair.j1ql.engine.transport.GraphQueryTransport;
import com.github.salilvnair.j1ql.engine.transport.RawResponse;
import com.github.salilvnair.j1ql.util.JsonPathUtil;
import com.github.salilvnair.j1ql.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Drives one query through SUBMITTING, POLLING and PAGINATING until it reaches COMPLETED or FAILED.
 * <p>
 * Each submission asks for a forced deferred response, so the first answer is only a download url.
 * That url is fetched until it stops reporting {@code IN_PROGRESS}; the materialized page is
 * normalized and its cursor, if any, feeds the next submission. A query with its own
 * {@code LIMIT n} stops after the first page.
 */
@Slf4j
@Component
public class DefaultJ1qlQueryEngine implements J1qlQueryEngine {

    private static final Pattern LIMIT_DIRECTIVE = Pattern.compile("\\bLIMIT\\s+\\d+", Pattern.CASE_INSENSITIVE);

    private final GraphQueryTransport transport;
    private final QueryV1RequestFactory requestFactory;
    private final ErrorClassifier classifier;
    private final ResultNormalizer normalizer;
    private final J1qlClientConfig config;
    private final Clock clock;

    @Autowired
    public DefaultJ1qlQueryEngine(
            GraphQueryTransport transport,
            QueryV1RequestFactory requestFactory,
            ErrorClassifier classifier,
            ResultNormalizer normalizer,
            J1qlClientConfig config
    ) {
        this(transport, requestFactory, classifier, normalizer, config, Clock.systemUTC());
    }

    public DefaultJ1qlQueryEngine(
            GraphQueryTransport transport,
            QueryV1RequestFactory requestFactory,
            ErrorClassifier classifier,
            ResultNormalizer normalizer,
            J1qlClientConfig config,
            Clock clock
    ) {
        this.transport = transport;
        this.requestFactory = requestFactory;
        this.classifier = classifier;
        this.normalizer = normalizer;
        this.config = config;
        this.clock = clock;
    }

    public static boolean hasExplicitLimit(String query) {
        return query != null && LIMIT_DIRECTIVE.matcher(query).find();
    }

    @Override
    public ExecutionResult execute(String query) {
        return execute(query, ExecutionOptions.defaults());
    }

    @Override
    public ExecutionResult execute(String query, ExecutionOptions options) {
        ExecutionOptions safeOptions = options == null ? ExecutionOptions.defaults() : options;
        CancellationToken token = safeOptions.getCancellationToken() == null
                ? CancellationToken.create()
                : safeOptions.getCancellationToken();
        boolean includeDeleted = safeOptions.getIncludeDeleted() == null
                ? config.isIncludeDeleted()
                : safeOptions.getIncludeDeleted();

        ExecutionSession session = new ExecutionSession(query, hasExplicitLimit(query), includeDeleted, token);
        try {
            return run(session);
        } catch (J1qlEngineException e) {
            log.debug("J1QL execution aborted errorCode={} recoverable={}", e.getErrorCode(), e.isRecoverable());
            session.fail(new StructuredError.TransportFailure(e.getMessage()));
            return failed(session);
        } catch (RuntimeException e) {
            log.error("J1QL execution failed unexpectedly", e);
            session.fail(new StructuredError.TransportFailure(
                    J1qlErrorCode.INTERNAL_ERROR.defaultMessage() + ": " + e.getMessage()));
            return failed(session);
        }
    }

    private ExecutionResult run(ExecutionSession session) {
        while (true) {
            switch (session.getState()) {
                case SUBMITTING -> submit(session);
                case POLLING -> poll(session);
                case PAGINATING -> paginate(session);
                case COMPLETED -> {
                    return completed(session);
                }
                case FAILED -> {
                    return failed(session);
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // SUBMITTING
    // ---------------------------------------------------------------------
    private void submit(ExecutionSession session) {
        CancellationToken token = session.getCancellationToken();
        token.throwIfCancelled();

        String body = requestFactory.submissionBody(session.getQuery(), session.getCursor(), session.isIncludeDeleted());
        RawResponse response = transport.post(requestFactory.endpoint(), requestFactory.headers(), body, token);
        if (!response.isSuccess()) {
            session.fail(classifier.classifyHttpStatus(response));
            return;
        }

        JsonNode payload = JsonUtil.parse(response.body());
        Optional<StructuredError> error = classifier.classify(response, payload, session.getQuery());
        if (error.isPresent()) {
            session.fail(error.get());
            return;
        }

        String url = JsonPathUtil.readText(payload, J1qlConstants.PATH_DEFERRED_URL);
        if (!isHttpUrl(url)) {
            session.fail(new StructuredError.TransportFailure(
                    J1qlErrorCode.DEFERRED_URL_MISSING.defaultMessage()
                            + (url == null ? "" : " (malformed url)")));
            return;
        }
        session.startPolling(url.trim());
    }

    // ---------------------------------------------------------------------
    // POLLING
    // ---------------------------------------------------------------------
    private void poll(ExecutionSession session) {
        CancellationToken token = session.getCancellationToken();
        token.throwIfCancelled();

        RawResponse response = transport.get(session.getDownloadUrl(), Map.of(), token);
        session.recordPoll();
        if (!response.isSuccess()) {
            session.fail(classifier.classifyHttpStatus(response));
            return;
        }

        JsonNode payload = JsonUtil.parse(response.body());
        String status = JsonUtil.textOrNull(payload, J1qlConstants.RESPONSE_KEY_STATUS);
        if (J1qlConstants.STATUS_IN_PROGRESS.equals(status)) {
            token.sleep(config.getPollIntervalMs());
            return;
        }
        if (J1qlConstants.STATUS_FAILED.equals(status)) {
            String reason = JsonUtil.textOrNull(payload, J1qlConstants.RESPONSE_KEY_ERROR);
            session.fail(classifier.classifyProtocolErrors(
                    JsonUtil.object().arrayNode().add(reason == null ? J1qlConstants.MESSAGE_DEFERRED_QUERY_FAILED : reason),
                    session.getQuery()));
            return;
        }

        session.setCurrentPage(ResultPage.from(payload));
        session.transitionTo(ExecutionState.PAGINATING);
    }

    // ---------------------------------------------------------------------
    // PAGINATING
    // ---------------------------------------------------------------------
    private void paginate(ExecutionSession session) {
        ResultPage page = session.getCurrentPage();

        if (page.isTree()) {
            session.appendPage(List.of(new NormalizedItem.PassThroughRecord(page.tree())));
            session.setHasMore(false);
            session.transitionTo(ExecutionState.COMPLETED);
            return;
        }

        session.appendPage(normalizer.normalizeAll(page.records()));
        session.setHasMore(page.hasCursor());

        if (session.isExplicitLimit() || !page.hasCursor()) {
            session.transitionTo(ExecutionState.COMPLETED);
            return;
        }
        session.setCursor(page.cursor());
        session.transitionTo(ExecutionState.SUBMITTING);
    }

    private ExecutionResult completed(ExecutionSession session) {
        log.info("J1QL query completed pages={} polls={} items={} hasMore={}",
                session.getPageCount(), session.getPollCount(), session.getAccumulated().size(), session.isHasMore());
        return ExecutionResult.success(session.getQuery(), session.getAccumulated(), now(), session.isHasMore());
    }

    private ExecutionResult failed(ExecutionSession session) {
        StructuredError error = session.getError();
        log.warn("J1QL query failed type={} pages={} msg={}",
                error.getClass().getSimpleName(), session.getPageCount(), error.message());
        return ExecutionResult.failure(session.getQuery(), error, now());
    }

    private String now() {
        return clock.instant().toString();
    }

    private static boolean isHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            return uri.isAbsolute()
                    && uri.getHost() != null
                    && scheme != null
                    && ("http".equals(scheme.toLowerCase(Locale.ROOT)) || "https".equals(scheme.toLowerCase(Locale.ROOT)));
        } catch (IllegalArgumentException malformed) {
            return false;
        }
    }
}
