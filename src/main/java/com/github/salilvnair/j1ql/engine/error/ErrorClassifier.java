package com.github.salilvnair.j1ql.engine.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.j1ql.engine.constants.J1qlConstants;
import com.github.salilvnair.j1ql.engine.transport.RawResponse;
import com.github.salilvnair.j1ql.util.JsonUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns HTTP statuses and GraphQL error payloads into {@link StructuredError}s.
 * <ol>
 *     <li>HTTP tier: any non-2xx status.</li>
 *     <li>Protocol tier: a 2xx body carrying an {@code errors} list.</li>
 *     <li>Parsing tier: protocol messages reported by the J1QL parser.</li>
 * </ol>
 */
@Component
public class ErrorClassifier {

    private static final String RATE_LIMIT_STATUS_TEXT = "429";

    private final ParsingErrorDecomposer decomposer;

    public ErrorClassifier() {
        this(new ParsingErrorDecomposer());
    }

    public ErrorClassifier(ParsingErrorDecomposer decomposer) {
        this.decomposer = decomposer;
    }

    /**
     * @param body parsed response body, may be null when the status already failed
     * @return empty when the response is a 2xx without protocol errors
     */
    public Optional<StructuredError> classify(RawResponse response, JsonNode body, String query) {
        if (!response.isSuccess()) {
            return Optional.of(classifyHttpStatus(response));
        }
        JsonNode errors = body == null ? null : body.get(J1qlConstants.RESPONSE_KEY_ERRORS);
        if (errors != null && errors.isArray() && !errors.isEmpty()) {
            return Optional.of(classifyProtocolErrors(errors, query));
        }
        return Optional.empty();
    }

    public StructuredError classifyHttpStatus(RawResponse response) {
        int status = response.status();
        return switch (status) {
            case 401 -> new StructuredError.HttpError(status, HttpErrorKind.UNAUTHORIZED, J1qlConstants.MESSAGE_UNAUTHORIZED);
            case 429, 503 -> new StructuredError.TransientError(status, J1qlConstants.MESSAGE_RATE_LIMITED);
            case 504 -> new StructuredError.TransientError(status, J1qlConstants.MESSAGE_GATEWAY_TIMEOUT);
            case 500 -> new StructuredError.HttpError(status, HttpErrorKind.INTERNAL_SERVER_ERROR,
                    J1qlConstants.MESSAGE_INTERNAL_SERVER_ERROR);
            default -> new StructuredError.HttpError(status, HttpErrorKind.GENERIC,
                    status + ":" + (response.body() == null ? "" : response.body()));
        };
    }

    public StructuredError classifyProtocolErrors(JsonNode errors, String query) {
        List<String> messages = new ArrayList<>();
        for (JsonNode error : errors) {
            String message = error.isTextual()
                    ? error.asText()
                    : JsonUtil.textOrNull(error, J1qlConstants.RESPONSE_KEY_MESSAGE);
            if (message == null) {
                message = error.toString();
            }
            if (decomposer.isParsingError(message)) {
                return decomposer.decompose(message, query);
            }
            messages.add(message);
        }
        if (messages.size() == 1 && messages.get(0).contains(RATE_LIMIT_STATUS_TEXT)) {
            return new StructuredError.TransientError(429, J1qlConstants.MESSAGE_RATE_LIMITED);
        }
        return new StructuredError.GraphQLError(messages);
    }
}
