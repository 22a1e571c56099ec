package com.github.salilvnair.j1ql.engine.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Classified failure of one query execution. Serialized with a {@code type} discriminator so
 * callers can branch without inspecting message text.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StructuredError.HttpError.class, name = "HTTP_ERROR"),
        @JsonSubTypes.Type(value = StructuredError.TransientError.class, name = "TRANSIENT_ERROR"),
        @JsonSubTypes.Type(value = StructuredError.GraphQLError.class, name = "GRAPHQL_ERROR"),
        @JsonSubTypes.Type(value = StructuredError.ParsingError.class, name = "PARSING_ERROR"),
        @JsonSubTypes.Type(value = StructuredError.TransportFailure.class, name = "TRANSPORT_FAILURE")
})
public sealed interface StructuredError permits
        StructuredError.HttpError,
        StructuredError.TransientError,
        StructuredError.GraphQLError,
        StructuredError.ParsingError,
        StructuredError.TransportFailure {

    String message();

    /**
     * Non-2xx status that is not worth retrying as-is.
     */
    record HttpError(int status, HttpErrorKind kind, String message) implements StructuredError {
    }

    /**
     * Rate limiting or gateway timeout. The whole execution may be retried later.
     */
    record TransientError(int status, String message) implements StructuredError {
    }

    record GraphQLError(List<String> messages) implements StructuredError {

        public GraphQLError {
            messages = messages == null ? List.of() : List.copyOf(messages);
        }

        @Override
        public String message() {
            return String.join("; ", messages);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ParsingError(
            String message,
            Integer line,
            Integer column,
            String unexpectedToken,
            String queryLine,
            String pointer,
            String suggestion
    ) implements StructuredError {
    }

    record TransportFailure(String message) implements StructuredError {
    }
}
