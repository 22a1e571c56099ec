package com.github.salilvnair.j1ql.engine.constants;

public final class J1qlConstants {

    private J1qlConstants() {
    }

    public static final String HEADER_AUTHORIZATION = "Authorization";
    public static final String HEADER_ACCOUNT = "JupiterOne-Account";
    public static final String HEADER_CONTENT_TYPE = "Content-Type";
    public static final String BEARER_PREFIX = "Bearer";
    public static final String APPLICATION_JSON = "application/json";

    public static final String DEFERRED_RESPONSE_FORCE = "FORCE";

    public static final String VAR_QUERY = "query";
    public static final String VAR_VARIABLES = "variables";
    public static final String VAR_INCLUDE_DELETED = "includeDeleted";
    public static final String VAR_DEFERRED_RESPONSE = "deferredResponse";
    public static final String VAR_FLAGS = "flags";
    public static final String VAR_VARIABLE_RESULT_SIZE = "variableResultSize";
    public static final String VAR_CURSOR = "cursor";

    public static final String PATH_DEFERRED_URL = "$.data.queryV1.url";

    public static final String RESPONSE_KEY_ERRORS = "errors";
    public static final String RESPONSE_KEY_MESSAGE = "message";
    public static final String RESPONSE_KEY_STATUS = "status";
    public static final String RESPONSE_KEY_DATA = "data";
    public static final String RESPONSE_KEY_CURSOR = "cursor";
    public static final String RESPONSE_KEY_ERROR = "error";
    public static final String RESPONSE_KEY_VERTICES = "vertices";
    public static final String RESPONSE_KEY_EDGES = "edges";

    public static final String STATUS_IN_PROGRESS = "IN_PROGRESS";
    public static final String STATUS_FAILED = "FAILED";

    public static final String RECORD_KEY_ID = "id";
    public static final String RECORD_KEY_ENTITY = "entity";
    public static final String RECORD_KEY_PROPERTIES = "properties";
    public static final String ENTITY_KEY_ID = "_id";
    public static final String ENTITY_KEY_TYPE = "_type";
    public static final String ENTITY_KEY_CLASS = "_class";
    public static final String ENTITY_KEY_DISPLAY_NAME = "displayName";
    public static final String ENTITY_KEY_INTEGRATION_NAME = "_integrationName";

    public static final String MESSAGE_UNAUTHORIZED = "401: Unauthorized. Please supply a valid account id and API token.";
    public static final String MESSAGE_RATE_LIMITED = "J1QL API rate limit exceeded";
    public static final String MESSAGE_GATEWAY_TIMEOUT = "Gateway Timeout";
    public static final String MESSAGE_INTERNAL_SERVER_ERROR = "J1QL API internal server error";
    public static final String MESSAGE_DEFERRED_QUERY_FAILED = "Deferred query failed";

    public static final String QUERY_V1_DOCUMENT = """
            query J1QL(
              $query: String!
              $variables: JSON
              $cursor: String
              $includeDeleted: Boolean
              $deferredResponse: DeferredResponseOption
              $flags: QueryV1Flags
            ) {
              queryV1(
                query: $query
                variables: $variables
                cursor: $cursor
                includeDeleted: $includeDeleted
                deferredResponse: $deferredResponse
                flags: $flags
              ) {
                type
                data
                url
              }
            }
            """;
}
