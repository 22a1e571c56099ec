package com.github.salilvnair.j1ql.engine.error;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a J1QL parser message into positional and token metadata. Every fragment is optional; a
 * fragment that is absent or malformed leaves its field null.
 *
 * <pre>
 * Error parsing query: Unexpected token "=" at line 1 column 12
 *
 * &gt; 1 | FIND Host = 'x'
 *     |           ^
 * </pre>
 */
public final class ParsingErrorDecomposer {

    private static final Pattern PARSING_ERROR_MARKER =
            Pattern.compile("error parsing query|query parsing error|parse error", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE_COLUMN =
            Pattern.compile("at line (\\d+),? column (\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNEXPECTED_TOKEN =
            Pattern.compile("Unexpected token \"(.*?)\"(?=[\\s.,;:)]|$)");
    private static final Pattern QUERY_LINE =
            Pattern.compile("^\\s*>\\s*\\d+\\s*\\| ?(.*)$", Pattern.MULTILINE);
    private static final Pattern POINTER =
            Pattern.compile("^\\s*\\| ?( *\\^+)", Pattern.MULTILINE);

    public boolean isParsingError(String message) {
        return message != null && PARSING_ERROR_MARKER.matcher(message).find();
    }

    public StructuredError.ParsingError decompose(String message, String query) {
        String safeMessage = message == null ? "" : message;

        Integer line = null;
        Integer column = null;
        Matcher position = LINE_COLUMN.matcher(safeMessage);
        if (position.find()) {
            line = parseIntOrNull(position.group(1));
            column = parseIntOrNull(position.group(2));
        }

        String unexpectedToken = firstGroup(UNEXPECTED_TOKEN, safeMessage);
        String queryLine = firstGroup(QUERY_LINE, safeMessage);
        String pointer = firstGroup(POINTER, safeMessage);

        return new StructuredError.ParsingError(
                safeMessage.trim(),
                line,
                column,
                unexpectedToken,
                queryLine == null ? null : stripTrailing(queryLine),
                pointer == null ? null : stripTrailing(pointer),
                ParsingSuggestions.suggest(unexpectedToken, query));
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static Integer parseIntOrNull(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException overflow) {
            return null;
        }
    }

    private static String stripTrailing(String value) {
        return value.replaceAll("\\s+$", "");
    }
}
