package com.github.salilvnair.j1ql.engine.error;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lookup table of common J1QL mistakes, keyed by the token the parser rejected.
 */
public final class ParsingSuggestions {

    private ParsingSuggestions() {
    }

    public static final String SUGGEST_WITH_INSTEAD_OF_EQUALS =
            "Filter entity properties with WITH directly after the entity (FIND Host WITH active = true). "
                    + "WHERE is only valid for comparisons on aliased selectors (FIND Host AS h WHERE h.active = true).";

    public static final String SUGGEST_SINGLE_QUOTES =
            "Use single quotes for string literals (FIND User WITH name = 'admin').";

    public static final String SUGGEST_MISSPELLING_TEMPLATE = "Did you mean %s instead of %s?";

    private static final Map<String, String> MISSPELLINGS = Map.ofEntries(
            Map.entry("FIDN", "FIND"),
            Map.entry("FNID", "FIND"),
            Map.entry("FIN", "FIND"),
            Map.entry("FINDD", "FIND"),
            Map.entry("WIHT", "WITH"),
            Map.entry("WTIH", "WITH"),
            Map.entry("WIT", "WITH"),
            Map.entry("WHIT", "WITH"),
            Map.entry("THTA", "THAT"),
            Map.entry("TAHT", "THAT"),
            Map.entry("TAT", "THAT"),
            Map.entry("RETRUN", "RETURN"),
            Map.entry("RETUNR", "RETURN"),
            Map.entry("RETRN", "RETURN"),
            Map.entry("LIMT", "LIMIT"),
            Map.entry("LIMTI", "LIMIT"),
            Map.entry("LIMIIT", "LIMIT"),
            Map.entry("WEHRE", "WHERE"),
            Map.entry("WHRE", "WHERE"),
            Map.entry("ODRER", "ORDER"),
            Map.entry("OREDR", "ORDER")
    );

    private static final List<KeywordOrder> KEYWORD_ORDERS = List.of(
            new KeywordOrder(
                    Pattern.compile("\\bORDER\\s+BY\\b", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("\\bLIMIT\\b", Pattern.CASE_INSENSITIVE),
                    "ORDER BY must come before LIMIT (FIND Host ORDER BY Host.name LIMIT 10).")
    );

    /**
     * @return suggestion text, or null when nothing in the table applies
     */
    public static String suggest(String unexpectedToken, String query) {
        if (unexpectedToken != null) {
            String token = unexpectedToken.trim();
            if ("=".equals(token)) {
                return SUGGEST_WITH_INSTEAD_OF_EQUALS;
            }
            if (token.startsWith("\"")) {
                return SUGGEST_SINGLE_QUOTES;
            }
            String keyword = MISSPELLINGS.get(token.toUpperCase(Locale.ROOT));
            if (keyword != null) {
                return String.format(SUGGEST_MISSPELLING_TEMPLATE, keyword, token);
            }
        }
        return keywordOrderSuggestion(query);
    }

    private static String keywordOrderSuggestion(String query) {
        if (query == null || query.isBlank()) {
            return null;
        }
        for (KeywordOrder order : KEYWORD_ORDERS) {
            int first = firstOffset(order.first(), query);
            int second = firstOffset(order.second(), query);
            if (first >= 0 && second >= 0 && second < first) {
                return order.suggestion();
            }
        }
        return null;
    }

    private static int firstOffset(Pattern pattern, String query) {
        Matcher matcher = pattern.matcher(query);
        return matcher.find() ? matcher.start() : -1;
    }

    /**
     * {@code first} is expected to precede {@code second} when both are present.
     */
    private record KeywordOrder(Pattern first, Pattern second, String suggestion) {
    }
}
