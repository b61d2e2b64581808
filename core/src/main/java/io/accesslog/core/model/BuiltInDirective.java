package io.accesslog.core.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Built-in directives. Each constant except {@link #PEER_ADDRESS} is addressed
 * by a single case-sensitive character after {@code %}; the peer address is
 * only reachable through the parameterized form {@code %{r}a}.
 */
public enum BuiltInDirective {
    REQUEST_TIME('t'),
    REMOTE_ADDRESS('a'),
    REQUEST_LINE('r'),
    METHOD('M'),
    URL_PATH('U'),
    QUERY_STRING('Q'),
    HTTP_VERSION('V'),
    STATUS('s'),
    BODY_BYTES('b'),
    ELAPSED_SECONDS('T'),
    ELAPSED_MILLIS('D'),
    PEER_ADDRESS('\0');

    private static final char NO_KEY = '\0';

    private static final Map<Character, BuiltInDirective> BY_KEY = new HashMap<>();

    static {
        for (BuiltInDirective directive : values()) {
            if (directive.key != NO_KEY) {
                BY_KEY.put(directive.key, directive);
            }
        }
    }

    private final char key;

    BuiltInDirective(char key) {
        this.key = key;
    }

    /** The single-character key, or {@code '\0'} for parameter-only directives. */
    public char key() {
        return key;
    }

    /**
     * Looks up a directive by its single-character key.
     *
     * @return the directive, or {@code null} if {@code key} is not a built-in key
     */
    public static BuiltInDirective forKey(char key) {
        return BY_KEY.get(key);
    }

    /** Returns {@code true} if {@code name} is exactly one built-in key character. */
    public static boolean isReservedKey(String name) {
        return name != null && name.length() == 1 && BY_KEY.containsKey(name.charAt(0));
    }
}
