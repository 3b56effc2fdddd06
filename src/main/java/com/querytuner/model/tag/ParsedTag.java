package com.querytuner.model.tag;

/**
 * Tag string split into key and value.
 *
 * <p>Wire format is {@code key} or {@code key=value}. Keys starting with
 * {@value #SYSTEM_PREFIX} belong to built-in features (starring); that is a naming
 * convention only, user paths can still write them.
 *
 * <pre>
 *   "production"          -> ("production", "")
 *   " env = staging "     -> ("env", "staging")
 *   "a=b=c"               -> ("a", "b=c")
 * </pre>
 */
public record ParsedTag(String key, String value) {

    public static final String SYSTEM_PREFIX = "system:";

    public static final String STARRED_KEY = SYSTEM_PREFIX + "starred";

    public ParsedTag {
        key = key == null ? "" : key;
        value = value == null ? "" : value;
    }

    /**
     * Split on the first {@code =} and trim both halves. Total: null parses like "".
     */
    public static ParsedTag parse(String raw) {
        if (raw == null) {
            return new ParsedTag("", "");
        }
        int separator = raw.indexOf('=');
        if (separator < 0) {
            return new ParsedTag(raw.trim(), "");
        }
        return new ParsedTag(raw.substring(0, separator).trim(), raw.substring(separator + 1).trim());
    }

    public static String format(String key, String value) {
        if (value == null || value.isEmpty()) {
            return key == null ? "" : key;
        }
        return key + "=" + value;
    }

    public static boolean isSystemTag(String key) {
        return key != null && key.startsWith(SYSTEM_PREFIX);
    }

    public String format() {
        return format(key, value);
    }

    public boolean isSystem() {
        return isSystemTag(key);
    }

    public boolean hasValue() {
        return !value.isEmpty();
    }
}
