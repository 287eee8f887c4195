package confetti.lang;

/**
 * Translates a declared Java identifier into the directive name used in text.
 */
public enum NamingPolicy {

    /** {@code maxConnections} stays {@code maxConnections}. */
    AS_DECLARED {
        @Override
        public String apply(String identifier) {
            return identifier;
        }
    },

    /** {@code maxConnections} becomes {@code max-connections}. */
    KEBAB_CASE {
        @Override
        public String apply(String identifier) {
            return separateWords(identifier, '-');
        }
    },

    /** {@code maxConnections} becomes {@code max_connections}. */
    SNAKE_CASE {
        @Override
        public String apply(String identifier) {
            return separateWords(identifier, '_');
        }
    };

    public abstract String apply(String identifier);

    /**
     * Lower-cases {@code identifier}, inserting {@code separator} at each
     * camel-case word boundary. An acronym ends before its last capital when
     * a lower-case letter follows, so {@code HTTPPort} becomes {@code http-port}.
     */
    static String separateWords(String identifier, char separator) {
        var result = new StringBuilder(identifier.length() + 4);
        for (var i = 0; i < identifier.length(); i++) {
            var c = identifier.charAt(i);
            if (Character.isUpperCase(c)) {
                var previous = i > 0 ? identifier.charAt(i - 1) : '\0';
                var next = i + 1 < identifier.length() ? identifier.charAt(i + 1) : '\0';
                var boundary = Character.isLowerCase(previous)
                    || Character.isDigit(previous)
                    || (Character.isUpperCase(previous) && Character.isLowerCase(next));
                if (boundary) {
                    result.append(separator);
                }
                result.append(Character.toLowerCase(c));
            } else if (c == '_' || c == '-') {
                result.append(separator);
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
