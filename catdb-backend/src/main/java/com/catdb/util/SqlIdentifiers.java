package com.catdb.util;

/**
 * Identifier quoting per connection kind.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    /**
     * Quote a single identifier. Embedded quote characters are doubled.
     *
     * @param kind connection kind
     * @param identifier identifier
     * @return quoted identifier
     */
    public static String quote(String kind, String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        String q = "mysql".equals(DbKindNormalizer.normalize(kind)) ? "`" : "\"";
        return q + identifier.replace(q, q + q) + q;
    }

    /**
     * Quote a possibly schema-qualified name ({@code schema.table}).
     *
     * @param kind connection kind
     * @param name name
     * @return quoted name
     */
    public static String quoteQualified(String kind, String name) {
        QualifiedName qn = QualifiedName.parse(name);
        if (qn.schema() == null) {
            return quote(kind, qn.name());
        }
        return quote(kind, qn.schema()) + "." + quote(kind, qn.name());
    }

    /**
     * A name split on its first dot.
     *
     * @param schema schema, or null when unqualified
     * @param name object name
     */
    public record QualifiedName(String schema, String name) {

        /**
         * Parse {@code schema.name} or {@code name}.
         *
         * @param raw raw name
         * @return parsed name
         */
        public static QualifiedName parse(String raw) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("Table name is required");
            }
            String v = raw.trim();
            int dot = v.indexOf('.');
            if (dot > 0 && dot < v.length() - 1) {
                return new QualifiedName(v.substring(0, dot), v.substring(dot + 1));
            }
            return new QualifiedName(null, v);
        }
    }
}
