package com.catdb.util;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses JDBC-style connection descriptors into {@link ParsedDescriptor}.
 *
 * <p>Vendor-specific query parameters are folded into normalized ones: TLS flags become
 * {@code sslmode}, schema aliases become the {@code schema} field plus a
 * {@code -c search_path=...} fragment in {@code options}, and timezone aliases become a
 * {@code -c TimeZone=...} fragment. The alias keys themselves never reach the driver.
 */
public final class DsnParser {

    public static final String JDBC_PREFIX = "jdbc:";

    private static final Set<String> SCHEMA_KEYS = Set.of("currentschema", "search_path", "schema");
    private static final Set<String> TLS_KEYS = Set.of("ssl", "usessl");
    private static final Set<String> TIMEZONE_KEYS = Set.of("timezone", "servertimezone");
    private static final String ENCODING_KEY = "characterencoding";
    private static final String OPTIONS_KEY = "options";

    private static final Pattern SEARCH_PATH_IN_OPTIONS = Pattern.compile("search_path\\s*=\\s*([\\w\",]+)");

    private DsnParser() {
    }

    /**
     * Parse a descriptor of the shape {@code jdbc:scheme://[user[:pass]@]host[:port]/database[?k=v&...]}.
     * File-based descriptors ({@code jdbc:sqlite:/path} or {@code jdbc:sqlite:///path}) are accepted too.
     *
     * @param descriptor descriptor
     * @return parsed descriptor
     * @throws DescriptorParseException if the descriptor is not a JDBC URL
     */
    public static ParsedDescriptor parse(String descriptor) {
        if (descriptor == null || !descriptor.trim().regionMatches(true, 0, JDBC_PREFIX, 0, JDBC_PREFIX.length())) {
            throw new DescriptorParseException("Not a JDBC URL: " + maskCredentials(descriptor));
        }
        String body = descriptor.trim().substring(JDBC_PREFIX.length());

        // Split off the query first so that '/' or '@' inside parameter values cannot confuse the authority scan.
        String base = body;
        String query = null;
        int queryIdx = body.indexOf('?');
        if (queryIdx != -1) {
            base = body.substring(0, queryIdx);
            query = body.substring(queryIdx + 1);
        }

        String scheme;
        String authority = "";
        String path;
        int schemeIdx = base.indexOf("://");
        if (schemeIdx != -1) {
            scheme = base.substring(0, schemeIdx);
            String rest = base.substring(schemeIdx + 3);
            int pathIdx = rest.indexOf('/');
            if (pathIdx != -1) {
                authority = rest.substring(0, pathIdx);
                path = rest.substring(pathIdx + 1);
            } else {
                authority = rest;
                path = "";
            }
        } else {
            int colonIdx = base.indexOf(':');
            if (colonIdx <= 0) {
                throw new DescriptorParseException("Missing scheme in descriptor: " + maskCredentials(descriptor));
            }
            scheme = base.substring(0, colonIdx);
            path = base.substring(colonIdx + 1);
        }
        if (scheme.isBlank()) {
            throw new DescriptorParseException("Missing scheme in descriptor: " + maskCredentials(descriptor));
        }

        String userInfo = null;
        String hostPort = authority;
        // lastIndexOf keeps passwords containing '@' intact
        int atIdx = authority.lastIndexOf('@');
        if (atIdx != -1) {
            userInfo = authority.substring(0, atIdx);
            hostPort = authority.substring(atIdx + 1);
        }

        String host = hostPort;
        Integer port = null;
        int colonIdx = hostPort.lastIndexOf(':');
        if (colonIdx != -1 && colonIdx > hostPort.lastIndexOf(']')) {
            host = hostPort.substring(0, colonIdx);
            try {
                port = Integer.parseInt(hostPort.substring(colonIdx + 1));
            } catch (NumberFormatException e) {
                port = null;
            }
        }

        String username = null;
        String password = null;
        if (userInfo != null) {
            int sep = userInfo.indexOf(':');
            if (sep != -1) {
                username = percentDecode(userInfo.substring(0, sep));
                password = percentDecode(userInfo.substring(sep + 1));
            } else {
                username = percentDecode(userInfo);
            }
        }

        ParsedDescriptor parsed = ParsedDescriptor.builder()
                .scheme(scheme)
                .kind(detectKind(scheme))
                .host(host.isBlank() ? null : host)
                .port(port)
                .database(path.isBlank() ? null : path)
                .username(username)
                .password(password)
                .build();
        consolidateParams(parseQuery(query), parsed);
        return parsed;
    }

    /**
     * Map a descriptor scheme onto a connection kind.
     *
     * @param scheme scheme, e.g. {@code postgresql} or {@code mysql+pymysql}
     * @return kind
     */
    public static String detectKind(String scheme) {
        String s = scheme.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("postgresql") || s.startsWith("postgres")) {
            return "postgresql";
        }
        if (s.startsWith("mysql")) {
            return "mysql";
        }
        if (s.startsWith("sqlite")) {
            return "sqlite";
        }
        int plus = s.indexOf('+');
        return plus == -1 ? s : s.substring(0, plus);
    }

    /**
     * Parse a query string, keeping parameter order and the first value of a repeated key.
     *
     * @param query raw query (may be null)
     * @return ordered parameters
     */
    public static Map<String, String> parseQuery(String query) {
        Map<String, String> params = new LinkedHashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx > 0) {
                String key = decode(pair.substring(0, idx), true);
                String value = decode(pair.substring(idx + 1), true);
                params.putIfAbsent(key, value);
            }
        }
        return params;
    }

    /**
     * Find the first {@code search_path=} value inside a session options string.
     *
     * @param options options, e.g. {@code -c search_path=app,public}
     * @return search path without surrounding quotes, or null
     */
    public static String extractSearchPath(String options) {
        if (options == null || options.isBlank()) {
            return null;
        }
        Matcher m = SEARCH_PATH_IN_OPTIONS.matcher(options);
        if (!m.find()) {
            return null;
        }
        String value = m.group(1).replace("\"", "").trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Mask the password part of a descriptor for logging.
     *
     * @param descriptor descriptor
     * @return masked descriptor
     */
    public static String maskCredentials(String descriptor) {
        if (descriptor == null) {
            return null;
        }
        return descriptor.replaceAll(":[^@:/]+@", ":****@");
    }

    private static void consolidateParams(Map<String, String> raw, ParsedDescriptor parsed) {
        Map<String, String> params = new LinkedHashMap<>();
        List<String> searchPaths = new ArrayList<>();
        String existingOptions = null;
        String timezone = null;
        Boolean tls = null;

        for (Map.Entry<String, String> e : raw.entrySet()) {
            String key = e.getKey().toLowerCase(Locale.ROOT);
            String value = e.getValue();
            if (SCHEMA_KEYS.contains(key)) {
                if (value != null && !value.isBlank() && !searchPaths.contains(value)) {
                    searchPaths.add(value);
                }
            } else if (TLS_KEYS.contains(key)) {
                if (tls == null) {
                    tls = Boolean.parseBoolean(value);
                }
            } else if (TIMEZONE_KEYS.contains(key)) {
                if (timezone == null && value != null && !value.isBlank()) {
                    timezone = value;
                }
            } else if (ENCODING_KEY.equals(key)) {
                continue;
            } else if (OPTIONS_KEY.equals(key)) {
                existingOptions = value;
            } else {
                params.put(e.getKey(), value);
            }
        }

        if (tls != null) {
            params.putIfAbsent("sslmode", tls ? "require" : "disable");
        }

        List<String> fragments = new ArrayList<>();
        if (existingOptions != null && !existingOptions.isBlank()) {
            fragments.add(existingOptions.trim());
        }
        for (String searchPath : searchPaths) {
            String fragment = "-c search_path=" + searchPath;
            if (existingOptions == null || !existingOptions.contains(fragment)) {
                fragments.add(fragment);
            }
        }
        if (timezone != null) {
            fragments.add("-c TimeZone=" + timezone);
        }
        if (!fragments.isEmpty()) {
            params.put(OPTIONS_KEY, String.join(" ", fragments));
        }

        parsed.setParams(params);
        parsed.setSchema(searchPaths.isEmpty() ? null : searchPaths.get(0));
    }

    private static String percentDecode(String value) {
        return decode(value, false);
    }

    /**
     * Decode {@code %XX} escapes. A {@code %} not followed by two hex digits is kept literally.
     */
    static String decode(String value, boolean plusAsSpace) {
        if (value.indexOf('%') == -1 && (!plusAsSpace || value.indexOf('+') == -1)) {
            return value;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '%' && i + 2 < value.length() && hex(value.charAt(i + 1)) >= 0 && hex(value.charAt(i + 2)) >= 0) {
                out.write(hex(value.charAt(i + 1)) * 16 + hex(value.charAt(i + 2)));
                i += 3;
                continue;
            }
            if (c == '+' && plusAsSpace) {
                out.write(' ');
            } else {
                int end = Character.charCount(value.codePointAt(i));
                out.writeBytes(value.substring(i, i + end).getBytes(StandardCharsets.UTF_8));
                i += end;
                continue;
            }
            i++;
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static int hex(char c) {
        return c < 128 ? Character.digit(c, 16) : -1;
    }
}
