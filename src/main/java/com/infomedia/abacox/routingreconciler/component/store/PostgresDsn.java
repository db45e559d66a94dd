package com.infomedia.abacox.routingreconciler.component.store;

import com.infomedia.abacox.routingreconciler.exception.StoreConnectionMissingException;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a libpq style connection string into a JDBC connection config.
 * Accepted forms:
 * <ul>
 *     <li>{@code jdbc:postgresql://host:5432/db?user=u&password=p}, used as is</li>
 *     <li>{@code postgresql://u:p@host:5432/db?sslmode=require} (also {@code postgres://})</li>
 *     <li>{@code host=h port=5432 dbname=db user=u password='p w' sslmode=require}, other
 *     keywords become JDBC url parameters</li>
 * </ul>
 */
public final class PostgresDsn {

    public static final String DRIVER_CLASS_NAME = "org.postgresql.Driver";
    private static final int DEFAULT_PORT = 5432;

    // libpq keywords that pgjdbc spells differently, the rest are passed as is
    private static final Map<String, String> JDBC_PROPERTY_NAMES = Map.of(
            "connect_timeout", "connectTimeout",
            "application_name", "ApplicationName",
            "gssencmode", "gssEncMode");

    private PostgresDsn() {
    }

    public static StoreDbConfig toConfig(String dsn) {
        String trimmed = dsn.trim();
        if (trimmed.startsWith("jdbc:")) {
            return StoreDbConfig.builder().url(trimmed).driverClassName(DRIVER_CLASS_NAME).build();
        }
        if (trimmed.startsWith("postgresql://") || trimmed.startsWith("postgres://")) {
            return fromUri(trimmed);
        }
        return fromKeyValue(trimmed);
    }

    private static StoreDbConfig fromUri(String dsn) {
        URI uri = URI.create(dsn);
        String username = null;
        String password = null;
        if (uri.getRawUserInfo() != null) {
            String[] credentials = uri.getRawUserInfo().split(":", 2);
            username = decode(credentials[0]);
            if (credentials.length > 1) {
                password = decode(credentials[1]);
            }
        }

        StringBuilder url = new StringBuilder("jdbc:postgresql://")
                .append(uri.getHost() == null ? "localhost" : uri.getHost())
                .append(':')
                .append(uri.getPort() < 0 ? DEFAULT_PORT : uri.getPort());
        url.append(uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath());
        if (uri.getRawQuery() != null) {
            url.append('?').append(uri.getRawQuery());
        }

        return StoreDbConfig.builder()
                .url(url.toString())
                .username(username)
                .password(password)
                .driverClassName(DRIVER_CLASS_NAME)
                .build();
    }

    private static StoreDbConfig fromKeyValue(String dsn) {
        Map<String, String> values = parseKeyValue(dsn);

        String host = values.remove("host");
        String hostAddr = values.remove("hostaddr");
        String port = values.remove("port");
        String database = values.remove("dbname");
        String username = values.remove("user");
        String password = values.remove("password");

        StringBuilder url = new StringBuilder("jdbc:postgresql://")
                .append(firstNonBlank(host, hostAddr, "localhost"))
                .append(':')
                .append(firstNonBlank(port, null, String.valueOf(DEFAULT_PORT)))
                .append('/')
                .append(database == null ? "" : database);

        char separator = '?';
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String property = JDBC_PROPERTY_NAMES.getOrDefault(entry.getKey(), entry.getKey());
            url.append(separator)
                    .append(property)
                    .append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }

        return StoreDbConfig.builder()
                .url(url.toString())
                .username(username)
                .password(password)
                .driverClassName(DRIVER_CLASS_NAME)
                .build();
    }

    /**
     * Splits {@code keyword = value} pairs. A value may be single quoted, and a
     * backslash escapes the next character inside or outside quotes.
     */
    private static Map<String, String> parseKeyValue(String dsn) {
        Map<String, String> values = new LinkedHashMap<>();
        int length = dsn.length();
        int i = skipWhitespace(dsn, 0);
        while (i < length) {
            int keyStart = i;
            while (i < length && dsn.charAt(i) != '=' && !Character.isWhitespace(dsn.charAt(i))) {
                i++;
            }
            String keyword = dsn.substring(keyStart, i);
            i = skipWhitespace(dsn, i);
            if (i >= length || dsn.charAt(i) != '=') {
                throw new StoreConnectionMissingException("PG_DSN malformed: missing \"=\" after \"" + keyword + "\"");
            }
            i = skipWhitespace(dsn, i + 1);

            StringBuilder value = new StringBuilder();
            if (i < length && dsn.charAt(i) == '\'') {
                i++;
                boolean closed = false;
                while (i < length) {
                    char c = dsn.charAt(i++);
                    if (c == '\\' && i < length) {
                        value.append(dsn.charAt(i++));
                    } else if (c == '\'') {
                        closed = true;
                        break;
                    } else {
                        value.append(c);
                    }
                }
                if (!closed) {
                    throw new StoreConnectionMissingException("PG_DSN malformed: unterminated quoted value for \"" + keyword + "\"");
                }
            } else {
                while (i < length && !Character.isWhitespace(dsn.charAt(i))) {
                    char c = dsn.charAt(i++);
                    if (c == '\\' && i < length) {
                        value.append(dsn.charAt(i++));
                    } else {
                        value.append(c);
                    }
                }
            }
            values.put(keyword, value.toString());
            i = skipWhitespace(dsn, i);
        }
        return values;
    }

    private static int skipWhitespace(String value, int from) {
        int i = from;
        while (i < value.length() && Character.isWhitespace(value.charAt(i))) {
            i++;
        }
        return i;
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return fallback;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
