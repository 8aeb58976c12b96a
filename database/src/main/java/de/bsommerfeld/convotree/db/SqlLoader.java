package de.bsommerfeld.convotree.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Keeping every statement in its own {@code .sql} file means the recursive
 * CTEs can be read, highlighted and linted as plain SQL, and each file can
 * carry a short {@code --} header explaining its bind parameters. Full-line
 * comments are stripped on load; trailing comments inside a line are left to
 * SQLite.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * Names follow {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code insert-message.sql}, {@code select-path-to-root.sql}.
 *
 * @see SqlStoreSession
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement stored in {@code sql/<name>.sql}.
     *
     * @param name the file stem without path prefix or extension
     * @return the SQL string without comment lines, trimmed
     * @throws IllegalStateException if the resource is missing, unreadable or
     *                               contains no statement
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            String sql = stripCommentLines(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            if (sql.isEmpty()) {
                throw new IllegalStateException("SQL resource is empty: " + path);
            }
            return sql;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }

    static String stripCommentLines(String raw) {
        return raw.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"))
                .trim();
    }
}
