package com.catdb.schema;

import com.catdb.config.CatdbSettings;
import com.catdb.driver.JdbcTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Invokes {@code pg_dump --schema-only} when it is installed. Its absence is not an error.
 */
@Slf4j
@Component
public class PgDumpRunner {

    private static final String JDBC_POSTGRES_PREFIX = "jdbc:postgresql://";

    private final Duration timeout;

    public PgDumpRunner(CatdbSettings settings) {
        this.timeout = settings.pgDumpTimeout();
    }

    /**
     * Find {@code pg_dump} on the {@code PATH}.
     *
     * @return executable, if installed
     */
    public Optional<Path> locate() {
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String exe : List.of("pg_dump", "pg_dump.exe")) {
                Path candidate = Paths.get(dir, exe);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Dump the schema of a database, or of one table.
     *
     * @param target Postgres target
     * @param table table name, or null for the whole database
     * @return dump text, empty when the tool is missing or fails
     */
    public String dump(JdbcTarget target, String table) {
        Optional<Path> pgDump = locate();
        if (pgDump.isEmpty() || target.getUrl() == null || !target.getUrl().startsWith(JDBC_POSTGRES_PREFIX)) {
            return "";
        }
        List<String> cmd = new ArrayList<>(List.of(pgDump.get().toString(), "--schema-only", "--no-owner", "--no-privileges"));
        if (table != null && !table.isBlank()) {
            cmd.add("--table");
            cmd.add(table);
        }
        cmd.add(libpqUrl(target));

        Path out = null;
        try {
            out = Files.createTempFile("catdb-pgdump", ".sql");
            ProcessBuilder pb = new ProcessBuilder(cmd)
                    .redirectOutput(out.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD);
            if (target.getPassword() != null) {
                pb.environment().put("PGPASSWORD", target.getPassword());
            }
            Process process = pb.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("pg_dump timed out (timeout_ms={}, table={})", timeout.toMillis(), table);
                return "";
            }
            if (process.exitValue() != 0) {
                log.debug("pg_dump failed (exit_code={}, table={})", process.exitValue(), table);
                return "";
            }
            return Files.readString(out, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("pg_dump could not run (error={})", e.getMessage());
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } finally {
            if (out != null) {
                try {
                    Files.deleteIfExists(out);
                } catch (IOException e) {
                    log.debug("Removing pg_dump output failed (file={})", out);
                }
            }
        }
    }

    /**
     * Pull the {@code CREATE TABLE} block of one table, optionally schema-qualified, out of dump text.
     *
     * @param dumpText pg_dump output
     * @param table table name
     * @return statement, or empty text
     */
    public static String extractCreateTable(String dumpText, String table) {
        if (dumpText == null || dumpText.isEmpty() || table == null || table.isBlank()) {
            return "";
        }
        Pattern pattern = Pattern.compile(
                "CREATE TABLE\\s+(?:[\\w\"]+\\.)?\"?" + Pattern.quote(table) + "\"?\\s*\\([\\s\\S]*?\\n\\);",
                Pattern.CASE_INSENSITIVE
        );
        Matcher m = pattern.matcher(dumpText);
        return m.find() ? m.group() : "";
    }

    static String libpqUrl(JdbcTarget target) {
        String rest = target.getUrl().substring(JDBC_POSTGRES_PREFIX.length());
        StringBuilder sb = new StringBuilder("postgresql://");
        if (target.getUsername() != null && !target.getUsername().isBlank()) {
            sb.append(URLEncoder.encode(target.getUsername(), StandardCharsets.UTF_8)).append('@');
        }
        sb.append(rest);
        String sslmode = target.getProperties().get("sslmode");
        if (sslmode != null && !sslmode.isBlank()) {
            sb.append(rest.contains("?") ? '&' : '?').append("sslmode=").append(URLEncoder.encode(sslmode, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }
}
