package com.supporters.infrastructure.config;

import com.supporters.application.config.ConfigKey;
import com.supporters.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * File + env configuration.
 *
 * Load order (low -> high priority):
 *  1) config.properties (profile dir)
 *  2) .env (profile dir, optional)
 *  3) OS environment variables: SUPPORTERS_* mapped from the property key
 *     (db.url -> SUPPORTERS_DB_URL, report.format -> SUPPORTERS_REPORT_FORMAT)
 *
 * Only {@link ConfigKey} keys are read from .env and the environment.
 */
public final class FileConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(FileConfigService.class);

    public static final String ENV_PREFIX = "SUPPORTERS_";
    static final String DOT_ENV = ".env";

    private final Properties props = new Properties();
    private final Path profileDir;

    FileConfigService(Path profileDir, Map<String, String> env) throws IOException {
        this.profileDir = profileDir;
        loadAll();
        applyEnvOverrides(Objects.requireNonNull(env, "env"));
    }

    /** Reads {@code ./config} or {@code ./config/<profile>}; missing files are fine. */
    public static FileConfigService defaultFromWorkingDir(String profile) throws IOException {
        Path base = Path.of(System.getProperty("user.dir")).resolve("config");
        if (profile != null && !profile.isBlank()) {
            base = base.resolve(profile.trim());
        }
        return new FileConfigService(base, System.getenv());
    }

    public static FileConfigService fromDirectory(Path profileDir, Map<String, String> env) throws IOException {
        return new FileConfigService(profileDir, env);
    }

    public Path getProfileDir() {
        return profileDir;
    }

    private void loadAll() throws IOException {
        if (profileDir == null) return;

        Path file = profileDir.resolve("config.properties");
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            }
        }

        loadDotEnv(profileDir.resolve(DOT_ENV));
    }

    /**
     * {@code KEY=value} lines, {@code #} comments, optional {@code export } prefix and quotes.
     * A key is either the property name ({@code db.url}) or its env name ({@code SUPPORTERS_DB_URL});
     * anything else is skipped with a warning.
     */
    private void loadDotEnv(Path envFile) throws IOException {
        if (!Files.exists(envFile)) return;

        int lineNo = 0;
        for (String line : Files.readAllLines(envFile, StandardCharsets.UTF_8)) {
            lineNo++;
            String t = line.trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            if (t.startsWith("export ")) t = t.substring("export ".length()).trim();

            int eq = t.indexOf('=');
            if (eq <= 0) {
                log.warn("[CONFIG] {}:{} ignored, expected KEY=value", envFile, lineNo);
                continue;
            }

            String name = t.substring(0, eq).trim();
            Optional<ConfigKey> key = resolveKey(name);
            if (key.isEmpty()) {
                log.warn("[CONFIG] {}:{} unknown key '{}' ignored", envFile, lineNo, name);
                continue;
            }
            props.setProperty(key.get().key(), unquote(t.substring(eq + 1).trim()));
        }
    }

    private void applyEnvOverrides(Map<String, String> env) {
        for (ConfigKey k : ConfigKey.values()) {
            String val = env.get(toEnvKey(k.key()));
            if (val != null) props.setProperty(k.key(), val);
        }
    }

    static Optional<ConfigKey> resolveKey(String name) {
        for (ConfigKey k : ConfigKey.values()) {
            if (k.key().equals(name) || toEnvKey(k.key()).equals(name)) return Optional.of(k);
        }
        return Optional.empty();
    }

    private static String unquote(String val) {
        if (val.length() >= 2
                && ((val.startsWith("\"") && val.endsWith("\"")) || (val.startsWith("'") && val.endsWith("'")))) {
            return val.substring(1, val.length() - 1);
        }
        return val;
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - db.url          -> SUPPORTERS_DB_URL
     * - report.cadences -> SUPPORTERS_REPORT_CADENCES
     */
    static String toEnvKey(String key) {
        return ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }
}
