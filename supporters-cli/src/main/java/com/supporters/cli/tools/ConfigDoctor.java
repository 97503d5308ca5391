package com.supporters.cli.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.supporters.application.config.ConfigKey;
import com.supporters.application.config.ConfigValidationResult;
import com.supporters.application.config.ConfigValidator;
import com.supporters.application.ports.ConfigPort;
import com.supporters.infrastructure.config.FileConfigService;

import java.io.PrintStream;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration diagnostics.
 *
 * Usage:
 *   java -jar supporters-cli.jar validate-config [--profile <name>] [--json]
 *
 * Exit codes:
 *   0: OK
 *   2: Problems found
 */
public final class ConfigDoctor {

    private ConfigDoctor() {}

    public static int run(String[] args) {
        return run(args, System.out);
    }

    static int run(String[] args, PrintStream out) {
        CliArgs a;
        try {
            a = CliArgs.parse(args, List.of("--profile"), List.of("--json"));
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            return 2;
        }
        String profile = a.value("--profile");
        boolean json = a.flag("--json");

        try {
            FileConfigService cfg = FileConfigService.defaultFromWorkingDir(profile);
            ConfigValidationResult res = new ConfigValidator().validate(cfg);
            int code = res.ok() ? 0 : 2;

            if (json) {
                out.println(buildJson(profile, cfg, res));
                return code;
            }

            out.println("configDir: " + cfg.getProfileDir());
            for (Map.Entry<String, String> e : effective(cfg).entrySet()) {
                out.println("  " + e.getKey() + " = " + e.getValue());
            }
            if (res.ok()) {
                out.println("Config OK.");
                return 0;
            }
            out.println("Config problems:");
            for (String err : res.errors()) {
                out.println(" - " + err);
            }
            out.println("Set values in config/config.properties, config/.env or SUPPORTERS_* environment variables.");
            return 2;
        } catch (Exception e) {
            out.println("Doctor failed: " + e.getMessage());
            return 2;
        }
    }

    private static Map<String, String> effective(ConfigPort cfg) {
        Map<String, String> m = new LinkedHashMap<>();
        for (ConfigKey k : ConfigKey.values()) {
            m.put(k.key(), cfg.get(k.key(), k.defaultValue()));
        }
        return m;
    }

    private static String buildJson(String profile, FileConfigService cfg, ConfigValidationResult res) throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ok", res.ok());
        payload.put("profile", profile);
        payload.put("configDir", String.valueOf(cfg.getProfileDir()));
        payload.put("generated_at_utc", Instant.now().toString());
        payload.put("config", effective(cfg));
        payload.put("errors", res.errors());
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(payload);
    }
}
