package com.supporters.cli.tools;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@code --name value} and {@code --flag} parsing shared by the tools. Unknown options are usage errors.
 */
final class CliArgs {

    private final Map<String, String> values = new HashMap<>();
    private final Set<String> flags = new HashSet<>();

    private CliArgs() {}

    /**
     * @throws IllegalArgumentException on an unknown option, a missing value or a positional argument
     */
    static CliArgs parse(String[] args, List<String> valueOptions, List<String> flagOptions) {
        CliArgs out = new CliArgs();
        for (int i = 0; i < args.length; i++) {
            String a = args[i] == null ? "" : args[i].trim();
            if (a.isEmpty()) continue;

            String name = a.toLowerCase(Locale.ROOT);
            String inline = null;
            int eq = name.indexOf('=');
            if (name.startsWith("--") && eq > 0) {
                inline = a.substring(eq + 1);
                name = name.substring(0, eq);
            }

            if (valueOptions.contains(name)) {
                if (inline != null) {
                    out.values.put(name, inline);
                } else if (i + 1 < args.length) {
                    out.values.put(name, args[++i]);
                } else {
                    throw new IllegalArgumentException("Missing value for " + name);
                }
            } else if (flagOptions.contains(name) && inline == null) {
                out.flags.add(name);
            } else {
                throw new IllegalArgumentException("Unknown argument: " + a);
            }
        }
        return out;
    }

    String value(String name) {
        return values.get(name);
    }

    boolean flag(String name) {
        return flags.contains(name);
    }
}
