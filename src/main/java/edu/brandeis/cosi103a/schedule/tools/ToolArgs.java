package edu.brandeis.cosi103a.schedule.tools;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Flag parsing shared by the command-line tools. Accepts {@code --flag value},
 * {@code --flag=value} and bare boolean switches.
 */
final class ToolArgs {

    private final Map<String, String> values;

    private ToolArgs(Map<String, String> values) {
        this.values = values;
    }

    /**
     * @param valueFlags flags that take a value
     * @param switches   flags that take none
     * @throws IllegalArgumentException on unknown flags or a missing value
     */
    static ToolArgs parse(String[] args, Set<String> valueFlags, Set<String> switches) {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }
            if (valueFlags.contains(name)) {
                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for " + name);
                    }
                    value = args[++i];
                }
            } else if (switches.contains(name)) {
                value = value == null ? "true" : value;
            } else {
                throw new IllegalArgumentException("Unknown argument: " + arg);
            }
            values.put(name, value);
        }
        return new ToolArgs(values);
    }

    boolean has(String flag) {
        return values.containsKey(flag);
    }

    String get(String flag, String defaultValue) {
        return values.getOrDefault(flag, defaultValue);
    }

    String require(String flag) {
        String value = values.get(flag);
        if (value == null) {
            throw new IllegalArgumentException("Missing required argument: " + flag);
        }
        return value;
    }

    int requireInt(String flag) {
        return toInt(flag, require(flag));
    }

    int getInt(String flag, int defaultValue) {
        return values.containsKey(flag) ? toInt(flag, values.get(flag)) : defaultValue;
    }

    boolean isSet(String flag) {
        return Boolean.parseBoolean(values.getOrDefault(flag, "false"));
    }

    private static int toInt(String flag, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + flag + ": " + value);
        }
    }
}
