package org.carball.cinebot.tool;

import java.util.Collections;
import java.util.Map;

/**
 * Typed read access to the argument map of one invocation. Models send numbers as JSON numbers or
 * as strings, both are accepted.
 */
public class ToolArguments {

    private final ToolName tool;
    private final Map<String, Object> values;

    public ToolArguments(ToolName tool, Map<String, Object> values) {
        this.tool = tool;
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public boolean has(String name) {
        Object value = values.get(name);
        return value != null && !value.toString().isBlank();
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value == null ? null : value.toString().trim();
    }

    /**
     * @return the positive integer value, or the default when the argument is absent
     * @throws InvalidArgumentsException when the value is not a positive whole number
     */
    public int getInt(String name, int defaultValue) {
        if (!has(name)) {
            return defaultValue;
        }
        Object value = values.get(name);
        int parsed;
        if (value instanceof Number) {
            Number number = (Number) value;
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw invalid(name, value);
            }
            parsed = number.intValue();
        } else {
            try {
                parsed = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw invalid(name, value);
            }
        }
        if (parsed <= 0) {
            throw invalid(name, value);
        }
        return parsed;
    }

    private InvalidArgumentsException invalid(String name, Object value) {
        return new InvalidArgumentsException(String.format(
                "Argument '%s' of %s must be a positive integer, got '%s'", name, tool, value));
    }
}
