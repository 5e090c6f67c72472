package com.example.forecastmcp.tool;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

// JSON Schema subset used by tool descriptors: type, properties, required,
// additionalProperties false, items, minimum and maximum
@Component
public class InputSchemaValidator {

    public List<String> validate(Map<String, Object> schema, Object value) {
        List<String> violations = new ArrayList<>();
        validate(schema, value, "arguments", violations);
        return violations;
    }

    @SuppressWarnings("unchecked")
    private void validate(Map<String, Object> schema, Object value, String path, List<String> violations) {
        Object type = schema.get("type");
        if (type instanceof String expected && !matchesType(expected, value)) {
            violations.add(path + " must be " + article(expected));
            return;
        }

        if (value instanceof Map<?, ?> object) {
            Map<String, Object> properties = (Map<String, Object>) schema.getOrDefault("properties", Map.of());
            Object required = schema.get("required");
            if (required instanceof Collection<?> names) {
                for (Object name : names) {
                    if (!object.containsKey(name) || object.get(name) == null) {
                        violations.add(child(path, name) + " is required");
                    }
                }
            }
            for (Map.Entry<?, ?> entry : object.entrySet()) {
                Object propertySchema = properties.get(entry.getKey());
                if (propertySchema instanceof Map<?, ?> nested) {
                    if (entry.getValue() != null) {
                        validate((Map<String, Object>) nested, entry.getValue(), child(path, entry.getKey()), violations);
                    }
                } else if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
                    violations.add("unexpected property '" + entry.getKey() + "'");
                }
            }
        } else if (value instanceof List<?> array && schema.get("items") instanceof Map<?, ?> items) {
            for (int i = 0; i < array.size(); i++) {
                validate((Map<String, Object>) items, array.get(i), path + "[" + i + "]", violations);
            }
        } else if (value instanceof Number number) {
            checkBound(schema.get("minimum"), number, path, -1, ">=", violations);
            checkBound(schema.get("maximum"), number, path, 1, "<=", violations);
        }
    }

    private void checkBound(Object bound, Number value, String path, int outside, String relation,
                            List<String> violations) {
        if (!(bound instanceof Number limit)
                || (value instanceof Double || value instanceof Float) && !Double.isFinite(value.doubleValue())) {
            return;
        }
        if (new BigDecimal(value.toString()).compareTo(new BigDecimal(limit.toString())) == outside) {
            violations.add(path + " must be " + relation + " " + limit);
        }
    }

    private boolean matchesType(String type, Object value) {
        return switch (type) {
            case "object" -> value instanceof Map<?, ?>;
            case "array" -> value instanceof List<?>;
            case "string" -> value instanceof String;
            case "boolean" -> value instanceof Boolean;
            case "number" -> value instanceof Number;
            case "integer" -> isInteger(value);
            case "null" -> value == null;
            default -> true;
        };
    }

    private boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private String child(String path, Object name) {
        return "arguments".equals(path) ? String.valueOf(name) : path + "." + name;
    }

    private String article(String type) {
        return switch (type) {
            case "object", "array", "integer" -> "an " + type;
            default -> "a " + type;
        };
    }
}
