package com.example.forecastmcp.protocol;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum McpMethod {
    INITIALIZE("initialize"),
    TOOLS_LIST("tools/list"),
    TOOLS_CALL("tools/call");

    public static final String NOTIFICATION_PREFIX = "notifications/";

    private static final Map<String, McpMethod> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(McpMethod::wireName, Function.identity()));

    private final String wireName;

    McpMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<McpMethod> fromWireName(String name) {
        return Optional.ofNullable(name).map(BY_WIRE_NAME::get);
    }

    public static boolean isNotification(String name) {
        return name != null && name.startsWith(NOTIFICATION_PREFIX);
    }
}
