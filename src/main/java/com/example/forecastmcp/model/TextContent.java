package com.example.forecastmcp.model;

public record TextContent(String type, String text) {

    public static TextContent of(String text) {
        return new TextContent("text", text);
    }
}
