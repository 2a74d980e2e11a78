package com.example.purgejobs.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

public record Alert(
        @JsonProperty("level") Level level,
        @JsonProperty("text") String text
) {

    public enum Level {
        SUCCESS, WARNING, ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static Alert success(String text) {
        return new Alert(Level.SUCCESS, text);
    }

    public static Alert warning(String text) {
        return new Alert(Level.WARNING, text);
    }

    public static Alert error(String text) {
        return new Alert(Level.ERROR, text);
    }
}
