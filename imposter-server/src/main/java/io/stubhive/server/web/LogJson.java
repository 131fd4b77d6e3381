package io.stubhive.server.web;

import com.fasterxml.jackson.databind.JsonNode;

final class LogJson {
    private static final int MAX_LENGTH = 500;

    private LogJson() {
    }

    static String safe(JsonNode value) {
        if (value == null) {
            return "";
        }
        String json = value.toString();
        if (json.length() > MAX_LENGTH) {
            return json.substring(0, MAX_LENGTH) + "…";
        }
        return json;
    }
}
