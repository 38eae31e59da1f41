package org.carball.cinebot.tool;

public enum ParameterType {
    STRING("string"),
    INTEGER("integer");

    private final String jsonType;

    ParameterType(String jsonType) {
        this.jsonType = jsonType;
    }

    public String getJsonType() {
        return jsonType;
    }
}
