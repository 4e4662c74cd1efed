package com.llmrouter.security;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A credential lifted from request headers, not yet verified.
 */
@Getter
@AllArgsConstructor
public class Credential {

    public enum Type {
        API_KEY,
        BEARER_TOKEN
    }

    private final Type type;
    private final String value;

    public static Credential apiKey(String value) {
        return new Credential(Type.API_KEY, value);
    }

    public static Credential bearerToken(String value) {
        return new Credential(Type.BEARER_TOKEN, value);
    }

    @Override
    public String toString() {
        return "Credential(" + type + ")";
    }
}
