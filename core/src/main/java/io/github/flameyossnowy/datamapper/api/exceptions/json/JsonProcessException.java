package io.github.flameyossnowy.datamapper.api.exceptions.json;

public class JsonProcessException extends RuntimeException {
    private final JsonPosition position;

    public JsonProcessException(String message, JsonPosition position) {
        super(message);
        this.position = position;
    }

    public JsonProcessException(String message, Throwable cause, JsonPosition position) {
        super(message, cause);
        this.position = position;
    }

    public JsonPosition getPosition() {
        return position;
    }
}
