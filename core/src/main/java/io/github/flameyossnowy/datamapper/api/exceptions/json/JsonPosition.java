package io.github.flameyossnowy.datamapper.api.exceptions.json;

import com.fasterxml.jackson.core.JsonLocation;

/**
 * Position inside a JSON document where decoding failed.
 *
 * @param line   1-based line, or -1 when unknown
 * @param column 1-based column, or -1 when unknown
 */
public record JsonPosition(int line, int column) {
    public static final JsonPosition UNKNOWN = new JsonPosition(-1, -1);

    public static JsonPosition from(JsonLocation location) {
        if (location == null) return UNKNOWN;
        return new JsonPosition(location.getLineNr(), location.getColumnNr());
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
