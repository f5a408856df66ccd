package io.github.flameyossnowy.datamapper.api.query;

public enum Direction {
    ASC,
    DESC
}
