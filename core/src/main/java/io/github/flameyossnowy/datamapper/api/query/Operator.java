package io.github.flameyossnowy.datamapper.api.query;

public enum Operator {
    EQL,
    IN,
    NOT,
    LIKE,
    GT,
    GTE,
    LT,
    LTE,
    RAW;

    public boolean isComparison() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }
}
