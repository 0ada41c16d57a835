package com.splittree.common.errorsor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class Value<T> implements ErrorsOr<T> {
    private final T value;

    Value(T value) {
        this.value = Objects.requireNonNull(value);
    }

    @Override
    public boolean isError() {
        return false;
    }

    @Override
    public boolean isValue() {
        return true;
    }

    @Override
    public Optional<T> getValue() {
        return Optional.of(value);
    }

    @Override
    public List<String> getErrors() {
        return List.of();
    }

    @Override
    public ErrorsOr<T> addPrefixIfError(String prefix) {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Value<?> other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Value(" + value + ")";
    }
}
