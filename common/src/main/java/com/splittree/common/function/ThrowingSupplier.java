package com.splittree.common.function;

@FunctionalInterface
public interface ThrowingSupplier<T> {
    T get() throws Exception;
}
