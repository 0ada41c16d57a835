package com.splittree.common.errorsor;

import com.splittree.common.function.ThrowingSupplier;

import java.text.MessageFormat;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * <p>
 * Boundaries (parsing, building, rendering) report recoverable problems through this type
 * instead of throwing, so that all problems of one input can be collected and shown together.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    ErrorsOr<T> addPrefixIfError(String prefix);

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> error(String pattern, Exception e) {
        return new Error<>(List.of(MessageFormat.format(pattern, e.getClass().getSimpleName(), e.getMessage())));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    // --- Functional helpers ---
    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(getValue().get()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(getValue().get());
    }

    /** Wrap a throwing supplier; the exception becomes a single error message. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> toMsg) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error(toMsg.apply(e));
        }
    }
}
