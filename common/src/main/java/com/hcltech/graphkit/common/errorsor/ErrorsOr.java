package com.hcltech.graphkit.common.errorsor;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/** Either a value or a non-empty list of error messages. Used where bad input is reported, not thrown. */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** Value from the supplier if no errors were collected, otherwise all of the errors. */
    static <T> ErrorsOr<T> errorsOrLift(List<String> errors, Supplier<T> value) {
        return errors.isEmpty() ? lift(value.get()) : errors(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }
}
