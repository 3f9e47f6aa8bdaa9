package dev.newsroom.domain;

import java.util.Objects;
import java.util.function.Function;

/**
 * Tagged result of an engine operation.
 * <ul>
 *   <li>{@code CHANGED}: the operation produced a new value</li>
 *   <li>{@code UNCHANGED}: nothing to do, the requested state already holds</li>
 *   <li>{@code FAILED}: the operation was refused with an {@link ErrorKind}</li>
 * </ul>
 */
public record Outcome<T>(Status status, T value, ErrorKind error) {

    public enum Status { CHANGED, UNCHANGED, FAILED }

    public Outcome {
        Objects.requireNonNull(status, "status");
        if (status == Status.FAILED && error == null) {
            throw new IllegalArgumentException("A failed outcome needs an error kind");
        }
    }

    public static <T> Outcome<T> changed(T value) {
        return new Outcome<>(Status.CHANGED, value, null);
    }

    public static <T> Outcome<T> unchanged(T value) {
        return new Outcome<>(Status.UNCHANGED, value, null);
    }

    public static <T> Outcome<T> failed(ErrorKind error) {
        return new Outcome<>(Status.FAILED, null, error);
    }

    public boolean isChanged() {
        return status == Status.CHANGED;
    }

    public boolean isUnchanged() {
        return status == Status.UNCHANGED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailed()) {
            return failed(error);
        }
        return new Outcome<>(status, mapper.apply(value), null);
    }

    /**
     * Returns the value, or throws {@link WorkflowException} carrying the error kind.
     */
    public T orElseThrow() {
        if (isFailed()) {
            throw new WorkflowException(error);
        }
        return value;
    }
}
