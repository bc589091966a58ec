package org.bitconverter.utils;

import org.bitconverter.exceptions.AutomatonException;
import org.bitconverter.exceptions.InvalidDefinitionException;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 要么携带一个值，要么携带一个非空的、有序的错误列表。
 * 此类是不可变的。
 *
 * @param <T> 成功时的值类型。
 */
public final class Result<T> {

    private final T value;
    private final List<AutomatonException> errors;

    private Result(T value, List<AutomatonException> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(Objects.requireNonNull(value, "Result value cannot be null."), List.of());
    }

    public static <T> Result<T> failure(List<? extends AutomatonException> errors) {
        Objects.requireNonNull(errors, "Errors list cannot be null.");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("失败结果至少需要一个错误");
        }
        return new Result<>(null, List.<AutomatonException>copyOf(errors));
    }

    public static <T> Result<T> failure(AutomatonException error) {
        return failure(List.of(error));
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /**
     * @return 错误列表；成功时为空列表。
     */
    public List<AutomatonException> getErrors() {
        return errors;
    }

    /**
     * 成功时对值做映射，失败时原样传递错误。
     */
    public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        if (!isSuccess()) {
            return new Result<>(null, errors);
        }
        return mapper.apply(value);
    }

    /**
     * 返回值；失败时只有一个错误则抛出该错误本身，否则抛出汇总的 {@link InvalidDefinitionException}。
     */
    public T getOrThrow() {
        if (isSuccess()) {
            return value;
        }
        if (errors.size() == 1) {
            throw errors.get(0);
        }
        throw new InvalidDefinitionException(errors);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Result(success=" + value + ")" : "Result(errors=" + errors + ")";
    }
}
