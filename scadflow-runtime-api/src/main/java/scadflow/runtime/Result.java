package scadflow.runtime;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result 类型，组件边界的错误处理
 *
 * <p>有两种变体：Ok(value) 和 Err(error)。组件的公开方法返回 Result，
 * 不让异常越过自身边界。</p>
 *
 * @param <T> 成功值类型
 * @param <E> 错误类型
 */
public final class Result<T, E> {

    private final boolean ok;
    private final T value;
    private final E error;

    private Result(boolean ok, T value, E error) {
        this.ok = ok;
        this.value = value;
        this.error = error;
    }

    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(true, value, null);
    }

    public static <T, E> Result<T, E> err(E error) {
        Objects.requireNonNull(error, "error");
        return new Result<>(false, null, error);
    }

    public boolean isOk() {
        return ok;
    }

    public boolean isErr() {
        return !ok;
    }

    /** Ok 时的值，Err 时为 null */
    public T getValue() {
        return value;
    }

    /** Err 时的错误，Ok 时为 null */
    public E getError() {
        return error;
    }

    /** unwrap：Ok 返回 value，Err 抛出异常 */
    public T unwrap() {
        if (!ok) {
            if (error instanceof Throwable) {
                throw new ScadException("Called unwrap() on Err: " + ((Throwable) error).getMessage(), (Throwable) error);
            }
            throw new ScadException("Called unwrap() on Err: " + error);
        }
        return value;
    }

    /** unwrapOr：Ok 返回 value，Err 返回 defaultValue */
    public T unwrapOr(T defaultValue) {
        return ok ? value : defaultValue;
    }

    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        if (!ok) return err(error);
        return ok(mapper.apply(value));
    }

    public <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        if (!ok) return err(error);
        return mapper.apply(value);
    }

    public <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
        if (ok) return ok(value);
        return err(mapper.apply(error));
    }

    @Override
    public String toString() {
        return ok ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
