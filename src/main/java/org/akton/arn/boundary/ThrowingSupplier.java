package org.akton.arn.boundary;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link GenerationBoundary} to wrap calls to the identifier source.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
