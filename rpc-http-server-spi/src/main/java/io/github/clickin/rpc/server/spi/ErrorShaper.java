package io.github.clickin.rpc.server.spi;

/**
 * Defines the on-wire representation of an error.
 *
 * <p>The returned value is placed under {@code "error"} in the envelope and written with the configured
 * JSON codec. Implementations must be pure.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface ErrorShaper<C> {
    Object shape(ErrorShapeRequest<C> request);
}
