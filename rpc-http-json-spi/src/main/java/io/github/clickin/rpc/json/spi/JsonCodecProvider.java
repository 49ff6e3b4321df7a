package io.github.clickin.rpc.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 *
 * <p>Implementations are registered in {@code META-INF/services/io.github.clickin.rpc.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /** Creates a codec with the provider's default settings. */
    JsonCodec create();
}
