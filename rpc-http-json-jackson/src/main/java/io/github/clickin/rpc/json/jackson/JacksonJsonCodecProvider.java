package io.github.clickin.rpc.json.jackson;

import io.github.clickin.rpc.json.spi.JsonCodec;
import io.github.clickin.rpc.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec create() {
        return new JacksonJsonCodec();
    }
}
