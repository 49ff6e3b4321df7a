package io.github.clickin.rpc.json.spi;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Returns a codec from the first {@link JsonCodecProvider} on the class path.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader classLoader) {
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, classLoader).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("No " + JsonCodecProvider.class.getName()
                    + " found; add rpc-http-json-jackson or pass a JsonCodec explicitly");
        }
        return it.next().create();
    }
}
