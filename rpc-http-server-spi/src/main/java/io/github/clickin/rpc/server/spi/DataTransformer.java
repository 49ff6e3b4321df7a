package io.github.clickin.rpc.server.spi;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Symmetric encode/decode pair applied to payloads at the wire boundary.
 *
 * <p>{@link #deserializeInput} runs on every present input after JSON parsing; {@link #serializeOutput}
 * runs on every result {@code data} and every shaped error before JSON writing. Both must be pure.
 */
public interface DataTransformer {

    Object deserializeInput(Object value);

    Object serializeOutput(Object value);

    /** Transformer that leaves values untouched. */
    static DataTransformer identity() {
        return of(UnaryOperator.identity(), UnaryOperator.identity());
    }

    static DataTransformer of(UnaryOperator<Object> inputDeserializer, UnaryOperator<Object> outputSerializer) {
        Objects.requireNonNull(inputDeserializer, "inputDeserializer");
        Objects.requireNonNull(outputSerializer, "outputSerializer");
        return new DataTransformer() {
            @Override
            public Object deserializeInput(Object value) {
                return inputDeserializer.apply(value);
            }

            @Override
            public Object serializeOutput(Object value) {
                return outputSerializer.apply(value);
            }
        };
    }
}
