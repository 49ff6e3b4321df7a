package io.github.clickin.rpc.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProcedureTypeTest {

    @Test
    void mapsHttpMethodsToProcedureTypes() {
        assertThat(ProcedureType.fromHttpMethod("GET")).isEqualTo(ProcedureType.QUERY);
        assertThat(ProcedureType.fromHttpMethod("POST")).isEqualTo(ProcedureType.MUTATION);
        assertThat(ProcedureType.fromHttpMethod("PATCH")).isEqualTo(ProcedureType.SUBSCRIPTION);
        assertThat(ProcedureType.fromHttpMethod("get")).isEqualTo(ProcedureType.QUERY);
    }

    @Test
    void unmappedMethodsAreUnknown() {
        assertThat(ProcedureType.fromHttpMethod("PUT")).isEqualTo(ProcedureType.UNKNOWN);
        assertThat(ProcedureType.fromHttpMethod("DELETE")).isEqualTo(ProcedureType.UNKNOWN);
        assertThat(ProcedureType.fromHttpMethod(null)).isEqualTo(ProcedureType.UNKNOWN);
    }

    @Test
    void onlyQueriesAndMutationsAreServable() {
        assertThat(ProcedureType.QUERY.isServableOverHttp()).isTrue();
        assertThat(ProcedureType.MUTATION.isServableOverHttp()).isTrue();
        assertThat(ProcedureType.SUBSCRIPTION.isServableOverHttp()).isFalse();
        assertThat(ProcedureType.UNKNOWN.isServableOverHttp()).isFalse();
        assertThat(ProcedureType.MUTATION.wireName()).isEqualTo("mutation");
    }
}
