package io.github.clickin.rpc.server.core;

import java.util.List;

/**
 * Derives the HTTP status of a response from its envelopes.
 */
final class HttpStatusCodes {
    static final int OK = 200;
    static final int NO_CONTENT = 204;
    static final int INTERNAL_SERVER_ERROR = 500;

    private HttpStatusCodes() {}

    static int of(ResponseEnvelope envelope) {
        if (envelope instanceof ResponseEnvelope.Error error) {
            return error.cause().code().httpStatus();
        }
        return OK;
    }

    /**
     * 200 when every call succeeded, otherwise the status of the first failing call. A batch with mixed
     * outcomes therefore reports one representative failure status for the whole response.
     */
    static int of(List<ResponseEnvelope> envelopes) {
        for (ResponseEnvelope envelope : envelopes) {
            if (envelope.isError()) return of(envelope);
        }
        return OK;
    }
}
