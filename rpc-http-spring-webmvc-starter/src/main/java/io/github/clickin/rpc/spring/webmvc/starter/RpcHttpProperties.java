package io.github.clickin.rpc.spring.webmvc.starter;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the procedure-call HTTP handler.
 *
 * <p>Configure via application properties:
 * <pre>
 * rpc-http.batching-enabled=true
 * rpc-http.max-body-size=10485760
 * rpc-http.include-stack-trace=false
 * </pre>
 */
@ConfigurationProperties("rpc-http")
public class RpcHttpProperties {

    private boolean batchingEnabled = true;
    private long maxBodySize = 0;
    private boolean includeStackTrace = false;

    public boolean isBatchingEnabled() {
        return batchingEnabled;
    }

    public void setBatchingEnabled(boolean batchingEnabled) {
        this.batchingEnabled = batchingEnabled;
    }

    /** Maximum request body in bytes; 0 or less means unlimited. */
    public long getMaxBodySize() {
        return maxBodySize;
    }

    public void setMaxBodySize(long maxBodySize) {
        this.maxBodySize = maxBodySize;
    }

    public boolean isIncludeStackTrace() {
        return includeStackTrace;
    }

    public void setIncludeStackTrace(boolean includeStackTrace) {
        this.includeStackTrace = includeStackTrace;
    }
}
