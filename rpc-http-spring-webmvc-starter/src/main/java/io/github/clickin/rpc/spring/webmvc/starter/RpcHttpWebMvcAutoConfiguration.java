package io.github.clickin.rpc.spring.webmvc.starter;

import io.github.clickin.rpc.json.jackson.JacksonJsonCodec;
import io.github.clickin.rpc.json.spi.JsonCodec;
import io.github.clickin.rpc.server.core.ContextFactory;
import io.github.clickin.rpc.server.core.DefaultErrorShaper;
import io.github.clickin.rpc.server.core.ErrorListener;
import io.github.clickin.rpc.server.core.ResponseMetaProvider;
import io.github.clickin.rpc.server.core.RpcRequestHandler;
import io.github.clickin.rpc.server.spi.DataTransformer;
import io.github.clickin.rpc.server.spi.ErrorShaper;
import io.github.clickin.rpc.server.spi.ProcedureRouter;
import io.github.clickin.rpc.servlet.RpcServlet;
import jakarta.servlet.http.HttpServlet;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the procedure-call HTTP handler with Spring WebMVC.
 *
 * <p>Provides default beans for {@link JsonCodec}, {@link RpcRequestHandler} and {@link RpcServlet} once
 * the application defines a {@link ProcedureRouter} bean. Optional {@link ContextFactory},
 * {@link ErrorListener}, {@link ResponseMetaProvider}, {@link DataTransformer} and {@link ErrorShaper}
 * beans are picked up when present. Every default can be overridden by defining your own bean.
 *
 * <p><strong>Note:</strong> This autoconfiguration does NOT register the servlet. Map it yourself:
 * <pre>{@code
 * @Bean
 * public ServletRegistrationBean<RpcServlet> rpcServletRegistration(RpcServlet servlet) {
 *     ServletRegistrationBean<RpcServlet> registration = new ServletRegistrationBean<>(servlet, "/rpc/*");
 *     registration.setAsyncSupported(true);
 *     return registration;
 * }
 * }</pre>
 */
@AutoConfiguration
@ConditionalOnClass({RpcRequestHandler.class, RpcServlet.class, HttpServlet.class})
@EnableConfigurationProperties(RpcHttpProperties.class)
public class RpcHttpWebMvcAutoConfiguration {

    /**
     * Provides a Jackson {@link JsonCodec}.
     * Override by defining your own JsonCodec bean.
     */
    @Bean
    @ConditionalOnMissingBean
    public JsonCodec rpcJsonCodec() {
        return new JacksonJsonCodec();
    }

    /**
     * Provides a {@link RpcRequestHandler} configured from {@link RpcHttpProperties} and the optional hook beans.
     * Override by defining your own RpcRequestHandler bean.
     */
    @Bean
    @ConditionalOnBean(ProcedureRouter.class)
    @ConditionalOnMissingBean
    public RpcRequestHandler<Object> rpcRequestHandler(ProcedureRouter<Object> router,
                                                       JsonCodec codec,
                                                       RpcHttpProperties properties,
                                                       ObjectProvider<ContextFactory<Object>> contextFactory,
                                                       ObjectProvider<ErrorListener<Object>> errorListener,
                                                       ObjectProvider<ResponseMetaProvider<Object>> responseMeta,
                                                       ObjectProvider<DataTransformer> transformer,
                                                       ObjectProvider<ErrorShaper<Object>> errorShaper) {
        return RpcRequestHandler.builder(router)
                .codec(codec)
                .batchingEnabled(properties.isBatchingEnabled())
                .maxBodySize(properties.getMaxBodySize())
                .contextFactory(contextFactory.getIfAvailable())
                .errorListener(errorListener.getIfAvailable())
                .responseMeta(responseMeta.getIfAvailable())
                .transformer(transformer.getIfAvailable())
                .errorShaper(errorShaper.getIfAvailable(() -> new DefaultErrorShaper<>(properties.isIncludeStackTrace())))
                .build();
    }

    /**
     * Provides a {@link RpcServlet} for servlet-based integration.
     * Override by defining your own servlet bean.
     */
    @Bean
    @ConditionalOnBean(RpcRequestHandler.class)
    @ConditionalOnMissingBean
    public RpcServlet rpcServlet(RpcRequestHandler<?> handler) {
        return new RpcServlet(handler);
    }
}
