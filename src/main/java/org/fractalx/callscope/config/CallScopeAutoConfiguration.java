package org.fractalx.callscope.config;

import io.grpc.ServerInterceptor;
import org.fractalx.callscope.core.CallHook;
import org.fractalx.callscope.core.DefaultEntryResources;
import org.fractalx.callscope.core.EntryResources;
import org.fractalx.callscope.grpc.CallScopeClientInterceptor;
import org.fractalx.callscope.grpc.CallScopeServerInterceptor;
import org.fractalx.callscope.security.BasicAuthHook;
import org.fractalx.callscope.security.BasicAuthOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties
@ConditionalOnClass(ServerInterceptor.class)
@ConditionalOnProperty(name = "callscope.enabled", havingValue = "true", matchIfMissing = true)
public class CallScopeAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(CallScopeAutoConfiguration.class);
    static final String CS_CONFIG = "callscope.internal.config";

    public CallScopeAutoConfiguration() {
        logger.info("CallScope Auto-Configuration initialized");
    }

    // ── Config ────────────────────────────────────────────────────────────────

    @Bean(CS_CONFIG)
    @ConfigurationProperties(prefix = "callscope")
    @ConditionalOnMissingBean(name = CS_CONFIG)
    public CallScopeConfig callScopeInternalConfig() {
        return new CallScopeConfig();
    }

    // ── Collaborators ─────────────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public EntryResources callScopeEntryResources() {
        return new DefaultEntryResources();
    }

    // ── Hooks: basic auth ─────────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "callscope.basic-auth.enabled", havingValue = "true")
    public BasicAuthOptions basicAuthOptions(@Qualifier(CS_CONFIG) CallScopeConfig config) {
        return BasicAuthOptions.builder()
                .enabled(config.getBasicAuth().isEnabled())
                .credentials(config.getBasicAuth().getCredentials())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "callscope.basic-auth.enabled", havingValue = "true")
    public BasicAuthHook basicAuthHook(BasicAuthOptions options) {
        return new BasicAuthHook(options);
    }

    // ── Interceptors ──────────────────────────────────────────────────────────

    /**
     * Hooks are taken from the context in {@code @Order}; each interceptor only runs the
     * hooks that apply to its call types.
     */
    @Bean
    @ConditionalOnMissingBean
    public CallScopeServerInterceptor callScopeServerInterceptor(
            @Qualifier(CS_CONFIG) CallScopeConfig config,
            EntryResources resources,
            ObjectProvider<CallHook> hooks) {
        return new CallScopeServerInterceptor(config.toOptions(config.getServer()), resources, ordered(hooks));
    }

    @Bean
    @ConditionalOnMissingBean
    public CallScopeClientInterceptor callScopeClientInterceptor(
            @Qualifier(CS_CONFIG) CallScopeConfig config,
            EntryResources resources,
            ObjectProvider<CallHook> hooks) {
        return new CallScopeClientInterceptor(config.toOptions(config.getClient()), resources, ordered(hooks));
    }

    private static List<CallHook> ordered(ObjectProvider<CallHook> hooks) {
        return hooks.orderedStream().collect(Collectors.toList());
    }
}
