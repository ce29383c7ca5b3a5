package org.fractalx.callscope.annotation;

import org.fractalx.callscope.config.CallScopeAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers the CallScope interceptors and hooks in a Spring application.
 *
 * <p>Spring Boot auto-configuration already does this when the library is on the
 * classpath. Use the annotation in non-Boot Spring applications or custom contexts:
 * <pre>
 * {@literal @}Configuration
 * {@literal @}EnableCallScope
 * public class GrpcConfig {
 * }
 * </pre>
 * The interceptors are then available as {@code CallScopeServerInterceptor} and
 * {@code CallScopeClientInterceptor} beans, ready for {@code ServerBuilder.intercept}
 * and {@code ManagedChannelBuilder.intercept}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(CallScopeAutoConfiguration.class)
public @interface EnableCallScope {
}
