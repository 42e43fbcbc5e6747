package com.shlokmestry.gateway.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.gateway.auth.AdminAccessGuard;
import com.shlokmestry.gateway.auth.AdminApiFilter;
import com.shlokmestry.gateway.auth.AdminAuthService;
import com.shlokmestry.gateway.auth.AdminCredentials;
import com.shlokmestry.gateway.crypto.CryptoProvider;
import com.shlokmestry.gateway.crypto.DelegatingCryptoProvider;
import com.shlokmestry.gateway.crypto.JcaCryptoProvider;
import com.shlokmestry.gateway.csp.CspPolicyBuilder;
import com.shlokmestry.gateway.events.SecurityEventLogger;
import com.shlokmestry.gateway.gateway.ClientIdentityResolver;
import com.shlokmestry.gateway.gateway.GatewayResponses;
import com.shlokmestry.gateway.gateway.SecurityGatewayFilter;
import com.shlokmestry.gateway.headers.SecurityHeaderWriter;
import com.shlokmestry.gateway.hmac.HmacGate;
import com.shlokmestry.gateway.observability.RateLimitMetrics;
import com.shlokmestry.gateway.ratelimit.FixedWindowRateLimiter;
import com.shlokmestry.gateway.ratelimit.InMemoryBucketStore;
import com.shlokmestry.gateway.ratelimit.RateLimitPolicies;
import com.shlokmestry.gateway.ratelimit.RateLimiter;

import io.micrometer.core.instrument.MeterRegistry;

@Configuration
@EnableScheduling
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    public static final int GATEWAY_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;
    public static final int ADMIN_FILTER_ORDER = GATEWAY_FILTER_ORDER + 10;

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    DeploymentEnvironment deploymentEnvironment(GatewayProperties props) {
        log.info("gateway environment={}", props.environment());
        return props.environment();
    }

    @Bean
    CryptoProvider cryptoProvider(GatewayProperties props, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        JcaCryptoProvider local = new JcaCryptoProvider();
        GatewayProperties.Crypto crypto = props.crypto();
        if (crypto.mode() == GatewayProperties.Crypto.Mode.FULL) {
            return local;
        }

        if (crypto.delegateUrl() == null || crypto.delegateUrl().isBlank()) {
            throw new IllegalStateException("gateway.crypto.mode=delegating requires gateway.crypto.delegate-url");
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) crypto.delegateTimeout().toMillis());
        requestFactory.setReadTimeout((int) crypto.delegateTimeout().toMillis());

        RestClient client = RestClient.builder()
                .baseUrl(crypto.delegateUrl())
                .requestFactory(requestFactory)
                .build();

        log.info("crypto mode=delegating delegateUrl={} timeout={}", crypto.delegateUrl(), crypto.delegateTimeout());
        return new DelegatingCryptoProvider(local, client, objectMapper,
                props.hmac().secret(), props.hmac().signatureHeader(), meterRegistry);
    }

    @Bean
    RateLimiter rateLimiter(GatewayProperties props, Clock clock) {
        return new FixedWindowRateLimiter(new InMemoryBucketStore(), clock, props.rateLimit().maxBuckets());
    }

    @Bean
    RateLimitPolicies rateLimitPolicies(GatewayProperties props) {
        return RateLimitPolicies.from(props.rateLimit());
    }

    @Bean
    CspPolicyBuilder cspPolicyBuilder(GatewayProperties props) {
        return new CspPolicyBuilder(props.csp());
    }

    @Bean
    SecurityHeaderWriter securityHeaderWriter() {
        return new SecurityHeaderWriter();
    }

    @Bean
    HmacGate hmacGate(CryptoProvider crypto, DeploymentEnvironment environment, GatewayProperties props) {
        return new HmacGate(crypto, environment, props.hmac());
    }

    @Bean
    AdminCredentials adminCredentials(GatewayProperties props) {
        return AdminCredentials.resolve(props.admin().passwordHash(), props.admin().password());
    }

    @Bean
    SecurityEventLogger securityEventLogger(DeploymentEnvironment environment, Clock clock, MeterRegistry meterRegistry) {
        return new SecurityEventLogger(environment, clock, meterRegistry);
    }

    @Bean
    ClientIdentityResolver clientIdentityResolver() {
        return new ClientIdentityResolver();
    }

    @Bean
    GatewayResponses gatewayResponses(ObjectMapper objectMapper) {
        return new GatewayResponses(objectMapper);
    }

    @Bean
    AdminAuthService adminAuthService(
            AdminCredentials credentials,
            CryptoProvider crypto,
            RateLimiter limiter,
            RateLimitPolicies policies,
            RateLimitMetrics metrics,
            SecurityEventLogger events,
            Clock clock,
            GatewayProperties props
    ) {
        return new AdminAuthService(credentials, crypto, limiter, policies.adminLogin(), metrics, events, clock,
                props.admin().tokenTtl());
    }

    @Bean
    AdminAccessGuard adminAccessGuard(
            AdminAuthService auth,
            RateLimiter limiter,
            RateLimitPolicies policies,
            RateLimitMetrics metrics,
            SecurityEventLogger events,
            ClientIdentityResolver identities,
            GatewayResponses responses,
            Clock clock
    ) {
        return new AdminAccessGuard(auth, limiter, policies.adminApi(), metrics, events, identities, responses, clock);
    }

    @Bean
    FilterRegistrationBean<SecurityGatewayFilter> securityGatewayFilter(
            GatewayProperties props,
            DeploymentEnvironment environment,
            CryptoProvider crypto,
            CspPolicyBuilder csp,
            SecurityHeaderWriter headers,
            RateLimiter limiter,
            RateLimitPolicies policies,
            RateLimitMetrics metrics,
            HmacGate hmac,
            SecurityEventLogger events,
            ClientIdentityResolver identities,
            GatewayResponses responses,
            Clock clock
    ) {
        SecurityGatewayFilter filter = new SecurityGatewayFilter(
                environment, crypto, csp, props.csp().reportUri(), headers,
                limiter, policies, props.rateLimit().bypassPaths(), metrics,
                hmac, props.hmac().maxBodyBytes(),
                events, identities, responses, clock);

        FilterRegistrationBean<SecurityGatewayFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setOrder(GATEWAY_FILTER_ORDER);
        registration.addUrlPatterns("/*");
        return registration;
    }

    @Bean
    FilterRegistrationBean<AdminApiFilter> adminApiFilter(AdminAccessGuard guard) {
        FilterRegistrationBean<AdminApiFilter> registration = new FilterRegistrationBean<>(new AdminApiFilter(guard));
        registration.setOrder(ADMIN_FILTER_ORDER);
        registration.addUrlPatterns("/api/admin/*");
        return registration;
    }
}
