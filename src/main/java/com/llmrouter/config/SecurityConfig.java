package com.llmrouter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrouter.security.CallerAuthenticator;
import com.llmrouter.security.CredentialAuthenticationFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.security.web.server.util.matcher.OrServerWebExchangeMatcher;
import org.springframework.security.web.server.util.matcher.PathPatternParserServerWebExchangeMatcher;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatcher;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Security configuration for API key and bearer token authentication.
 *
 * Public endpoints: service info, health, token exchange and key creation.
 */
@Configuration
@EnableWebFluxSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private static final String[] PUBLIC_PATHS = {"/", "/health", "/auth/**", "/actuator/**"};
    private static final String KEY_CREATION_PATH = "/v1/api-keys";

    private final CallerAuthenticator callerAuthenticator;
    private final ObjectMapper objectMapper;

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        CredentialAuthenticationFilter credentialFilter =
                new CredentialAuthenticationFilter(callerAuthenticator, publicEndpoints(), objectMapper);

        return http
            .csrf(ServerHttpSecurity.CsrfSpec::disable)
            .securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
            .authorizeExchange(exchanges -> exchanges
                // Public endpoints
                .pathMatchers(PUBLIC_PATHS).permitAll()
                .pathMatchers(HttpMethod.POST, KEY_CREATION_PATH).permitAll()
                // All other endpoints require authentication
                .anyExchange().authenticated()
            )
            .addFilterAt(credentialFilter, SecurityWebFiltersOrder.AUTHENTICATION)
            .exceptionHandling(handling -> handling
                .authenticationEntryPoint((exchange, ex) -> {
                    exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
                    exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    byte[] body = "{\"kind\":\"UNAUTHORIZED\",\"detail\":\"Authentication required\"}"
                            .getBytes(StandardCharsets.UTF_8);
                    return exchange.getResponse().writeWith(
                            Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
                }))
            .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
            .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
            .build();
    }

    static ServerWebExchangeMatcher publicEndpoints() {
        ServerWebExchangeMatcher[] matchers = new ServerWebExchangeMatcher[PUBLIC_PATHS.length + 1];
        for (int i = 0; i < PUBLIC_PATHS.length; i++) {
            matchers[i] = new PathPatternParserServerWebExchangeMatcher(PUBLIC_PATHS[i]);
        }
        matchers[PUBLIC_PATHS.length] = new PathPatternParserServerWebExchangeMatcher(KEY_CREATION_PATH, HttpMethod.POST);
        return new OrServerWebExchangeMatcher(matchers);
    }
}
