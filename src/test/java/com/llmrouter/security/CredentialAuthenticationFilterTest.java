package com.llmrouter.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrouter.exception.InvalidApiKeyException;
import com.llmrouter.exception.KeyRevokedException;
import com.llmrouter.model.entity.ApiKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpMethod;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.web.server.util.matcher.PathPatternParserServerWebExchangeMatcher;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CredentialAuthenticationFilter.
 */
@ExtendWith(MockitoExtension.class)
class CredentialAuthenticationFilterTest {

    @Mock
    private CallerAuthenticator callerAuthenticator;

    private CredentialAuthenticationFilter filter;
    private final AtomicReference<Object> principal = new AtomicReference<>();
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new CredentialAuthenticationFilter(callerAuthenticator,
                new PathPatternParserServerWebExchangeMatcher("/health"), new ObjectMapper());
        chain = exchange -> ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .map(Authentication::getPrincipal)
                .doOnNext(principal::set)
                .then();
    }

    @Test
    void filter_PublicPathSkipsAuthentication() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/health"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        verifyNoInteractions(callerAuthenticator);
        assertThat(exchange.getResponse().getStatusCode()).isNull();
    }

    @Test
    void filter_AuthenticatedCallerBecomesPrincipal() {
        CallerIdentity caller = CallerIdentity.viaApiKey(ApiKey.builder().id("ak_1").name("alice").active(true).build());
        when(callerAuthenticator.authenticate(any(HttpHeaders.class))).thenReturn(Mono.just(caller));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/v1/models")
                .header(HttpHeaders.AUTHORIZATION, "Bearer llm-router-abc"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(principal.get()).isSameAs(caller);
    }

    @Test
    void filter_InvalidCredentialIs401WithJsonBody() {
        when(callerAuthenticator.authenticate(any(HttpHeaders.class)))
                .thenReturn(Mono.error(new InvalidApiKeyException()));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest
                .method(HttpMethod.POST, "/v1/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer llm-router-wrong"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        StepVerifier.create(exchange.getResponse().getBodyAsString())
                .assertNext(body -> assertThat(body)
                        .contains("\"kind\":\"UNAUTHORIZED\"")
                        .contains("Invalid or expired API key")
                        .doesNotContain("llm-router-wrong"))
                .verifyComplete();
        assertThat(principal.get()).isNull();
    }

    @Test
    void filter_RevokedKeyIsReportedAsRevoked() {
        when(callerAuthenticator.authenticate(any(HttpHeaders.class)))
                .thenReturn(Mono.error(new KeyRevokedException("ak_1")));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/v1/usage")
                .header(HttpHeaders.AUTHORIZATION, "Bearer eyJ.x.y"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        StepVerifier.create(exchange.getResponse().getBodyAsString())
                .assertNext(body -> assertThat(body).contains("\"kind\":\"KEY_REVOKED\""))
                .verifyComplete();
    }

    @Test
    void filter_UnexpectedFailureIs500WithoutDetails() {
        when(callerAuthenticator.authenticate(any(HttpHeaders.class)))
                .thenReturn(Mono.error(new IllegalStateException("connection pool exhausted")));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/v1/usage")
                .header(HttpHeaders.AUTHORIZATION, "Bearer llm-router-abc"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        StepVerifier.create(exchange.getResponse().getBodyAsString())
                .assertNext(body -> assertThat(body).doesNotContain("connection pool"))
                .verifyComplete();
    }
}
