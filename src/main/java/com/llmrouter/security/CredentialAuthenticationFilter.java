package com.llmrouter.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrouter.exception.ErrorKind;
import com.llmrouter.exception.InvalidCredentialsException;
import com.llmrouter.exception.KeyRevokedException;
import com.llmrouter.model.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatcher;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.UUID;

/**
 * Filter for API key and bearer token authentication.
 * Sets the {@link CallerIdentity} as principal in the security context.
 */
@Slf4j
@RequiredArgsConstructor
public class CredentialAuthenticationFilter implements WebFilter {

    private final CallerAuthenticator callerAuthenticator;
    private final ServerWebExchangeMatcher publicEndpoints;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        return publicEndpoints.matches(exchange)
                .flatMap(match -> match.isMatch()
                        ? chain.filter(exchange)
                        : authenticate(exchange, chain));
    }

    private Mono<Void> authenticate(ServerWebExchange exchange, WebFilterChain chain) {
        return callerAuthenticator.authenticate(exchange.getRequest().getHeaders())
                .map(caller -> {
                    UsernamePasswordAuthenticationToken authentication =
                            new UsernamePasswordAuthenticationToken(caller, null, Collections.emptyList());
                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
                })
                .onErrorResume(error -> Mono.just(reject(exchange, error)))
                .flatMap(next -> next);
    }

    private Mono<Void> reject(ServerWebExchange exchange, Throwable error) {
        HttpStatus status;
        ErrorKind kind;
        String detail;
        if (error instanceof KeyRevokedException) {
            status = HttpStatus.UNAUTHORIZED;
            kind = ErrorKind.KEY_REVOKED;
            detail = error.getMessage();
            log.warn("Rejected revoked credential: {}", error.getMessage());
        } else if (error instanceof InvalidCredentialsException) {
            status = HttpStatus.UNAUTHORIZED;
            kind = ErrorKind.UNAUTHORIZED;
            detail = error.getMessage();
            log.warn("Credential verification failed: {}", error.getMessage());
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            kind = ErrorKind.INTERNAL_ERROR;
            detail = "Internal server error";
            log.error("Authentication failed unexpectedly", error);
        }
        return writeError(exchange.getResponse(), status, ErrorResponse.builder()
                .kind(kind)
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build());
    }

    private Mono<Void> writeError(ServerHttpResponse response, HttpStatus status, ErrorResponse body) {
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        if (status == HttpStatus.UNAUTHORIZED) {
            response.getHeaders().set("WWW-Authenticate", "Bearer");
        }
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error response", e);
            bytes = body.getDetail().getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
