package com.llmrouter.service;

import com.llmrouter.config.GatewayProperties;
import com.llmrouter.exception.InvalidTokenException;
import com.llmrouter.exception.KeyRevokedException;
import com.llmrouter.exception.ResourceNotFoundException;
import com.llmrouter.model.dto.TokenResponse;
import com.llmrouter.model.entity.ApiKey;
import com.llmrouter.repository.ApiKeyRepository;
import com.llmrouter.util.ApiKeyUtil;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import com.nimbusds.jose.proc.BadJWSException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.security.oauth2.jwt.NimbusReactiveJwtDecoder;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Issues, verifies and refreshes HS256-signed bearer tokens bound to an API key.
 *
 * <p>Tokens are stateless. Every verification re-reads the key they name, so a
 * deactivated key invalidates its outstanding tokens on their next use.
 * There is no denylist: {@link #revoke(String)} only checks the token.
 */
@Slf4j
@Service
public class TokenManager {

    static final String TOKEN_TYPE = "access";
    static final String NAME_CLAIM = "name";
    static final String TYPE_CLAIM = "type";

    private static final int MIN_SECRET_BYTES = 32;

    private final ApiKeyRepository apiKeyRepository;
    private final GatewayProperties.Tokens properties;
    private final Clock clock;
    private final JwtEncoder jwtEncoder;
    private final ReactiveJwtDecoder jwtDecoder;

    public TokenManager(ApiKeyRepository apiKeyRepository, GatewayProperties gatewayProperties, Clock clock) {
        this.apiKeyRepository = apiKeyRepository;
        this.properties = gatewayProperties.getTokens();
        this.clock = clock;

        SecretKey signingKey = signingKey(properties.getSecret());
        this.jwtEncoder = new NimbusJwtEncoder(new ImmutableSecret<>(signingKey));

        NimbusReactiveJwtDecoder decoder = NimbusReactiveJwtDecoder.withSecretKey(signingKey)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        // Expiry is checked against the injected clock in verifyClaims
        decoder.setJwtValidator(jwt -> OAuth2TokenValidatorResult.success());
        this.jwtDecoder = decoder;
    }

    /**
     * Issue a token for an API key.
     *
     * @param apiKeyId Subject key
     * @param ttl Requested lifetime, clamped to the configured bounds; null means the default
     */
    public Mono<TokenResponse> issue(String apiKeyId, Duration ttl) {
        return apiKeyRepository.findById(apiKeyId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("API key", apiKeyId)))
                .flatMap(key -> key.isActive()
                        ? Mono.just(key)
                        : Mono.<ApiKey>error(new KeyRevokedException(apiKeyId)))
                .map(key -> encode(key, clamp(ttl)));
    }

    /**
     * Verify a token and re-check that its key is still active.
     *
     * @return claims, {@link InvalidTokenException} for malformed, badly signed or expired tokens,
     * {@link KeyRevokedException} when the token is sound but its key is gone or inactive
     */
    public Mono<TokenClaims> verify(String token) {
        return Mono.defer(() -> jwtDecoder.decode(token))
                .onErrorMap(JwtException.class, this::classify)
                .flatMap(this::verifyClaims)
                .flatMap(claims -> apiKeyRepository.findByIdAndActiveTrue(claims.getApiKeyId())
                        .switchIfEmpty(Mono.error(() -> new KeyRevokedException(claims.getApiKeyId())))
                        .map(key -> TokenClaims.builder()
                                .apiKeyId(claims.getApiKeyId())
                                .apiKeyName(claims.getApiKeyName())
                                .tokenId(claims.getTokenId())
                                .issuedAt(claims.getIssuedAt())
                                .expiresAt(claims.getExpiresAt())
                                .apiKey(key)
                                .build()));
    }

    /**
     * Exchange a valid token for a new one with the default lifetime.
     */
    public Mono<TokenResponse> refresh(String oldToken) {
        return verify(oldToken)
                .flatMap(claims -> issue(claims.getApiKeyId(), properties.getDefaultTtl()));
    }

    /**
     * Confirm a token is valid. The token is NOT invalidated and stays usable until it expires.
     */
    public Mono<TokenClaims> revoke(String token) {
        return verify(token)
                .doOnNext(claims -> log.info("Revoke requested for token {} of key {}; token remains valid until {}",
                        claims.getTokenId(), claims.getApiKeyId(), claims.getExpiresAt()));
    }

    Duration clamp(Duration ttl) {
        if (ttl == null) {
            return properties.getDefaultTtl();
        }
        if (ttl.compareTo(properties.getMinTtl()) < 0) {
            return properties.getMinTtl();
        }
        if (ttl.compareTo(properties.getMaxTtl()) > 0) {
            return properties.getMaxTtl();
        }
        return ttl;
    }

    private TokenResponse encode(ApiKey key, Duration ttl) {
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl);

        JwtClaimsSet claims = JwtClaimsSet.builder()
                .subject(key.getId())
                .claim(NAME_CLAIM, key.getName())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .id(ApiKeyUtil.randomHex(16))
                .claim(TYPE_CLAIM, TOKEN_TYPE)
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();

        log.info("Issued token for key {} expiring at {}", key.getId(), expiresAt);
        return TokenResponse.builder()
                .accessToken(token)
                .tokenType("bearer")
                .expiresIn(ttl.toSeconds())
                .expiresAt(expiresAt)
                .apiKeyId(key.getId())
                .apiKeyName(key.getName())
                .build();
    }

    private Mono<TokenClaims> verifyClaims(Jwt jwt) {
        Instant expiresAt = jwt.getExpiresAt();
        if (jwt.getSubject() == null || expiresAt == null
                || !TOKEN_TYPE.equals(jwt.getClaimAsString(TYPE_CLAIM))) {
            return Mono.error(new InvalidTokenException(InvalidTokenException.Reason.MALFORMED));
        }
        if (!clock.instant().isBefore(expiresAt)) {
            log.debug("Token {} expired at {}", jwt.getId(), expiresAt);
            return Mono.error(new InvalidTokenException(InvalidTokenException.Reason.EXPIRED));
        }
        return Mono.just(TokenClaims.builder()
                .apiKeyId(jwt.getSubject())
                .apiKeyName(jwt.getClaimAsString(NAME_CLAIM))
                .tokenId(jwt.getId())
                .issuedAt(jwt.getIssuedAt())
                .expiresAt(expiresAt)
                .build());
    }

    private InvalidTokenException classify(JwtException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof BadJWSException) {
                log.warn("Rejected token with invalid signature");
                return new InvalidTokenException(InvalidTokenException.Reason.BAD_SIGNATURE, e);
            }
        }
        log.warn("Rejected malformed token: {}", e.getMessage());
        return new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, e);
    }

    private static SecretKey signingKey(String secret) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("gateway.tokens.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }
}
