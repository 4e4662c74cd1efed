package com.llmrouter.security;

import com.llmrouter.service.KeyManager;
import com.llmrouter.service.TokenManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Turns request headers into a {@link CallerIdentity}.
 *
 * API keys are verified and touched; bearer tokens are verified only, their
 * use is not counted against the key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallerAuthenticator {

    private final CredentialExtractor credentialExtractor;
    private final KeyManager keyManager;
    private final TokenManager tokenManager;

    public Mono<CallerIdentity> authenticate(HttpHeaders headers) {
        return Mono.fromCallable(() -> credentialExtractor.extract(headers))
                .flatMap(this::authenticate);
    }

    public Mono<CallerIdentity> authenticate(Credential credential) {
        if (credential.getType() == Credential.Type.BEARER_TOKEN) {
            return tokenManager.verify(credential.getValue())
                    .map(claims -> CallerIdentity.viaToken(claims.getApiKey(), claims.getTokenId()));
        }
        return keyManager.verify(credential.getValue())
                .flatMap(keyManager::touch)
                .map(CallerIdentity::viaApiKey)
                .doOnNext(caller -> log.debug("Authenticated API key {}", caller.getApiKeyId()));
    }
}
