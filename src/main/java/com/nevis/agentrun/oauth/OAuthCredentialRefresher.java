package com.nevis.agentrun.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.agentrun.config.OAuthProperties;
import com.nevis.agentrun.exception.FatalExecutionException;
import com.nevis.agentrun.exception.RetriableExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * OAuth2 {@code refresh_token} grant against the configured token endpoint.
 */
@Slf4j
@Component
public class OAuthCredentialRefresher implements CredentialRefresher {

    static final String ACCESS_TOKEN = "access_token";
    static final String REFRESH_TOKEN = "refresh_token";
    static final String EXPIRES_AT = "expires_at";

    private final RestClient restClient;
    private final OAuthProperties properties;

    public OAuthCredentialRefresher(RestClient.Builder restClientBuilder, OAuthProperties properties) {
        this.restClient = restClientBuilder.build();
        this.properties = properties;
    }

    record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expires_in") Long expiresIn
    ) {}

    @Override
    public Map<String, Object> refresh(String ownerId, Map<String, Object> currentCredentials) {
        Object refreshToken = currentCredentials.get(REFRESH_TOKEN);
        if (refreshToken == null || refreshToken.toString().isBlank()) {
            throw new FatalExecutionException("No refresh token stored for " + ownerId + "; re-authorization required");
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add(REFRESH_TOKEN, refreshToken.toString());
        if (properties.clientId() != null) {
            form.add("client_id", properties.clientId());
        }
        if (properties.clientSecret() != null) {
            form.add("client_secret", properties.clientSecret());
        }

        TokenResponse response;
        try {
            response = restClient.post()
                .uri(properties.tokenUri())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(TokenResponse.class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.BAD_REQUEST)
                || e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)) {
                throw new FatalExecutionException("Refresh token rejected for " + ownerId + ": " + e.getStatusCode(), e);
            }
            throw new RetriableExecutionException("Token endpoint returned " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new RetriableExecutionException("Token endpoint unavailable: " + e.getMessage(), e);
        }

        if (response == null || response.accessToken() == null) {
            throw new RetriableExecutionException("Token endpoint returned no access token");
        }

        Map<String, Object> refreshed = new HashMap<>(currentCredentials);
        refreshed.put(ACCESS_TOKEN, response.accessToken());
        if (response.refreshToken() != null) {
            refreshed.put(REFRESH_TOKEN, response.refreshToken());
        }
        if (response.expiresIn() != null) {
            refreshed.put(EXPIRES_AT, Instant.now().plusSeconds(response.expiresIn()).getEpochSecond());
        } else {
            refreshed.remove(EXPIRES_AT);
        }

        log.info("Refreshed credentials for {}", ownerId);
        return refreshed;
    }
}
