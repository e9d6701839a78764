package com.example.dynatrace.service;

import com.example.dynatrace.config.DynatraceApiConfig;
import com.example.dynatrace.exception.DynatraceApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Blocking HTTP access to one Dynatrace environment.
 * Every call is a single round trip. Non-2xx responses and connection failures surface as
 * {@link DynatraceApiException}; nothing is retried.
 */
@Component
public class DynatraceTransport {

    private static final Logger log = LoggerFactory.getLogger(DynatraceTransport.class);

    private static final String TOKEN_PREFIX = "Api-Token ";

    private final WebClient webClient;
    private final String environmentUrl;

    @Autowired
    public DynatraceTransport(WebClient.Builder webClientBuilder, DynatraceApiConfig config) {
        this(webClientBuilder, config.getEnvironmentUrl(), config.getApiToken());
        if (config.isConfigured()) {
            log.info("Dynatrace transport initialized for environment: {}", config.getEnvironmentUrl());
        } else {
            log.warn("Dynatrace environment is not configured. Set dynatrace.environment-url and dynatrace.api-token to enable.");
        }
    }

    public DynatraceTransport(WebClient.Builder webClientBuilder, String environmentUrl, String apiToken) {
        this.environmentUrl = environmentUrl;
        this.webClient = webClientBuilder.clone()
                .defaultHeader(HttpHeaders.AUTHORIZATION, TOKEN_PREFIX + apiToken)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    public String getEnvironmentUrl() {
        return environmentUrl;
    }

    public String get(String url) {
        return execute("GET", url, webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty(""));
    }

    /**
     * GET {@code <collectionUrl>/<id>}. The id is expanded as a URI variable, so it is encoded
     * rather than parsed as part of the path.
     */
    public String getById(String collectionUrl, String id) {
        return execute("GET", collectionUrl + "/" + id, webClient.get()
                .uri(collectionUrl + "/{id}", id)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty(""));
    }

    /**
     * Like {@link #getById} but treats 404 as an absent resource instead of a failure.
     */
    public Optional<String> getIfExists(String collectionUrl, String id) {
        return execute("GET", collectionUrl + "/" + id, webClient.get()
                .uri(collectionUrl + "/{id}", id)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(Optional::of)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.just(Optional.<String>empty())));
    }

    /**
     * POST a JSON body. The whole response is returned since some APIs answer a create
     * with an empty body and only a {@code Location} header.
     */
    public ResponseEntity<String> post(String url, String json) {
        return execute("POST", url, webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(json)
                .retrieve()
                .toEntity(String.class));
    }

    public String put(String collectionUrl, String id, String json) {
        return execute("PUT", collectionUrl + "/" + id, webClient.put()
                .uri(collectionUrl + "/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(json)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty(""));
    }

    public void delete(String collectionUrl, String id) {
        execute("DELETE", collectionUrl + "/" + id, webClient.delete()
                .uri(collectionUrl + "/{id}", id)
                .retrieve()
                .toBodilessEntity());
    }

    public String postMultipart(String url, MultiValueMap<String, ?> parts) {
        return execute("POST", url, webClient.post()
                .uri(url)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(parts))
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty(""));
    }

    private <T> T execute(String method, String url, Mono<T> call) {
        try {
            return call.block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            log.error("{} {} failed with status {}: {}", method, url, status, e.getResponseBodyAsString());
            throw new DynatraceApiException(
                    method + " " + url + " failed with status " + status + ": " + e.getResponseBodyAsString(),
                    status, "HTTP_" + status, e);
        } catch (WebClientRequestException e) {
            log.error("{} {} could not be completed: {}", method, url, e.getMessage());
            throw new DynatraceApiException(
                    method + " " + url + " could not be completed: " + e.getMessage(),
                    DynatraceApiException.NO_RESPONSE, "TRANSPORT_ERROR", e);
        }
    }
}
