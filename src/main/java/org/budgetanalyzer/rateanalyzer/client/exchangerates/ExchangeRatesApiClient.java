package org.budgetanalyzer.rateanalyzer.client.exchangerates;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Set;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.Exceptions;

import org.budgetanalyzer.rateanalyzer.client.exchangerates.response.ExchangeRatesErrorResponse;
import org.budgetanalyzer.rateanalyzer.client.exchangerates.response.HistoricalRatesResponse;
import org.budgetanalyzer.rateanalyzer.config.RateAnalyzerProperties;
import org.budgetanalyzer.rateanalyzer.exception.ClientException;

/**
 * Client for the exchangeratesapi.io historical rates endpoint.
 *
 * <p>Issues exactly one HTTP request per call and never retries; retry policy belongs to the
 * caller. Every outcome is classified into a {@link ProviderResponse} instead of being thrown, so
 * the caller can tell retryable transport problems from provider refusals.
 */
@Component
public class ExchangeRatesApiClient {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRatesApiClient.class);

  private static final String USER_AGENT = "RateAnalyzerClient/1.0";

  /** Statuses signalling the provider or a gateway is temporarily unable to answer. */
  private static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(408, 429, 502, 503, 504);

  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final WebClient webClient;
  private final String accessKey;
  private final Duration timeout;
  private final ObjectMapper objectMapper;

  public ExchangeRatesApiClient(
      WebClient.Builder webClientBuilder,
      RateAnalyzerProperties properties,
      ObjectMapper objectMapper) {

    var providerConfig = properties.getProvider();

    // properties have @Validated but double checking
    if (providerConfig.getAccessKey() == null || providerConfig.getAccessKey().isBlank()) {
      throw new IllegalArgumentException("Exchange rate API access key must be configured");
    }

    this.accessKey = providerConfig.getAccessKey();
    this.timeout = Duration.ofSeconds(providerConfig.getTimeoutSeconds());
    this.webClient =
        webClientBuilder
            .baseUrl(providerConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();
    this.objectMapper = objectMapper;

    log.info("ExchangeRatesApiClient initialized with base URL: {}", providerConfig.getBaseUrl());
  }

  /**
   * Requests the rate between two currencies on one day.
   *
   * @param date the day to request, sent as the last path segment
   * @param baseCurrency ISO 4217 code sent as {@code base}
   * @param targetCurrency ISO 4217 code sent as {@code symbols}
   * @return the classified response
   * @throws ClientException on a failure that is neither transport nor provider related
   */
  public ProviderResponse getHistoricalRates(
      LocalDate date, String baseCurrency, String targetCurrency) {
    log.info("Requesting historical rate {} -> {} for {}", baseCurrency, targetCurrency, date);

    try {
      var response =
          webClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path("/{date}")
                          .queryParam("access_key", accessKey)
                          .queryParam("base", baseCurrency)
                          .queryParam("symbols", targetCurrency)
                          .build(date.toString()))
              .accept(MediaType.APPLICATION_JSON)
              .exchangeToMono(
                  clientResponse ->
                      clientResponse
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .map(body -> classify(clientResponse.statusCode(), body, date)))
              .timeout(timeout)
              .block();

      if (response == null) {
        throw new ClientException("Received null response from exchange rate API for " + date);
      }

      return response;
    } catch (ClientException ce) {
      throw ce;
    } catch (RuntimeException e) {
      var cause = Exceptions.unwrap(e);
      if (isTransportFailure(cause)) {
        log.warn("Transport failure requesting rate for {}: {}", date, cause.toString());
        return new ProviderResponse.TransientFailure(cause.toString());
      }

      log.warn("Unexpected error requesting rate for {}: {}", date, e.getMessage(), e);
      throw new ClientException("Failed to fetch exchange rate for " + date, cause);
    }
  }

  private ProviderResponse classify(HttpStatusCode status, String body, LocalDate date) {
    if (status.is2xxSuccessful()) {
      return classifySuccessfulStatus(status, body, date);
    }

    var errorMessage = parseErrorMessage(body);
    log.warn("Exchange rate API error for {}: HTTP {} - {}", date, status.value(), errorMessage);

    if (TRANSIENT_STATUS_CODES.contains(status.value())) {
      return new ProviderResponse.TransientFailure("HTTP " + status.value() + ": " + errorMessage);
    }
    return new ProviderResponse.ProviderFailure(status.value(), errorMessage);
  }

  private ProviderResponse classifySuccessfulStatus(
      HttpStatusCode status, String body, LocalDate date) {
    if (body.isBlank()) {
      return new ProviderResponse.TransientFailure("Empty response body");
    }

    HistoricalRatesResponse response;
    try {
      response = objectMapper.readValue(body, HistoricalRatesResponse.class);
    } catch (JsonParseException e) {
      // Truncated or garbled transfer, another attempt may well succeed
      log.warn("Could not parse exchange rate response for {}: {}", date, e.getOriginalMessage());
      return new ProviderResponse.TransientFailure("Unreadable response body: " + truncate(body));
    } catch (JsonProcessingException e) {
      // Valid JSON with the wrong content, the provider will send the same thing again
      log.warn("Unexpected exchange rate data for {}: {}", date, e.getOriginalMessage());
      return new ProviderResponse.InvalidData(
          "Unusable response data: " + e.getOriginalMessage());
    }

    if (response == null) {
      return new ProviderResponse.TransientFailure("Empty response body");
    }

    if (!response.isSuccess()) {
      var message = response.error() != null ? response.error().describe() : "No error info";
      log.warn("Exchange rate API reported failure for {}: {}", date, message);
      return new ProviderResponse.ProviderFailure(status.value(), message);
    }

    log.debug("Successfully fetched exchange rate data for {}: {}", date, response.rates());
    return new ProviderResponse.Rates(response);
  }

  private String parseErrorMessage(String body) {
    if (body == null || body.isBlank()) {
      return "No response body";
    }

    try {
      var errorResponse = objectMapper.readValue(body, ExchangeRatesErrorResponse.class);
      if (errorResponse != null && errorResponse.error() != null) {
        return errorResponse.error().describe();
      }
    } catch (JsonProcessingException e) {
      // Not JSON or doesn't match our error structure, keep the raw body as the message
      log.debug("Could not parse exchange rate error response as JSON: {}", e.getMessage());
    }

    return truncate(body);
  }

  private static String truncate(String body) {
    if (body.length() > MAX_ERROR_BODY_LENGTH) {
      return body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)";
    }
    return body;
  }

  private static boolean isTransportFailure(Throwable cause) {
    return cause instanceof WebClientException
        || cause instanceof TimeoutException
        || cause instanceof IOException;
  }
}
