package org.budgetanalyzer.rateanalyzer.client.exchangerates;

import java.util.Objects;

import org.budgetanalyzer.rateanalyzer.client.exchangerates.response.HistoricalRatesResponse;

/**
 * Classified outcome of one request to the rates provider.
 *
 * <ul>
 *   <li>{@link Rates}: a 2xx response that the provider marked as successful
 *   <li>{@link TransientFailure}: timeouts, connection errors, throttling and gateway errors; worth
 *       retrying
 *   <li>{@link ProviderFailure}: the provider answered and refused; retrying will not help
 *   <li>{@link InvalidData}: a complete JSON body that does not fit the expected shape, such as a
 *       rate that is not a number; retrying will not help
 * </ul>
 */
public sealed interface ProviderResponse
    permits ProviderResponse.Rates,
        ProviderResponse.TransientFailure,
        ProviderResponse.ProviderFailure,
        ProviderResponse.InvalidData {

  record Rates(HistoricalRatesResponse body) implements ProviderResponse {
    public Rates {
      Objects.requireNonNull(body, "body");
    }
  }

  record TransientFailure(String message) implements ProviderResponse {}

  /**
   * @param statusCode HTTP status of the response
   * @param message provider error description
   */
  record ProviderFailure(int statusCode, String message) implements ProviderResponse {}

  record InvalidData(String message) implements ProviderResponse {}
}
