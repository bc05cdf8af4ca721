package org.budgetanalyzer.rateanalyzer.client.exchangerates.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of the exchangeratesapi.io {@code /{date}} endpoint.
 *
 * <p>A provider-side failure still arrives as HTTP 200 with {@code success=false} and an {@code
 * error} object, so callers must check {@link #isSuccess()} before reading rates.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoricalRatesResponse(
    Boolean success,
    Boolean historical,
    Long timestamp,
    String base,
    LocalDate date,
    Map<String, BigDecimal> rates,
    ExchangeRatesErrorResponse.ErrorDetail error) {

  /** An absent {@code success} flag counts as success. */
  public boolean isSuccess() {
    return success == null || success;
  }

  /**
   * Returns the rate quoted for a currency.
   *
   * @param currencyCode ISO 4217 code of the target currency
   * @return the rate, empty if the response carries no rate for that currency
   */
  public Optional<BigDecimal> findRate(String currencyCode) {
    if (rates == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(rates.get(currencyCode));
  }
}
