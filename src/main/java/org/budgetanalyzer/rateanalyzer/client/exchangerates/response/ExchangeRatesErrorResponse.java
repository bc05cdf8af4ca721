package org.budgetanalyzer.rateanalyzer.client.exchangerates.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExchangeRatesErrorResponse(Boolean success, ErrorDetail error) {

  /** Error payload, e.g. {@code {"code":104,"type":"usage_limit_reached","info":"..."}}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ErrorDetail(Integer code, String type, String info) {

    public String describe() {
      var message = info != null ? info : type != null ? type : "No error info";
      return code != null ? message + " (code " + code + ")" : message;
    }
  }
}
