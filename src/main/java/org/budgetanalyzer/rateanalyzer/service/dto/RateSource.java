package org.budgetanalyzer.rateanalyzer.service.dto;

/** Where an available rate was read from. */
public enum RateSource {
  CACHE,
  PROVIDER,
}
