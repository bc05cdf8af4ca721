package org.budgetanalyzer.rateanalyzer.integration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.stubbing.Scenario;

import org.budgetanalyzer.rateanalyzer.base.AbstractWireMockTest;
import org.budgetanalyzer.rateanalyzer.domain.RatePoint;
import org.budgetanalyzer.rateanalyzer.domain.Trend;
import org.budgetanalyzer.rateanalyzer.fixture.TestConstants;
import org.budgetanalyzer.rateanalyzer.runner.RateAnalysisRunner;
import org.budgetanalyzer.rateanalyzer.service.ExchangeRateFetcher;
import org.budgetanalyzer.rateanalyzer.service.ExchangeRateSeriesService;
import org.budgetanalyzer.rateanalyzer.service.dto.RateResult;
import org.budgetanalyzer.rateanalyzer.service.dto.RateSource;
import org.budgetanalyzer.rateanalyzer.service.dto.UnavailableReason;

/**
 * End-to-end tests of the fetch, cache, normalize and analyze pipeline against a WireMock
 * provider.
 *
 * <p>The rate cache lives for the whole Spring context, so each test uses its own dates.
 */
@DisplayName("Rate Analysis Pipeline Integration Tests")
class RateAnalysisPipelineIntegrationTest extends AbstractWireMockTest {

  @Autowired private RateAnalysisRunner rateAnalysisRunner;

  @Autowired private ExchangeRateFetcher exchangeRateFetcher;

  @Autowired private ExchangeRateSeriesService exchangeRateSeriesService;

  @Autowired private ObjectMapper objectMapper;

  // ===========================================================================================
  // Happy Path
  // ===========================================================================================

  @Test
  @DisplayName("Should fetch, cache, analyze and report three days of rates")
  void shouldRunFullPipeline() throws IOException {
    // Given
    stubs.stubRate(TestConstants.DATE_2024_MAR_10, TestConstants.RATE_MAR_10);
    stubs.stubRate(TestConstants.DATE_2024_MAR_11, TestConstants.RATE_MAR_11);
    stubs.stubRate(TestConstants.DATE_2024_MAR_12, TestConstants.RATE_MAR_12);

    // When
    var statistics =
        rateAnalysisRunner.run(TestConstants.DATE_2024_MAR_10, TestConstants.DATE_2024_MAR_12);

    // Then
    assertThat(statistics).isPresent();
    assertThat(statistics.get().best().date()).isEqualTo(TestConstants.DATE_2024_MAR_12);
    assertThat(statistics.get().worst().date()).isEqualTo(TestConstants.DATE_2024_MAR_10);
    assertThat(statistics.get().trend()).isEqualTo(Trend.INCREASING);
    wireMockServer.verify(3, anyRequestedFor(anyUrl()));

    // cache file holds every fetched day
    var cacheFile = WORK_DIR.resolve("exchange_rates_cache.json");
    Map<String, BigDecimal> cached =
        objectMapper.readValue(cacheFile.toFile(), new TypeReference<Map<String, BigDecimal>>() {});
    assertThat(cached)
        .containsEntry("AUD_NZD_2024-03-10", TestConstants.RATE_MAR_10)
        .containsEntry("AUD_NZD_2024-03-11", TestConstants.RATE_MAR_11)
        .containsEntry("AUD_NZD_2024-03-12", TestConstants.RATE_MAR_12);

    // insights report was written
    try (var reports = Files.list(WORK_DIR.resolve("insights"))) {
      assertThat(reports)
          .anySatisfy(
              report ->
                  assertThat(report.getFileName().toString())
                      .startsWith("exchange_rate_insights_AUD_to_NZD_"));
    }

    // When - the same range again
    wireMockServer.resetRequests();
    var rerun =
        rateAnalysisRunner.run(TestConstants.DATE_2024_MAR_10, TestConstants.DATE_2024_MAR_12);

    // Then - served entirely from cache
    assertThat(rerun).isPresent();
    assertThat(rerun.get()).isEqualTo(statistics.get());
    wireMockServer.verify(0, anyRequestedFor(anyUrl()));
  }

  @Test
  @DisplayName("Should forward fill a day the provider cannot supply")
  void shouldForwardFillUnavailableDay() {
    // Given
    var day1 = LocalDate.of(2024, 4, 1);
    var day2 = LocalDate.of(2024, 4, 2);
    var day3 = LocalDate.of(2024, 4, 3);
    stubs.stubRate(day1, new BigDecimal("1.0801"));
    stubs.stubStatus(day2, 500);
    stubs.stubRate(day3, new BigDecimal("1.0850"));

    // When
    var statistics = rateAnalysisRunner.run(day1, day3);

    // Then
    assertThat(statistics).isPresent();
    assertThat(statistics.get().mean())
        .isCloseTo((1.0801 + 1.0801 + 1.0850) / 3, within(1e-9));
    wireMockServer.verify(1, getRequestedFor(urlPathEqualTo(TestConstants.historicalPath(day2))));
  }

  @Test
  @DisplayName("Should return empty when no day can be fetched")
  void shouldReturnEmptyWhenNoData() {
    // Given
    var day = LocalDate.of(2024, 5, 1);
    stubs.stubProviderFailure(day, 101, "invalid_access_key", "Invalid key");

    // When & Then
    assertThat(rateAnalysisRunner.run(day, day)).isEmpty();
  }

  @Test
  @DisplayName("Should leave a gap for a day the client cannot read and keep fetching")
  void shouldContinuePastUnreadableDay() {
    // Given
    var day1 = LocalDate.of(2022, 2, 1);
    var day2 = LocalDate.of(2022, 2, 2);
    var day3 = LocalDate.of(2022, 2, 3);
    stubs.stubRate(day1, new BigDecimal("1.1"));
    stubs.stubOversizedBody(day2, 2 * 1024 * 1024);
    stubs.stubRate(day3, new BigDecimal("1.3"));

    // When
    var series = exchangeRateSeriesService.fetchSeries(day1, day3);

    // Then
    assertThat(series.points())
        .containsExactly(
            new RatePoint(day1, new BigDecimal("1.1")), new RatePoint(day3, new BigDecimal("1.3")));
    wireMockServer.verify(1, getRequestedFor(urlPathEqualTo(TestConstants.historicalPath(day2))));
    wireMockServer.verify(1, getRequestedFor(urlPathEqualTo(TestConstants.historicalPath(day3))));
  }

  // ===========================================================================================
  // Retry Behavior
  // ===========================================================================================

  @Test
  @DisplayName("Should make exactly three requests with 2s and 4s backoff on persistent 503")
  void shouldRetryThreeTimesOnTransientFailure() {
    // Given
    var day = LocalDate.of(2023, 6, 1);
    stubs.stubStatus(day, 503);

    // When
    var result = exchangeRateFetcher.fetch(day);

    // Then
    assertThat(result).isInstanceOf(RateResult.Unavailable.class);
    assertThat(((RateResult.Unavailable) result).reason())
        .isEqualTo(UnavailableReason.RETRIES_EXHAUSTED);
    wireMockServer.verify(3, getRequestedFor(urlPathEqualTo(TestConstants.historicalPath(day))));
    assertThat(recordingSleeper.getDelays())
        .containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
  }

  @Test
  @DisplayName("Should make exactly one request on a hard provider error")
  void shouldNotRetryHardError() {
    // Given
    var day = LocalDate.of(2023, 6, 2);
    stubs.stubStatus(day, 500);

    // When
    var result = exchangeRateFetcher.fetch(day);

    // Then
    assertThat(((RateResult.Unavailable) result).reason())
        .isEqualTo(UnavailableReason.PROVIDER_ERROR);
    wireMockServer.verify(1, getRequestedFor(urlPathEqualTo(TestConstants.historicalPath(day))));
    assertThat(recordingSleeper.getDelays()).isEmpty();
  }

  @Test
  @DisplayName("Should make exactly one request when the rate is not a number")
  void shouldNotRetryNonNumericRate() {
    // Given
    var day = LocalDate.of(2023, 6, 4);
    stubs.stubNonNumericRate(day);

    // When
    var result = exchangeRateFetcher.fetch(day);

    // Then
    assertThat(((RateResult.Unavailable) result).reason())
        .isEqualTo(UnavailableReason.MISSING_RATE);
    wireMockServer.verify(1, getRequestedFor(urlPathEqualTo(TestConstants.historicalPath(day))));
    assertThat(recordingSleeper.getDelays()).isEmpty();
  }

  @Test
  @DisplayName("Should recover after a gateway outage and then serve from cache")
  void shouldRecoverAfterGatewayOutage() {
    // Given - first request gets a 503, second succeeds
    var day = LocalDate.of(2023, 6, 3);
    wireMockServer.stubFor(
        get(urlPathEqualTo(TestConstants.historicalPath(day)))
            .inScenario("flaky")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(503))
            .willSetStateTo("recovered"));
    wireMockServer.stubFor(
        get(urlPathEqualTo(TestConstants.historicalPath(day)))
            .inScenario("flaky")
            .whenScenarioStateIs("recovered")
            .willReturn(
                okJson(
                    "{\"success\":true,\"historical\":true,\"base\":\"AUD\","
                        + "\"date\":\"2023-06-03\",\"rates\":{\"NZD\":1.0912}}")));

    // When
    var first = exchangeRateFetcher.fetch(day);
    var second = exchangeRateFetcher.fetch(day);

    // Then
    assertThat(first)
        .isEqualTo(new RateResult.Available(day, new BigDecimal("1.0912"), RateSource.PROVIDER));
    assertThat(second)
        .isEqualTo(new RateResult.Available(day, new BigDecimal("1.0912"), RateSource.CACHE));
    wireMockServer.verify(2, getRequestedFor(urlPathEqualTo(TestConstants.historicalPath(day))));
    assertThat(recordingSleeper.getDelays()).containsExactly(Duration.ofSeconds(2));
  }
}
