package org.budgetanalyzer.rateanalyzer.config;

import java.time.Duration;
import java.time.LocalDate;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "rate-analyzer")
@Validated
public class RateAnalyzerProperties {

  /** ISO 4217 code of the currency being converted from. */
  @NotBlank
  @Pattern(regexp = "[A-Z]{3}")
  private String baseCurrency = "AUD";

  /** ISO 4217 code of the currency being converted to. */
  @NotBlank
  @Pattern(regexp = "[A-Z]{3}")
  private String targetCurrency = "NZD";

  @Valid private Provider provider = new Provider();
  @Valid private Retry retry = new Retry();
  @Valid private Cache cache = new Cache();
  @Valid private Analysis analysis = new Analysis();
  @Valid private Report report = new Report();

  public String getBaseCurrency() {
    return baseCurrency;
  }

  public void setBaseCurrency(String baseCurrency) {
    this.baseCurrency = baseCurrency;
  }

  public String getTargetCurrency() {
    return targetCurrency;
  }

  public void setTargetCurrency(String targetCurrency) {
    this.targetCurrency = targetCurrency;
  }

  public Provider getProvider() {
    return provider;
  }

  public void setProvider(Provider provider) {
    this.provider = provider;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Analysis getAnalysis() {
    return analysis;
  }

  public void setAnalysis(Analysis analysis) {
    this.analysis = analysis;
  }

  public Report getReport() {
    return report;
  }

  public void setReport(Report report) {
    this.report = report;
  }

  public static class Provider {
    /** exchangeratesapi.io base URL, the date is appended as the last path segment. */
    @NotBlank private String baseUrl = "https://api.exchangeratesapi.io/v1";

    /** Access key - should be set via the EXCHANGE_RATE_API_KEY environment variable. */
    @NotBlank(message = "Exchange rate API access key must be configured")
    private String accessKey;

    /** Timeout in seconds for a single provider request. */
    @Min(1)
    @Max(120)
    private int timeoutSeconds = 30;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getAccessKey() {
      return accessKey;
    }

    public void setAccessKey(String accessKey) {
      this.accessKey = accessKey;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }
  }

  public static class Retry {
    /**
     * Maximum number of attempts per day (including the initial attempt). Example: max-attempts=3
     * means 1 initial + 2 retries.
     */
    @Min(1)
    @Max(10)
    private int maxAttempts = 3;

    /** Base of the exponential backoff; attempt n waits initial-backoff * 2^n. */
    @NotNull private Duration initialBackoff = Duration.ofSeconds(1);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }
  }

  public static class Cache {
    /** JSON file backing the durable cache layer. */
    @NotBlank private String file = "cache/exchange_rates_cache.json";

    public String getFile() {
      return file;
    }

    public void setFile(String file) {
      this.file = file;
    }
  }

  public static class Analysis {
    /** Whether to run the analysis once the application context is ready. */
    private boolean runOnStartup = true;

    /** Number of days before the end date to start from when no start date is given. */
    @Min(0)
    @Max(3650)
    private int lookbackDays = 30;

    /** Optional explicit start date (inclusive). */
    private LocalDate startDate;

    /** Optional explicit end date (inclusive), defaults to today. */
    private LocalDate endDate;

    /** Size of the trailing window for rolling mean and standard deviation. */
    @Min(2)
    @Max(365)
    private int rollingWindow = 7;

    public boolean isRunOnStartup() {
      return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
      this.runOnStartup = runOnStartup;
    }

    public int getLookbackDays() {
      return lookbackDays;
    }

    public void setLookbackDays(int lookbackDays) {
      this.lookbackDays = lookbackDays;
    }

    public LocalDate getStartDate() {
      return startDate;
    }

    public void setStartDate(LocalDate startDate) {
      this.startDate = startDate;
    }

    public LocalDate getEndDate() {
      return endDate;
    }

    public void setEndDate(LocalDate endDate) {
      this.endDate = endDate;
    }

    public int getRollingWindow() {
      return rollingWindow;
    }

    public void setRollingWindow(int rollingWindow) {
      this.rollingWindow = rollingWindow;
    }
  }

  public static class Report {
    /** Whether the insights text report is written. */
    private boolean enabled = true;

    /** Directory receiving insights reports. */
    @NotBlank private String directory = "insights";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getDirectory() {
      return directory;
    }

    public void setDirectory(String directory) {
      this.directory = directory;
    }
  }
}
