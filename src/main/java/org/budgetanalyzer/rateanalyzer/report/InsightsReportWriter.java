package org.budgetanalyzer.rateanalyzer.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import org.budgetanalyzer.rateanalyzer.config.RateAnalyzerProperties;
import org.budgetanalyzer.rateanalyzer.domain.RateSeries;
import org.budgetanalyzer.rateanalyzer.exception.ServiceException;
import org.budgetanalyzer.rateanalyzer.service.dto.RateStatistics;

/**
 * Writes a plain text summary of an analysis to the report directory.
 *
 * <p>File name: {@code exchange_rate_insights_{BASE}_to_{TARGET}_{yyyy-MM-dd_HH-mm-ss}.txt}.
 */
@Component
@ConditionalOnProperty(
    prefix = "rate-analyzer.report",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class InsightsReportWriter implements RateAnalysisSink {

  private static final Logger log = LoggerFactory.getLogger(InsightsReportWriter.class);

  static final String HEADER = "Exchange Rate Analysis Insights:";

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

  private final Path directory;
  private final String currencyPair;
  private final Clock clock;

  public InsightsReportWriter(RateAnalyzerProperties properties, Clock clock) {
    this.directory = Path.of(properties.getReport().getDirectory());
    this.currencyPair = properties.getBaseCurrency() + "_to_" + properties.getTargetCurrency();
    this.clock = clock;
  }

  @Override
  public void accept(RateSeries series, RateStatistics statistics) {
    write(statistics);
  }

  /**
   * Writes the report file.
   *
   * @param statistics the statistics to summarize
   * @return path of the written file
   * @throws ServiceException if the file cannot be written
   */
  public Path write(RateStatistics statistics) {
    var insights = render(statistics);
    var fileName =
        "exchange_rate_insights_"
            + currencyPair
            + "_"
            + LocalDateTime.now(clock).format(FILE_TIMESTAMP)
            + ".txt";
    var file = directory.resolve(fileName);

    try {
      Files.createDirectories(directory);
      Files.writeString(file, HEADER + "\n\n" + insights, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ServiceException("Failed to write insights report " + file, e);
    }

    log.info("{}\n{}", HEADER, insights);
    log.info("Insights generated and saved successfully in {}", file);
    return file;
  }

  /** Renders the insight lines, without the header. */
  public String render(RateStatistics statistics) {
    var lines = new ArrayList<String>();
    lines.add(
        "Best Rate: "
            + statistics.best().rate().toPlainString()
            + " on "
            + statistics.best().date());
    lines.add(
        "Worst Rate: "
            + statistics.worst().rate().toPlainString()
            + " on "
            + statistics.worst().date());
    lines.add("Average Rate over the period: " + fourDecimals(statistics.mean()));
    lines.add(
        statistics
            .findVolatilityPeak()
            .map(
                peak ->
                    "Highest volatility observed on: "
                        + peak.date()
                        + " with a standard deviation of "
                        + fourDecimals(peak.value()))
            .orElse(
                "Highest volatility: not available (fewer than "
                    + statistics.rollingWindow()
                    + " days of data)"));
    lines.add("The overall trend in the exchange rate is " + statistics.trend().getLabel());
    return String.join("\n", lines);
  }

  private static String fourDecimals(double value) {
    return String.format(Locale.ROOT, "%.4f", value);
  }
}
