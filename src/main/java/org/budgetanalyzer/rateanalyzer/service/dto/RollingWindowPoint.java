package org.budgetanalyzer.rateanalyzer.service.dto;

import java.time.LocalDate;

/**
 * Value of a rolling statistic for the window ending on {@code date}.
 *
 * @param date last day of the trailing window
 * @param value the statistic computed over the window
 */
public record RollingWindowPoint(LocalDate date, double value) {}
