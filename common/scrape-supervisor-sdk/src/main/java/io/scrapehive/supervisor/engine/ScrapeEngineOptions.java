package io.scrapehive.supervisor.engine;

/**
 * Engine-wide options fixed at engine creation.
 *
 * @param extraMetrics emit additional per-scrape series
 * @param userAgent    User-Agent header sent with every scrape request
 */
public record ScrapeEngineOptions(boolean extraMetrics, String userAgent) {
}
