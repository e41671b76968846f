package com.crypto.rebalance.binance;

import com.crypto.rebalance.market.PriceBar;
import com.crypto.rebalance.market.PriceHistoryProvider;
import com.google.common.util.concurrent.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Price-history collaborator backed by Binance klines.
 * Rate limited. Failed requests are retried; a successful empty response (pair not listed
 * for the window) and client errors are not. An empty list means "unavailable" to the caller.
 */
@Component
@Slf4j
public class BinancePriceHistoryProvider implements PriceHistoryProvider {

    private final BinanceClient binanceClient;
    private final RateLimiter rateLimiter;
    private final int maxRetries;
    private final long retryDelayMs;

    public BinancePriceHistoryProvider(BinanceClient binanceClient,
                                       @Value("${binance.api.requests-per-second:10}") double requestsPerSecond,
                                       @Value("${binance.api.max-retries:3}") int maxRetries,
                                       @Value("${binance.api.retry-delay-ms:2000}") long retryDelayMs) {
        this.binanceClient = binanceClient;
        // Binance allows 1200 requests per minute
        this.rateLimiter = RateLimiter.create(requestsPerSecond);
        this.maxRetries = Math.max(1, maxRetries);
        this.retryDelayMs = retryDelayMs;
    }

    @Override
    public List<PriceBar> getHistory(String symbol, String interval, int lookback) {
        return getHistory(symbol, interval, null, lookback);
    }

    @Override
    public List<PriceBar> getHistory(String symbol, String interval, LocalDateTime endTime, int lookback) {
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            rateLimiter.acquire();
            try {
                return binanceClient.fetchKlines(symbol, interval, endTime, lookback);
            } catch (HttpClientErrorException e) {
                log.warn("Kline request for {} rejected: {}", symbol, e.getMessage());
                return List.of();
            } catch (RestClientException e) {
                if (attempt == maxRetries) {
                    log.error("Kline request for {} failed after {} attempts: {}", symbol, maxRetries, e.getMessage());
                    return List.of();
                }
                log.warn("Kline request for {} failed, retry {}/{}: {}", symbol, attempt, maxRetries, e.getMessage());
            }

            try {
                Thread.sleep(retryDelayMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }
        return List.of();
    }
}
