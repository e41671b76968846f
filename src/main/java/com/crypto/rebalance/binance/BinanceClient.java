package com.crypto.rebalance.binance;

import com.crypto.rebalance.market.PriceBar;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class BinanceClient {

    private static final String QUOTE_ASSET = "USDT";
    private static final int MAX_LIMIT = 1000;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${binance.api.base-url:https://api.binance.com}")
    private String baseUrl;

    @Value("${binance.api.klines-endpoint:/api/v3/klines}")
    private String klinesEndpoint;

    /**
     * Fetch klines for {@code <coin>USDT}, oldest first.
     *
     * @param endTime last bar open time to include, or null for the latest bars
     * @return parsed bars; empty when the pair has no bars or the payload cannot be parsed
     * @throws RestClientException when the request fails
     */
    public List<PriceBar> fetchKlines(String coin, String interval, LocalDateTime endTime, int limit) {
        String symbol = coin + QUOTE_ASSET;
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl + klinesEndpoint)
                .queryParam("symbol", symbol)
                .queryParam("interval", interval)
                .queryParam("limit", Math.max(1, Math.min(limit, MAX_LIMIT)));

        if (endTime != null) {
            builder.queryParam("endTime", dateTimeToMillis(endTime));
        }

        String url = builder.toUriString();
        log.debug("Fetching klines from: {}", url);

        String response = restTemplate.getForObject(url, String.class);

        if (response == null || response.isBlank()) {
            log.warn("Empty kline response from Binance for {}", symbol);
            return Collections.emptyList();
        }

        return parseResponse(coin, response);
    }

    List<PriceBar> parseResponse(String coin, String response) {
        List<PriceBar> bars = new ArrayList<>();

        try {
            JsonNode root = objectMapper.readTree(response);

            if (root.isArray()) {
                for (JsonNode node : root) {
                    bars.add(PriceBar.builder()
                            .symbol(coin)
                            .openTime(millisToDateTime(node.get(0).asLong()))
                            .openPrice(new BigDecimal(node.get(1).asText()))
                            .highPrice(new BigDecimal(node.get(2).asText()))
                            .lowPrice(new BigDecimal(node.get(3).asText()))
                            .closePrice(new BigDecimal(node.get(4).asText()))
                            .volume(new BigDecimal(node.get(5).asText()))
                            .closeTime(millisToDateTime(node.get(6).asLong()))
                            .build());
                }
            } else {
                log.warn("Unexpected kline payload for {}: {}", coin, root);
            }

        } catch (Exception e) {
            log.error("Error parsing Binance kline response for {}: {}", coin, e.getMessage());
            return Collections.emptyList();
        }

        return bars;
    }

    private LocalDateTime millisToDateTime(long millis) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
    }

    public static long dateTimeToMillis(LocalDateTime dateTime) {
        return dateTime.toInstant(ZoneOffset.UTC).toEpochMilli();
    }
}
