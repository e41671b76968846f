package com.crypto.rebalance.indicator;

import java.util.ArrayList;
import java.util.List;

public class PriceStatistics {

    private PriceStatistics() {}

    /**
     * Last n elements of a price series (or the whole series if shorter).
     */
    public static List<Double> tail(List<Double> prices, int n) {
        if (prices.size() <= n) {
            return prices;
        }
        return prices.subList(prices.size() - n, prices.size());
    }

    /**
     * r[i] = p[i] / p[i-1] - 1
     */
    public static List<Double> dailyReturns(List<Double> prices) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < prices.size(); i++) {
            double previous = prices.get(i - 1);
            returns.add(previous == 0 ? 0.0 : prices.get(i) / previous - 1);
        }
        return returns;
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Population standard deviation.
     */
    public static double stdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double variance = 0.0;
        for (double value : values) {
            variance += (value - mean) * (value - mean);
        }
        return Math.sqrt(variance / values.size());
    }

    /**
     * Volatility = population stdev of daily returns.
     */
    public static double volatility(List<Double> prices) {
        if (prices.size() < 2) {
            return 0.0;
        }
        return stdDev(dailyReturns(prices));
    }

    /**
     * Trend = (last / first - 1) / window length
     */
    public static double trend(List<Double> prices) {
        if (prices.size() < 2 || prices.get(0) == 0) {
            return 0.0;
        }
        return (prices.get(prices.size() - 1) / prices.get(0) - 1) / prices.size();
    }

    /**
     * Pearson correlation of the daily returns of two equally long price series.
     * Returns 0 when lengths differ or either series is flat.
     */
    public static double returnCorrelation(List<Double> prices1, List<Double> prices2) {
        if (prices1.size() != prices2.size() || prices1.size() < 2) {
            return 0.0;
        }
        return correlation(dailyReturns(prices1), dailyReturns(prices2));
    }

    public static double correlation(List<Double> series1, List<Double> series2) {
        if (series1.size() != series2.size() || series1.isEmpty()) {
            return 0.0;
        }
        double mean1 = mean(series1);
        double mean2 = mean(series2);

        double numerator = 0.0;
        double sumSq1 = 0.0;
        double sumSq2 = 0.0;
        for (int i = 0; i < series1.size(); i++) {
            double d1 = series1.get(i) - mean1;
            double d2 = series2.get(i) - mean2;
            numerator += d1 * d2;
            sumSq1 += d1 * d1;
            sumSq2 += d2 * d2;
        }

        if (sumSq1 == 0 || sumSq2 == 0) {
            return 0.0;
        }
        return numerator / Math.sqrt(sumSq1 * sumSq2);
    }

    /**
     * R-squared of a least-squares line through (index, price).
     * Flat or degenerate series return 0.5, i.e. a neutral trend strength of 1.0
     * once shifted by {@link #trendStrength(List)}.
     */
    public static double rSquared(List<Double> prices) {
        int n = prices.size();
        if (n < 3) {
            return 0.5;
        }

        double xMean = (n - 1) / 2.0;
        double yMean = mean(prices);

        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < n; i++) {
            numerator += (i - xMean) * (prices.get(i) - yMean);
            denominator += (i - xMean) * (i - xMean);
        }
        if (denominator == 0) {
            return 0.5;
        }
        double slope = numerator / denominator;

        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < n; i++) {
            double predicted = yMean + slope * (i - xMean);
            ssRes += (prices.get(i) - predicted) * (prices.get(i) - predicted);
            ssTot += (prices.get(i) - yMean) * (prices.get(i) - yMean);
        }
        if (ssTot == 0) {
            return 0.5;
        }
        return 1 - ssRes / ssTot;
    }

    /**
     * Trend strength in [0.5, 1.5]: 0.5 + R-squared.
     */
    public static double trendStrength(List<Double> prices) {
        return 0.5 + Math.max(0.0, Math.min(1.0, rSquared(prices)));
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
