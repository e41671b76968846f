package com.crypto.rebalance.strategy;

import com.crypto.rebalance.indicator.PriceStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Two-state capital protection controller: unprotected (crypto allocation) or
 * protected (100% reserve).
 *
 * Entry needs at least two risk signals, or a single cumulative decline of 12% or worse:
 * <ul>
 *   <li>cumulative decline over the capital window &lt;= -8%</li>
 *   <li>2+ consecutive losing cycles</li>
 *   <li>3-cycle average market volatility &gt; 6%</li>
 *   <li>5-cycle cumulative loss &lt;= -12%</li>
 *   <li>sentiment &lt; 0.3</li>
 *   <li>accelerating decline: r[-1] - r[-3] &lt; -5%</li>
 * </ul>
 * Exit needs at least two recovery signals, or a single market recovery of 6% or more:
 * <ul>
 *   <li>market recovery &gt;= 3%</li>
 *   <li>2 consecutive positive market cycles</li>
 *   <li>3-cycle average market volatility &lt; 3%</li>
 *   <li>sentiment &gt; 0.6</li>
 *   <li>3-cycle market momentum &gt; 2%</li>
 * </ul>
 * After an exit, re-entry is blocked for a cooldown of 3 evaluations (2 after a strong recovery).
 * One instance per simulation run.
 */
@Slf4j
public class CapitalProtection {

    static final int CAPITAL_WINDOW = 30;
    static final int RETURN_WINDOW = 10;

    static final double CUMULATIVE_DECLINE_THRESHOLD = -0.08;
    static final double SEVERE_DECLINE_THRESHOLD = -0.12;
    static final int CONSECUTIVE_LOSS_THRESHOLD = 2;
    static final double HIGH_VOLATILITY_THRESHOLD = 0.06;
    static final double FIVE_DAY_LOSS_THRESHOLD = -0.12;
    static final double LOW_SENTIMENT_THRESHOLD = 0.3;
    static final double ACCELERATING_DECLINE_THRESHOLD = -0.05;

    static final double RECOVERY_THRESHOLD = 0.03;
    static final double STRONG_RECOVERY_THRESHOLD = 0.06;
    static final double LOW_VOLATILITY_THRESHOLD = 0.03;
    static final double HIGH_SENTIMENT_THRESHOLD = 0.6;
    static final double MOMENTUM_THRESHOLD = 0.02;

    static final int COOLDOWN_CYCLES = 3;
    static final int STRONG_RECOVERY_COOLDOWN_CYCLES = 2;

    private static final double INITIAL_SENTIMENT = 0.5;

    private final Deque<Double> capitalHistory = new ArrayDeque<>();
    private final Deque<Double> portfolioReturns = new ArrayDeque<>();
    private final Deque<Double> marketReturns = new ArrayDeque<>();

    private boolean protectionActive;
    private int cooldownRemaining;
    private int consecutiveLosses;
    private double sentiment = INITIAL_SENTIMENT;

    public CapitalProtection(double startingCapital) {
        capitalHistory.addLast(startingCapital);
    }

    /**
     * Record the outcome of a finished cycle.
     *
     * @param capital         capital at the end of the cycle
     * @param portfolioReturn net return of the portfolio for the cycle
     * @param marketReturn    average return of the reference assets for the cycle
     */
    public void recordCycle(double capital, double portfolioReturn, double marketReturn) {
        push(capitalHistory, capital, CAPITAL_WINDOW);
        push(portfolioReturns, portfolioReturn, RETURN_WINDOW);
        push(marketReturns, marketReturn, RETURN_WINDOW);

        if (!protectionActive) {
            consecutiveLosses = portfolioReturn < 0 ? consecutiveLosses + 1 : 0;
        }
        updateSentiment(protectionActive ? marketReturn : portfolioReturn);
    }

    /**
     * Evaluate entry or exit once per cycle, before allocations are computed.
     */
    public ProtectionDecision evaluate() {
        if (protectionActive) {
            List<String> signals = exitSignals();
            double recovery = lastOf(marketReturns);
            boolean strongRecovery = recovery >= STRONG_RECOVERY_THRESHOLD;

            if (signals.size() >= 2 || strongRecovery) {
                protectionActive = false;
                consecutiveLosses = 0;
                cooldownRemaining = strongRecovery && signals.size() < 2
                        ? STRONG_RECOVERY_COOLDOWN_CYCLES
                        : COOLDOWN_CYCLES;
                log.info("Capital protection EXITED: signals={}, recovery={}, cooldown={}",
                        signals, String.format("%.2f%%", recovery * 100), cooldownRemaining);
                return ProtectionDecision.EXITED;
            }
            return ProtectionDecision.STAY_PROTECTED;
        }

        if (cooldownRemaining > 0) {
            cooldownRemaining--;
            return ProtectionDecision.COOLDOWN;
        }

        List<String> signals = entrySignals();
        double decline = cumulativeDecline();
        if (signals.size() >= 2 || decline <= SEVERE_DECLINE_THRESHOLD) {
            protectionActive = true;
            log.info("Capital protection ENTERED: signals={}, decline={}",
                    signals, String.format("%.2f%%", decline * 100));
            return ProtectionDecision.ENTERED;
        }
        return ProtectionDecision.STAY_UNPROTECTED;
    }

    List<String> entrySignals() {
        List<String> signals = new ArrayList<>();
        List<Double> returns = new ArrayList<>(portfolioReturns);

        if (cumulativeDecline() <= CUMULATIVE_DECLINE_THRESHOLD) {
            signals.add("cumulative_decline");
        }
        if (consecutiveLosses >= CONSECUTIVE_LOSS_THRESHOLD) {
            signals.add("consecutive_losses");
        }
        if (marketReturns.size() >= 3 && averageVolatility() > HIGH_VOLATILITY_THRESHOLD) {
            signals.add("high_volatility");
        }
        if (returns.size() >= 5 && sum(PriceStatistics.tail(returns, 5)) <= FIVE_DAY_LOSS_THRESHOLD) {
            signals.add("five_day_loss");
        }
        if (sentiment < LOW_SENTIMENT_THRESHOLD) {
            signals.add("low_sentiment");
        }
        if (returns.size() >= 3
                && returns.get(returns.size() - 1) - returns.get(returns.size() - 3) < ACCELERATING_DECLINE_THRESHOLD) {
            signals.add("accelerating_decline");
        }
        return signals;
    }

    List<String> exitSignals() {
        List<String> signals = new ArrayList<>();
        List<Double> market = new ArrayList<>(marketReturns);
        if (market.isEmpty()) {
            return signals;
        }

        if (lastOf(marketReturns) >= RECOVERY_THRESHOLD) {
            signals.add("market_recovery");
        }
        if (market.size() >= 2 && market.get(market.size() - 1) > 0 && market.get(market.size() - 2) > 0) {
            signals.add("consecutive_positive");
        }
        if (market.size() >= 3 && averageVolatility() < LOW_VOLATILITY_THRESHOLD) {
            signals.add("low_volatility");
        }
        if (sentiment > HIGH_SENTIMENT_THRESHOLD) {
            signals.add("high_sentiment");
        }
        if (market.size() >= 3 && sum(PriceStatistics.tail(market, 3)) > MOMENTUM_THRESHOLD) {
            signals.add("positive_momentum");
        }
        return signals;
    }

    /**
     * Capital change from the start of the rolling window to the latest value.
     */
    public double cumulativeDecline() {
        double first = capitalHistory.peekFirst();
        double last = capitalHistory.peekLast();
        return first <= 0 ? 0.0 : last / first - 1;
    }

    private double averageVolatility() {
        List<Double> recent = PriceStatistics.tail(new ArrayList<>(marketReturns), 3);
        double total = 0.0;
        for (double value : recent) {
            total += Math.abs(value);
        }
        return recent.isEmpty() ? 0.0 : total / recent.size();
    }

    private void updateSentiment(double performance) {
        double delta;
        if (performance > 0.05) {
            delta = 0.1;
        } else if (performance > 0.02) {
            delta = 0.05;
        } else if (performance > -0.02) {
            delta = 0.0;
        } else if (performance > -0.05) {
            delta = -0.05;
        } else {
            delta = -0.1;
        }

        List<Double> market = new ArrayList<>(marketReturns);
        if (market.size() >= 3) {
            double momentum = sum(PriceStatistics.tail(market, 3));
            if (momentum > 0.06) {
                delta += 0.05;
            } else if (momentum < -0.06) {
                delta -= 0.05;
            }
        }

        sentiment = PriceStatistics.clamp(sentiment + delta, 0.0, 1.0);
    }

    private static void push(Deque<Double> deque, double value, int maxSize) {
        deque.addLast(value);
        while (deque.size() > maxSize) {
            deque.removeFirst();
        }
    }

    private static double lastOf(Deque<Double> deque) {
        return deque.isEmpty() ? 0.0 : deque.peekLast();
    }

    private static double sum(List<Double> values) {
        double total = 0.0;
        for (double value : values) {
            total += value;
        }
        return total;
    }

    public boolean isProtectionActive() {
        return protectionActive;
    }

    public int getCooldownRemaining() {
        return cooldownRemaining;
    }

    public int getConsecutiveLosses() {
        return consecutiveLosses;
    }

    public double getSentiment() {
        return sentiment;
    }
}
