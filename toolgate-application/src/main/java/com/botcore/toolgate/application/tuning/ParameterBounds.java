package com.botcore.toolgate.application.tuning;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.botcore.toolgate.application.tuning.TuningTier.GREEN;
import static com.botcore.toolgate.application.tuning.TuningTier.RED;
import static com.botcore.toolgate.application.tuning.TuningTier.YELLOW;

/**
 * Central place for the tunable engine parameters and their hard bounds.
 * Changing a range here is a code review, not a runtime decision.
 */
public final class ParameterBounds {

    public static final String BASIC_SETTINGS = "/api/paper-trading/basic-settings";
    public static final String SIGNAL_INTERVAL = "/api/paper-trading/signal-interval";
    public static final String ENGINE_START = "/api/paper-trading/start";
    public static final String ENGINE_STOP = "/api/paper-trading/stop";

    static final long ONE_HOUR = 60 * 60 * 1000L;
    static final long SIX_HOURS = 6 * ONE_HOUR;

    private static final Map<String, ParameterBound> BOUNDS = build();

    private ParameterBounds() {}

    public static Optional<ParameterBound> find(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(BOUNDS.get(key));
    }

    public static Collection<ParameterBound> all() {
        return BOUNDS.values();
    }

    /** Every tier is present, possibly with an empty list. */
    public static Map<TuningTier, List<ParameterBound>> byTier() {
        Map<TuningTier, List<ParameterBound>> grouped = new EnumMap<>(TuningTier.class);
        for (TuningTier t : TuningTier.values()) {
            grouped.put(t, new ArrayList<>());
        }
        for (ParameterBound b : BOUNDS.values()) {
            grouped.get(b.tier()).add(b);
        }
        return grouped;
    }

    private static Map<String, ParameterBound> build() {
        Map<String, ParameterBound> m = new LinkedHashMap<>();

        // GREEN: auto-adjust + notify
        put(m, number("rsi_oversold", "RSI Oversold Threshold", GREEN, 20, 40, 1, BASIC_SETTINGS, "rsi_oversold",
                "RSI level below which a symbol is considered oversold (buy signal)", 30, SIX_HOURS));
        put(m, number("rsi_overbought", "RSI Overbought Threshold", GREEN, 60, 80, 1, BASIC_SETTINGS, "rsi_overbought",
                "RSI level above which a symbol is considered overbought (sell signal)", 70, SIX_HOURS));
        put(m, number("signal_interval_minutes", "Signal Generation Interval", GREEN, 3, 30, 1, SIGNAL_INTERVAL, "interval_seconds",
                "Minutes between signal generation cycles", 5, ONE_HOUR));
        put(m, number("confidence_threshold", "Signal Confidence Threshold", GREEN, 0.50, 0.90, 0.05, BASIC_SETTINGS, "confidence_threshold",
                "Minimum confidence score required to act on a trading signal", 0.65, SIX_HOURS));
        put(m, new ParameterBound("data_resolution", "Data Resolution / Timeframe", GREEN, ParameterType.ENUM,
                null, null, null, List.of("1m", "3m", "5m", "15m", "30m", "1h", "4h", "1d"),
                BASIC_SETTINGS, "data_resolution",
                "Timeframe for trading signal analysis and kline data", "15m", ONE_HOUR));
        put(m, number("stop_loss_percent", "Stop Loss % (PnL-based)", GREEN, 1.0, 20.0, 0.5, BASIC_SETTINGS, "stop_loss_percent",
                "PnL percentage to trigger stop loss. Actual price move = this / leverage", 10.0, SIX_HOURS));
        put(m, number("take_profit_percent", "Take Profit % (PnL-based)", GREEN, 2.0, 40.0, 1.0, BASIC_SETTINGS, "take_profit_percent",
                "PnL percentage to trigger take profit. Actual price move = this / leverage", 20.0, SIX_HOURS));
        put(m, number("min_required_indicators", "Min Required Indicators", GREEN, 2, 5, 1, BASIC_SETTINGS, "min_required_indicators",
                "Minimum indicators that must agree per timeframe before trading. 2=aggressive, 5=conservative", 4, SIX_HOURS));
        put(m, number("min_required_timeframes", "Min Required Timeframes", GREEN, 1, 4, 1, BASIC_SETTINGS, "min_required_timeframes",
                "Minimum timeframes that must agree before trading. 1=aggressive, 4=conservative", 3, SIX_HOURS));

        // YELLOW: capital at risk, confirmation required
        put(m, number("position_size_percent", "Position Size %", YELLOW, 1.0, 10.0, 0.5, BASIC_SETTINGS, "position_size_percent",
                "Percentage of portfolio allocated per trade", 5.0, SIX_HOURS));
        put(m, number("max_positions", "Max Concurrent Positions", YELLOW, 1, 8, 1, BASIC_SETTINGS, "max_positions",
                "Maximum number of simultaneous open positions", 4, SIX_HOURS));
        put(m, number("leverage", "Leverage", YELLOW, 1, 20, 1, BASIC_SETTINGS, "leverage",
                "Trading leverage multiplier", 10, SIX_HOURS));

        // RED: explicit critical approval
        put(m, number("max_daily_loss_percent", "Max Daily Loss %", RED, 3.0, 15.0, 1.0, BASIC_SETTINGS, "max_daily_loss_percent",
                "Maximum daily portfolio loss before trading is paused", 10.0, SIX_HOURS));
        put(m, new ParameterBound("engine_running", "Paper Trading Engine On/Off", RED, ParameterType.BOOLEAN,
                null, null, null, List.of(), ENGINE_START, "_action",
                "Start or stop the paper trading engine", false, ONE_HOUR));

        return Collections.unmodifiableMap(m);
    }

    private static ParameterBound number(String key, String name, TuningTier tier, double min, double max, double step,
                                         String endpoint, String field, String description, Object defaultValue,
                                         long cooldownMs) {
        return new ParameterBound(key, name, tier, ParameterType.NUMBER, min, max, step, List.of(),
                endpoint, field, description, defaultValue, cooldownMs);
    }

    private static void put(Map<String, ParameterBound> m, ParameterBound b) {
        if (m.putIfAbsent(b.key(), b) != null) {
            throw new IllegalStateException("Duplicate tunable parameter: " + b.key());
        }
    }
}
