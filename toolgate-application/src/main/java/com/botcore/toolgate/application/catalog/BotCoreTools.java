package com.botcore.toolgate.application.catalog;

import com.botcore.toolgate.application.tuning.TuningTools;
import com.botcore.toolgate.domain.tool.ArgumentSpec;
import com.botcore.toolgate.domain.tool.HttpMethod;
import com.botcore.toolgate.domain.tool.Tier;
import com.botcore.toolgate.domain.tool.ToolDefinition;

import java.util.List;

import static com.botcore.toolgate.application.config.GatewaySettings.PYTHON;
import static com.botcore.toolgate.application.config.GatewaySettings.RUST;
import static com.botcore.toolgate.domain.tool.ArgType.ANY;
import static com.botcore.toolgate.domain.tool.ArgType.ARRAY;
import static com.botcore.toolgate.domain.tool.ArgType.NUMBER;
import static com.botcore.toolgate.domain.tool.ArgType.OBJECT;
import static com.botcore.toolgate.domain.tool.ArgType.STRING;
import static com.botcore.toolgate.domain.tool.ArgumentSpec.body;
import static com.botcore.toolgate.domain.tool.ArgumentSpec.optional;
import static com.botcore.toolgate.domain.tool.ArgumentSpec.required;
import static com.botcore.toolgate.domain.tool.ArgumentSpec.requiredOneOf;
import static com.botcore.toolgate.domain.tool.HttpMethod.DELETE;
import static com.botcore.toolgate.domain.tool.HttpMethod.GET;
import static com.botcore.toolgate.domain.tool.HttpMethod.POST;
import static com.botcore.toolgate.domain.tool.HttpMethod.PUT;
import static com.botcore.toolgate.domain.tool.Tier.AUTHENTICATED;
import static com.botcore.toolgate.domain.tool.Tier.CRITICAL;
import static com.botcore.toolgate.domain.tool.Tier.PUBLIC;
import static com.botcore.toolgate.domain.tool.Tier.SENSITIVE;

/**
 * Central place for the bot-core tool set.
 * Later move to a declarative file once tools are added by operators.
 *
 * Every tool declares its arguments; arguments not listed here never reach a backend.
 */
public final class BotCoreTools {

    public static final String MARKET = "market";
    public static final String PAPER_TRADING = "paper-trading";
    public static final String REAL_TRADING = "real-trading";
    public static final String AI = "ai";
    public static final String SETTINGS = "settings";
    public static final String HEALTH = "health";

    static final String[] TIMEFRAMES = {"1m", "5m", "15m", "30m", "1h", "4h", "1d"};
    static final String[] SIDES = {"buy", "sell"};

    private static final String PAPER = "/api/paper-trading";

    private BotCoreTools() {}

    public static ToolCatalog catalog() {
        ToolCatalog c = new ToolCatalog();

        // health (no backend credential needed)
        c.register(tool("check_rust_health", "Check trading engine health", PUBLIC, HEALTH, RUST, GET, "/api/health", 10_000L, true));
        c.register(tool("check_python_health", "Check AI service health", PUBLIC, HEALTH, PYTHON, GET, "/health", 10_000L, true));
        c.register(tool("get_system_monitoring", "CPU, memory and connection stats of the trading engine", AUTHENTICATED, HEALTH, RUST, GET, "/api/monitoring/system", 10_000L, false));

        // market data
        c.register(tool("get_market_prices", "Latest prices for tracked symbols", AUTHENTICATED, MARKET, RUST, GET, "/api/market/prices", 10_000L, false));
        c.register(tool("get_market_overview", "Market overview across tracked symbols", AUTHENTICATED, MARKET, RUST, GET, "/api/market/overview", 10_000L, false));
        c.register(tool("get_candles", "OHLCV candles for a symbol and timeframe", AUTHENTICATED, MARKET, RUST, GET, "/api/market/candles/{symbol}/{timeframe}", 15_000L, false,
                required("symbol", STRING), requiredOneOf("timeframe", TIMEFRAMES), optional("limit", NUMBER)));
        c.register(tool("get_chart", "Chart data with indicators for a symbol and timeframe", AUTHENTICATED, MARKET, RUST, GET, "/api/market/chart/{symbol}/{timeframe}", 15_000L, false,
                required("symbol", STRING), requiredOneOf("timeframe", TIMEFRAMES), optional("limit", NUMBER)));
        c.register(tool("get_multi_charts", "Chart data for several symbols at once", AUTHENTICATED, MARKET, RUST, GET, "/api/market/charts", 20_000L, false,
                optional("symbols", ARRAY)));
        c.register(tool("get_symbols", "Symbols tracked by the engine", AUTHENTICATED, MARKET, RUST, GET, "/api/market/symbols", 5_000L, false));
        c.register(tool("add_symbol", "Start tracking a symbol", SENSITIVE, MARKET, RUST, POST, "/api/market/symbols", null, false,
                required("symbol", STRING)));
        c.register(tool("remove_symbol", "Stop tracking a symbol", SENSITIVE, MARKET, RUST, DELETE, "/api/market/symbols/{symbol}", null, false,
                required("symbol", STRING)));

        // paper trading: engine and positions
        c.register(tool("get_paper_trading_status", "Paper trading engine status", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/status", null, false));
        c.register(tool("get_paper_portfolio", "Paper portfolio and performance", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/portfolio", null, false));
        c.register(tool("get_paper_open_trades", "Open paper trades", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/trades/open", null, false));
        c.register(tool("get_paper_closed_trades", "Closed paper trades with realized P&L", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/trades/closed", 10_000L, false));
        c.register(tool("get_paper_pending_orders", "Pending paper orders not yet executed", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/pending-orders", 10_000L, false));
        c.register(tool("start_paper_engine", "Start the paper trading engine", AUTHENTICATED, PAPER_TRADING, RUST, POST, PAPER + "/start", null, false));
        c.register(tool("stop_paper_engine", "Stop the paper trading engine", AUTHENTICATED, PAPER_TRADING, RUST, POST, PAPER + "/stop", null, false));
        c.register(tool("create_paper_order", "Place a simulated order", AUTHENTICATED, PAPER_TRADING, RUST, POST, PAPER + "/orders", 10_000L, false,
                orderArguments(optional("stop_price", NUMBER))));
        c.register(tool("close_paper_trade", "Close a paper trade at the current price", AUTHENTICATED, PAPER_TRADING, RUST, POST, PAPER + "/trades/{trade_id}/close", 10_000L, false,
                required("trade_id", STRING)));
        c.register(tool("cancel_paper_order", "Cancel a pending paper order", AUTHENTICATED, PAPER_TRADING, RUST, DELETE, PAPER + "/pending-orders/{order_id}", 10_000L, false,
                required("order_id", STRING)));
        c.register(tool("reset_paper_account", "Reset the paper account to its initial balance", SENSITIVE, PAPER_TRADING, RUST, POST, PAPER + "/reset", null, false));

        // paper trading: signals and analyses
        c.register(tool("get_paper_signals_history", "Signals generated by the paper strategies", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/signals-history", 10_000L, false));
        c.register(tool("get_paper_latest_signals", "Most recent paper signals", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/latest-signals", 10_000L, false));
        c.register(tool("get_paper_trade_analyses", "AI analyses of closed paper trades", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/trade-analyses", 15_000L, false));
        c.register(tool("get_paper_trade_analysis", "AI analysis of one closed paper trade", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/trade-analyses/{trade_id}", 15_000L, false,
                required("trade_id", STRING)));
        c.register(tool("get_paper_config_suggestions", "AI configuration suggestions from paper performance", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/config-suggestions", 15_000L, false));
        c.register(tool("get_paper_latest_config_suggestions", "Most recent AI configuration suggestions", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/config-suggestions/latest", 15_000L, false));
        c.register(tool("trigger_paper_analysis", "Run AI analysis of recent closed paper trades", AUTHENTICATED, PAPER_TRADING, RUST, POST, PAPER + "/trigger-analysis", 30_000L, false));

        // paper trading: settings
        c.register(tool("get_paper_strategy_settings", "Strategy thresholds and enable flags", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/strategy-settings", 10_000L, false));
        c.register(tool("get_paper_basic_settings", "Balance, sizing, leverage and risk settings", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/basic-settings", 10_000L, false));
        c.register(tool("get_paper_symbols", "Per-symbol settings overriding the global defaults", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/symbols", 10_000L, false));
        c.register(tool("get_paper_indicator_settings", "Technical indicator periods and thresholds", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/indicator-settings", 10_000L, false));
        c.register(tool("get_paper_execution_settings", "Simulated execution settings", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/execution-settings", 10_000L, false));
        c.register(tool("get_paper_ai_settings", "AI integration settings of the paper engine", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/ai-settings", 10_000L, false));
        c.register(tool("get_paper_notification_settings", "Paper trading notification settings", AUTHENTICATED, PAPER_TRADING, RUST, GET, PAPER + "/notification-settings", 10_000L, false));
        c.register(tool("update_paper_settings", "Update generic paper trading settings", SENSITIVE, PAPER_TRADING, RUST, PUT, PAPER + "/settings", 10_000L, false,
                body("settings")));
        c.register(tool("update_paper_strategy_settings", "Update strategy thresholds and enable flags", SENSITIVE, PAPER_TRADING, RUST, PUT, PAPER + "/strategy-settings", 10_000L, false,
                body("settings")));
        c.register(tool("update_paper_basic_settings", "Update balance, sizing, leverage and risk settings", SENSITIVE, PAPER_TRADING, RUST, PUT, PAPER + "/basic-settings", 10_000L, false,
                body("settings")));
        c.register(tool("update_paper_symbols", "Update per-symbol settings", SENSITIVE, PAPER_TRADING, RUST, PUT, PAPER + "/symbols", 10_000L, false,
                required("symbols", OBJECT)));
        c.register(tool("update_paper_indicator_settings", "Update indicator periods and thresholds", SENSITIVE, PAPER_TRADING, RUST, PUT, PAPER + "/indicator-settings", 10_000L, false,
                body("settings")));
        c.register(tool("update_paper_execution_settings", "Update simulated execution settings", SENSITIVE, PAPER_TRADING, RUST, PUT, PAPER + "/execution-settings", 10_000L, false,
                body("settings")));
        c.register(tool("update_paper_ai_settings", "Update AI integration settings of the paper engine", SENSITIVE, PAPER_TRADING, RUST, PUT, PAPER + "/ai-settings", 10_000L, false,
                body("settings")));
        c.register(tool("update_paper_notification_settings", "Update paper trading notification settings", AUTHENTICATED, PAPER_TRADING, RUST, PUT, PAPER + "/notification-settings", 10_000L, false,
                body("settings")));
        c.register(tool("update_paper_signal_interval", "Seconds between signal generation cycles", AUTHENTICATED, PAPER_TRADING, RUST, PUT, PAPER + "/signal-interval", 10_000L, false,
                required("interval_seconds", NUMBER)));

        // real trading (real money)
        c.register(tool("get_real_trading_status", "Real trading engine status", AUTHENTICATED, REAL_TRADING, RUST, GET, "/api/real-trading/status", null, false));
        c.register(tool("get_real_portfolio", "Real portfolio, balance and open positions", AUTHENTICATED, REAL_TRADING, RUST, GET, "/api/real-trading/portfolio", null, false));
        c.register(tool("get_real_open_trades", "Open real trades", AUTHENTICATED, REAL_TRADING, RUST, GET, "/api/real-trading/trades/open", null, false));
        c.register(tool("get_real_closed_trades", "Closed real trades", AUTHENTICATED, REAL_TRADING, RUST, GET, "/api/real-trading/trades/closed", null, false));
        c.register(tool("get_real_orders", "Active orders on the real account", AUTHENTICATED, REAL_TRADING, RUST, GET, "/api/real-trading/orders", null, false));
        c.register(tool("get_real_trading_settings", "Real trading risk and sizing settings", AUTHENTICATED, REAL_TRADING, RUST, GET, "/api/real-trading/settings", null, false));
        c.register(tool("start_real_engine", "Start executing real trades with real money", CRITICAL, REAL_TRADING, RUST, POST, "/api/real-trading/start", null, false));
        c.register(tool("stop_real_engine", "Stop opening new real trades; open positions stay open", SENSITIVE, REAL_TRADING, RUST, POST, "/api/real-trading/stop", null, false));
        c.register(tool("place_order", "Create a real order on the exchange", CRITICAL, REAL_TRADING, RUST, POST, "/api/real-trading/orders", null, false,
                orderArguments()));
        c.register(tool("close_real_trade", "Close a real trade at market price", CRITICAL, REAL_TRADING, RUST, POST, "/api/real-trading/trades/{trade_id}/close", null, false,
                required("trade_id", STRING)));
        c.register(tool("cancel_real_order", "Cancel one pending real order", SENSITIVE, REAL_TRADING, RUST, DELETE, "/api/real-trading/orders/{id}", null, false,
                required("id", STRING)));
        c.register(tool("cancel_all_real_orders", "Cancel every pending real order on all symbols", CRITICAL, REAL_TRADING, RUST, DELETE, "/api/real-trading/orders/all", null, false));
        c.register(tool("update_real_trading_settings", "Update real trading risk settings", CRITICAL, REAL_TRADING, RUST, PUT, "/api/real-trading/settings", null, false,
                body("settings")));
        c.register(tool("update_real_position_sltp", "Move stop-loss / take-profit of an open position", SENSITIVE, REAL_TRADING, RUST, PUT, "/api/real-trading/positions/{symbol}/sltp", null, false,
                required("symbol", STRING), optional("stop_loss", NUMBER), optional("take_profit", NUMBER)));

        // AI
        c.register(tool("get_ai_info", "AI service model information", PUBLIC, AI, RUST, GET, "/api/ai/info", null, true));
        c.register(tool("get_ai_strategies", "Strategies known to the AI service", AUTHENTICATED, AI, RUST, GET, "/api/ai/strategies", null, false));
        c.register(tool("analyze_market", "GPT market analysis for a symbol", AUTHENTICATED, AI, RUST, POST, "/api/ai/analyze", 120_000L, false,
                required("symbol", STRING), optional("timeframe", STRING)));
        c.register(tool("get_strategy_recommendations", "AI strategy recommendations for a symbol", AUTHENTICATED, AI, RUST, POST, "/api/ai/strategy-recommendations", 60_000L, false,
                required("symbol", STRING)));
        c.register(tool("get_market_condition", "AI assessment of market condition", AUTHENTICATED, AI, RUST, POST, "/api/ai/market-condition", 60_000L, false,
                required("symbol", STRING)));
        c.register(tool("send_ai_feedback", "Rate an AI signal to improve future ones", AUTHENTICATED, AI, RUST, POST, "/api/ai/feedback", null, false,
                required("signal_id", STRING), requiredOneOf("feedback", "positive", "negative"), optional("comment", STRING)));
        c.register(tool("get_ai_performance", "Model accuracy and performance", AUTHENTICATED, AI, PYTHON, GET, "/ai/performance", null, false));
        c.register(tool("get_ai_cost_statistics", "GPT usage cost statistics", AUTHENTICATED, AI, PYTHON, GET, "/ai/cost/statistics", null, false));
        c.register(tool("get_ai_storage_stats", "Size of the stored AI analyses", AUTHENTICATED, AI, PYTHON, GET, "/ai/storage/stats", null, false));
        c.register(tool("get_ai_config_suggestions", "Configuration suggestions from the AI service", AUTHENTICATED, AI, PYTHON, GET, "/ai/config-suggestions", null, false));
        c.register(tool("get_ai_analysis_history", "History of GPT analyses", AUTHENTICATED, AI, PYTHON, GET, "/ai/gpt4-analysis-history", null, false));
        c.register(tool("clear_ai_storage", "Delete stored AI analyses", SENSITIVE, AI, PYTHON, POST, "/ai/storage/clear", null, false));

        // settings
        c.register(tool("get_api_keys_status", "Which exchange API keys are configured (values masked)", AUTHENTICATED, SETTINGS, RUST, GET, "/api/settings/api-keys", null, false));
        c.register(tool("update_api_keys", "Replace the exchange API keys", CRITICAL, SETTINGS, RUST, POST, "/api/settings/api-keys", null, false,
                required("exchange", STRING), required("api_key", STRING), required("secret_key", STRING)));
        c.register(tool("delete_api_keys", "Remove the exchange API keys", CRITICAL, SETTINGS, RUST, DELETE, "/api/settings/api-keys", null, false));
        c.register(tool("test_api_keys", "Check the stored exchange API keys against the exchange", AUTHENTICATED, SETTINGS, RUST, POST, "/api/settings/api-keys/test", null, false));
        c.register(tool("get_notification_preferences", "Notification preferences", AUTHENTICATED, SETTINGS, RUST, GET, "/api/notifications/preferences", null, false));
        c.register(tool("update_notification_preferences", "Update notification preferences", AUTHENTICATED, SETTINGS, RUST, PUT, "/api/notifications/preferences", null, false,
                body("preferences")));
        c.register(tool("subscribe_push_notifications", "Register a browser push subscription", AUTHENTICATED, SETTINGS, RUST, POST, "/api/notifications/push/subscribe", null, false,
                body("subscription")));
        c.register(tool("unsubscribe_push_notifications", "Remove the browser push subscription", AUTHENTICATED, SETTINGS, RUST, DELETE, "/api/notifications/push/subscribe", null, false));
        c.register(tool("test_notification", "Send a test notification", AUTHENTICATED, SETTINGS, RUST, POST, "/api/notifications/test", null, false));
        c.register(tool("get_vapid_key", "Public VAPID key for browser push", AUTHENTICATED, SETTINGS, RUST, GET, "/api/notifications/vapid-key", null, false));

        // self-tuning, answered in-process; writes go to the paper engine
        c.register(tool(TuningTools.GET_PARAMETER_BOUNDS, "Tunable parameters with ranges, tiers and cooldowns", AUTHENTICATED, SETTINGS, ToolDefinition.IN_PROCESS, GET, "/tuning/bounds", null, false));
        c.register(tool(TuningTools.APPLY_GREEN, "Apply a GREEN tier parameter change (auto-applied, user is notified)", AUTHENTICATED, SETTINGS, ToolDefinition.IN_PROCESS, PUT, "/tuning/green", null, false,
                required("parameter", STRING), required("new_value", ANY), required("reasoning", STRING)));
        c.register(tool(TuningTools.REQUEST_YELLOW, "Apply a YELLOW tier parameter change after confirmation", SENSITIVE, SETTINGS, ToolDefinition.IN_PROCESS, PUT, "/tuning/yellow", null, false,
                required("parameter", STRING), required("new_value", NUMBER), required("reasoning", STRING)));
        c.register(tool(TuningTools.REQUEST_RED, "Apply a RED tier parameter change after explicit approval", CRITICAL, SETTINGS, ToolDefinition.IN_PROCESS, PUT, "/tuning/red", null, false,
                required("parameter", STRING), required("new_value", ANY), required("reasoning", STRING), required("risk_assessment", STRING)));

        return c;
    }

    private static ArgumentSpec[] orderArguments(ArgumentSpec... extra) {
        List<ArgumentSpec> base = List.of(
                required("symbol", STRING),
                requiredOneOf("side", SIDES),
                required("order_type", STRING),
                optional("quantity", NUMBER),
                optional("price", NUMBER));
        ArgumentSpec[] out = base.toArray(new ArgumentSpec[base.size() + extra.length]);
        System.arraycopy(extra, 0, out, base.size(), extra.length);
        return out;
    }

    private static ToolDefinition tool(String name, String description, Tier tier, String category, String service,
                                       HttpMethod method, String path, Long timeoutMs, boolean skipAuth,
                                       ArgumentSpec... arguments) {
        return new ToolDefinition(name, null, description, tier, category, service, method, path, timeoutMs, skipAuth,
                List.of(arguments));
    }
}
