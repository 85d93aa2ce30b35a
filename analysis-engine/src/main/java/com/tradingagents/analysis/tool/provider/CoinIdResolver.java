package com.tradingagents.analysis.tool.provider;

import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolFailureException;

import java.util.Locale;
import java.util.Map;

/**
 * Maps exchange ticker symbols to CoinGecko coin ids.
 */
public final class CoinIdResolver {

    private static final Map<String, String> SYMBOL_TO_ID = Map.ofEntries(
        Map.entry("BTC",   "bitcoin"),
        Map.entry("ETH",   "ethereum"),
        Map.entry("SOL",   "solana"),
        Map.entry("MATIC", "matic-network"),
        Map.entry("AVAX",  "avalanche-2"),
        Map.entry("BNB",   "binancecoin"),
        Map.entry("ADA",   "cardano"),
        Map.entry("DOT",   "polkadot"),
        Map.entry("LINK",  "chainlink"),
        Map.entry("UNI",   "uniswap"),
        Map.entry("ATOM",  "cosmos"),
        Map.entry("XRP",   "ripple"),
        Map.entry("DOGE",  "dogecoin"),
        Map.entry("LTC",   "litecoin"),
        Map.entry("NEAR",  "near"),
        Map.entry("ARB",   "arbitrum"),
        Map.entry("OP",    "optimism")
    );

    private CoinIdResolver() {}

    /**
     * @throws ToolFailureException (PERMANENT) for symbols with no known id
     */
    public static String resolve(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ToolFailureException(FailureKind.PERMANENT, "symbol is required");
        }
        String id = SYMBOL_TO_ID.get(symbol.trim().toUpperCase(Locale.ROOT));
        if (id == null) {
            throw new ToolFailureException(FailureKind.PERMANENT, "no CoinGecko id known for " + symbol);
        }
        return id;
    }
}
