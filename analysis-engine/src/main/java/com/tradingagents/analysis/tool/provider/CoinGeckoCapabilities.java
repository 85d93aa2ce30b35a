package com.tradingagents.analysis.tool.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolArguments;
import com.tradingagents.analysis.tool.ToolCapability;
import com.tradingagents.analysis.tool.ToolFailureException;
import com.tradingagents.analysis.tool.ToolParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Price, market-wide and trending data from the public CoinGecko v3 API.
 */
public class CoinGeckoCapabilities {

    private static final Logger log = LoggerFactory.getLogger(CoinGeckoCapabilities.class);

    public static final String PRICE_DATA    = "get_crypto_price_data";
    public static final String GLOBAL_MARKET = "get_global_crypto_market";
    public static final String TRENDING      = "get_trending_cryptocurrencies";
    public static final String PROJECT_STATS = "get_onchain_metrics";

    private static final int DEFAULT_PRICE_DAYS = 30;

    private final WebClient coinGeckoClient;
    private final ObjectMapper objectMapper;

    public CoinGeckoCapabilities(WebClient coinGeckoClient, ObjectMapper objectMapper) {
        this.coinGeckoClient = coinGeckoClient;
        this.objectMapper = objectMapper;
    }

    public List<ToolCapability> capabilities() {
        return List.of(
            new ToolCapability(PRICE_DATA,
                "Get cryptocurrency price history and current market statistics: current price, "
                    + "24h/7d/30d change, market cap and rank, volume, high/low over the window.",
                List.of(ToolParameter.symbol(),
                    ToolParameter.optionalInt("days", "Number of days of price history (default 30)")),
                this::priceData),
            new ToolCapability(GLOBAL_MARKET,
                "Get the global cryptocurrency market overview: total market cap, 24h change, "
                    + "total volume, BTC and ETH dominance.",
                List.of(), args -> globalMarket()),
            new ToolCapability(TRENDING,
                "Get currently trending cryptocurrencies by search interest.",
                List.of(ToolParameter.optionalInt("limit", "Number of trending coins (default 10)")),
                this::trending),
            new ToolCapability(PROJECT_STATS,
                "Get on-chain, developer and community metrics for any cryptocurrency.",
                List.of(ToolParameter.symbol()),
                this::projectStats)
        );
    }

    Mono<String> priceData(ToolArguments args) {
        return Mono.defer(() -> {
            String coinId = CoinIdResolver.resolve(args.symbol());
            int days = Math.min(args.lookbackOr(DEFAULT_PRICE_DAYS), 365);

            Mono<JsonNode> market = get("/coins/markets?vs_currency=usd&ids=" + coinId
                + "&price_change_percentage=24h,7d,30d");
            Mono<JsonNode> chart = get("/coins/" + coinId + "/market_chart?vs_currency=usd&days=" + days);

            return Mono.zip(market, chart)
                .map(t -> formatPriceData(args.symbol(), days, t.getT1(), t.getT2()));
        });
    }

    Mono<String> globalMarket() {
        return get("/global").map(root -> {
            JsonNode data = root.path("data");
            if (data.isMissingNode()) {
                throw new ToolFailureException(FailureKind.PERMANENT, "global market response had no data");
            }
            return String.format(Locale.ROOT, """
                === Global Crypto Market Overview ===

                Total Market Cap: $%,.0f
                24h Market Cap Change: %+.2f%%
                Total 24h Volume: $%,.0f

                Market Dominance:
                  Bitcoin: %.2f%%
                  Ethereum: %.2f%%

                Active Cryptocurrencies: %,d
                Active Markets: %,d
                """,
                    data.path("total_market_cap").path("usd").asDouble(),
                    data.path("market_cap_change_percentage_24h_usd").asDouble(),
                    data.path("total_volume").path("usd").asDouble(),
                    data.path("market_cap_percentage").path("btc").asDouble(),
                    data.path("market_cap_percentage").path("eth").asDouble(),
                    data.path("active_cryptocurrencies").asInt(),
                    data.path("markets").asInt()).strip();
        });
    }

    Mono<String> trending(ToolArguments args) {
        int limit = Math.max(1, args.intExtra("limit", 10));
        return get("/search/trending").map(root -> {
            JsonNode coins = root.path("coins");
            if (!coins.isArray() || coins.isEmpty()) return "No trending coins data available";
            StringBuilder sb = new StringBuilder();
            int n = Math.min(limit, coins.size());
            sb.append("=== Top ").append(n).append(" Trending Cryptocurrencies ===\n\n");
            for (int i = 0; i < n; i++) {
                JsonNode item = coins.get(i).path("item");
                sb.append(String.format(Locale.ROOT, "%d. %s (%s)\n   Market Cap Rank: #%s\n   Price (BTC): %.8f BTC\n\n",
                    i + 1, item.path("name").asText(), item.path("symbol").asText(),
                    item.path("market_cap_rank").asText("N/A"), item.path("price_btc").asDouble()));
            }
            return sb.toString().strip();
        });
    }

    Mono<String> projectStats(ToolArguments args) {
        return Mono.defer(() -> get("/coins/" + CoinIdResolver.resolve(args.symbol())
                + "?localization=false&tickers=false&market_data=true&community_data=true&developer_data=true"))
            .map(root -> {
                JsonNode community = root.path("community_data");
                JsonNode developer = root.path("developer_data");
                JsonNode marketData = root.path("market_data");
                return String.format(Locale.ROOT, """
                    === %s On-Chain & Network Metrics ===

                    Supply:
                      Circulating: %,.0f
                      Total: %,.0f
                    Community:
                      Reddit Subscribers: %,d
                      Reddit Active Accounts (48h): %,d
                      Telegram Users: %,d
                    Developer Activity:
                      GitHub Stars: %,d
                      Commits (4 weeks): %,d
                      Merged PRs: %,d
                    """,
                        args.symbol(),
                        marketData.path("circulating_supply").asDouble(),
                        marketData.path("total_supply").asDouble(),
                        community.path("reddit_subscribers").asLong(),
                        community.path("reddit_accounts_active_48h").asLong(),
                        community.path("telegram_channel_user_count").asLong(),
                        developer.path("stars").asLong(),
                        developer.path("commit_count_4_weeks").asLong(),
                        developer.path("pull_requests_merged").asLong()).strip();
            });
    }

    static String formatPriceData(String symbol, int days, JsonNode markets, JsonNode chart) {
        if (!markets.isArray() || markets.isEmpty()) {
            throw new ToolFailureException(FailureKind.PERMANENT, "no market data for " + symbol);
        }
        JsonNode m = markets.get(0);
        JsonNode prices = chart.path("prices");
        JsonNode volumes = chart.path("total_volumes");

        double high = Double.NEGATIVE_INFINITY, low = Double.POSITIVE_INFINITY;
        for (JsonNode point : prices) {
            double p = point.get(1).asDouble();
            high = Math.max(high, p);
            low = Math.min(low, p);
        }
        double first = prices.size() > 0 ? prices.get(0).get(1).asDouble() : 0.0;
        double last  = prices.size() > 0 ? prices.get(prices.size() - 1).get(1).asDouble() : 0.0;
        double change = first > 0 ? (last - first) / first * 100 : 0.0;
        double volumeSum = 0;
        for (JsonNode point : volumes) volumeSum += point.get(1).asDouble();
        double avgVolume = volumes.size() > 0 ? volumeSum / volumes.size() : 0.0;

        log.debug("[CoinGecko] price data symbol={} points={}", symbol, prices.size());
        return String.format(Locale.ROOT, """
            === %s (%s) Market Data ===

            Current Price: $%,.2f
            Market Cap: $%,.0f (Rank #%s)
            24h Volume: $%,.0f

            Price Changes:
              24h: %+.2f%%
              7d:  %+.2f%%
              30d: %+.2f%%

            All-Time High: $%,.2f (%+.2f%% from ATH)

            Price History (%d days):
              Change: %+.2f%%
              High: $%,.2f
              Low: $%,.2f
              Avg Volume: $%,.0f
            """,
                m.path("name").asText(symbol), symbol,
                m.path("current_price").asDouble(),
                m.path("market_cap").asDouble(), m.path("market_cap_rank").asText("N/A"),
                m.path("total_volume").asDouble(),
                m.path("price_change_percentage_24h_in_currency").asDouble(),
                m.path("price_change_percentage_7d_in_currency").asDouble(),
                m.path("price_change_percentage_30d_in_currency").asDouble(),
                m.path("ath").asDouble(), m.path("ath_change_percentage").asDouble(),
                days, change,
                prices.size() > 0 ? high : 0.0, prices.size() > 0 ? low : 0.0,
                avgVolume).strip();
    }

    private Mono<JsonNode> get(String uri) {
        return coinGeckoClient.get()
            .uri(uri)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> JsonResponses.read(objectMapper, body, "CoinGecko"));
    }
}
