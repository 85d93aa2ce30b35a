package com.tradingagents.analysis.tool.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolCapability;
import com.tradingagents.analysis.tool.ToolFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Network metrics for Bitcoin (blockchain.info) and Ethereum gas and supply (Etherscan).
 */
public class OnChainCapabilities {

    private static final Logger log = LoggerFactory.getLogger(OnChainCapabilities.class);

    static final double WHALE_MIN_BTC = 50.0;
    static final int WHALE_SCAN_LIMIT = 20;
    static final int WHALE_SHOWN = 5;

    public static final String BITCOIN_ONCHAIN  = "get_bitcoin_onchain_metrics";
    public static final String ETHEREUM_ONCHAIN = "get_ethereum_onchain_metrics";

    private final WebClient blockchainInfoClient;
    private final WebClient etherscanClient;
    private final ObjectMapper objectMapper;
    private final String etherscanApiKey;

    public OnChainCapabilities(WebClient blockchainInfoClient, WebClient etherscanClient,
                               ObjectMapper objectMapper, String etherscanApiKey) {
        this.blockchainInfoClient = blockchainInfoClient;
        this.etherscanClient = etherscanClient;
        this.objectMapper = objectMapper;
        this.etherscanApiKey = etherscanApiKey;
    }

    public List<ToolCapability> capabilities() {
        return List.of(
            new ToolCapability(BITCOIN_ONCHAIN,
                "Get Bitcoin network metrics: hash rate, difficulty, transactions, block time, "
                    + "supply, on-chain volume, miner revenue, mempool congestion and whale transactions.",
                List.of(), args -> bitcoinMetrics()),
            new ToolCapability(ETHEREUM_ONCHAIN,
                "Get Ethereum network metrics: gas prices, network congestion and total supply.",
                List.of(), args -> ethereumMetrics())
        );
    }

    Mono<String> bitcoinMetrics() {
        Mono<JsonNode> stats = blockchainInfoClient.get()
            .uri("/stats?format=json")
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> JsonResponses.read(objectMapper, body, "blockchain.info"));
        Mono<Long> mempool = blockchainInfoClient.get()
            .uri("/q/unconfirmedcount")
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> Long.parseLong(body.trim()))
            .onErrorReturn(NumberFormatException.class, -1L);
        Mono<JsonNode> unconfirmedTxs = blockchainInfoClient.get()
            .uri("/unconfirmed-transactions?format=json")
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> JsonResponses.read(objectMapper, body, "blockchain.info"))
            .onErrorResume(e -> {
                log.warn("[OnChain] Whale feed unavailable: {}", e.getMessage());
                return Mono.just(objectMapper.createObjectNode());
            });

        return Mono.zip(stats, mempool, unconfirmedTxs).map(t -> {
            List<WhaleTransaction> whales = largeTransactions(t.getT3(), t.getT1().path("market_price_usd").asDouble());
            return formatBitcoin(t.getT1(), t.getT2()) + "\n" + formatWhales(whales);
        });
    }

    /** A single unconfirmed transaction whose first output moves at least {@link #WHALE_MIN_BTC}. */
    record WhaleTransaction(String hash, double valueBtc, double valueUsd) {}

    static List<WhaleTransaction> largeTransactions(JsonNode unconfirmed, double priceUsd) {
        List<WhaleTransaction> whales = new ArrayList<>();
        int scanned = 0;
        for (JsonNode tx : unconfirmed.path("txs")) {
            if (scanned++ >= WHALE_SCAN_LIMIT) break;
            double valueBtc = tx.path("out").path(0).path("value").asDouble() / 1e8;
            if (valueBtc >= WHALE_MIN_BTC) {
                whales.add(new WhaleTransaction(tx.path("hash").asText(""), valueBtc, valueBtc * priceUsd));
            }
        }
        return whales;
    }

    static String formatWhales(List<WhaleTransaction> whales) {
        StringBuilder sb = new StringBuilder("Whale Activity (Recent Large Transactions):");
        if (whales.isEmpty()) {
            return sb.append("\n  No large transactions detected recently").toString();
        }
        for (int i = 0; i < Math.min(WHALE_SHOWN, whales.size()); i++) {
            WhaleTransaction tx = whales.get(i);
            sb.append(String.format(Locale.ROOT, "\n  %d. %,.2f BTC ($%,.0f)", i + 1, tx.valueBtc(), tx.valueUsd()));
        }
        return sb.toString();
    }

    static String formatBitcoin(JsonNode s, long unconfirmed) {
        String mempoolLine = unconfirmed < 0
            ? "  Unconfirmed Transactions: N/A"
            : String.format(Locale.ROOT, "  Unconfirmed Transactions: %,d (congestion: %s)",
                unconfirmed, mempoolCongestion(unconfirmed));
        return String.format(Locale.ROOT, """
            === Bitcoin On-Chain Metrics ===

            Network:
              Hash Rate: %,.2f EH/s
              Difficulty: %,.0f
              Minutes Between Blocks: %.2f
            Activity:
              Transactions (24h): %,d
              Estimated Transaction Volume: $%,.0f
              Miners Revenue: $%,.0f
            Supply:
              Total BTC Mined: %,.2f
            Mempool:
            %s
            """,
                s.path("hash_rate").asDouble() / 1e9,
                s.path("difficulty").asDouble(),
                s.path("minutes_between_blocks").asDouble(),
                s.path("n_tx").asLong(),
                s.path("estimated_transaction_volume_usd").asDouble(),
                s.path("miners_revenue_usd").asDouble(),
                s.path("totalbc").asDouble() / 1e8,
                mempoolLine).strip();
    }

    static String mempoolCongestion(long unconfirmed) {
        if (unconfirmed > 10_000) return "High";
        if (unconfirmed < 2_000) return "Low";
        return "Medium";
    }

    Mono<String> ethereumMetrics() {
        if (etherscanApiKey == null || etherscanApiKey.isBlank()) {
            return Mono.error(new ToolFailureException(FailureKind.PERMANENT, "Etherscan API key not configured"));
        }
        Mono<JsonNode> gas = etherscan("gastracker", "gasoracle");
        Mono<Optional<BigDecimal>> supply = etherscan("stats", "ethsupply")
            .map(OnChainCapabilities::totalSupplyEth)
            .onErrorResume(e -> {
                log.warn("[OnChain] ETH supply unavailable: {}", e.getMessage());
                return Mono.just(Optional.empty());
            });

        return Mono.zip(gas, supply).map(t -> formatEthereum(t.getT1()) + "\n" + formatSupply(t.getT2()));
    }

    private Mono<JsonNode> etherscan(String module, String action) {
        return etherscanClient.get()
            .uri(uri -> uri.path("/api")
                .queryParam("module", module)
                .queryParam("action", action)
                .queryParam("apikey", etherscanApiKey)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> JsonResponses.read(objectMapper, body, "Etherscan"));
    }

    /** Total supply from {@code stats/ethsupply}, converted from wei. */
    static Optional<BigDecimal> totalSupplyEth(JsonNode root) {
        if (!"1".equals(root.path("status").asText())) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(root.path("result").asText()).movePointLeft(18));
        } catch (NumberFormatException e) {
            log.warn("[OnChain] Unparseable ETH supply: {}", root.path("result").asText());
            return Optional.empty();
        }
    }

    static String formatSupply(Optional<BigDecimal> totalEth) {
        return totalEth
            .map(v -> String.format(Locale.ROOT, "Supply Metrics:\n  Total Supply: %,.0f ETH", v))
            .orElse("Supply Metrics:\n  Total Supply: N/A");
    }

    static String formatEthereum(JsonNode root) {
        if (!"1".equals(root.path("status").asText())) {
            throw new ToolFailureException(FailureKind.PERMANENT,
                "Etherscan error: " + root.path("message").asText("unknown"));
        }
        JsonNode r = root.path("result");
        double fast = r.path("FastGasPrice").asDouble();
        String congestion = fast > 50 ? "High" : fast < 20 ? "Low" : "Medium";
        return String.format(Locale.ROOT, """
            === Ethereum On-Chain Metrics ===

            Gas Prices (Gwei):
              Safe: %s
              Proposed: %s
              Fast: %s
              Base Fee: %s
            Network Congestion: %s
            """,
                r.path("SafeGasPrice").asText("N/A"),
                r.path("ProposeGasPrice").asText("N/A"),
                r.path("FastGasPrice").asText("N/A"),
                r.path("suggestBaseFee").asText("N/A"),
                congestion).strip();
    }
}
