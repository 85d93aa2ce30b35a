package com.tradingagents.analysis.tool.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OnChainCapabilitiesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("mempool congestion thresholds")
    void congestion() {
        assertEquals("High", OnChainCapabilities.mempoolCongestion(10_001));
        assertEquals("Medium", OnChainCapabilities.mempoolCongestion(10_000));
        assertEquals("Medium", OnChainCapabilities.mempoolCongestion(2_000));
        assertEquals("Low", OnChainCapabilities.mempoolCongestion(1_999));
    }

    @Test
    @DisplayName("bitcoin stats are scaled to EH/s and whole BTC")
    void bitcoinFormatting() throws Exception {
        String body = """
            {"hash_rate": 500000000000, "difficulty": 7.2e13, "n_tx": 350000,
             "minutes_between_blocks": 9.5, "totalbc": 1950000000000000,
             "estimated_transaction_volume_usd": 1.0e10, "miners_revenue_usd": 4.0e7}
            """;
        String text = OnChainCapabilities.formatBitcoin(mapper.readTree(body), 15_000);

        assertTrue(text.contains("Hash Rate: 500.00 EH/s"), text);
        assertTrue(text.contains("Total BTC Mined: 19,500,000.00"), text);
        assertTrue(text.contains("congestion: High"), text);
    }

    @Test
    @DisplayName("etherscan gas oracle: fast > 50 gwei is high congestion")
    void ethereumFormatting() throws Exception {
        String body = """
            {"status":"1","message":"OK","result":{"SafeGasPrice":"40","ProposeGasPrice":"55",
             "FastGasPrice":"60","suggestBaseFee":"39.5"}}
            """;
        String text = OnChainCapabilities.formatEthereum(mapper.readTree(body));

        assertTrue(text.contains("Fast: 60"));
        assertTrue(text.contains("Network Congestion: High"));
    }

    @Test
    @DisplayName("etherscan error status → PERMANENT")
    void ethereumError() throws Exception {
        ToolFailureException e = assertThrows(ToolFailureException.class, () ->
            OnChainCapabilities.formatEthereum(mapper.readTree("{\"status\":\"0\",\"message\":\"NOTOK\"}")));
        assertEquals(FailureKind.PERMANENT, e.getKind());
    }

    @Test
    @DisplayName("missing Etherscan key fails without any network call")
    void missingKey() {
        OnChainCapabilities capabilities = new OnChainCapabilities(
            WebClient.create("http://localhost:1"), WebClient.create("http://localhost:1"), mapper, "");

        StepVerifier.create(capabilities.ethereumMetrics())
            .expectErrorSatisfies(e -> assertEquals(FailureKind.PERMANENT, ((ToolFailureException) e).getKind()))
            .verify();
    }

    @Test
    @DisplayName("whale scan keeps first outputs of at least 50 BTC within the first 20 transactions")
    void whaleTransactions() throws Exception {
        StringBuilder txs = new StringBuilder("{\"txs\":[");
        txs.append("{\"hash\":\"big\",\"out\":[{\"value\":7500000000}]},");
        txs.append("{\"hash\":\"small\",\"out\":[{\"value\":4999999999}]},");
        txs.append("{\"hash\":\"exact\",\"out\":[{\"value\":5000000000}]},");
        txs.append("{\"hash\":\"noout\"}");
        for (int i = 0; i < 20; i++) {
            txs.append(",{\"hash\":\"late").append(i).append("\",\"out\":[{\"value\":90000000000}]}");
        }
        txs.append("]}");

        List<OnChainCapabilities.WhaleTransaction> whales =
            OnChainCapabilities.largeTransactions(mapper.readTree(txs.toString()), 40_000);

        // 4 leading entries plus 16 "late" ones fall inside the scan window
        assertEquals(18, whales.size());
        assertEquals("big", whales.get(0).hash());
        assertEquals(75.0, whales.get(0).valueBtc(), 1e-9);
        assertEquals(3_000_000.0, whales.get(0).valueUsd(), 1e-6);
        assertEquals("exact", whales.get(1).hash());
    }

    @Test
    @DisplayName("whale section lists at most five transactions")
    void whaleFormatting() {
        List<OnChainCapabilities.WhaleTransaction> whales = List.of(
            new OnChainCapabilities.WhaleTransaction("a", 75, 3_000_000),
            new OnChainCapabilities.WhaleTransaction("b", 60, 2_400_000),
            new OnChainCapabilities.WhaleTransaction("c", 55, 2_200_000),
            new OnChainCapabilities.WhaleTransaction("d", 51, 2_040_000),
            new OnChainCapabilities.WhaleTransaction("e", 50, 2_000_000),
            new OnChainCapabilities.WhaleTransaction("f", 50, 2_000_000));

        String text = OnChainCapabilities.formatWhales(whales);

        assertTrue(text.contains("1. 75.00 BTC ($3,000,000)"), text);
        assertTrue(text.contains("5. 50.00 BTC"), text);
        assertFalse(text.contains("6."), text);
        assertTrue(OnChainCapabilities.formatWhales(List.of()).contains("No large transactions detected recently"));
    }

    @Test
    @DisplayName("eth supply is converted from wei; error status yields N/A")
    void ethereumSupply() throws Exception {
        Optional<BigDecimal> supply = OnChainCapabilities.totalSupplyEth(
            mapper.readTree("{\"status\":\"1\",\"result\":\"120250000000000000000000000\"}"));

        assertEquals(0, new BigDecimal("120250000").compareTo(supply.orElseThrow()));
        assertEquals("Supply Metrics:\n  Total Supply: 120,250,000 ETH", OnChainCapabilities.formatSupply(supply));

        Optional<BigDecimal> failed = OnChainCapabilities.totalSupplyEth(
            mapper.readTree("{\"status\":\"0\",\"result\":\"Invalid API Key\"}"));
        assertTrue(failed.isEmpty());
        assertTrue(OnChainCapabilities.formatSupply(failed).endsWith("Total Supply: N/A"));
    }
}
