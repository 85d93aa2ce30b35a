package com.tradingagents.analysis.tool.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolArguments;
import com.tradingagents.analysis.tool.ToolFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class CryptoNewsCapabilitiesTest {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T12:00:00Z"), ZoneOffset.UTC);

    static final NewsFeed DESK = new NewsFeed("Desk", "https://desk.example/rss", false);
    static final NewsFeed WIRE = new NewsFeed("Wire", "https://wire.example/rss", false);
    static final NewsFeed BTC_ONLY = new NewsFeed("Sats", "https://sats.example/rss", true);

    static String rss(String... items) {
        StringBuilder sb = new StringBuilder("<?xml version=\"1.0\"?><rss version=\"2.0\"><channel>");
        for (String item : items) sb.append(item);
        return sb.append("</channel></rss>").toString();
    }

    static String item(String title, String pubDate, String description) {
        return "<item><title>" + title + "</title><link>https://news.example/" + title.hashCode()
            + "</link><pubDate>" + pubDate + "</pubDate><description>" + description + "</description></item>";
    }

    static CryptoNewsCapabilities capabilities(Map<String, String> bodies, Set<String> requested,
                                               List<NewsFeed> feeds, String apiKey) {
        WebClient client = StubWebClients.serving(bodies, requested);
        return new CryptoNewsCapabilities(client, new RssFeedReader(client, feeds),
            new ObjectMapper(), apiKey, CLOCK);
    }

    @Test
    @DisplayName("regulatory keywords match whole words only")
    void regulatoryKeywords() {
        assertTrue(CryptoNewsCapabilities.isRegulatory("SEC approves spot Bitcoin ETF"));
        assertTrue(CryptoNewsCapabilities.isRegulatory("Court rules on exchange lawsuit"));
        assertFalse(CryptoNewsCapabilities.isRegulatory("Second-largest exchange sees record volume"));
        assertFalse(CryptoNewsCapabilities.isRegulatory("Bitcoin rallies past 45k"));
    }

    @Nested
    @DisplayName("news aggregation")
    class Aggregation {

        @Test
        @DisplayName("without a CryptoPanic key the RSS feeds alone answer, newest first")
        void rssOnly() {
            Map<String, String> bodies = new HashMap<>();
            bodies.put(DESK.url(), rss(item("Older desk story", "Mon, 15 Jan 2024 08:00:00 GMT", "desk")));
            bodies.put(WIRE.url(), rss(item("Fresh wire story", "Mon, 15 Jan 2024 11:00:00 GMT", "wire")));
            Set<String> requested = ConcurrentHashMap.newKeySet();

            StepVerifier.create(capabilities(bodies, requested, List.of(DESK, WIRE), null)
                    .news(ToolArguments.forSymbol("ETH")))
                .assertNext(text -> {
                    assertTrue(text.startsWith("=== ETH News (last 24h) ==="), text);
                    assertTrue(text.indexOf("Fresh wire story") < text.indexOf("Older desk story"), text);
                    assertTrue(text.contains("Source: Wire"), text);
                })
                .verifyComplete();
            assertTrue(requested.stream().noneMatch(u -> u.contains("/api/v1/posts/")));
        }

        @Test
        @DisplayName("a failing feed is skipped while the others still answer")
        void failingFeedSkipped() {
            Map<String, String> bodies = Map.of(
                DESK.url(), rss(item("Desk survives", "Mon, 15 Jan 2024 11:00:00 GMT", "ok")));

            StepVerifier.create(capabilities(bodies, ConcurrentHashMap.newKeySet(), List.of(DESK, WIRE), null)
                    .news(ToolArguments.forSymbol("ETH")))
                .assertNext(text -> assertTrue(text.contains("Desk survives"), text))
                .verifyComplete();
        }

        @Test
        @DisplayName("every source failing is a TRANSIENT failure")
        void allSourcesFail() {
            StepVerifier.create(capabilities(Map.of(), ConcurrentHashMap.newKeySet(), List.of(DESK, WIRE), null)
                    .news(ToolArguments.forSymbol("ETH")))
                .expectErrorSatisfies(e -> assertEquals(FailureKind.TRANSIENT, ((ToolFailureException) e).getKind()))
                .verify();
        }

        @Test
        @DisplayName("no key and no feeds is a PERMANENT failure")
        void nothingConfigured() {
            StepVerifier.create(capabilities(Map.of(), ConcurrentHashMap.newKeySet(), List.of(), null)
                    .news(ToolArguments.forSymbol("BTC")))
                .expectErrorSatisfies(e -> assertEquals(FailureKind.PERMANENT, ((ToolFailureException) e).getKind()))
                .verify();
        }

        @Test
        @DisplayName("CryptoPanic posts merge with feed items and keep their votes")
        void mergesCryptoPanic() {
            String posts = """
                {"results":[{"title":"Panic headline","published_at":"2024-01-15T11:30:00Z",
                  "url":"https://cryptopanic.example/1","source":{"title":"PanicSource"},
                  "votes":{"positive":7,"negative":2,"important":3}}]}
                """;
            Map<String, String> bodies = new HashMap<>();
            bodies.put("/api/v1/posts/", posts);
            bodies.put(DESK.url(), rss(item("Desk headline", "Mon, 15 Jan 2024 11:00:00 GMT", "desk")));
            Set<String> requested = ConcurrentHashMap.newKeySet();

            StepVerifier.create(capabilities(bodies, requested, List.of(DESK), "key")
                    .news(ToolArguments.forSymbol("BTC")))
                .assertNext(text -> {
                    assertTrue(text.indexOf("Panic headline") < text.indexOf("Desk headline"), text);
                    assertTrue(text.contains("Votes: +7 / -2 (important: 3)"), text);
                })
                .verifyComplete();
            assertTrue(requested.stream().anyMatch(u -> u.contains("currencies=BTC")), requested.toString());
        }

        @Test
        @DisplayName("articles older than the window are dropped")
        void windowApplied() {
            Map<String, String> bodies = Map.of(DESK.url(), rss(
                item("Two days old", "Sat, 13 Jan 2024 11:00:00 GMT", "stale")));

            StepVerifier.create(capabilities(bodies, ConcurrentHashMap.newKeySet(), List.of(DESK), null)
                    .news(ToolArguments.forSymbol("ETH")))
                .expectNext("No news found for ETH in the last 24 hours")
                .verifyComplete();
        }

        @Test
        @DisplayName("the bitcoin-only feed is polled for BTC but not for ETH")
        void bitcoinOnlyFeed() {
            Map<String, String> bodies = Map.of(BTC_ONLY.url(), rss(
                item("Sats story", "Mon, 15 Jan 2024 11:00:00 GMT", "sats")));
            Set<String> requested = ConcurrentHashMap.newKeySet();
            CryptoNewsCapabilities capabilities = capabilities(bodies, requested, List.of(DESK, BTC_ONLY), null);

            StepVerifier.create(capabilities.news(ToolArguments.forSymbol("ETH")))
                .expectErrorSatisfies(e -> assertEquals(FailureKind.TRANSIENT, ((ToolFailureException) e).getKind()))
                .verify();
            assertFalse(requested.contains(BTC_ONLY.url()));

            StepVerifier.create(capabilities.news(ToolArguments.forSymbol("BTC")))
                .assertNext(text -> assertTrue(text.contains("Sats story"), text))
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("regulatory news matches keywords in the summary as well as the title")
    void regulatoryMatchesSummary() {
        Map<String, String> bodies = Map.of(DESK.url(), rss(
            item("Exchange update", "Sun, 14 Jan 2024 11:00:00 GMT", "Filing with the CFTC was approved"),
            item("Price moves", "Sun, 14 Jan 2024 10:00:00 GMT", "Traders bought the dip")));

        StepVerifier.create(capabilities(bodies, ConcurrentHashMap.newKeySet(), List.of(DESK), null)
                .regulatoryNews())
            .assertNext(text -> {
                assertTrue(text.contains("Exchange update"), text);
                assertFalse(text.contains("Price moves"), text);
            })
            .verifyComplete();
    }
}
