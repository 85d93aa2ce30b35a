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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Headlines aggregated from CryptoPanic (when a key is configured) and the public crypto RSS
 * feeds, plus a regulatory filter over the same sources.
 */
public class CryptoNewsCapabilities {

    private static final Logger log = LoggerFactory.getLogger(CryptoNewsCapabilities.class);

    public static final String CRYPTO_NEWS     = "get_crypto_news";
    public static final String REGULATORY_NEWS = "get_regulatory_news";

    static final List<String> REGULATORY_KEYWORDS = List.of(
        "sec", "regulation", "regulatory", "ban", "legal", "lawsuit", "compliance",
        "government", "legislation", "policy", "etf", "securities", "cftc",
        "congress", "senate", "court");

    static final int NEWS_PER_SOURCE = 5;
    static final int REGULATORY_PER_SOURCE = 10;
    private static final int REGULATORY_WINDOW_HOURS = 24 * 7;

    private static final Comparator<NewsArticle> NEWEST_FIRST = Comparator.comparing(
        NewsArticle::publishedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final WebClient cryptoPanicClient;
    private final RssFeedReader rssReader;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Clock clock;

    public CryptoNewsCapabilities(WebClient cryptoPanicClient, RssFeedReader rssReader,
                                  ObjectMapper objectMapper, String apiKey, Clock clock) {
        this.cryptoPanicClient = cryptoPanicClient;
        this.rssReader = rssReader;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.clock = clock;
    }

    public List<ToolCapability> capabilities() {
        return List.of(
            new ToolCapability(CRYPTO_NEWS,
                "Get recent cryptocurrency news headlines from CryptoPanic and the major crypto news "
                    + "sites, with community sentiment votes where available.",
                List.of(ToolParameter.symbol(),
                    ToolParameter.optionalInt("hours", "Look-back window in hours (default 24)"),
                    ToolParameter.optionalInt("max_articles", "Maximum number of articles (default 10)")),
                this::news),
            new ToolCapability(REGULATORY_NEWS,
                "Get regulatory and legal news affecting cryptocurrency markets over the last week.",
                List.of(), args -> regulatoryNews())
        );
    }

    Mono<String> news(ToolArguments args) {
        int hours = Math.max(1, args.intExtra("hours", 24));
        int max = Math.max(1, args.intExtra("max_articles", 10));
        return aggregate(args.symbol(), NEWS_PER_SOURCE).map(all -> {
            List<NewsArticle> recent = withinWindow(all, hours);
            if (recent.isEmpty()) return "No news found for " + args.symbol() + " in the last " + hours + " hours";
            return formatArticles("=== " + args.symbol() + " News (last " + hours + "h) ===",
                recent.subList(0, Math.min(max, recent.size())));
        });
    }

    Mono<String> regulatoryNews() {
        return aggregate(null, REGULATORY_PER_SOURCE).map(all -> {
            List<NewsArticle> matching = new ArrayList<>();
            for (NewsArticle article : withinWindow(all, REGULATORY_WINDOW_HOURS)) {
                if (isRegulatory(article.searchableText())) matching.add(article);
            }
            if (matching.isEmpty()) return "No regulatory news found in the last 7 days";
            return formatArticles("=== Regulatory News (last 7 days) ===",
                matching.subList(0, Math.min(10, matching.size())));
        });
    }

    static boolean isRegulatory(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : REGULATORY_KEYWORDS) {
            if (lower.matches("(?s).*\\b" + keyword + "\\b.*")) return true;
        }
        return false;
    }

    /**
     * Every reachable source merged newest first. Fails only when no source answered at all.
     */
    private Mono<List<NewsArticle>> aggregate(String symbol, int perSource) {
        List<Mono<Optional<List<NewsArticle>>>> sources = new ArrayList<>();
        if (apiKey != null && !apiKey.isBlank()) {
            sources.add(cryptoPanic(symbol, perSource));
        }
        for (NewsFeed feed : rssReader.feedsFor(symbol)) {
            sources.add(rssReader.read(feed, perSource));
        }
        if (sources.isEmpty()) {
            return Mono.error(new ToolFailureException(FailureKind.PERMANENT, "no news sources configured"));
        }

        return Flux.mergeSequential(sources)
            .collectList()
            .map(results -> {
                if (results.stream().allMatch(Optional::isEmpty)) {
                    throw new ToolFailureException(FailureKind.TRANSIENT, "all news sources unavailable");
                }
                List<NewsArticle> merged = new ArrayList<>();
                results.forEach(r -> r.ifPresent(merged::addAll));
                merged.sort(NEWEST_FIRST);
                log.debug("[News] Aggregated articles={} sources={}", merged.size(), results.size());
                return merged;
            });
    }

    private Mono<Optional<List<NewsArticle>>> cryptoPanic(String currency, int limit) {
        return cryptoPanicClient.get()
            .uri(uri -> {
                uri.path("/api/v1/posts/")
                    .queryParam("auth_token", apiKey)
                    .queryParam("filter", "hot")
                    .queryParam("public", "true");
                if (currency != null) uri.queryParam("currencies", currency);
                return uri.build();
            })
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> Optional.of(fromCryptoPanic(JsonResponses.read(objectMapper, body, "CryptoPanic"), limit)))
            .onErrorResume(e -> {
                log.warn("[News] CryptoPanic unavailable: {}", e.getMessage());
                return Mono.just(Optional.empty());
            });
    }

    static List<NewsArticle> fromCryptoPanic(JsonNode root, int limit) {
        List<NewsArticle> articles = new ArrayList<>();
        for (JsonNode post : root.path("results")) {
            if (articles.size() >= limit) break;
            JsonNode votes = post.path("votes");
            articles.add(new NewsArticle(
                post.path("title").asText(),
                post.path("source").path("title").asText("CryptoPanic"),
                parseInstant(post.path("published_at").asText(null)),
                post.path("url").asText(""),
                "",
                new NewsArticle.Votes(votes.path("positive").asInt(), votes.path("negative").asInt(),
                    votes.path("important").asInt())));
        }
        return articles;
    }

    private List<NewsArticle> withinWindow(List<NewsArticle> articles, int hours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
        List<NewsArticle> kept = new ArrayList<>();
        for (NewsArticle article : articles) {
            Instant published = article.publishedAt();
            if (published == null || !published.isBefore(cutoff)) kept.add(article);
        }
        return kept;
    }

    private static Instant parseInstant(String raw) {
        if (raw == null) return null;
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String formatArticles(String header, List<NewsArticle> articles) {
        StringBuilder sb = new StringBuilder(header).append("\n\n");
        int i = 1;
        for (NewsArticle article : articles) {
            sb.append(i++).append(". ").append(article.title()).append('\n')
                .append("   Source: ").append(article.source())
                .append(" | Published: ").append(article.publishedAt() == null ? "unknown" : article.publishedAt())
                .append('\n');
            NewsArticle.Votes votes = article.votes();
            if (votes != null) {
                sb.append(String.format(Locale.ROOT, "   Votes: +%d / -%d (important: %d)\n",
                    votes.positive(), votes.negative(), votes.important()));
            }
            if (!article.summary().isEmpty()) {
                sb.append("   ").append(article.summary()).append('\n');
            }
            sb.append("   ").append(article.url()).append("\n\n");
        }
        return sb.toString().strip();
    }
}
