package com.tradingagents.analysis.tool.provider;

import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import reactor.core.publisher.Mono;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches RSS 2.0 and Atom feeds and maps their entries to {@link NewsArticle}s.
 */
public class RssFeedReader {

    private static final Logger log = LoggerFactory.getLogger(RssFeedReader.class);

    static final int SUMMARY_LIMIT = 200;

    private final WebClient rssClient;
    private final List<NewsFeed> feeds;

    public RssFeedReader(WebClient rssClient, List<NewsFeed> feeds) {
        this.rssClient = rssClient;
        this.feeds = List.copyOf(feeds);
    }

    List<NewsFeed> feedsFor(String symbol) {
        return feeds.stream().filter(f -> f.appliesTo(symbol)).toList();
    }

    /**
     * Latest entries of one feed. Empty when the feed could not be fetched or parsed; the
     * cause is logged and the other sources carry on.
     */
    Mono<Optional<List<NewsArticle>>> read(NewsFeed feed, int maxItems) {
        return rssClient.get()
            .uri(feed.url())
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> Optional.of(parse(body, feed.name(), maxItems)))
            .onErrorResume(e -> {
                log.warn("[News] Feed unavailable source={} error={}", feed.name(), e.getMessage());
                return Mono.just(Optional.empty());
            });
    }

    static List<NewsArticle> parse(String xml, String source, int maxItems) {
        Document doc = document(xml, source);
        List<NewsArticle> articles = new ArrayList<>();

        NodeList items = doc.getElementsByTagName("item");
        if (items.getLength() > 0) {
            for (int i = 0; i < Math.min(items.getLength(), maxItems); i++) {
                Element e = (Element) items.item(i);
                articles.add(new NewsArticle(text(e, "title"), source, parseRfc1123(text(e, "pubDate")),
                    text(e, "link"), cleanSummary(text(e, "description")), null));
            }
            return articles;
        }

        NodeList entries = doc.getElementsByTagName("entry");
        for (int i = 0; i < Math.min(entries.getLength(), maxItems); i++) {
            Element e = (Element) entries.item(i);
            String summary = text(e, "summary");
            if (summary.isEmpty()) summary = text(e, "content");
            String date = text(e, "published");
            if (date.isEmpty()) date = text(e, "updated");
            articles.add(new NewsArticle(text(e, "title"), source, parseIso(date),
                linkHref(e), cleanSummary(summary), null));
        }
        return articles;
    }

    private static Document document(String xml, String source) {
        if (xml == null || xml.isBlank()) {
            throw new ToolFailureException(FailureKind.PERMANENT, source + " returned an empty feed");
        }
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(false);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder db = dbf.newDocumentBuilder();
            Document doc = db.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
            doc.getDocumentElement().normalize();
            return doc;
        } catch (Exception e) {
            throw new ToolFailureException(FailureKind.PERMANENT, "unreadable " + source + " feed", e);
        }
    }

    private static String text(Element parent, String tag) {
        NodeList nodes = parent.getElementsByTagName(tag);
        if (nodes.getLength() == 0) return "";
        return nodes.item(0).getTextContent().trim();
    }

    private static String linkHref(Element entry) {
        NodeList links = entry.getElementsByTagName("link");
        for (int i = 0; i < links.getLength(); i++) {
            Node href = links.item(i).getAttributes().getNamedItem("href");
            if (href != null) return href.getNodeValue();
        }
        return "";
    }

    /** Strips markup, collapses whitespace and keeps the first {@link #SUMMARY_LIMIT} characters. */
    static String cleanSummary(String html) {
        String plain = html.replaceAll("<[^>]*>", " ")
            .replace("&nbsp;", " ")
            .replaceAll("\\s+", " ")
            .trim();
        return plain.length() <= SUMMARY_LIMIT ? plain : plain.substring(0, SUMMARY_LIMIT);
    }

    static Instant parseRfc1123(String raw) {
        if (raw.isEmpty()) return null;
        try {
            return ZonedDateTime.parse(raw, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("[News] Unparseable pubDate={}", raw);
            return null;
        }
    }

    static Instant parseIso(String raw) {
        if (raw.isEmpty()) return null;
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("[News] Unparseable Atom date={}", raw);
            return null;
        }
    }
}
