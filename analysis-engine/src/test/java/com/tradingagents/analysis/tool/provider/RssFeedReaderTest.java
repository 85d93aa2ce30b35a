package com.tradingagents.analysis.tool.provider;

import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RssFeedReaderTest {

    static final String RSS = """
        <?xml version="1.0" encoding="UTF-8"?>
        <rss version="2.0" xmlns:dc="http://purl.org/dc/elements/1.1/">
          <channel>
            <title>Example</title>
            <item>
              <title>SEC delays decision on spot ETF</title>
              <link>https://example.com/sec-etf</link>
              <pubDate>Mon, 15 Jan 2024 10:30:00 GMT</pubDate>
              <description><![CDATA[<p>The agency <b>extended</b>&nbsp;its review.</p>]]></description>
            </item>
            <item>
              <title>Bitcoin hashrate hits record</title>
              <link>https://example.com/hashrate</link>
              <pubDate>not a date</pubDate>
              <description>Miners keep adding capacity.</description>
            </item>
            <item>
              <title>Third headline</title>
              <link>https://example.com/third</link>
            </item>
          </channel>
        </rss>
        """;

    @Nested
    @DisplayName("RSS 2.0")
    class Rss {

        @Test
        @DisplayName("items map to articles with parsed dates and plain-text summaries")
        void items() {
            List<NewsArticle> articles = RssFeedReader.parse(RSS, "Example", 5);

            assertEquals(3, articles.size());
            NewsArticle first = articles.get(0);
            assertEquals("SEC delays decision on spot ETF", first.title());
            assertEquals("Example", first.source());
            assertEquals(Instant.parse("2024-01-15T10:30:00Z"), first.publishedAt());
            assertEquals("https://example.com/sec-etf", first.url());
            assertEquals("The agency extended its review.", first.summary());
            assertNull(first.votes());
        }

        @Test
        @DisplayName("unparseable or missing pubDate leaves the article undated")
        void undated() {
            List<NewsArticle> articles = RssFeedReader.parse(RSS, "Example", 5);

            assertNull(articles.get(1).publishedAt());
            assertNull(articles.get(2).publishedAt());
            assertEquals("", articles.get(2).summary());
        }

        @Test
        @DisplayName("per-source limit caps the items read")
        void limit() {
            assertEquals(2, RssFeedReader.parse(RSS, "Example", 2).size());
        }
    }

    @Test
    @DisplayName("Atom entries use href links and published dates")
    void atom() {
        String atom = """
            <?xml version="1.0" encoding="utf-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom">
              <title>Atom Example</title>
              <entry>
                <title>Ethereum upgrade scheduled</title>
                <link rel="alternate" href="https://example.com/upgrade"/>
                <published>2024-01-15T08:00:00+00:00</published>
                <updated>2024-01-15T09:00:00Z</updated>
                <summary>Core developers agreed on a date.</summary>
              </entry>
            </feed>
            """;

        List<NewsArticle> articles = RssFeedReader.parse(atom, "Atom", 5);

        assertEquals(1, articles.size());
        assertEquals("https://example.com/upgrade", articles.get(0).url());
        assertEquals(Instant.parse("2024-01-15T08:00:00Z"), articles.get(0).publishedAt());
        assertEquals("Core developers agreed on a date.", articles.get(0).summary());
    }

    @Test
    @DisplayName("summaries are cut to 200 characters")
    void summaryLimit() {
        String cleaned = RssFeedReader.cleanSummary("<div>" + "a".repeat(300) + "</div>");

        assertEquals(RssFeedReader.SUMMARY_LIMIT, cleaned.length());
    }

    @Test
    @DisplayName("documents with a DOCTYPE are rejected")
    void doctypeRejected() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE rss [<!ENTITY x \"y\">]><rss><channel/></rss>";

        ToolFailureException e = assertThrows(ToolFailureException.class,
            () -> RssFeedReader.parse(xml, "Hostile", 5));
        assertEquals(FailureKind.PERMANENT, e.getKind());
    }

    @Test
    @DisplayName("bitcoin-only feeds are consulted for BTC alone")
    void bitcoinOnlyFeeds() {
        RssFeedReader reader = new RssFeedReader(null, NewsFeed.DEFAULTS);

        assertEquals(5, reader.feedsFor("BTC").size());
        assertEquals(4, reader.feedsFor("ETH").size());
        assertEquals(4, reader.feedsFor(null).size());
    }
}
