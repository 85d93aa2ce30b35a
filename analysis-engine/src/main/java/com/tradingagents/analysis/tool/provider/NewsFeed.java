package com.tradingagents.analysis.tool.provider;

import java.util.List;

/**
 * An RSS or Atom feed polled for headlines.
 *
 * @param bitcoinOnly only consulted when the requested symbol is BTC
 */
public record NewsFeed(String name, String url, boolean bitcoinOnly) {

    public static final List<NewsFeed> DEFAULTS = List.of(
        new NewsFeed("CoinTelegraph", "https://cointelegraph.com/rss", false),
        new NewsFeed("Decrypt", "https://decrypt.co/feed", false),
        new NewsFeed("CoinDesk", "https://www.coindesk.com/arc/outboundfeeds/rss/", false),
        new NewsFeed("The Block", "https://www.theblock.co/rss.xml", false),
        new NewsFeed("Bitcoin Magazine", "https://bitcoinmagazine.com/.rss/full/", true));

    public boolean appliesTo(String symbol) {
        return !bitcoinOnly || "BTC".equalsIgnoreCase(symbol);
    }
}
