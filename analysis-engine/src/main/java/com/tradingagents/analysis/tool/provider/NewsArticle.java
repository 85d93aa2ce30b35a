package com.tradingagents.analysis.tool.provider;

import java.time.Instant;

/**
 * One headline from any news source.
 *
 * @param publishedAt null when the source gave no parseable date
 * @param votes       community votes; only CryptoPanic carries them
 */
record NewsArticle(String title, String source, Instant publishedAt, String url, String summary, Votes votes) {

    record Votes(int positive, int negative, int important) {}

    String searchableText() {
        return title + " " + summary;
    }
}
