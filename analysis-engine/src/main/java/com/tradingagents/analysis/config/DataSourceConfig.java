package com.tradingagents.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.tool.CapabilityRegistry;
import com.tradingagents.analysis.tool.ToolCapability;
import com.tradingagents.analysis.tool.ToolInvoker;
import com.tradingagents.analysis.tool.provider.CoinGeckoCapabilities;
import com.tradingagents.analysis.tool.provider.CryptoNewsCapabilities;
import com.tradingagents.analysis.tool.provider.NewsFeed;
import com.tradingagents.analysis.tool.provider.OnChainCapabilities;
import com.tradingagents.analysis.tool.provider.RssFeedReader;
import com.tradingagents.analysis.tool.provider.SentimentCapabilities;
import com.tradingagents.common.config.PipelineConfig;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * WebClients for the public data providers and the capability registry built on them.
 */
@Configuration
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    @Value("${data.coingecko.base-url:https://api.coingecko.com/api/v3}")
    private String coinGeckoBaseUrl;

    @Value("${data.fear-greed.base-url:https://api.alternative.me}")
    private String fearGreedBaseUrl;

    @Value("${data.blockchain-info.base-url:https://blockchain.info}")
    private String blockchainInfoBaseUrl;

    @Value("${data.etherscan.base-url:https://api.etherscan.io}")
    private String etherscanBaseUrl;

    @Value("${data.etherscan.api-key:}")
    private String etherscanApiKey;

    @Value("${data.cryptopanic.base-url:https://cryptopanic.com}")
    private String cryptoPanicBaseUrl;

    @Value("${data.cryptopanic.api-key:}")
    private String cryptoPanicApiKey;

    @Value("${data.news.rss-enabled:true}")
    private boolean rssEnabled;

    @Bean
    public CapabilityRegistry capabilityRegistry(WebClient.Builder builder, ObjectMapper objectMapper, Clock clock) {
        List<ToolCapability> all = new ArrayList<>();
        all.addAll(new CoinGeckoCapabilities(dataClient(builder, coinGeckoBaseUrl), objectMapper).capabilities());
        all.addAll(new SentimentCapabilities(dataClient(builder, fearGreedBaseUrl), objectMapper).capabilities());
        all.addAll(new OnChainCapabilities(dataClient(builder, blockchainInfoBaseUrl),
            dataClient(builder, etherscanBaseUrl), objectMapper, etherscanApiKey).capabilities());
        RssFeedReader rssReader = new RssFeedReader(dataClient(builder, null),
            rssEnabled ? NewsFeed.DEFAULTS : List.of());
        all.addAll(new CryptoNewsCapabilities(dataClient(builder, cryptoPanicBaseUrl), rssReader,
            objectMapper, cryptoPanicApiKey, clock).capabilities());

        CapabilityRegistry registry = new CapabilityRegistry(all);
        log.info("[DataSourceConfig] Registered capabilities={}", registry.names());
        return registry;
    }

    @Bean
    public ToolInvoker toolInvoker(CapabilityRegistry capabilityRegistry, PipelineConfig pipelineConfig) {
        return new ToolInvoker(capabilityRegistry, pipelineConfig.toolTimeout());
    }

    private WebClient dataClient(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(15))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
            );

        WebClient.Builder configured = builder.clone()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter());
        // feeds are fetched by absolute URL
        if (baseUrl != null) configured.baseUrl(baseUrl);
        return configured.build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString()
                .replaceAll("(apikey|auth_token)=[^&]+", "$1=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
