package com.docsight.research.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient webClient(ResearchProperties properties) {
        return buildWebClient(properties.getFetch());
    }

    /**
     * Shared by the Spring bean and tests that construct the fetch client by hand.
     */
    public static WebClient buildWebClient(ResearchProperties.Fetch fetch) {
        long readTimeoutMs = fetch.getTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) fetch.getConnectTimeout().toMillis())
                .responseTimeout(fetch.getTimeout())
                .doOnConnected(conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
                )
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("User-Agent", fetch.getUserAgent())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(fetch.getMaxInMemorySize()))
                .build();
    }
}
