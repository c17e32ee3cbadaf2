package com.automate.FindingSync.Config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    private final SonarProperties sonarProperties;

    public WebClientConfig(SonarProperties sonarProperties){
        this.sonarProperties = sonarProperties;
    }

    /** Shared builder; each SonarClient clones it and sets its own base URL. */
    @Bean
    public WebClient.Builder sonarWebClientBuilder() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, sonarProperties.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(sonarProperties.getRequestTimeoutMs()));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(sonarProperties.getMaxResponseBytes()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
    }
}
