/**
 * Configuration for WebClient
 * - Defines the shared builder used by the feed, translation and Discord clients
 * - Sets connection and socket timeouts generous enough for LLM responses
 */
package net.ohaasarelay.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient instances
 * - Provides a pre-configured WebClient Builder
 * - Per-call deadlines are applied by each client on top of these socket limits
 */
@Configuration
public class WebClientConfig {

    static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private static final int CONNECT_TIMEOUT_MILLIS = 5000;
    private static final int SOCKET_TIMEOUT_SECONDS = 90;

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection timeout of 5 seconds
     * - Read, write and response timeouts of 90 seconds
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(SOCKET_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(SOCKET_TIMEOUT_SECONDS, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(SOCKET_TIMEOUT_SECONDS));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(2 * 1024 * 1024)) // 2MB
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
