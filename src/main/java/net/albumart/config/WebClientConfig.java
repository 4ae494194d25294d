/**
 * Configuration for WebClient
 * - Defines the shared builder used by the artwork lookup and device clients
 * - Sets up default timeouts and connection settings
 */
package net.albumart.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient instances
 * - Provides a pre-configured, prototype-scoped WebClient Builder
 * - Each client derives its own base URL without leaking into the others
 */
@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "album-art-display/0.1";
    private static final int CONNECT_TIMEOUT_MILLIS = 5000;
    private static final int IO_TIMEOUT_SECONDS = 10;

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Sets connection timeout to 5000ms
     * - Sets read and write timeouts to 10 seconds; callers apply tighter per-request bounds
     * - Limits in-memory buffering to 2MB (lookup and SOAP responses are small)
     *
     * @return A WebClient Builder instance
     */
    @Bean
    @Scope("prototype")
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(IO_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(IO_TIMEOUT_SECONDS, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(IO_TIMEOUT_SECONDS));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(2 * 1024 * 1024))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
