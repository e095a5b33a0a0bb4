/**
 * Configuration for WebClient
 * - Shared builder for the Ahrefs and DataForSEO clients and for content verification fetches
 * - Identifies crawls with a bot User-Agent so publishers can recognize page checks
 * - Read/write timeouts sit below the provider call timeout so a stalled socket fails the
 *   attempt and lets the retry policy take over
 * - Codec buffer raised for deep analyses: 1000 backlink rows with titles and surrounding text
 *   exceed the 256KB default
 */
package net.linkcoverage.config;

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

@Configuration
public class WebClientConfig {

    private static final String DEFAULT_USER_AGENT = "LinkCoverageBot/1.0 (+https://linkcoverage.net/bot)";
    private static final int CONNECT_TIMEOUT_MILLIS = 5000;
    private static final int IO_TIMEOUT_SECONDS = 15;
    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    /**
     * @return builder shared by provider clients and page fetching
     */
    @Bean
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
                .maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
