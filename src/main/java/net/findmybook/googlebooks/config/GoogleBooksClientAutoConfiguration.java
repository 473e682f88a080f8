/**
 * Auto-configuration for the Google Books client
 * - Binds {@link GoogleBooksProperties}
 * - Builds a dedicated WebClient with connect/read timeouts and a raised buffer limit
 * - Exposes resolver, transport and client beans, each replaceable by the application
 *
 * @author William Callahan
 */
package net.findmybook.googlebooks.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import net.findmybook.googlebooks.client.GoogleBooksClient;
import net.findmybook.googlebooks.resolve.ResponseResolver;
import net.findmybook.googlebooks.transport.VolumeTransport;
import net.findmybook.googlebooks.transport.WebClientVolumeTransport;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(GoogleBooksProperties.class)
public class GoogleBooksClientAutoConfiguration {

    static final String WEB_CLIENT_BEAN = "googleBooksWebClient";
    static final String JSON_MAPPER_BEAN = "googleBooksJsonMapper";

    /**
     * WebClient for Google Books only, so its timeouts do not leak into other clients.
     * Redirects are followed by the connector; nothing here retries.
     */
    @Bean(name = WEB_CLIENT_BEAN)
    @ConditionalOnMissingBean(name = WEB_CLIENT_BEAN)
    public WebClient googleBooksWebClient(GoogleBooksProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeout())
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(properties.getReadTimeout(), TimeUnit.MILLISECONDS)))
            .responseTimeout(Duration.ofMillis(properties.getReadTimeout()));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(properties.getMaxInMemorySize()))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .exchangeStrategies(strategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Bean(name = JSON_MAPPER_BEAN)
    @ConditionalOnMissingBean(name = JSON_MAPPER_BEAN)
    public JsonMapper googleBooksJsonMapper() {
        return JsonMapper.builder().build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseResolver googleBooksResponseResolver(@Qualifier(JSON_MAPPER_BEAN) JsonMapper jsonMapper) {
        return new ResponseResolver(jsonMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public VolumeTransport googleBooksVolumeTransport(@Qualifier(WEB_CLIENT_BEAN) WebClient webClient) {
        return new WebClientVolumeTransport(webClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public GoogleBooksClient googleBooksClient(VolumeTransport transport,
                                               ResponseResolver resolver,
                                               GoogleBooksProperties properties) {
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver, properties.getBaseUrl(), properties.getKey());
        if (!client.isApiKeyAvailable()) {
            log.info("No Google Books API key configured - requests to {} will be unauthenticated", client.getBaseUrl());
        }
        return client;
    }
}
