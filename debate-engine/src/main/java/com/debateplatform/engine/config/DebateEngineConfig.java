package com.debateplatform.engine.config;

import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.variant.PromptVariant;
import com.debateplatform.common.variant.VariantSelector;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Configuration
public class DebateEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(DebateEngineConfig.class);

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicUrl;

    @Value("${services.entity-store.base-url}")
    private String entityStoreUrl;

    @Bean
    public WebClient anthropicClient(WebClient.Builder builder) {
        // read timeout stays above debate.call-timeout; the per-call timeout is applied reactively
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .doOnConnected(conn -> conn.addHandlerLast(new ReadTimeoutHandler(180, TimeUnit.SECONDS)));

        return builder
            .baseUrl(anthropicUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient entityStoreClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(30));

        return builder
            .baseUrl(entityStoreUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public KindPolicyRegistry kindPolicyRegistry(DebateProperties properties) {
        return new KindPolicyRegistry(properties);
    }

    @Bean
    public VariantSelector variantSelector(DebateProperties properties) {
        Map<DebateKind, List<PromptVariant>> byKind = new EnumMap<>(DebateKind.class);
        properties.getVariants().forEach((code, variants) -> byKind.put(
            DebateKind.fromCode(code),
            variants.stream().map(DebateProperties.Variant::toPromptVariant).toList()));
        PromptVariant fallback = properties.getDefaultVariant().toPromptVariant();
        log.info("Prompt variants configured. kinds={} fallback={}", byKind.keySet(), fallback.id());
        return new VariantSelector(byKind, fallback);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
