package com.medical.records.service.summary;

import com.medical.records.config.SummarizerConfig;
import com.medical.records.model.dto.MistralChatRequest;
import com.medical.records.model.dto.MistralChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.concurrent.TimeoutException;

/**
 * {@link Summarizer} backed by the Mistral chat completions API.
 */
@Slf4j
@Service
public class MistralSummarizer implements Summarizer {

    private final SummarizerConfig summarizerConfig;
    private final WebClient webClient;

    public MistralSummarizer(SummarizerConfig summarizerConfig, WebClient.Builder webClientBuilder) {
        this.summarizerConfig = summarizerConfig;
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(summarizerConfig.getApiUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(1024 * 1024));

        if (summarizerConfig.hasApiKey()) {
            String apiKey = summarizerConfig.getApiKey();
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
            log.info("[Summarizer] API URL: {}, model: {}, API Key: {}***",
                    summarizerConfig.getApiUrl(), summarizerConfig.getModel(),
                    apiKey.substring(0, Math.min(4, apiKey.length())));
        } else {
            log.warn("[Summarizer] no API key configured, health summaries will be unavailable");
        }
        this.webClient = builder.build();
    }

    @Override
    public SummaryResult summarize(SummaryRequest request) {
        if (!summarizerConfig.hasApiKey()) {
            log.error("[Summarizer] summarizer.api-key is not configured");
            return SummaryResult.unavailable(SummaryResult.FailureReason.MISSING_CREDENTIAL,
                    "Summarizer API key not configured on server.");
        }

        MistralChatRequest body = new MistralChatRequest();
        body.setModel(summarizerConfig.getModel());
        body.setMessages(Collections.singletonList(new MistralChatRequest.Message("user", request.getDocument())));
        body.setTemperature(request.getTemperature());
        body.setMaxTokens(request.getMaxTokens());

        log.info("[Summarizer] requesting summary, document length: {}, max tokens: {}",
                request.getDocument().length(), request.getMaxTokens());

        try {
            SummaryResult result = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(status -> status.is4xxClientError() || status.is5xxServerError(),
                            response -> response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(errorBody -> {
                                        log.error("[Summarizer] call failed: {} - {}", response.rawStatusCode(), errorBody);
                                        return new SummarizerHttpException(response.rawStatusCode());
                                    }))
                    .bodyToMono(MistralChatResponse.class)
                    .timeout(summarizerConfig.getTimeout())
                    .map(this::toResult)
                    .onErrorResume(TimeoutException.class, e -> {
                        log.warn("[Summarizer] no response within {}", summarizerConfig.getTimeout());
                        return Mono.just(SummaryResult.unavailable(SummaryResult.FailureReason.TIMEOUT,
                                "No response within " + summarizerConfig.getTimeout()));
                    })
                    .onErrorResume(SummarizerHttpException.class, e -> Mono.just(
                            SummaryResult.unavailable(SummaryResult.FailureReason.TRANSPORT_ERROR, e.getMessage())))
                    .onErrorResume(DecodingException.class, e -> {
                        log.error("[Summarizer] response could not be parsed", e);
                        return Mono.just(SummaryResult.unavailable(SummaryResult.FailureReason.MALFORMED_RESPONSE,
                                "Response could not be parsed"));
                    })
                    .onErrorResume(e -> {
                        log.error("[Summarizer] call failed", e);
                        return Mono.just(SummaryResult.unavailable(SummaryResult.FailureReason.TRANSPORT_ERROR,
                                e.getMessage()));
                    })
                    .defaultIfEmpty(SummaryResult.unavailable(SummaryResult.FailureReason.MALFORMED_RESPONSE,
                            "Empty response body"))
                    .block();
            return result != null
                    ? result
                    : SummaryResult.unavailable(SummaryResult.FailureReason.MALFORMED_RESPONSE, "Empty response body");
        } catch (RuntimeException e) {
            log.error("[Summarizer] call could not be completed", e);
            return SummaryResult.unavailable(SummaryResult.FailureReason.TRANSPORT_ERROR, e.getMessage());
        }
    }

    private SummaryResult toResult(MistralChatResponse response) {
        if (response.getError() != null) {
            log.error("[Summarizer] error payload: {}", response.getError());
            return SummaryResult.unavailable(SummaryResult.FailureReason.TRANSPORT_ERROR,
                    response.getError().getMessage());
        }
        if (response.getChoices() == null) {
            return SummaryResult.unavailable(SummaryResult.FailureReason.MALFORMED_RESPONSE, "No choices in response");
        }
        if (response.getChoices().isEmpty()) {
            log.warn("[Summarizer] response {} contained no choices", response.getId());
            return SummaryResult.unavailable(SummaryResult.FailureReason.EMPTY_CANDIDATES);
        }
        MistralChatResponse.Choice first = response.getChoices().get(0);
        if (first == null || first.getMessage() == null
                || first.getMessage().getContent() == null || first.getMessage().getContent().trim().isEmpty()) {
            return SummaryResult.unavailable(SummaryResult.FailureReason.MALFORMED_RESPONSE, "First choice has no text");
        }
        if (response.getUsage() != null) {
            log.info("[Summarizer] summary received, tokens used: {}", response.getUsage().getTotalTokens());
        }
        return SummaryResult.success(first.getMessage().getContent());
    }

    private static class SummarizerHttpException extends RuntimeException {
        SummarizerHttpException(int status) {
            super("Summarizer responded with HTTP " + status);
        }
    }
}
