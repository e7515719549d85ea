package com.waterCompliance.complianceDemo.reasoning.client;

import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallTimeoutException;
import com.waterCompliance.complianceDemo.reasoning.dto.GroqApiRequest;
import com.waterCompliance.complianceDemo.reasoning.dto.GroqApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.List;

/**
 * Client for Groq's OpenAI-compatible chat completions endpoint.
 * Single attempt per call; retries belong to the caller.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "reasoning.provider", havingValue = "groq")
public class GroqApiClient {

    private static final String GROQ_API_URL = "https://api.groq.com/openai/v1/chat/completions";
    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    private final RestClient restClient;

    @Value("${groq.api.key:}")
    private String apiKey;

    @Value("${groq.api.model:" + DEFAULT_MODEL + "}")
    private String defaultModel;

    @Value("${groq.api.temperature:0.2}")
    private Double temperature;

    @Value("${groq.api.max-completion-tokens:1024}")
    private Integer maxCompletionTokens;

    public GroqApiClient(@Qualifier("externalRequestFactory") ClientHttpRequestFactory requestFactory) {
        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .baseUrl(GROQ_API_URL)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Calls Groq API with function calling support.
     *
     * @param systemPrompt System prompt for the task
     * @param userMessage User message to process
     * @param tools List of tools (functions) available to the model
     * @param toolChoice "none", "auto" or "required"
     * @return GroqApiResponse with the result
     * @throws ExternalCallException if the API call fails or times out
     */
    public GroqApiResponse callGroqApiWithTools(String systemPrompt, String userMessage,
                                                List<GroqApiRequest.Tool> tools, String toolChoice) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Groq API key is not configured. Set groq.api.key in application.yaml");
        }

        GroqApiRequest request = GroqApiRequest.builder()
                .messages(List.of(
                        GroqApiRequest.Message.builder()
                                .role("system")
                                .content(systemPrompt)
                                .build(),
                        GroqApiRequest.Message.builder()
                                .role("user")
                                .content(userMessage)
                                .build()
                ))
                .model(defaultModel)
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .stream(false)
                .tools(tools)
                .toolChoice(toolChoice != null ? toolChoice : "auto")
                .build();

        try {
            log.debug("Calling Groq API with tools - model: {}, message length: {}, tools: {}",
                    defaultModel, userMessage.length(), tools != null ? tools.size() : 0);

            GroqApiResponse response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(GroqApiResponse.class);

            if (response == null) {
                throw new ExternalCallException("Groq API returned null response");
            }

            log.debug("Groq API response received - model: {}, tokens used: {}, hasToolCalls: {}",
                    response.getModel(),
                    response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown",
                    response.hasToolCalls());

            return response;

        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new ExternalCallTimeoutException("Groq API timed out: " + e.getMessage(), e);
            }
            throw new ExternalCallException("Failed to reach Groq API: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("Error calling Groq API with tools", e);
            throw new ExternalCallException("Failed to call Groq API: " + e.getMessage(), e);
        }
    }
}
