package com.example.workflowengine.agent;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP client for the agent service chat endpoint ({@code POST {baseUrl}/chat}).
 * The base URL is passed per call because a run's context may override the configured one.
 */
@Slf4j
public class AgentServiceClient {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE = new ParameterizedTypeReference<>() { };

    private final RestClient restClient;

    public AgentServiceClient(RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    /**
     * Sends one chat turn.
     *
     * @throws AgentServiceException when the service answers with a non-2xx status
     */
    public AgentReply chat(String baseUrl, AgentChatRequest request) {
        String url = chatUrl(baseUrl);
        log.debug("Calling agent service url={} agentId={} historySize={}", url, request.agentId(), request.history().size());
        Map<String, Object> body = restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    String text = StreamUtils.copyToString(res.getBody(), StandardCharsets.UTF_8);
                    throw new AgentServiceException(res.getStatusCode().value(), text);
                })
                .body(MAP_TYPE);
        return AgentReply.from(body);
    }

    static String chatUrl(String baseUrl) {
        String base = Objects.requireNonNull(baseUrl, "baseUrl").trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/chat";
    }
}
