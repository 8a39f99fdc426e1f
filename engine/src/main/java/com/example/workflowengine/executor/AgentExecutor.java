package com.example.workflowengine.executor;

import com.example.workflowengine.agent.AgentChatRequest;
import com.example.workflowengine.agent.AgentReply;
import com.example.workflowengine.agent.AgentServiceClient;
import com.example.workflowengine.agent.AgentServiceException;
import com.example.workflowengine.domain.Component;
import com.example.workflowengine.llm.ChatModelFactory;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executor for agent components.
 * <p>
 * With {@code agent_id} configured, the turn goes to the agent service; otherwise, with
 * {@code api_url}, {@code api_key} and {@code model} configured, it goes straight to an
 * OpenAI-compatible chat-completion endpoint. The turn reads {@code message} and {@code history}
 * from the merged inputs. Collaborator failures are returned as error payloads.
 * </p>
 */
@Slf4j
public class AgentExecutor implements ComponentExecutor {

    /**
     * Context key overriding the agent service for one run. The value is the service host
     * (e.g. {@code http://agents:5000}); the {@code /api} prefix is added when missing, so
     * {@code http://agents:5000/api} works too.
     */
    public static final String AGENT_SERVICE_URL = "agent_service_url";

    private static final String API_PREFIX = "/api";

    private final AgentServiceClient agentServiceClient;
    private final ChatModelFactory chatModelFactory;
    private final String defaultAgentServiceUrl;

    public AgentExecutor(AgentServiceClient agentServiceClient, ChatModelFactory chatModelFactory, String defaultAgentServiceUrl) {
        this.agentServiceClient = Objects.requireNonNull(agentServiceClient, "agentServiceClient");
        this.chatModelFactory = Objects.requireNonNull(chatModelFactory, "chatModelFactory");
        this.defaultAgentServiceUrl = Objects.requireNonNull(defaultAgentServiceUrl, "defaultAgentServiceUrl");
    }

    @Override
    public Map<String, Object> execute(Component component, Map<String, Object> inputs, Map<String, Object> context) {
        String message = inputs.get("message") != null ? inputs.get("message").toString() : "";
        List<Map<String, Object>> history = historyFrom(inputs.get("history"));

        String agentId = component.configString(Component.AGENT_ID);
        if (agentId != null) {
            return callAgentService(component, agentId, message, history, context);
        }
        String apiUrl = component.configString(Component.API_URL);
        String apiKey = component.configString(Component.API_KEY);
        String model = component.configString(Component.MODEL);
        if (apiUrl != null && apiKey != null && model != null) {
            return callChatModel(component, apiUrl, apiKey, model, message, history);
        }
        log.warn("Agent component id={} has neither agent_id nor api_url/api_key/model", component.id());
        return ComponentErrors.error("No agent configuration provided");
    }

    private Map<String, Object> callAgentService(Component component, String agentId, String message,
                                                 List<Map<String, Object>> history, Map<String, Object> context) {
        Object override = context != null ? context.get(AGENT_SERVICE_URL) : null;
        String baseUrl = override != null && !override.toString().isBlank()
                ? agentServiceBase(override.toString())
                : defaultAgentServiceUrl;
        try {
            AgentReply reply = agentServiceClient.chat(baseUrl, new AgentChatRequest(message, history, agentId));
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("message", reply.message());
            output.put("agent_id", agentId);
            if (reply.usage() != null) {
                output.put("usage", reply.usage());
            }
            return output;
        } catch (AgentServiceException e) {
            log.error("Agent service error componentId={} agentId={} status={}", component.id(), agentId, e.getStatusCode());
            return ComponentErrors.error("Error calling agent service: " + e.getStatusCode(), e.getResponseBody());
        } catch (RuntimeException e) {
            log.error("Error executing agent componentId={} agentId={}: {}", component.id(), agentId, e.getMessage());
            return ComponentErrors.error("Error executing agent: " + e.getMessage());
        }
    }

    private Map<String, Object> callChatModel(Component component, String apiUrl, String apiKey, String model,
                                              String message, List<Map<String, Object>> history) {
        try {
            List<ChatMessage> messages = new ArrayList<>();
            String systemPrompt = component.configString(Component.SYSTEM_PROMPT);
            if (systemPrompt != null) {
                messages.add(SystemMessage.from(systemPrompt));
            }
            for (Map<String, Object> turn : history) {
                ChatMessage converted = toChatMessage(turn);
                if (converted != null) {
                    messages.add(converted);
                }
            }
            messages.add(UserMessage.from(message));
            ChatModel chatModel = chatModelFactory.build(
                    apiUrl, apiKey, model,
                    doubleSetting(component, Component.TEMPERATURE),
                    intSetting(component, Component.MAX_TOKENS));
            ChatResponse response = chatModel.chat(messages);
            String text = response != null && response.aiMessage() != null ? response.aiMessage().text() : null;
            if (text == null) {
                log.error("Chat completion returned no content componentId={} model={}", component.id(), model);
                return ComponentErrors.error("Error calling API: empty response");
            }
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("message", text);
            Map<String, Object> usage = usageOf(response.tokenUsage());
            if (usage != null) {
                output.put("usage", usage);
            }
            return output;
        } catch (RuntimeException e) {
            log.error("Error executing agent componentId={} model={}: {}", component.id(), model, e.getMessage());
            return ComponentErrors.error("Error executing agent: " + e.getMessage());
        }
    }

    static String agentServiceBase(String host) {
        String base = host.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base.endsWith(API_PREFIX) ? base : base + API_PREFIX;
    }

    private static ChatMessage toChatMessage(Map<String, Object> turn) {
        Object content = turn.get("content");
        if (content == null) {
            return null;
        }
        String role = turn.get("role") != null ? turn.get("role").toString() : "user";
        return switch (role) {
            case "system" -> SystemMessage.from(content.toString());
            case "assistant" -> AiMessage.from(content.toString());
            default -> UserMessage.from(content.toString());
        };
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> historyFrom(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> history = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> turn) {
                history.add((Map<String, Object>) turn);
            }
        }
        return history;
    }

    private static Map<String, Object> usageOf(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return null;
        }
        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("prompt_tokens", tokenUsage.inputTokenCount());
        usage.put("completion_tokens", tokenUsage.outputTokenCount());
        usage.put("total_tokens", tokenUsage.totalTokenCount());
        return usage;
    }

    private static Double doubleSetting(Component component, String key) {
        String value = component.configString(key);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={} on component id={}", key, value, component.id());
            return null;
        }
    }

    private static Integer intSetting(Component component, String key) {
        Double value = doubleSetting(component, key);
        return value != null ? value.intValue() : null;
    }
}
