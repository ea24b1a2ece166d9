package com.nevis.agentrun.toolkit;

import com.nevis.agentrun.exception.CredentialExpiredException;
import com.nevis.agentrun.exception.FatalExecutionException;
import com.nevis.agentrun.exception.RetriableExecutionException;
import com.nevis.agentrun.infra.RateLimiter;
import com.nevis.agentrun.model.UsageMetrics;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Slf4j
@Component
public class LangChainToolkit implements Toolkit {

    static final String EXPIRES_AT = "expires_at";

    private static final int CHARS_PER_TOKEN = 4;

    private static final String SYSTEM_PROMPT_TEMPLATE =
        """
            You are a helpful assistant with access to the user's Google Workspace.
            You may only act within these granted capabilities: %s.
            If a request needs a capability that is not granted, say so instead of guessing.
            
            Context:
            %s
            """;

    private final ChatModel chatModel;
    private final RateLimiter toolkitLimiter;

    public LangChainToolkit(ChatModel chatModel, @Qualifier("toolkitLimiter") RateLimiter toolkitLimiter) {
        this.chatModel = chatModel;
        this.toolkitLimiter = toolkitLimiter;
    }

    @Override
    public ToolkitResult execute(String input, Map<String, String> envContext, ToolkitCredentials credentials) {
        if (isExpired(credentials.credentialData())) {
            throw new CredentialExpiredException("Access token for " + credentials.ownerId() + " has expired");
        }

        ChatRequest request = ChatRequest.builder()
            .messages(
                SystemMessage.from(systemPrompt(envContext, credentials)),
                UserMessage.from(input)
            )
            .build();

        int estimatedTokens = estimateTokens(input);
        toolkitLimiter.reserve(credentials.ownerId(), estimatedTokens);

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RetriableException e) {
            throw new RetriableExecutionException("Model temporarily unavailable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new FatalExecutionException("Model rejected the request: " + e.getMessage(), e);
        }

        String text = response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new RetriableExecutionException("Model returned an empty response");
        }

        UsageMetrics usage = usageOf(response.tokenUsage(), input, text);
        toolkitLimiter.settle(credentials.ownerId(), estimatedTokens, usage.totalTokens());
        return new ToolkitResult(text, usage);
    }

    private static String systemPrompt(Map<String, String> envContext, ToolkitCredentials credentials) {
        String scopes = credentials.allowedScopes().isEmpty()
            ? "none"
            : credentials.allowedScopes().stream().sorted().collect(Collectors.joining(", "));
        String context = envContext.isEmpty()
            ? "(none)"
            : new TreeMap<>(envContext).entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
        return String.format(SYSTEM_PROMPT_TEMPLATE, scopes, context);
    }

    static boolean isExpired(Map<String, Object> credentialData) {
        Object expiresAt = credentialData.get(EXPIRES_AT);
        if (expiresAt == null) {
            return false;
        }
        try {
            long epochSeconds = expiresAt instanceof Number n ? n.longValue() : (long) Double.parseDouble(expiresAt.toString());
            return Instant.ofEpochSecond(epochSeconds).isBefore(Instant.now());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable credential expiry '{}'", expiresAt);
            return false;
        }
    }

    private static UsageMetrics usageOf(TokenUsage usage, String input, String output) {
        if (usage == null || usage.inputTokenCount() == null || usage.outputTokenCount() == null) {
            return UsageMetrics.of(estimateTokens(input), estimateTokens(output));
        }
        return UsageMetrics.of(usage.inputTokenCount(), usage.outputTokenCount());
    }

    private static int estimateTokens(String text) {
        return Math.max(1, text.length() / CHARS_PER_TOKEN);
    }
}
