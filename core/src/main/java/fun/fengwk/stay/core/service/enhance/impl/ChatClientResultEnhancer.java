package fun.fengwk.stay.core.service.enhance.impl;

import fun.fengwk.stay.core.service.enhance.EnhancerProperties;
import fun.fengwk.stay.core.service.enhance.ResultEnhancer;
import fun.fengwk.stay.core.service.enhance.model.EnhancedSummary;
import fun.fengwk.stay.core.service.search.model.Property;
import fun.fengwk.stay.core.utils.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ResultEnhancer} backed by a Spring AI {@link ChatClient}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ChatClientResultEnhancer implements ResultEnhancer, DisposableBean {

    static final List<String> DEFAULT_SUGGESTIONS = List.of(
        "Find a place in San Francisco",
        "Beach house in Miami",
        "Apartment in New York",
        "Villa with pool",
        "Pet-friendly accommodation"
    );

    private static final int MIN_PARTIAL_QUERY_LENGTH = 2;
    private static final int MAX_SUMMARY_PROPERTIES = 10;
    private static final int MAX_CONCURRENT_CALLS = 4;
    private static final AtomicInteger THREAD_ID_GEN = new AtomicInteger();

    private static final String SUMMARY_SYSTEM_PROMPT = """
        You enhance vacation rental search results with helpful insights.
        Given the user's query and the matching properties, write a one or two sentence summary
        of the results and two or three short reasons why these properties match the query.
        Be concise and focus on value to the traveler.
        """;

    private static final String SUGGESTION_SYSTEM_PROMPT = """
        Generate %d helpful vacation rental search suggestions based on the partial query.
        Each suggestion must be a complete, natural search query.
        Example input: beach
        Example output: ["Beach house in Miami", "Beachfront apartment in California", \
        "Beach villa with ocean view", "Beach cottage for families", "Luxury beach resort"]
        """;

    private static final ParameterizedTypeReference<List<String>> STRING_LIST = new ParameterizedTypeReference<>() {};

    private final EnhancerProperties properties;
    private final ChatClient chatClient;
    private final ExecutorService executor = Executors.newFixedThreadPool(MAX_CONCURRENT_CALLS, runnable -> {
        Thread thread = new Thread(runnable);
        thread.setName("stay-enhancer-" + THREAD_ID_GEN.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    @Autowired
    public ChatClientResultEnhancer(EnhancerProperties properties, ObjectProvider<ChatModel> chatModelProvider) {
        this(properties, buildChatClient(chatModelProvider.getIfAvailable()));
    }

    ChatClientResultEnhancer(EnhancerProperties properties, ChatClient chatClient) {
        this.properties = properties;
        this.chatClient = chatClient;
    }

    private static ChatClient buildChatClient(ChatModel chatModel) {
        return chatModel == null ? null : ChatClient.builder(chatModel).build();
    }

    @Override
    public boolean isAvailable() {
        return properties.isEnabled() && chatClient != null;
    }

    @Override
    public Optional<EnhancedSummary> summarize(String query, List<Property> results) {
        if (!isAvailable() || results == null || results.isEmpty()) {
            return Optional.empty();
        }

        String userMessage = "Query: " + query + "\n\nResults:\n" + describe(results);
        Optional<EnhancedSummary> answer = callWithTimeout("summary", () -> chatClient.prompt()
            .system(SUMMARY_SYSTEM_PROMPT)
            .user(userMessage)
            .call()
            .entity(EnhancedSummary.class));

        return answer
            .filter(summary -> StringUtils.isNotBlank(summary.summary()))
            .map(summary -> new EnhancedSummary(
                summary.summary().trim(),
                cleanLines(summary.matchReasons(), properties.getMaxMatchReasons())));
    }

    @Override
    public List<String> suggest(String partialQuery) {
        String partial = StringUtils.normalizeSpace(partialQuery);
        if (!isAvailable() || partial == null || partial.length() < MIN_PARTIAL_QUERY_LENGTH) {
            return DEFAULT_SUGGESTIONS;
        }

        int limit = Math.max(1, properties.getMaxSuggestions());
        Optional<List<String>> answer = callWithTimeout("suggestions", () -> chatClient.prompt()
            .system(SUGGESTION_SYSTEM_PROMPT.formatted(limit))
            .user(partial)
            .call()
            .entity(STRING_LIST));

        List<String> suggestions = answer.map(lines -> cleanLines(lines, limit)).orElse(List.of());
        return suggestions.isEmpty() ? fallbackSuggestions(partial) : suggestions;
    }

    static List<String> fallbackSuggestions(String partial) {
        return List.of(
            partial + " in San Francisco",
            partial + " in Miami",
            partial + " in New York",
            partial + " with pool",
            partial + " for families"
        );
    }

    private <T> Optional<T> callWithTimeout(String purpose, Callable<T> call) {
        Future<T> future = executor.submit(call);
        try {
            return Optional.ofNullable(future.get(properties.getTimeoutMs(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("chat model call timed out, purpose={}, timeoutMs={}", purpose, properties.getTimeoutMs());
        } catch (ExecutionException ex) {
            log.warn("chat model call failed, purpose={}, error={}", purpose, String.valueOf(ex.getCause()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("chat model call interrupted, purpose={}", purpose);
        }
        return Optional.empty();
    }

    private static String describe(List<Property> results) {
        StringBuilder builder = new StringBuilder();
        results.stream().limit(MAX_SUMMARY_PROPERTIES).forEach(property -> builder
            .append("- ").append(property.getTitle())
            .append(" | ").append(property.getLocation())
            .append(" | ").append(property.getPrice()).append(' ').append(property.getCurrency())
            .append(" | rating ").append(property.getRating())
            .append(" | ").append(property.getType())
            .append(" | ").append(property.getGuests()).append(" guests")
            .append('\n'));
        return builder.toString();
    }

    private static List<String> cleanLines(List<String> lines, int limit) {
        if (lines == null) {
            return List.of();
        }
        return lines.stream()
            .filter(Objects::nonNull)
            .map(StringUtils::normalizeSpace)
            .filter(StringUtils::isNotBlank)
            .map(line -> TextUtils.truncate(line, 200))
            .distinct()
            .limit(limit)
            .toList();
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }

}
