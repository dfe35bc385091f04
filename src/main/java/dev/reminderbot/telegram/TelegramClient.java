package dev.reminderbot.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.reminderbot.config.ReminderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Minimal Telegram Bot API client: sending text messages and long-polling for updates.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "reminder.telegram.enabled", havingValue = "true")
public class TelegramClient {

    private static final String SEND_MESSAGE_PATH = "/sendMessage";
    private static final String GET_UPDATES_PATH = "/getUpdates";
    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(30);
    // Extra time granted on top of the long-poll timeout before the HTTP call is abandoned
    private static final Duration POLL_GRACE = Duration.ofSeconds(10);

    private static final ParameterizedTypeReference<ApiResponse<Message>> MESSAGE_RESPONSE =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<ApiResponse<List<Update>>> UPDATES_RESPONSE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;

    public TelegramClient(WebClient.Builder webClientBuilder, ReminderProperties properties) {
        ReminderProperties.Telegram telegram = properties.getTelegram();
        if (telegram.getToken() == null || telegram.getToken().isBlank()) {
            log.warn("Telegram token is missing! Every Bot API call will fail.");
        }

        this.webClient = webClientBuilder
                .baseUrl(telegram.getBaseUrl() + "/bot" + telegram.getToken())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    /**
     * Send a text message.
     *
     * @param parseMode Bot API parse mode ("Markdown", "HTML") or {@code null} for plain text
     * @return Mono<Boolean> telling whether the Bot API accepted the message
     */
    @SuppressWarnings("null")
    public Mono<Boolean> sendMessage(long chatId, String text, String parseMode) {
        return webClient.post()
                .uri(SEND_MESSAGE_PATH)
                .bodyValue(new SendMessageRequest(chatId, text, parseMode))
                .retrieve()
                .bodyToMono(MESSAGE_RESPONSE)
                .timeout(SEND_TIMEOUT)
                .map(response -> {
                    if (!response.ok()) {
                        log.warn("Telegram refused message to {}: {}", chatId, response.description());
                    }
                    return response.ok();
                });
    }

    /**
     * Long-poll for new updates.
     *
     * @param offset         id of the first update to return; earlier updates are acknowledged
     * @param timeoutSeconds how long Telegram may hold the request open when nothing is pending
     */
    @SuppressWarnings("null")
    public Mono<List<Update>> getUpdates(long offset, int timeoutSeconds) {
        return webClient.post()
                .uri(GET_UPDATES_PATH)
                .bodyValue(new GetUpdatesRequest(offset, timeoutSeconds, List.of("message")))
                .retrieve()
                .bodyToMono(UPDATES_RESPONSE)
                .timeout(Duration.ofSeconds(timeoutSeconds).plus(POLL_GRACE))
                .map(response -> {
                    if (!response.ok() || response.result() == null) {
                        throw new IllegalStateException("getUpdates failed: " + response.description());
                    }
                    return response.result();
                });
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SendMessageRequest(
            @JsonProperty("chat_id") long chatId,
            String text,
            @JsonProperty("parse_mode") String parseMode) {
    }

    record GetUpdatesRequest(
            long offset,
            int timeout,
            @JsonProperty("allowed_updates") List<String> allowedUpdates) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ApiResponse<T>(boolean ok, T result, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Update(@JsonProperty("update_id") long updateId, Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(@JsonProperty("message_id") long messageId, Chat chat, String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chat(long id) {
    }
}
