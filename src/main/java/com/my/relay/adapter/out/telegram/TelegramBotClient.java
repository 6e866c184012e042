package com.my.relay.adapter.out.telegram;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.relay.config.AppConfig;
import com.my.relay.domain.exception.InvalidUpdateException;
import com.my.relay.domain.exception.UpdateFetchException;
import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.domain.port.out.TelegramUpdatePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 텔레그램 getUpdates 호출을 캡슐화해 도메인 포트 구현을 단순화하기 위함.
 * <p>
 * 전송 실패(I/O, 타임아웃, HTTP 4xx/5xx)는 예외로, 파싱 불가/ok=false 응답은 빈 결과로 돌려준다.
 * update_id가 있는데 본문을 해석할 수 없는 항목은 확인 시퀀스가 건너뛰지 않도록 UNSUPPORTED로 돌려준다.
 */
@ApplicationScoped
public class TelegramBotClient implements TelegramUpdatePort {

    private static final Logger log = Logger.getLogger(TelegramBotClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TelegramUpdateCodec codec;
    private final AppConfig.TelegramConfig telegramConfig;
    private final String apiBase;

    @Inject
    public TelegramBotClient(AppConfig appConfig, ObjectMapper objectMapper, TelegramUpdateCodec codec) {
        this.objectMapper = objectMapper;
        this.codec = codec;
        this.telegramConfig = appConfig.telegram();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        this.apiBase = telegramConfig.botToken()
                .filter(token -> !token.isBlank())
                .map(token -> trimTrailingSlash(telegramConfig.apiBaseUrl()) + "/bot" + token)
                .orElse("");
    }

    @Override
    public List<TelegramUpdate> fetchUpdates(long offset, int limit, int timeoutSeconds) {
        if (apiBase.isBlank()) {
            log.warn("텔레그램 봇 토큰이 설정되지 않아 업데이트 조회를 건너뜁니다.");
            return List.of();
        }
        HttpResponse<String> response = send(offset, limit, timeoutSeconds);
        if (response.statusCode() >= 400) {
            throw new UpdateFetchException("텔레그램 업데이트 조회 실패 status=" + response.statusCode()
                    + " body=" + response.body());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            log.errorf("텔레그램 업데이트 응답 파싱 실패: %s%n---%n%s%n---", e.getOriginalMessage(), response.body());
            return List.of();
        }
        if (root == null || !root.path("ok").asBoolean(false)) {
            log.errorf("텔레그램 업데이트 응답이 ok=false 입니다. code=%s description=%s",
                    root == null ? "" : root.path("error_code").asText(),
                    root == null ? "" : root.path("description").asText());
            return List.of();
        }
        List<TelegramUpdate> updates = new ArrayList<>();
        for (JsonNode element : root.path("result")) {
            try {
                updates.add(codec.decode(element));
            } catch (InvalidUpdateException e) {
                if (codec.hasUpdateId(element)) {
                    TelegramUpdate unsupported = codec.unsupported(element);
                    log.errorf("업데이트 %d 본문을 해석할 수 없어 UNSUPPORTED로 적재합니다: %s%n%s",
                            unsupported.updateId(), e.getMessage(), element);
                    updates.add(unsupported);
                } else {
                    log.errorf("update_id가 없는 항목을 건너뜁니다: %s", element);
                }
            }
        }
        if (!updates.isEmpty()) {
            log.debugf("getUpdates offset=%d 결과 %d건", offset, updates.size());
        }
        return updates;
    }

    private HttpResponse<String> send(long offset, int limit, int timeoutSeconds) {
        try {
            String body = objectMapper.writeValueAsString(new GetUpdatesRequest(
                    offset > 0 ? offset : null, limit, timeoutSeconds, telegramConfig.allowedUpdates()));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + "/getUpdates"))
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds((long) timeoutSeconds + telegramConfig.requestTimeoutSeconds()))
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpdateFetchException("텔레그램 업데이트 조회 중 I/O 오류: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpdateFetchException("텔레그램 업데이트 조회가 중단되었습니다.", e);
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record GetUpdatesRequest(@JsonProperty("offset") Long offset,
                                     @JsonProperty("limit") int limit,
                                     @JsonProperty("timeout") int timeout,
                                     @JsonProperty("allowed_updates") List<String> allowedUpdates) {
    }
}
