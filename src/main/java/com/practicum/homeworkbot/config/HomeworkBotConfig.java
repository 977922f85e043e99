package com.practicum.homeworkbot.config;

import com.practicum.homeworkbot.model.StartupPolicy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "homework")
public class HomeworkBotConfig {

    // OAuth token for the review API. Bound from PRACTICUM_TOKEN.
    @NotBlank(message = "homework.api-token (PRACTICUM_TOKEN) must be set")
    private String apiToken;

    @NotBlank
    private String endpoint = "https://practicum.yandex.ru/api/user_api/homework_statuses/";

    // Fixed delay between the end of one cycle and the start of the next.
    @Positive
    private long pollIntervalSeconds = 600;

    @Positive
    private int connectTimeoutMs = 5000;

    @Positive
    private int readTimeoutMs = 10000;

    // Whether the very first observed status is announced.
    @NotNull
    private StartupPolicy startupPolicy = StartupPolicy.NOTIFY_FIRST;

    private boolean pollingEnabled = true;
}
