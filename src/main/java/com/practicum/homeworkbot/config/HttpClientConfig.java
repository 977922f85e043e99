package com.practicum.homeworkbot.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient homeworkRestClient(RestClient.Builder builder, HomeworkBotConfig config) {
        return builder.clone()
                .baseUrl(config.getEndpoint())
                .requestFactory(requestFactory(config))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "notification.channel", havingValue = NotificationConfig.CHANNEL_TELEGRAM,
            matchIfMissing = true)
    public RestClient telegramRestClient(RestClient.Builder builder,
                                         NotificationConfig notificationConfig,
                                         HomeworkBotConfig config) {
        return builder.clone()
                .baseUrl(notificationConfig.getTelegram().getApiUrl())
                .requestFactory(requestFactory(config))
                .build();
    }

    private SimpleClientHttpRequestFactory requestFactory(HomeworkBotConfig config) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(config.getConnectTimeoutMs());
        factory.setReadTimeout(config.getReadTimeoutMs());
        return factory;
    }
}
