package com.practicum.homeworkbot.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI homeworkBotOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Homework Bot API")
                        .version("1.0.0")
                        .description(
                                "Background monitor for homework review statuses.\n\n" +
                                "**Poll Cycle:**\n" +
                                "1. Fetch statuses with `GET <endpoint>?from_date=<cursor>`\n" +
                                "2. Validate the payload shape (`homeworks` list, `current_date` cursor)\n" +
                                "3. Compare the newest homework's verdict with the last reported one\n" +
                                "4. Send a message when the verdict changed, then advance the cursor\n\n" +
                                "**Verdicts:** `pending`, `accepted`, `rejected`.\n\n" +
                                "Failures are alerted once per distinct error signature; repeats are only logged.")
                        .contact(new Contact().name("Homework Bot Maintainers")));
    }
}
