package com.community.botguard.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI botGuardOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Bot Guard API")
                        .version("1.0.0")
                        .description(
                                "Approval workflow that holds newly added bots until a reviewer decides.\n\n" +
                                "**Lifecycle:**\n" +
                                "1. The platform connector posts `POST /events/participant-joined`\n" +
                                "2. Automated participants are held as **PENDING** and reviewers are messaged\n" +
                                "3. A reviewer reacts (✅ / ❌), issues `!approve` / `!reject`, or calls the decision endpoint\n" +
                                "4. Without a decision the bot is removed when the timeout expires (**TIMED_OUT**)\n" +
                                "5. Every transition is appended to the audit log\n\n" +
                                "**Reviewer commands:** `status`, `approve <id>`, `reject <id>`, `history <id>`, `logs [limit]`")
                        .contact(new Contact().name("Community Safety Team")));
    }
}
