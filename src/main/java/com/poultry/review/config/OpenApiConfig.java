package com.poultry.review.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI applicationReviewOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Application Review API")
                        .version("1.0.0")
                        .description(
                                "Multi-tier review workflow for poultry program applications.\n\n" +
                                "**Lifecycle:**\n" +
                                "1. Create a draft via `POST /applications`\n" +
                                "2. Submit via `POST /applications/{id}/submit`; eligibility is screened (0-100, pass at 50)\n" +
                                "3. Passing applications enter the level-1 review queue with an SLA deadline\n" +
                                "4. Reviewers claim entries from `GET /review/queue` and approve, reject or request changes\n" +
                                "5. Approval advances to the next level; approval at the last level issues an identifier\n\n" +
                                "**Kinds:**\n" +
                                "- `FARMER_REGISTRATION`: constituency, regional and national review\n" +
                                "- `PROGRAM_ENROLLMENT`: constituency, regional and national review, enrollment activated on approval\n" +
                                "- `STAFF_INVITATION`: regional and national review, account activated on approval")
                        .contact(new Contact().name("Poultry Program Platform Team")));
    }
}
