package com.lesson.dedup.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeIn;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Lesson Duplicate Review API",
                version = "1.0.0",
                description = "Finds likely duplicate lessons by title and embedding similarity, and lets "
                        + "reviewers archive duplicates, merge their classification data or dismiss false matches."
        )
)
@SecurityScheme(
        securitySchemeName = "apiKey",
        type = SecuritySchemeType.APIKEY,
        apiKeyName = "X-API-Key",
        in = SecuritySchemeIn.HEADER,
        description = "API key identifying a user or service. Access is granted by the caller's profile role: "
                + "reviewer, admin or super_admin."
)
public class DuplicateReviewApplication extends Application {
}
