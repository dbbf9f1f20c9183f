package com.qualitylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Coarse functional categories inferred from dependency identifiers.
 *
 * <p>Classification is substring membership against curated keyword lists, so a single
 * import such as {@code "@auth/session-store-redis"} contributes to several concerns.
 *
 * @since 1.0.0
 */
public enum Concern {
    DATA_ACCESS("data-access", List.of(
        "database", "db", "sql", "mongo", "redis", "orm", "prisma", "sequelize", "typeorm", "knex")),
    NETWORK("network", List.of(
        "http", "axios", "fetch", "request", "api", "rest", "graphql", "socket", "grpc")),
    FILESYSTEM("filesystem", List.of(
        "file", "fs", "path", "upload", "download", "stream")),
    MESSAGING("messaging", List.of(
        "email", "mail", "smtp", "sendgrid", "nodemailer", "kafka", "amqp", "rabbit", "queue", "mqtt")),
    VALIDATION("validation", List.of(
        "validation", "validator", "joi", "yup", "ajv", "zod")),
    PRESENTATION("presentation", List.of(
        "react", "vue", "angular", "component", "ui", "dom", "jsx", "tsx")),
    AUTHENTICATION("authentication", List.of(
        "auth", "jwt", "passport", "session", "oauth", "bcrypt")),
    OBSERVABILITY("observability", List.of(
        "log", "winston", "pino", "console", "debug", "metrics", "tracing", "sentry"));

    private final String id;
    private final List<String> keywords;

    Concern(String id, List<String> keywords) {
        this.id = id;
        this.keywords = keywords;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public List<String> keywords() {
        return keywords;
    }

    /**
     * Returns true if the dependency identifier contains any keyword of this concern.
     *
     * @param dependency import specifier or module name
     * @return true if it belongs to this concern
     */
    public boolean matches(String dependency) {
        if (dependency == null || dependency.isEmpty()) {
            return false;
        }
        String lower = dependency.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
