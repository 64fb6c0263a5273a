package me.golemcore.pacing.adapter.outbound.github;

import me.golemcore.pacing.infrastructure.config.PacingConfiguration;
import me.golemcore.pacing.infrastructure.config.PacingProperties;
import me.golemcore.pacing.infrastructure.http.FeignClientFactory;
import me.golemcore.pacing.infrastructure.http.OkHttpConfig;
import me.golemcore.pacing.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Real Feign GitHub client wired to an in-memory OkHttp engine.
 */
final class GitHubApiFixture {

    static final Instant NOW = Instant.parse("2026-04-15T12:00:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private GitHubApiFixture() {
    }

    static GitHubApi api(OkHttpMockEngine engine) {
        OkHttpClient client = new OkHttpConfig(new PacingProperties()).okHttpClient().newBuilder()
                .addInterceptor(engine)
                .build();
        FeignClientFactory factory = new FeignClientFactory(client, PacingConfiguration.objectMapper());
        return factory.create(GitHubApi.class, "https://api.github.test");
    }
}
