package me.golemcore.pacing.adapter.outbound.github;

import me.golemcore.pacing.domain.model.ResolutionError;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GitHubErrorClassifierTest {

    private static final String RESOURCE = "/users/octocat/settings/billing/usage/summary";
    private static final Instant NOW = Instant.parse("2026-04-15T12:00:00Z");

    @Test
    void shouldClassifyUnauthorized() {
        ResolutionError error = classify(401, Map.of());

        assertEquals(ResolutionError.Kind.UNAUTHORIZED, error.getKind());
        assertNull(error.getScopeHint());
    }

    @Test
    void shouldClassifyForbiddenWithScopeHint() {
        ResolutionError error = classify(403, Map.of("X-RateLimit-Remaining", List.of("42")));

        assertEquals(ResolutionError.Kind.FORBIDDEN, error.getKind());
        assertEquals("read:billing", error.getScopeHint());
        assertTrue(error.getMessage().contains(RESOURCE));
    }

    @Test
    void shouldMatchRateLimitHeaderCaseInsensitively() {
        ResolutionError error = classify(403, Map.of("x-ratelimit-remaining", List.of("0")));

        assertEquals(ResolutionError.Kind.RATE_LIMITED, error.getKind());
        assertEquals(ResolutionError.DEFAULT_RETRY_AFTER_SECONDS, error.getRetryAfterSeconds());
    }

    @Test
    void shouldWaitUntilRateLimitResetWhenRetryAfterIsMissing() {
        String reset = String.valueOf(NOW.plusSeconds(900).getEpochSecond());

        ResolutionError error = classify(403, Map.of(
                "X-RateLimit-Remaining", List.of("0"),
                "X-RateLimit-Reset", List.of(reset)));

        assertEquals(ResolutionError.Kind.RATE_LIMITED, error.getKind());
        assertEquals(900, error.getRetryAfterSeconds());
    }

    @Test
    void shouldPreferRetryAfterOverRateLimitReset() {
        String reset = String.valueOf(NOW.plusSeconds(900).getEpochSecond());

        ResolutionError error = classify(429, Map.of(
                "Retry-After", List.of("30"),
                "X-RateLimit-Reset", List.of(reset)));

        assertEquals(30, error.getRetryAfterSeconds());
    }

    @Test
    void shouldFallBackToDefaultDelayForPastOrUnparsableReset() {
        String past = String.valueOf(NOW.minusSeconds(5).getEpochSecond());

        assertEquals(60, GitHubErrorClassifier.secondsUntilReset(past, NOW));
        assertEquals(60, GitHubErrorClassifier.secondsUntilReset("soon", NOW));
        assertEquals(60, GitHubErrorClassifier.secondsUntilReset(null, NOW));
    }

    @Test
    void shouldClassifyNotFound() {
        assertEquals(ResolutionError.Kind.NOT_FOUND, classify(404, Map.of()).getKind());
    }

    @Test
    void shouldReadRetryAfterOnTooManyRequests() {
        ResolutionError error = classify(429, Map.of("retry-after", List.of("120")));

        assertEquals(ResolutionError.Kind.RATE_LIMITED, error.getKind());
        assertEquals(120, error.getRetryAfterSeconds());
    }

    @Test
    void shouldTreatServerErrorsAsTransient() {
        ResolutionError error = GitHubErrorClassifier.classifyStatus(503, Map.of(), "maintenance", RESOURCE, null,
                NOW);

        assertEquals(ResolutionError.Kind.TRANSIENT, error.getKind());
        assertTrue(error.getMessage().contains("503"));
        assertTrue(error.getMessage().contains("maintenance"));
    }

    @Test
    void shouldFallBackToDefaultRetryAfterForUnparsableValues() {
        assertEquals(60, GitHubErrorClassifier.parseRetryAfter(null));
        assertEquals(60, GitHubErrorClassifier.parseRetryAfter(" "));
        assertEquals(60, GitHubErrorClassifier.parseRetryAfter("Wed, 21 Oct 2026 07:28:00 GMT"));
        assertEquals(60, GitHubErrorClassifier.parseRetryAfter("0"));
        assertEquals(15, GitHubErrorClassifier.parseRetryAfter(" 15 "));
    }

    @Test
    void shouldTreatNonHttpExceptionsAsTransient() {
        ResolutionError error = GitHubErrorClassifier.classify(new IllegalStateException("boom"), RESOURCE, null,
                NOW);

        assertEquals(ResolutionError.Kind.TRANSIENT, error.getKind());
        assertTrue(error.getMessage().contains("boom"));
    }

    private static ResolutionError classify(int status, Map<String, Collection<String>> headers) {
        return GitHubErrorClassifier.classifyStatus(status, headers, "", RESOURCE, "read:billing", NOW);
    }
}
