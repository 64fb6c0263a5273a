package me.golemcore.pacing.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * This interceptor never performs network I/O. Tests enqueue responses (or
 * failures) with optional headers, and every request is captured for
 * assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final String DEFAULT_CONTENT_TYPE = "application/json";

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public void enqueueJson(int code, String body) {
        enqueueJson(code, body, Map.of());
    }

    public void enqueueJson(int code, String body, Map<String, String> headers) {
        byte[] bytes = body != null ? body.getBytes(StandardCharsets.UTF_8) : new byte[0];
        plannedResults.add(PlannedResult.response(code, bytes, DEFAULT_CONTENT_TYPE, Headers.of(headers)));
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(PlannedResult.failure(failure));
    }

    public CapturedRequest takeRequest() {
        return capturedRequests.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        capturedRequests.add(new CapturedRequest(request));
        requestCount.incrementAndGet();

        PlannedResult plannedResult = plannedResults.poll();
        if (plannedResult == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (plannedResult.failure() != null) {
            throw plannedResult.failure();
        }

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(plannedResult.code())
                .message("mock")
                .headers(plannedResult.headers())
                .body(ResponseBody.create(plannedResult.body(), MediaType.parse(plannedResult.contentType())))
                .build();
    }

    private record PlannedResult(int code, byte[] body, String contentType, Headers headers, IOException failure) {
        static PlannedResult response(int code, byte[] body, String contentType, Headers headers) {
            return new PlannedResult(code, body, contentType, headers, null);
        }

        static PlannedResult failure(IOException failure) {
            return new PlannedResult(0, new byte[0], null, Headers.of(), failure);
        }
    }

    public static final class CapturedRequest {
        private final Request request;

        private CapturedRequest(Request request) {
            this.request = request;
        }

        public String method() {
            return request.method();
        }

        public String target() {
            String encodedPath = request.url().encodedPath();
            String encodedQuery = request.url().encodedQuery();
            if (encodedQuery == null || encodedQuery.isBlank()) {
                return encodedPath;
            }
            return encodedPath + "?" + encodedQuery;
        }

        public String header(String name) {
            return request.header(name);
        }
    }
}
