package me.golemcore.agentrun.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory OkHttp exchange engine for unit tests.
 * <p>
 * Responses are routed by request path and never touch the network. Every
 * request path is recorded for assertions; a path without a planned answer
 * fails with an {@link IOException}.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final Map<String, PlannedResult> routes = new ConcurrentHashMap<>();
    private final List<String> requestedPaths = new CopyOnWriteArrayList<>();

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public void respondJson(String path, int code, String body) {
        routes.put(path, new PlannedResult(code, body, null));
    }

    public void fail(String path, IOException failure) {
        routes.put(path, new PlannedResult(0, null, failure));
    }

    public List<String> requestedPaths() {
        return List.copyOf(requestedPaths);
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String path = request.url().encodedPath();
        requestedPaths.add(path);

        PlannedResult planned = routes.get(path);
        if (planned == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (planned.failure() != null) {
            throw planned.failure();
        }

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(planned.code())
                .message("mock")
                .body(ResponseBody.create(planned.body() != null ? planned.body() : "", JSON))
                .build();
    }

    private record PlannedResult(int code, String body, IOException failure) {
    }
}
