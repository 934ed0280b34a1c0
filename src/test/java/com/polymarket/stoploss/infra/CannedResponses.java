package com.polymarket.stoploss.infra;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OkHttp interceptor answering requests by path, so HTTP clients can be tested without a network.
 */
class CannedResponses implements Interceptor {

    record Canned(int code, String body) {
    }

    record Recorded(Request request, String body) {
    }

    private final Map<String, Canned> byPath = new LinkedHashMap<>();
    private final List<Recorded> requests = new ArrayList<>();

    CannedResponses on(String path, int code, String body) {
        byPath.put(path, new Canned(code, body));
        return this;
    }

    OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    List<Recorded> requests() {
        return requests;
    }

    Recorded last(String path) {
        for (int i = requests.size() - 1; i >= 0; i--) {
            if (requests.get(i).request().url().encodedPath().equals(path)) {
                return requests.get(i);
            }
        }
        throw new AssertionError("No request sent to " + path);
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String body = "";
        if (request.body() != null) {
            Buffer buffer = new Buffer();
            request.body().writeTo(buffer);
            body = buffer.readUtf8();
        }
        requests.add(new Recorded(request, body));

        Canned canned = byPath.get(request.url().encodedPath());
        if (canned == null) {
            throw new IOException("Unexpected request to " + request.url());
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(canned.code())
                .message(canned.code() < 300 ? "OK" : "Error")
                .body(ResponseBody.create(canned.body(), MediaType.get("application/json")))
                .build();
    }
}
