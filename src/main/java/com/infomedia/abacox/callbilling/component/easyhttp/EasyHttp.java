package com.infomedia.abacox.callbilling.component.easyhttp;

import com.fasterxml.jackson.core.JsonProcessingException;
import okhttp3.*;

import java.io.IOException;

/**
 * A fluent builder for constructing and executing a single HTTP request.
 * An instance of this class is created via an EasyHttpClient.
 */
public class EasyHttp {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final EasyHttpClient client;
    private final Request.Builder requestBuilder;
    private final HttpUrl.Builder urlBuilder;
    private RequestBody requestBody;

    // Package-private constructor, should only be created by EasyHttpClient
    EasyHttp(String url, EasyHttpClient client) {
        this.client = client;
        this.requestBuilder = new Request.Builder();
        HttpUrl parsedUrl = HttpUrl.parse(url);
        if (parsedUrl == null) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }
        this.urlBuilder = parsedUrl.newBuilder();
    }

    // --- Request Configuration Methods (Builder) ---
    public EasyHttp pathSegment(String segment) {
        urlBuilder.addPathSegment(segment);
        return this;
    }

    public EasyHttp json(Object object) {
        try {
            String jsonString = client.getObjectMapper().writeValueAsString(object);
            this.requestBody = RequestBody.create(jsonString, JSON);
            return this;
        } catch (JsonProcessingException e) {
            throw new EasyHttpException("Failed to serialize object to JSON", e);
        }
    }

    // --- Execution Methods (Terminal) ---

    private Request build(String method) {
        return requestBuilder.url(urlBuilder.build()).method(method, requestBody).build();
    }

    public ResponseExecutor post() { return new ResponseExecutor(build("POST"), client); }
    public ResponseExecutor delete() { return new ResponseExecutor(build("DELETE"), client); }

    /**
     * Handles synchronous response processing.
     */
    public static class ResponseExecutor {
        private final Request request;
        private final EasyHttpClient client;

        private ResponseExecutor(Request request, EasyHttpClient client) {
            this.request = request;
            this.client = client;
        }

        public Response execute() throws EasyHttpException {
            try {
                return client.getOkHttpClient().newCall(request).execute();
            } catch (IOException e) {
                throw new EasyHttpException("Network request failed: " + request.method() + " " + request.url(), e);
            }
        }

        /**
         * Executes and returns the status code, failing on any non-2xx status except those
         * listed as acceptable.
         */
        public int expectSuccess(int... acceptableStatuses) throws EasyHttpException {
            try (Response response = execute()) {
                if (response.isSuccessful()) {
                    return response.code();
                }
                for (int acceptable : acceptableStatuses) {
                    if (response.code() == acceptable) {
                        return response.code();
                    }
                }
                ResponseBody body = response.body();
                throw new EasyHttpException(response.message(), response.code(), body != null ? body.string() : null);
            } catch (IOException e) {
                throw new EasyHttpException("Failed to read response body", e);
            }
        }
    }
}
