package com.infomedia.abacox.callbilling.component.easyhttp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import okhttp3.OkHttpClient;
import okhttp3.logging.HttpLoggingInterceptor;

import java.time.Duration;

/**
 * A configurable factory for creating EasyHttp request builders.
 * An instance of this class holds a specific OkHttpClient configuration
 * (timeouts, interceptors, etc.).
 */
public class EasyHttpClient {

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    private EasyHttpClient(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
    }

    public OkHttpClient getOkHttpClient() {
        return okHttpClient;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Starts building a request for the given URL using this client's configuration.
     */
    public EasyHttp url(String url) {
        return new EasyHttp(url, this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public enum LoggingLevel {
        NONE, BASIC, HEADERS, BODY
    }

    public static class Builder {
        private final OkHttpClient.Builder clientBuilder;
        private final HttpLoggingInterceptor loggingInterceptor;
        private ObjectMapper customMapper;

        public Builder() {
            this.clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .writeTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30));

            this.loggingInterceptor = new HttpLoggingInterceptor();
            this.loggingInterceptor.setLevel(HttpLoggingInterceptor.Level.NONE);
            this.clientBuilder.addInterceptor(loggingInterceptor);
        }

        public Builder connectTimeout(Duration timeout) {
            clientBuilder.connectTimeout(timeout);
            return this;
        }

        public Builder readTimeout(Duration timeout) {
            clientBuilder.readTimeout(timeout);
            clientBuilder.writeTimeout(timeout);
            return this;
        }

        public Builder loggingLevel(LoggingLevel level) {
            HttpLoggingInterceptor.Level okhttpLevel;
            switch (level) {
                case BASIC:   okhttpLevel = HttpLoggingInterceptor.Level.BASIC;   break;
                case HEADERS: okhttpLevel = HttpLoggingInterceptor.Level.HEADERS; break;
                case BODY:    okhttpLevel = HttpLoggingInterceptor.Level.BODY;    break;
                case NONE:
                default:      okhttpLevel = HttpLoggingInterceptor.Level.NONE;    break;
            }
            this.loggingInterceptor.setLevel(okhttpLevel);
            return this;
        }

        /**
         * Provide a custom Jackson ObjectMapper for this client instance. It is copied, so the
         * settings below never leak into the caller's mapper.
         */
        public Builder objectMapper(ObjectMapper mapper) {
            this.customMapper = mapper;
            return this;
        }

        public EasyHttpClient build() {
            ObjectMapper mapper = (this.customMapper != null) ? this.customMapper.copy() : new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
            mapper.findAndRegisterModules();
            mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
            return new EasyHttpClient(clientBuilder.build(), mapper);
        }
    }
}
