package com.barvault.dataservice.remote;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared HTTP client and JSON mapper for provider clients.
 */
public final class HttpClientFactory {

    private static final OkHttpClient SHARED_CLIENT;
    private static final ObjectMapper SHARED_MAPPER;

    static {
        SHARED_CLIENT = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(5, 5, TimeUnit.MINUTES))
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(120, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();

        SHARED_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private HttpClientFactory() {
    }

    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    /**
     * Client sharing the pooled connections but with its own connect timeout.
     */
    public static OkHttpClient withConnectTimeout(Duration connectTimeout) {
        return SHARED_CLIENT.newBuilder()
            .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .build();
    }

    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
