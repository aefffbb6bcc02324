package me.golemcore.orchestrator.infrastructure.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp transport for the Feign backed adapters (the text-only
 * fallback tier and the infrastructure command API).
 *
 * <p>
 * The whole call is capped by the provider timeout so a stuck tier cannot
 * hold its worker past the cascade deadline.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final OrchestratorProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        OrchestratorProperties.HttpProperties http = properties.getHttp();
        Duration callTimeout = Duration.ofMillis(properties.getProviders().getTimeoutMs());
        log.info("[HTTP] Transport: connect={}ms, read={}ms, call={}ms, pool={}",
                http.getConnectTimeout(), http.getReadTimeout(), callTimeout.toMillis(),
                http.getMaxIdleConnections());
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(http.getConnectTimeout()))
                .readTimeout(Duration.ofMillis(http.getReadTimeout()))
                .writeTimeout(Duration.ofMillis(http.getWriteTimeout()))
                .callTimeout(callTimeout)
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(), TimeUnit.MILLISECONDS))
                .addInterceptor(new CallLoggingInterceptor())
                .build();
    }

    /**
     * Logs method, host, status and elapsed time of every outbound call at
     * debug level. Query strings and headers are never logged.
     */
    static final class CallLoggingInterceptor implements Interceptor {

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            long started = System.nanoTime();
            try {
                Response response = chain.proceed(request);
                if (log.isDebugEnabled()) {
                    log.debug("[HTTP] {} {}{} -> {} ({}ms)", request.method(), request.url().host(),
                            request.url().encodedPath(), response.code(), elapsedMillis(started));
                }
                return response;
            } catch (IOException e) {
                log.debug("[HTTP] {} {}{} failed after {}ms: {}", request.method(), request.url().host(),
                        request.url().encodedPath(), elapsedMillis(started), e.getMessage());
                throw e;
            }
        }

        private static long elapsedMillis(long startedNanos) {
            return (System.nanoTime() - startedNanos) / 1_000_000;
        }
    }
}
