package me.golemcore.orchestrator.domain.service;

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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Classifies provider failures into stable machine-readable codes that drive
 * and describe the provider cascade.
 *
 * <p>
 * The cause chain is walked from the outermost throwable. langchain4j
 * exceptions are recognised by class name, HTTP clients (langchain4j, Feign)
 * by their status code, and JDK timeout and I/O exceptions by type.
 */
public final class ProviderErrorClassifier {

    public static final String RATE_LIMIT = "provider.rate_limit";
    public static final String AUTHENTICATION = "provider.authentication";
    public static final String TIMEOUT = "provider.timeout";
    public static final String TRANSPORT = "provider.transport";
    public static final String INVALID_REQUEST = "provider.invalid_request";
    public static final String SERVER_ERROR = "provider.server_error";
    public static final String UNAVAILABLE = "provider.unavailable";
    public static final String UNKNOWN = "provider.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";

    private ProviderErrorClassifier() {
    }

    public static String classify(Throwable throwable) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            String code = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(code)) {
                return code;
            }
            current = current.getCause();
        }
        return throwable != null ? classifyFromMessage(throwable.getMessage()) : UNKNOWN;
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            String byType = classifyLangchain4j(className);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }
        }

        Integer status = readStatusCode(throwable);
        if (status != null && status > 0) {
            return classifyHttpStatus(status);
        }

        if (throwable instanceof IOException || throwable instanceof UncheckedIOException) {
            return TRANSPORT;
        }
        return UNKNOWN;
    }

    private static String classifyLangchain4j(String className) {
        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return RATE_LIMIT;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return TIMEOUT;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return AUTHENTICATION;
        }
        if (CLASS_INVALID_REQUEST_EXCEPTION.equals(className) || CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)) {
            return INVALID_REQUEST;
        }
        if (CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)) {
            return SERVER_ERROR;
        }
        if (CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION.equals(className)) {
            return TRANSPORT;
        }
        return UNKNOWN;
    }

    private static String classifyHttpStatus(int statusCode) {
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return TIMEOUT;
        }
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return UNKNOWN;
    }

    // langchain4j HttpException exposes statusCode(), FeignException exposes status()
    private static Integer readStatusCode(Throwable throwable) {
        for (String accessor : new String[] { "statusCode", "status" }) {
            try {
                Method method = throwable.getClass().getMethod(accessor);
                Object result = method.invoke(throwable);
                if (result instanceof Integer) {
                    return (Integer) result;
                }
            } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
                // try the next accessor
            }
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("rate limit") || normalized.contains("rate_limit")
                || normalized.contains("too many requests") || normalized.contains("quota")) {
            return RATE_LIMIT;
        }
        if (normalized.contains("unauthorized") || normalized.contains("invalid api key")) {
            return AUTHENTICATION;
        }
        if (normalized.contains("timed out") || normalized.contains("timeout")) {
            return TIMEOUT;
        }
        return UNKNOWN;
    }
}
