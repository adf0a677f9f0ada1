package me.golemcore.spychat.domain.system;

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

import me.golemcore.spychat.domain.model.TurnFailureReason;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies LLM failures into stable machine-readable reason codes, and those
 * codes into the two upstream failure kinds a turn reports.
 */
public final class LlmErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String CONNECTION_FAILED = "llm.connection.failed";
    public static final String LANGCHAIN4J_RATE_LIMIT = "llm.langchain4j.rate_limit";
    public static final String LANGCHAIN4J_TIMEOUT = "llm.langchain4j.timeout";
    public static final String LANGCHAIN4J_AUTHENTICATION = "llm.langchain4j.authentication";
    public static final String LANGCHAIN4J_INVALID_REQUEST = "llm.langchain4j.invalid_request";
    public static final String LANGCHAIN4J_MODEL_NOT_FOUND = "llm.langchain4j.model_not_found";
    public static final String LANGCHAIN4J_CONTENT_FILTERED = "llm.langchain4j.content_filtered";
    public static final String LANGCHAIN4J_INTERNAL_SERVER = "llm.langchain4j.internal_server";
    public static final String LANGCHAIN4J_UNRESOLVED_MODEL_SERVER = "llm.langchain4j.unresolved_model_server";
    public static final String LANGCHAIN4J_RETRIABLE = "llm.langchain4j.retriable";
    public static final String LANGCHAIN4J_NON_RETRIABLE = "llm.langchain4j.non_retriable";
    public static final String LANGCHAIN4J_HTTP_ERROR = "llm.langchain4j.http_error";
    public static final String LANGCHAIN4J_ERROR = "llm.langchain4j.error";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";
    private static final String CLASS_LANGCHAIN4J_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "LangChain4jException";

    private static final Set<String> UNAVAILABLE_CODES = Set.of(
            REQUEST_ABORTED,
            REQUEST_TIMEOUT,
            CONNECTION_FAILED,
            LANGCHAIN4J_RATE_LIMIT,
            LANGCHAIN4J_TIMEOUT,
            LANGCHAIN4J_INTERNAL_SERVER,
            LANGCHAIN4J_UNRESOLVED_MODEL_SERVER,
            LANGCHAIN4J_RETRIABLE);

    private LlmErrorClassifier() {
    }

    /**
     * Classify an LLM failure based on structured throwable types/cause chain.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Timeouts, refused connections, rate limits and 5xx responses mean the
     * provider is unavailable; everything else is an upstream error.
     */
    public static TurnFailureReason toFailureReason(String code) {
        if (code != null && UNAVAILABLE_CODES.contains(code)) {
            return TurnFailureReason.UPSTREAM_UNAVAILABLE;
        }
        return TurnFailureReason.UPSTREAM_ERROR;
    }

    public static TurnFailureReason failureReasonOf(Throwable throwable) {
        return toFailureReason(classifyFromThrowable(throwable));
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }
        if (throwable instanceof ConnectException || throwable instanceof UnknownHostException) {
            return CONNECTION_FAILED;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }

        return switch (className) {
        case CLASS_RATE_LIMIT_EXCEPTION -> LANGCHAIN4J_RATE_LIMIT;
        case CLASS_TIMEOUT_EXCEPTION -> LANGCHAIN4J_TIMEOUT;
        case CLASS_AUTHENTICATION_EXCEPTION -> LANGCHAIN4J_AUTHENTICATION;
        case CLASS_INVALID_REQUEST_EXCEPTION -> LANGCHAIN4J_INVALID_REQUEST;
        case CLASS_MODEL_NOT_FOUND_EXCEPTION -> LANGCHAIN4J_MODEL_NOT_FOUND;
        case CLASS_CONTENT_FILTERED_EXCEPTION -> LANGCHAIN4J_CONTENT_FILTERED;
        case CLASS_INTERNAL_SERVER_EXCEPTION -> LANGCHAIN4J_INTERNAL_SERVER;
        case CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION -> LANGCHAIN4J_UNRESOLVED_MODEL_SERVER;
        case CLASS_HTTP_EXCEPTION -> classifyHttpExceptionByStatus(throwable);
        case CLASS_RETRIABLE_EXCEPTION -> LANGCHAIN4J_RETRIABLE;
        case CLASS_NON_RETRIABLE_EXCEPTION -> LANGCHAIN4J_NON_RETRIABLE;
        case CLASS_LANGCHAIN4J_EXCEPTION -> LANGCHAIN4J_ERROR;
        default -> UNKNOWN;
        };
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return LANGCHAIN4J_HTTP_ERROR;
        }
        if (statusCode == 429) {
            return LANGCHAIN4J_RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return LANGCHAIN4J_AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return LANGCHAIN4J_TIMEOUT;
        }
        if (statusCode >= 500) {
            return LANGCHAIN4J_INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return LANGCHAIN4J_INVALID_REQUEST;
        }
        return LANGCHAIN4J_HTTP_ERROR;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }
}
