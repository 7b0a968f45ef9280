/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.http;

import static io.dataapi.driver.util.CheckNull.requireNonNull;
import static io.dataapi.driver.util.HttpConstants.ACCEPT;
import static io.dataapi.driver.util.HttpConstants.APPLICATION_JSON;
import static io.dataapi.driver.util.HttpConstants.CONTENT_LENGTH;
import static io.dataapi.driver.util.HttpConstants.CONTENT_TYPE;
import static io.dataapi.driver.util.HttpConstants.REQUEST_ID_HEADER;
import static io.dataapi.driver.util.HttpConstants.USER_AGENT;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import io.dataapi.driver.AuthorizationProvider;
import io.dataapi.driver.DataAPIException;
import io.dataapi.driver.DataAPIHandleConfig;
import io.dataapi.driver.DataAPIHttpException;
import io.dataapi.driver.DataAPIResponseException;
import io.dataapi.driver.ErrorDescriptor;
import io.dataapi.driver.RequestTimeoutException;
import io.dataapi.driver.RetryableException;
import io.dataapi.driver.ServiceUnavailableException;
import io.dataapi.driver.ThrottlingException;
import io.dataapi.driver.httpclient.HttpResponse;
import io.dataapi.driver.httpclient.ReactorHttpClient;
import io.dataapi.driver.ops.Request;
import io.dataapi.driver.ops.Result;
import io.dataapi.driver.ops.serde.JsonSerializerFactory;
import io.dataapi.driver.ops.serde.SerializerFactory;
import io.dataapi.driver.util.HttpConstants;
import io.dataapi.driver.util.LogUtil;
import io.dataapi.driver.values.FieldValue;
import io.dataapi.driver.values.JsonUtils;
import io.dataapi.driver.values.MapValue;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.ssl.SslContext;
import io.netty.util.IllegalReferenceCountException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;
import reactor.util.retry.Retry;

/**
 * @hidden
 *
 * Sends Data API commands over HTTP. Each {@link Request} is serialized to
 * a JSON command, posted to
 * {@code <endpoint><apiPath>/<namespace>/<collection>} and its response
 * turned into a {@link Result} or an exception.
 */
public class AsyncClient {

    /* base delay between retries of RetryableException */
    private static final int RETRY_DELAY_MS = 200;

    private final Logger logger;
    private final DataAPIHandleConfig config;

    private final SerializerFactory factory = new JsonSerializerFactory();

    /**
     * The URL representing the server that is the target of all client
     * requests.
     */
    private final URL url;

    /**
     * The service URL without a trailing path, the prefix of every
     * request URI.
     */
    private final String baseURI;

    private final String host;

    private final ReactorHttpClient httpClient;
    private final AuthorizationProvider authProvider;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /* for one-time messages */
    private final HashSet<String> oneTimeMessages;

    /* for keeping track of SDKs usage */
    private final String userAgent;

    private final AtomicInteger maxRequestId = new AtomicInteger(1);

    public AsyncClient(DataAPIHandleConfig config,
                       SslContext sslCtx,
                       Logger logger) {
        this.config = config;
        this.logger = logger;
        this.url = config.getServiceURL();

        LogUtil.logFine(logger, "Driver service URL:" + url.toString());

        final String protocol = url.getProtocol();
        if (!("http".equalsIgnoreCase(protocol) ||
                "https".equalsIgnoreCase(protocol))) {
            throw new IllegalArgumentException("Unknown protocol:" + protocol);
        }

        baseURI = url.getProtocol() + "://" + url.getHost() + ":" +
            url.getPort();
        host = url.getHost();

        if ("https".equalsIgnoreCase(protocol) && sslCtx == null) {
            throw new IllegalArgumentException("Unable to configure https: " +
                "SslContext is missing");
        }

        authProvider = config.getAuthorizationProvider();
        if (authProvider == null) {
            throw new IllegalArgumentException(
                "Must configure AuthorizationProvider to use HttpClient");
        }

        ReactorHttpClient.Builder builder = ReactorHttpClient
            .builder()
            .host(host)
            .port(url.getPort())
            .sslContext(sslCtx)
            .sslHandshakeTimeoutMs(config.getSSLHandshakeTimeout())
            .connectionPoolConfig(config.getConnectionPoolConfig())
            .wiretap(config.getWiretap())
            .logger(logger);
        if (config.getProxyHost() != null) {
            builder.proxyHost(config.getProxyHost())
                .proxyPort(config.getProxyPort())
                .proxyUsername(config.getProxyUsername())
                .proxyPassword(config.getProxyPassword());
        }
        httpClient = builder.build();

        String extensionUserAgent = config.getExtensionUserAgent();
        if (extensionUserAgent != null) {
            userAgent = HttpConstants.userAgent +
                " " + extensionUserAgent;
        } else {
            this.userAgent = HttpConstants.userAgent;
        }
        oneTimeMessages = new HashSet<>();
    }

    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        LogUtil.logFine(logger, "Shutting down driver http client");
        httpClient.shutdown();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private void initAndValidateRequest(Request request) {
        /*
         * Fill in the values defaulted from config, the timeout and
         * namespace, so both are explicit on the wire.
         */
        request.setDefaults(config);

        /* throws IllegalArgumentException */
        request.validate();
    }

    public Mono<Result> execute(Request request) {
        requireNonNull(request, "DataAPIHandle: request must be non-null");
        if (shutdown.get()) {
            return Mono.error(new IllegalStateException(
                "DataAPIHandle has been closed"));
        }
        try {
            initAndValidateRequest(request);
        } catch (IllegalArgumentException iae) {
            return Mono.error(iae);
        }

        ClientRequest clientRequest =
            new ClientRequest(request, maxRequestId.getAndIncrement());

        return executeWithTimeout(clientRequest);
    }

    private Mono<Result> executeWithTimeout(ClientRequest clientRequest) {
        final int timeoutMs = clientRequest.request.getTimeoutInternal();
        return executeWithRetry(clientRequest)
            .timeout(Duration.ofMillis(timeoutMs))
            .onErrorMap(TimeoutException.class, te ->
                new RequestTimeoutException(timeoutMs,
                    "Request " + clientRequest.request.getCommandName() +
                    " timed out", te));
    }

    private Mono<Result> executeWithRetry(ClientRequest clientRequest) {
        final String requestClass = clientRequest.requestClass;
        final String requestId = clientRequest.requestIdStr;

        return getHttpMono(clientRequest)
            // RetryableException: backoff from 200ms with jitter
            .retryWhen(Retry.backoff(config.getMaxRetries(),
                                     Duration.ofMillis(RETRY_DELAY_MS))
                       .jitter(0.2)
                       .filter(throwable ->
                               throwable instanceof RetryableException &&
                               clientRequest.request.shouldRetry())
                       .doBeforeRetry(retrySignal -> {
                           logRetries(requestId, requestClass,
                                      retrySignal.totalRetries() + 1,
                                      retrySignal.failure());
                       })
                       .onRetryExhaustedThrow((spec, signal) ->
                                              signal.failure()));
    }

    private Mono<Result> getHttpMono(ClientRequest clientRequest) {
        final Request request = clientRequest.request;
        final String requestClass = clientRequest.requestClass;
        final String requestId = clientRequest.requestIdStr;
        final String requestURI = baseURI +
            HttpConstants.makePath(config.getApiPath(),
                                   request.getNamespace(),
                                   request.getCollectionName());

        return Mono.defer(() -> {
            LogUtil.logRequest(logger, requestId, requestClass,
                               "Inside execute core part");

            return Mono.using(
                () -> { // Bytebuf resource acquisition
                    ByteBuf buffer = ByteBufAllocator.DEFAULT.directBuffer();
                    buffer.retain();
                    return buffer;
                },
                (buffer) -> { // Bytebuf resource use
                    try {
                        writeContent(buffer, request);
                    } catch (RuntimeException e) {
                        return Mono.error(e);
                    }

                    final Mono<HttpHeaders> requestHeader =
                        getHeader(request, buffer)
                        .map(headers -> headers.add(REQUEST_ID_HEADER,
                                                    requestId))
                        .doOnNext(header -> {
                            LogUtil.logRequest(logger, requestId,
                                requestClass,
                                "Sending request to " + requestURI);
                        });

                    Mono<HttpResponse> responseMono = httpClient
                        .postRequest(requestURI, requestHeader, buffer)
                        .doOnNext(response -> {
                            LogUtil.logRequest(logger, requestId,
                                requestClass,
                                "Response: status=" + response.getStatus());
                        }).doOnCancel(() -> {
                            LogUtil.logRequest(logger, requestId,
                                requestClass, "Http request is cancelled");
                        });
                    return processResponse(responseMono, clientRequest);
                },
                (buffer) -> { // Bytebuf resource cleanup
                    LogUtil.logRequest(logger, requestId, requestClass,
                        "Cleaning ByteBuf with refCount=" + buffer.refCnt());
                    buffer.release(buffer.refCnt());
                }
            );
        });
    }

    private void writeContent(ByteBuf content, Request request) {
        MapValue command = request.createSerializer(factory)
            .serialize(request);
        content.writeCharSequence(command.toJson(), UTF_8);
    }

    private Mono<Result> processResponse(Mono<HttpResponse> responseMono,
                                         ClientRequest clientRequest) {
        final String requestClass = clientRequest.requestClass;
        final String requestId = clientRequest.requestIdStr;
        final Request request = clientRequest.request;

        return responseMono.flatMap(httpResponse -> {
            HttpResponseStatus responseStatus = httpResponse.getStatus();
            /* an empty body aggregates to an empty Mono */
            Mono<ByteBuf> body = httpResponse.getBody()
                .defaultIfEmpty(Unpooled.EMPTY_BUFFER);
            return body.handle((ByteBuf content,
                                SynchronousSink<Result> sink) -> {
                LogUtil.logRequest(logger, requestId, requestClass,
                                   "processing response");
                try {
                    sink.next(processResponse(responseStatus, content,
                                              request));
                } catch (IllegalReferenceCountException e) {
                    LogUtil.logRequest(logger, requestId, requestClass,
                        "Illegal refCount, request might be cancelled");
                    sink.complete();
                } catch (Throwable t) {
                    sink.error(t);
                }
            });
        });
    }

    final Result processResponse(HttpResponseStatus status,
                                 ByteBuf responseBody,
                                 Request request) {
        if (!HttpResponseStatus.OK.equals(status)) {
            throw processNotOKResponse(status, responseBody);
        }
        return processOKResponse(readResponse(responseBody), request);
    }

    /**
     * Process an OK response. An "errors" array turns into
     * {@link DataAPIResponseException}, whatever else the response holds.
     *
     * @return the result of processing the successful request
     */
    Result processOKResponse(MapValue response, Request request) {
        FieldValue errors = response.get(JsonSerializerFactory.ERRORS);
        if (errors != null && errors.isArray() &&
                errors.asArray().size() > 0) {
            List<ErrorDescriptor> descriptors =
                new ArrayList<ErrorDescriptor>();
            for (FieldValue error : errors.asArray()) {
                if (error.isMap()) {
                    descriptors.add(ErrorDescriptor.fromMap(error.asMap()));
                }
            }
            throw new DataAPIResponseException(request.getCommandName(),
                                               descriptors,
                                               response);
        }
        return request.createSerializer(factory)
            .deserialize(request, response);
    }

    private MapValue readResponse(ByteBuf content) {
        if (content.readableBytes() == 0) {
            return new MapValue();
        }
        FieldValue value;
        try (ByteBufInputStream in = new ByteBufInputStream(content)) {
            value = JsonUtils.createValueFromJson(in);
        } catch (IOException ioe) {
            throw new DataAPIException("Unable to read response: " +
                                       ioe.getMessage(), ioe);
        }
        if (value == null || !value.isMap()) {
            throw new DataAPIException(
                "Unexpected response, not a JSON object: " + value);
        }
        return value.asMap();
    }

    /**
     * Process NotOK response, returning the exception to throw.
     *
     * @param status  the http response code it must not be OK
     * @param payload the payload representing the failure response
     */
    private RuntimeException processNotOKResponse(HttpResponseStatus status,
                                                  ByteBuf payload) {
        int len = payload.readableBytes();
        String errMsg = (len > 0) ?
            payload.readCharSequence(len, UTF_8).toString() : null;
        int code = status.code();
        if (code == HttpResponseStatus.TOO_MANY_REQUESTS.code()) {
            return new ThrottlingException("Request throttled: " +
                (errMsg != null ? errMsg : status.reasonPhrase()));
        }
        if (code == HttpResponseStatus.BAD_GATEWAY.code() ||
                code == HttpResponseStatus.SERVICE_UNAVAILABLE.code() ||
                code == HttpResponseStatus.GATEWAY_TIMEOUT.code()) {
            return new ServiceUnavailableException(code,
                "Service unavailable: " + status.reasonPhrase());
        }
        if (code == HttpResponseStatus.UNAUTHORIZED.code()) {
            oneTimeMessage("The Data API rejected the configured token");
        }
        return new DataAPIHttpException(code,
            "Error response: " + status.reasonPhrase(), errMsg);
    }

    public synchronized void oneTimeMessage(String msg) {
        if (!oneTimeMessages.add(msg)) {
            return;
        }
        LogUtil.logWarning(logger, msg);
    }

    private String getUserAgent() {
        return userAgent;
    }

    private Mono<HttpHeaders> getHeader(Request request, ByteBuf buffer) {
        /* a null credential must fail rather than complete empty */
        return Mono.defer(() -> {
                String authString =
                    authProvider.getAuthorizationString(request);
                authProvider.validateAuthString(authString);
                return Mono.just(authString);
            }).map(authString -> {
                HttpHeaders headers = new DefaultHttpHeaders();
                headers.set(CONTENT_TYPE, APPLICATION_JSON)
                        .set(HttpHeaderNames.CONNECTION,
                             HttpHeaderValues.KEEP_ALIVE)
                        .set(ACCEPT, "application/json")
                        .set(USER_AGENT, getUserAgent())
                        .set(HttpHeaderNames.HOST, host)
                        .setInt(CONTENT_LENGTH, buffer.readableBytes());
                authProvider.setRequiredHeaders(authString, request,
                                                headers);
                return headers;
            });
    }

    private void logRetries(String requestId,
                            String requestClass,
                            long numRetries,
                            Throwable exception) {
        LogUtil.logRequest(logger, requestId, requestClass,
            "Doing retry: " + numRetries +
            (exception != null ? ", exception: " + exception : ""));
    }

    /**
     * @hidden
     * For testing use
     */
    public ReactorHttpClient getHttpClient() {
        return httpClient;
    }

    /*
     * Helper class which contains all the information for async flow
     */
    private static class ClientRequest {
        private final Request request;
        private final String requestClass;
        private final String requestIdStr;

        ClientRequest(Request request, int requestId) {
            this.request = request;
            this.requestClass = request.getClass().getSimpleName();
            this.requestIdStr = Integer.toString(requestId);
        }
    }
}
