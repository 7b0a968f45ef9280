/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.httpclient;

import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.reactivestreams.Subscription;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.http.client.HttpClientResponse;

/**
 * A response received by {@link ReactorHttpClient}. The status and headers
 * are available at once; the body is read, at most once, through
 * {@link #getBody} or {@link #getBodyAsString}. A body nobody subscribes to
 * is drained when the exchange is cancelled or fails, so the connection
 * can return to the pool.
 */
public class HttpResponse {

    private static final Logger logger =
        Logger.getLogger(HttpResponse.class.getName());

    private final HttpClientResponse reactorNettyResponse;
    private final Connection reactorNettyConnection;

    private final AtomicReference<SubscriptionState> state =
        new AtomicReference<SubscriptionState>(
            SubscriptionState.NOT_SUBSCRIBED);

    HttpResponse(HttpClientResponse reactorNettyResponse,
                 Connection reactorNettyConnection) {
        this.reactorNettyResponse = reactorNettyResponse;
        this.reactorNettyConnection = reactorNettyConnection;
    }

    public int getStatusCode() {
        return reactorNettyResponse.status().code();
    }

    public HttpResponseStatus getStatus() {
        return reactorNettyResponse.status();
    }

    public HttpHeaders getHeaders() {
        return reactorNettyResponse.responseHeaders();
    }

    /**
     * Returns the aggregated body. The buffer is released by reactor-netty
     * once the returned Mono's subscriber has consumed it; a subscriber
     * that keeps it must retain it.
     *
     * @return the body, empty if the response had none
     */
    public Mono<ByteBuf> getBody() {
        return reactorNettyConnection.inbound().receive()
            .aggregate()
            .doOnSubscribe(this::updateSubscriptionState);
    }

    /**
     * Returns the body decoded as UTF-8.
     *
     * @return the body
     */
    public Mono<String> getBodyAsString() {
        return reactorNettyConnection.inbound().receive()
            .aggregate()
            .asString()
            .doOnSubscribe(this::updateSubscriptionState);
    }

    /*
     * Marks the body as subscribed. A body that was already drained after
     * a cancellation cannot be read.
     */
    void updateSubscriptionState(Subscription subscription) {
        if (state.compareAndSet(SubscriptionState.NOT_SUBSCRIBED,
                                SubscriptionState.SUBSCRIBED)) {
            return;
        }
        /*
         * reactor-netty rejects a second subscriber only while the first is
         * active; a late one would silently receive nothing.
         */
        if (state.get() == SubscriptionState.CANCELLED) {
            throw new IllegalStateException(
                "The response body has been released already due to " +
                "cancellation");
        }
    }

    /*
     * Drains a body that was never subscribed, after a cancel or an error.
     */
    void releaseUnSubscribedResponse(SubscriptionState newState) {
        if (state.compareAndSet(SubscriptionState.NOT_SUBSCRIBED, newState)) {
            logger.fine("Releasing body of unsubscribed response, state " +
                        newState);
            reactorNettyConnection.inbound().receive()
                .subscribe(byteBuf -> {},
                           ex -> logger.fine("Error draining response " +
                                             "body: " + ex));
        }
    }

    enum SubscriptionState {
        NOT_SUBSCRIBED,
        SUBSCRIBED,
        /* cancelled before the body was subscribed */
        CANCELLED,
        /* failed before the body was subscribed */
        ERROR
    }
}
