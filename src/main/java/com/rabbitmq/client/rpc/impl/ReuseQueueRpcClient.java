// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.client.rpc.impl;

import static com.rabbitmq.client.rpc.Resource.State.OPEN;
import static com.rabbitmq.client.rpc.Resource.State.RECOVERING;

import com.rabbitmq.client.rpc.ExchangeDeclareStrategy;
import com.rabbitmq.client.rpc.Message;
import com.rabbitmq.client.rpc.RpcException;
import com.rabbitmq.client.rpc.Transport;
import com.rabbitmq.client.rpc.metrics.MetricsCollector.RequestOutcome;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RPC client that receives all its replies on one queue.
 *
 * <p>Outstanding requests are kept in a table keyed by correlation ID. A request is in the table
 * before it is published, and whoever removes it from the table first (reply, timeout, connection
 * loss, or close) completes it.
 *
 * <p>The response queue is exclusive: it disappears with the connection that declared it. The
 * client drops its consumer when the connection is lost, and when a new connection is created it
 * fails all the outstanding requests with {@link RpcException.RpcConnectionLostException} before
 * declaring the queue and consuming from it again. Replies the broker delivers between the loss of
 * the connection and the disconnection event are lost and the corresponding requests time out.
 */
final class ReuseQueueRpcClient extends RpcClientBase {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReuseQueueRpcClient.class);

  private final Transport transport;
  private final String responseQueueName;
  private final Map<String, PendingRequest> outstandingRequests = new ConcurrentHashMap<>();
  private final Supplier<String> correlationIdSupplier;
  private final ExchangeDeclareStrategy exchangeDeclareStrategy;
  private final ScheduledExecutorService scheduledExecutorService;
  private final boolean internalScheduledExecutor;
  private final TimeoutScheduler timeoutScheduler;
  private final Executor dispatchingExecutor;
  private final ExecutorService internalDispatchingExecutor;
  private final Transport.ConnectionListener connectionListener = this::handleConnectionEvent;
  private final Lock subscriptionLock = new ReentrantLock();
  private volatile Transport.Subscription subscription;

  ReuseQueueRpcClient(DefaultRpcClientBuilder builder) {
    super(builder);
    this.transport = builder.transport();
    this.responseQueueName =
        builder.responseQueueName() == null
            ? Utils.NAME_SUPPLIER.get()
            : builder.responseQueueName();
    this.correlationIdSupplier =
        builder.correlationIdSupplier() == null
            ? Utils.sequenceSupplier()
            : builder.correlationIdSupplier();
    this.exchangeDeclareStrategy = builder.exchangeDeclareStrategy();

    if (builder.scheduledExecutorService() == null) {
      this.scheduledExecutorService =
          Executors.newSingleThreadScheduledExecutor(
              Utils.threadFactory("rabbitmq-rpc-client-timeout-"));
      this.internalScheduledExecutor = true;
    } else {
      this.scheduledExecutorService = builder.scheduledExecutorService();
      this.internalScheduledExecutor = false;
    }
    this.timeoutScheduler = new TimeoutScheduler(this.scheduledExecutorService);
    if (builder.dispatchingExecutor() == null) {
      this.internalDispatchingExecutor =
          Utils.executorService("rabbitmq-rpc-client-dispatching-");
      this.dispatchingExecutor = this.internalDispatchingExecutor;
    } else {
      this.internalDispatchingExecutor = null;
      this.dispatchingExecutor = builder.dispatchingExecutor();
    }

    this.transport.addConnectionListener(this.connectionListener);
    try {
      this.createQueueAndConsume();
    } catch (RuntimeException e) {
      this.transport.removeConnectionListener(this.connectionListener);
      this.shutdownInternalExecutors();
      throw e;
    }
    this.metricsCollector.openClient();
    this.state(OPEN);
  }

  @Override
  public CompletableFuture<Message> request(
      String exchange,
      String routingKey,
      boolean mandatory,
      boolean immediate,
      Duration timeout,
      Message request) {
    Duration requestTimeout = this.checkRequest(exchange, routingKey, timeout, request);
    this.checkOpen();

    String correlationId = this.correlationIdSupplier.get();
    PendingRequest pendingRequest = new PendingRequest(correlationId);
    if (this.outstandingRequests.putIfAbsent(correlationId, pendingRequest) != null) {
      throw new IllegalStateException(
          "A request with correlation ID " + correlationId + " is already outstanding");
    }
    if (this.closed()) {
      // close() may have drained the table before the request made it in
      this.remove(
          pendingRequest,
          new RpcException.RpcClientClosedException("RPC client is closed"),
          RequestOutcome.CLOSED);
      return pendingRequest.future;
    }

    this.metricsCollector.request();
    try {
      pendingRequest.timeout(
          this.timeoutScheduler.schedule(
              this.timeout,
              () ->
                  this.remove(
                      pendingRequest,
                      new RpcException.RpcTimeoutException(correlationId),
                      RequestOutcome.TIMED_OUT)));
      this.exchangeDeclareStrategy.declareExchange(
          this.transport, exchange, Transport.ExchangeType.DIRECT);
      request
          .replyTo(this.responseQueueName)
          .correlationId(correlationId)
          .expiration(milliseconds(requestTimeout));
      // TODO handle broker returns to honor mandatory/immediate instead of timing out
      this.transport.publish(exchange, routingKey, false, false, request);
    } catch (RuntimeException e) {
      LOGGER.debug("Error while sending request {}: {}", correlationId, e.getMessage());
      this.remove(pendingRequest, e, RequestOutcome.FAILED);
    }
    return pendingRequest.future;
  }

  private void handleConnectionEvent(Transport.ConnectionEvent event) {
    if (this.closed()) {
      return;
    }
    if (event == Transport.ConnectionEvent.DISCONNECTED) {
      this.onConnectionDisconnected();
    } else if (event == Transport.ConnectionEvent.CREATED) {
      this.onConnectionCreated();
    }
  }

  private void onConnectionDisconnected() {
    LOGGER.debug("Connection lost, dropping consumer of response queue {}", this.responseQueueName);
    this.subscriptionLock.lock();
    try {
      // close() may have run since the event was received
      if (this.closed()) {
        return;
      }
      this.state(RECOVERING);
      this.closeSubscription();
    } finally {
      this.subscriptionLock.unlock();
    }
  }

  private void onConnectionCreated() {
    List<PendingRequest> drained = this.drain();
    LOGGER.debug(
        "Connection created, failing {} in-flight request(s) and re-creating response queue {}",
        drained.size(),
        this.responseQueueName);
    for (PendingRequest request : drained) {
      this.fail(
          request,
          new RpcException.RpcConnectionLostException(request.correlationId),
          RequestOutcome.CONNECTION_LOST);
    }
    // failing the requests runs their callbacks, which can close the client
    this.subscriptionLock.lock();
    try {
      if (this.createQueueAndConsume()) {
        this.state(OPEN);
      }
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Error while re-creating response queue {}: {}", this.responseQueueName, e.getMessage());
      if (!this.closed()) {
        this.state(RECOVERING, e);
      }
    } finally {
      this.subscriptionLock.unlock();
    }
  }

  /** Declare the response queue and consume from it, return false if the client is closed. */
  private boolean createQueueAndConsume() {
    this.subscriptionLock.lock();
    try {
      if (this.closed()) {
        return false;
      }
      this.closeSubscription();
      Transport.QueueInfo queue =
          this.transport.declareQueue(this.responseQueueName, false, true, true, null);
      this.subscription = this.transport.consume(queue, this::dispatch);
      LOGGER.debug("Consuming replies from queue {}", queue.name());
      return true;
    } finally {
      this.subscriptionLock.unlock();
    }
  }

  private void dispatch(Message message) {
    try {
      this.dispatchingExecutor.execute(() -> this.handleReply(message));
    } catch (RejectedExecutionException e) {
      LOGGER.debug(
          "Reply with correlation ID {} rejected by dispatching executor: {}",
          message.correlationId(),
          e.getMessage());
    }
  }

  private void handleReply(Message message) {
    String correlationId = message.correlationId();
    PendingRequest request =
        correlationId == null ? null : this.outstandingRequests.remove(correlationId);
    if (request == null) {
      LOGGER.debug("No outstanding request for correlation ID {}, dropping reply", correlationId);
      this.metricsCollector.lateReply();
    } else {
      this.completeWithReply(request.future, message);
      request.cancelTimeout();
    }
  }

  /** Remove every outstanding request, one key at a time. */
  private List<PendingRequest> drain() {
    List<PendingRequest> drained = new ArrayList<>(this.outstandingRequests.size());
    for (String correlationId : this.outstandingRequests.keySet()) {
      PendingRequest request = this.outstandingRequests.remove(correlationId);
      if (request != null) {
        drained.add(request);
      }
    }
    return drained;
  }

  private void remove(PendingRequest request, Throwable cause, RequestOutcome outcome) {
    if (this.outstandingRequests.remove(request.correlationId, request)) {
      this.fail(request, cause, outcome);
    }
  }

  private void fail(PendingRequest request, Throwable cause, RequestOutcome outcome) {
    this.completeExceptionally(request.future, cause, outcome);
    request.cancelTimeout();
  }

  private void closeSubscription() {
    Transport.Subscription current = this.subscription;
    this.subscription = null;
    Utils.maybeClose(
        current,
        e ->
            LOGGER.info(
                "Error while closing consumer of response queue {}: {}",
                this.responseQueueName,
                e.getMessage()));
  }

  private void shutdownInternalExecutors() {
    if (this.internalScheduledExecutor) {
      this.scheduledExecutorService.shutdownNow();
    }
    if (this.internalDispatchingExecutor != null) {
      this.internalDispatchingExecutor.shutdownNow();
    }
  }

  @Override
  void doClose() {
    this.transport.removeConnectionListener(this.connectionListener);
    this.subscriptionLock.lock();
    try {
      this.closeSubscription();
    } finally {
      this.subscriptionLock.unlock();
    }
    for (PendingRequest request : this.drain()) {
      this.fail(
          request,
          new RpcException.RpcClientClosedException("RPC client is closed"),
          RequestOutcome.CLOSED);
    }
    this.shutdownInternalExecutors();
  }

  String responseQueueName() {
    return this.responseQueueName;
  }

  int outstandingRequestCount() {
    return this.outstandingRequests.size();
  }

  @Override
  public String toString() {
    return "ReuseQueueRpcClient{"
        + "responseQueueName='"
        + this.responseQueueName
        + '\''
        + ", timeout="
        + this.timeout
        + '}';
  }

  private static final class PendingRequest {

    private final String correlationId;
    private final CompletableFuture<Message> future = new CompletableFuture<>();
    private volatile TimeoutScheduler.Timeout timeout = TimeoutScheduler.Timeout.NO_OP;

    private PendingRequest(String correlationId) {
      this.correlationId = correlationId;
    }

    private void timeout(TimeoutScheduler.Timeout timeout) {
      this.timeout = timeout;
      // completion paths cancel after completing, so a request completed before this
      // assignment is seen as done here
      if (this.future.isDone()) {
        timeout.cancel();
      }
    }

    private void cancelTimeout() {
      this.timeout.cancel();
    }
  }
}
