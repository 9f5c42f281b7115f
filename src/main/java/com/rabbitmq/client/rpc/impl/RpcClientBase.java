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

import static com.rabbitmq.client.rpc.Resource.State.CLOSED;
import static com.rabbitmq.client.rpc.Resource.State.CLOSING;
import static com.rabbitmq.client.rpc.Resource.State.OPENING;

import com.rabbitmq.client.rpc.Message;
import com.rabbitmq.client.rpc.RpcClient;
import com.rabbitmq.client.rpc.RpcException;
import com.rabbitmq.client.rpc.metrics.MetricsCollector;
import com.rabbitmq.client.rpc.metrics.MetricsCollector.RequestOutcome;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** State, listeners, and request validation shared by the RPC client strategies. */
abstract class RpcClientBase implements RpcClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(RpcClientBase.class);

  private final AtomicReference<State> state = new AtomicReference<>();
  private final List<StateListener> listeners;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  protected final MetricsCollector metricsCollector;
  protected final FaultCodec faultCodec;
  protected final Duration timeout;

  RpcClientBase(DefaultRpcClientBuilder builder) {
    this.listeners = List.copyOf(builder.listeners());
    this.metricsCollector = builder.metricsCollector();
    this.faultCodec = new FaultCodec(builder.headerKeys());
    this.timeout = builder.timeout();
    this.state(OPENING);
  }

  @Override
  public Message message() {
    return new RpcMessage();
  }

  @Override
  public Message message(byte[] body) {
    return new RpcMessage(body);
  }

  @Override
  public final void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.state(CLOSING);
      try {
        this.doClose();
      } finally {
        this.metricsCollector.closeClient();
        this.state(CLOSED);
      }
    }
  }

  abstract void doClose();

  boolean closed() {
    return this.closed.get();
  }

  protected void checkOpen() {
    State current = this.state.get();
    if (this.closed() || current == CLOSING || current == CLOSED) {
      throw new RpcException.RpcClientClosedException("RPC client is closed");
    }
  }

  /**
   * Validate the arguments of a request and return the timeout to use for it.
   *
   * <p>A null timeout means the configured timeout.
   */
  Duration checkRequest(
      String exchange, String routingKey, Duration requestTimeout, Message request) {
    if (exchange == null) {
      throw new IllegalArgumentException("Exchange cannot be null");
    }
    if (routingKey == null) {
      throw new IllegalArgumentException("Routing key cannot be null");
    }
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null");
    }
    if (requestTimeout == null) {
      return this.timeout;
    } else if (requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new IllegalArgumentException("Request timeout must be positive");
    } else {
      return requestTimeout;
    }
  }

  /** Complete the future of a request with its reply, or with the failure the reply reports. */
  void completeWithReply(CompletableFuture<Message> future, Message reply) {
    FaultCodec.Reply decoded = this.faultCodec.decode(reply);
    if (decoded.faulted()) {
      this.completeExceptionally(
          future,
          new RpcException.RpcResponderException(decoded.exceptionMessage()),
          RequestOutcome.FAULTED);
    } else if (future.complete(reply)) {
      this.metricsCollector.outcome(RequestOutcome.SUCCEEDED);
    }
  }

  void completeExceptionally(
      CompletableFuture<Message> future, Throwable cause, RequestOutcome outcome) {
    if (future.completeExceptionally(cause)) {
      this.metricsCollector.outcome(outcome);
    }
  }

  protected State state() {
    return this.state.get();
  }

  protected void state(State state) {
    this.state(state, null);
  }

  protected void state(State state, Throwable failureCause) {
    State previousState;
    do {
      previousState = this.state.get();
      // CLOSING only leads to CLOSED, CLOSED is terminal
      if (previousState == CLOSED || (previousState == CLOSING && state != CLOSED)) {
        return;
      }
    } while (!this.state.compareAndSet(previousState, state));
    if ((state != previousState || failureCause != null) && !this.listeners.isEmpty()) {
      StateChange change = new StateChange(this, failureCause, previousState, state);
      for (StateListener listener : this.listeners) {
        try {
          listener.handle(change);
        } catch (Exception e) {
          LOGGER.warn("Error in RPC client state listener", e);
        }
      }
    }
  }

  static String milliseconds(Duration duration) {
    return String.valueOf(duration.toMillis());
  }

  private static final class StateChange implements Context {

    private final RpcClient client;
    private final Throwable failureCause;
    private final State previousState;
    private final State currentState;

    private StateChange(
        RpcClient client, Throwable failureCause, State previousState, State currentState) {
      this.client = client;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public RpcClient resource() {
      return this.client;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }
  }
}
