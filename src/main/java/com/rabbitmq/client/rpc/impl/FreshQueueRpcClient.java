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

import com.rabbitmq.client.rpc.Message;
import com.rabbitmq.client.rpc.RpcException;
import com.rabbitmq.client.rpc.Transport;
import com.rabbitmq.client.rpc.metrics.MetricsCollector.RequestOutcome;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RPC client that declares a new response queue for each request.
 *
 * <p>The queue is exclusive and named after the correlation ID, so the first message it receives
 * is the reply. There is no correlation table. Each queue has a server-side expiry equal to the
 * configured timeout, the broker deletes it even if the client never comes back.
 */
final class FreshQueueRpcClient extends RpcClientBase {

  static final String QUEUE_NAME_PREFIX = "rpc:";

  private static final Logger LOGGER = LoggerFactory.getLogger(FreshQueueRpcClient.class);

  private final Transport transport;
  private final Supplier<String> correlationIdSupplier;

  FreshQueueRpcClient(DefaultRpcClientBuilder builder) {
    super(builder);
    this.transport = builder.transport();
    this.correlationIdSupplier =
        builder.correlationIdSupplier() == null
            ? Utils.uuidSupplier()
            : builder.correlationIdSupplier();
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
    String responseQueueName = QUEUE_NAME_PREFIX + correlationId;
    CompletableFuture<Message> result = new CompletableFuture<>();
    CompletableFuture<Message> delivery = null;
    this.metricsCollector.request();
    try {
      Transport.QueueInfo queue =
          this.transport.declareQueue(responseQueueName, false, true, true, this.timeout);
      // replies go through the default exchange, no binding needed
      delivery = this.transport.consumeOnce(queue, requestTimeout);
      request
          .replyTo(responseQueueName)
          .correlationId(correlationId)
          .expiration(milliseconds(this.timeout));
      // TODO handle broker returns to honor mandatory/immediate instead of timing out
      this.transport.publish(exchange, routingKey, false, false, request);
    } catch (RuntimeException e) {
      LOGGER.debug("Error while sending request {}: {}", correlationId, e.getMessage());
      if (delivery != null) {
        delivery.cancel(false);
      }
      this.completeExceptionally(result, e, RequestOutcome.FAILED);
      return result;
    }

    delivery.whenComplete(
        (reply, failure) -> {
          if (failure == null) {
            this.completeWithReply(result, reply);
          } else {
            Throwable cause = ExceptionUtils.convertConsumeFailure(failure, correlationId);
            this.completeExceptionally(
                result,
                cause,
                cause instanceof RpcException.RpcTimeoutException
                    ? RequestOutcome.TIMED_OUT
                    : RequestOutcome.FAILED);
          }
        });
    return result;
  }

  @Override
  void doClose() {
    // in-flight requests end with their own consumer, bounded by their timeout
    LOGGER.debug("Closing fresh-queue RPC client");
  }

  @Override
  public String toString() {
    return "FreshQueueRpcClient{" + "timeout=" + this.timeout + '}';
  }
}
