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
package com.rabbitmq.client.rpc;

import com.rabbitmq.client.rpc.metrics.MetricsCollector;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/** API to configure and create a {@link RpcClient}. */
public interface RpcClientBuilder {

  /**
   * How the client receives replies.
   *
   * <p>Default is {@link ResponseQueueStrategy#REUSE_QUEUE}.
   *
   * @param strategy response queue strategy
   * @return this builder instance
   */
  RpcClientBuilder strategy(ResponseQueueStrategy strategy);

  /**
   * Timeout before failing outstanding requests.
   *
   * <p>With {@link ResponseQueueStrategy#FRESH_QUEUE}, this is also the server-side expiry of the
   * response queues and the expiration of the requests.
   *
   * <p>Default is 10 seconds.
   *
   * @param timeout timeout
   * @return this builder instance
   */
  RpcClientBuilder timeout(Duration timeout);

  /**
   * The name of the response queue, for {@link ResponseQueueStrategy#REUSE_QUEUE} only.
   *
   * <p>The client declares it as a non-durable, exclusive, auto-delete queue. The client generates
   * a name if it is not set.
   *
   * @param responseQueueName queue name
   * @return this builder instance
   */
  RpcClientBuilder responseQueueName(String responseQueueName);

  /**
   * The header names for failed replies.
   *
   * <p>Default is {@link RpcHeaderKeys#defaults()}.
   *
   * @param headerKeys header keys
   * @return this builder instance
   */
  RpcClientBuilder headerKeys(RpcHeaderKeys headerKeys);

  /**
   * How to make sure the request exchange exists, for {@link ResponseQueueStrategy#REUSE_QUEUE}
   * only.
   *
   * <p>Default is {@link ExchangeDeclareStrategy#caching()}.
   *
   * @param exchangeDeclareStrategy exchange declare strategy
   * @return this builder instance
   */
  RpcClientBuilder exchangeDeclareStrategy(ExchangeDeclareStrategy exchangeDeclareStrategy);

  /**
   * The generator for correlation ID.
   *
   * <p>The generated values must be unique among the outstanding requests of the client. With
   * {@link ResponseQueueStrategy#FRESH_QUEUE}, the value is also part of the response queue name.
   *
   * <p>The default generator uses random UUIDs for {@link ResponseQueueStrategy#FRESH_QUEUE} and a
   * fixed random UUID prefix with a strictly monotonic increasing sequence suffix for {@link
   * ResponseQueueStrategy#REUSE_QUEUE}.
   *
   * @param correlationIdSupplier correlation ID generator
   * @return this builder instance
   */
  RpcClientBuilder correlationIdSupplier(Supplier<String> correlationIdSupplier);

  /**
   * Scheduled executor service for request timeouts.
   *
   * <p>The client creates and closes its own if it is not set. The client does not shut down an
   * executor service set by the application.
   *
   * @param scheduledExecutorService scheduled executor service
   * @return this builder instance
   */
  RpcClientBuilder scheduledExecutorService(ScheduledExecutorService scheduledExecutorService);

  /**
   * Executor to process replies off the transport thread, for {@link
   * ResponseQueueStrategy#REUSE_QUEUE} only.
   *
   * <p>The client creates and closes its own if it is not set.
   *
   * @param executor dispatching executor
   * @return this builder instance
   */
  RpcClientBuilder dispatchingExecutor(Executor executor);

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see com.rabbitmq.client.rpc.metrics.MicrometerMetricsCollector
   */
  RpcClientBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Add {@link Resource.StateListener}s to the client.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  RpcClientBuilder listeners(Resource.StateListener... listeners);

  /**
   * Build the configured instance.
   *
   * @return the configured instance
   */
  RpcClient build();

  /** Strategies to receive replies. */
  enum ResponseQueueStrategy {
    /**
     * A new exclusive, auto-delete queue for each request.
     *
     * <p>The queue is the correlation: whatever arrives on it is the reply. There is no shared
     * state between requests, at the cost of a queue declaration for each request.
     */
    FRESH_QUEUE,
    /**
     * One exclusive, auto-delete queue for the lifetime of the client.
     *
     * <p>Replies are matched to requests with the correlation ID. Outstanding requests fail with
     * {@link RpcException.RpcConnectionLostException} when the connection is re-created, as the
     * queue does not survive the connection.
     */
    REUSE_QUEUE
  }
}
