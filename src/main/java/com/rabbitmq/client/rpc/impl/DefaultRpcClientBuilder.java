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

import com.rabbitmq.client.rpc.ExchangeDeclareStrategy;
import com.rabbitmq.client.rpc.Resource;
import com.rabbitmq.client.rpc.RpcClient;
import com.rabbitmq.client.rpc.RpcClientBuilder;
import com.rabbitmq.client.rpc.RpcHeaderKeys;
import com.rabbitmq.client.rpc.Transport;
import com.rabbitmq.client.rpc.metrics.MetricsCollector;
import com.rabbitmq.client.rpc.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Builder to create a {@link RpcClient} on top of a {@link Transport}.
 *
 * <p>The builder can be reused to create several clients.
 */
public class DefaultRpcClientBuilder implements RpcClientBuilder {

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private final Transport transport;
  private ResponseQueueStrategy strategy = ResponseQueueStrategy.REUSE_QUEUE;
  private Duration timeout = DEFAULT_TIMEOUT;
  private String responseQueueName;
  private RpcHeaderKeys headerKeys = RpcHeaderKeys.defaults();
  private ExchangeDeclareStrategy exchangeDeclareStrategy;
  private Supplier<String> correlationIdSupplier;
  private ScheduledExecutorService scheduledExecutorService;
  private Executor dispatchingExecutor;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private final List<Resource.StateListener> listeners = new ArrayList<>();

  public DefaultRpcClientBuilder(Transport transport) {
    if (transport == null) {
      throw new IllegalArgumentException("Transport cannot be null");
    }
    this.transport = transport;
  }

  @Override
  public RpcClientBuilder strategy(ResponseQueueStrategy strategy) {
    if (strategy == null) {
      throw new IllegalArgumentException("Response queue strategy cannot be null");
    }
    this.strategy = strategy;
    return this;
  }

  @Override
  public RpcClientBuilder timeout(Duration timeout) {
    if (timeout == null) {
      throw new IllegalArgumentException("Timeout cannot be null");
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("Timeout must be positive");
    }
    this.timeout = timeout;
    return this;
  }

  @Override
  public RpcClientBuilder responseQueueName(String responseQueueName) {
    if (responseQueueName != null && responseQueueName.isBlank()) {
      throw new IllegalArgumentException("Response queue name cannot be blank");
    }
    this.responseQueueName = responseQueueName;
    return this;
  }

  @Override
  public RpcClientBuilder headerKeys(RpcHeaderKeys headerKeys) {
    if (headerKeys == null) {
      throw new IllegalArgumentException("Header keys cannot be null");
    }
    this.headerKeys = headerKeys;
    return this;
  }

  @Override
  public RpcClientBuilder exchangeDeclareStrategy(
      ExchangeDeclareStrategy exchangeDeclareStrategy) {
    this.exchangeDeclareStrategy = exchangeDeclareStrategy;
    return this;
  }

  @Override
  public RpcClientBuilder correlationIdSupplier(Supplier<String> correlationIdSupplier) {
    this.correlationIdSupplier = correlationIdSupplier;
    return this;
  }

  @Override
  public RpcClientBuilder scheduledExecutorService(
      ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = scheduledExecutorService;
    return this;
  }

  @Override
  public RpcClientBuilder dispatchingExecutor(Executor executor) {
    this.dispatchingExecutor = executor;
    return this;
  }

  @Override
  public RpcClientBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public RpcClientBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      if (Arrays.stream(listeners).anyMatch(l -> l == null)) {
        throw new IllegalArgumentException("State listeners cannot be null");
      }
      this.listeners.addAll(Arrays.asList(listeners));
    }
    return this;
  }

  @Override
  public RpcClient build() {
    if (this.strategy == ResponseQueueStrategy.FRESH_QUEUE) {
      return new FreshQueueRpcClient(this);
    } else {
      return new ReuseQueueRpcClient(this);
    }
  }

  Transport transport() {
    return this.transport;
  }

  ResponseQueueStrategy strategy() {
    return this.strategy;
  }

  Duration timeout() {
    return this.timeout;
  }

  String responseQueueName() {
    return this.responseQueueName;
  }

  RpcHeaderKeys headerKeys() {
    return this.headerKeys;
  }

  ExchangeDeclareStrategy exchangeDeclareStrategy() {
    // one cache per client
    return this.exchangeDeclareStrategy == null
        ? ExchangeDeclareStrategy.caching()
        : this.exchangeDeclareStrategy;
  }

  Supplier<String> correlationIdSupplier() {
    return this.correlationIdSupplier;
  }

  ScheduledExecutorService scheduledExecutorService() {
    return this.scheduledExecutorService;
  }

  Executor dispatchingExecutor() {
    return this.dispatchingExecutor;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }
}
