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
package com.rabbitmq.client.rpc.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong clients;
  private final Counter requests;
  private final Counter succeeded, faulted, timedOut, connectionLost, closed, failed;
  private final Counter lateReplies;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "rabbitmq.rpc");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.clients = registry.gauge(prefix + ".clients", tags, new AtomicLong(0));
    this.requests = registry.counter(prefix + ".requests", tags);
    this.succeeded = registry.counter(prefix + ".requests_succeeded", tags);
    this.faulted = registry.counter(prefix + ".requests_faulted", tags);
    this.timedOut = registry.counter(prefix + ".requests_timed_out", tags);
    this.connectionLost = registry.counter(prefix + ".requests_connection_lost", tags);
    this.closed = registry.counter(prefix + ".requests_closed", tags);
    this.failed = registry.counter(prefix + ".requests_failed", tags);
    this.lateReplies = registry.counter(prefix + ".late_replies", tags);
  }

  @Override
  public void openClient() {
    this.clients.incrementAndGet();
  }

  @Override
  public void closeClient() {
    this.clients.decrementAndGet();
  }

  @Override
  public void request() {
    this.requests.increment();
  }

  @Override
  public void outcome(RequestOutcome outcome) {
    switch (outcome) {
      case SUCCEEDED:
        this.succeeded.increment();
        break;
      case FAULTED:
        this.faulted.increment();
        break;
      case TIMED_OUT:
        this.timedOut.increment();
        break;
      case CONNECTION_LOST:
        this.connectionLost.increment();
        break;
      case CLOSED:
        this.closed.increment();
        break;
      case FAILED:
        this.failed.increment();
        break;
      default:
        break;
    }
  }

  @Override
  public void lateReply() {
    this.lateReplies.increment();
  }
}
