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

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Schedules the countdown of outstanding requests. */
final class TimeoutScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimeoutScheduler.class);

  private final ScheduledExecutorService scheduledExecutorService;

  TimeoutScheduler(ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = scheduledExecutorService;
  }

  /**
   * Run a task once the timeout has elapsed, unless the returned handle is cancelled before.
   *
   * @param timeout the timeout
   * @param task the task to run on expiry
   * @return the handle to cancel the countdown
   */
  Timeout schedule(Duration timeout, Runnable task) {
    ScheduledFuture<?> future =
        this.scheduledExecutorService.schedule(
            () -> {
              try {
                task.run();
              } catch (Exception e) {
                LOGGER.info("Error during request timeout task: {}", e.getMessage());
              }
            },
            timeout.toNanos(),
            TimeUnit.NANOSECONDS);
    return new Timeout(future);
  }

  static final class Timeout {

    static final Timeout NO_OP = new Timeout(null);

    private final ScheduledFuture<?> future;

    private Timeout(ScheduledFuture<?> future) {
      this.future = future;
    }

    /** Cancel the countdown. Has no effect if the task already ran or was cancelled. */
    void cancel() {
      if (this.future != null) {
        this.future.cancel(false);
      }
    }

    boolean cancelled() {
      return this.future != null && this.future.isCancelled();
    }
  }
}
