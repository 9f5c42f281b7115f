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

import com.rabbitmq.client.rpc.RpcException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  /**
   * Remove the wrappers {@link java.util.concurrent.CompletableFuture} stages add around the
   * original failure.
   */
  static Throwable unwrap(Throwable throwable) {
    Throwable result = throwable;
    while ((result instanceof CompletionException || result instanceof ExecutionException)
        && result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }

  /**
   * Map the failure of a reply consumer to what the application gets.
   *
   * <p>A timeout becomes a {@link RpcException.RpcTimeoutException} carrying the correlation ID,
   * other failures are returned as they are.
   */
  static Throwable convertConsumeFailure(Throwable throwable, String correlationId) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof TimeoutException) {
      return new RpcException.RpcTimeoutException(correlationId, cause);
    } else {
      return cause;
    }
  }
}
