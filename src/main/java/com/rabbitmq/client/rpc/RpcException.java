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

/**
 * Base exception for RPC failures reported by the client.
 *
 * <p>All the failures of a request surface through the {@link
 * java.util.concurrent.CompletableFuture} returned by {@link RpcClient#request}. Failures coming
 * from the {@link Transport} are propagated as they are and are not necessarily instances of this
 * class.
 */
public class RpcException extends RuntimeException {

  public RpcException(Throwable cause) {
    super(cause);
  }

  public RpcException(String format, Object... args) {
    super(String.format(format, args));
  }

  public RpcException(String message, Throwable cause) {
    super(message, cause);
  }

  /** No reply arrived for a request within the configured timeout. */
  public static class RpcTimeoutException extends RpcException {

    private final String correlationId;

    public RpcTimeoutException(String correlationId) {
      super("Request timed out. Correlation ID: %s", correlationId);
      this.correlationId = correlationId;
    }

    public RpcTimeoutException(String correlationId, Throwable cause) {
      super("Request timed out. Correlation ID: " + correlationId, cause);
      this.correlationId = correlationId;
    }

    /**
     * The correlation ID of the request that timed out.
     *
     * @return correlation ID
     */
    public String correlationId() {
      return this.correlationId;
    }
  }

  /**
   * The responder processed the request and reported a failure.
   *
   * <p>The message of the exception is the one the responder sent in the reply headers.
   *
   * @see RpcHeaderKeys
   */
  public static class RpcResponderException extends RpcException {

    public RpcResponderException(String message) {
      super(message, (Throwable) null);
    }
  }

  /**
   * The connection was lost and re-created while the request was outstanding.
   *
   * <p>The reply cannot be received anymore, the application must send the request again.
   */
  public static class RpcConnectionLostException extends RpcException {

    private final String correlationId;

    public RpcConnectionLostException(String correlationId) {
      super("Connection lost while request was in-flight. Correlation ID: %s", correlationId);
      this.correlationId = correlationId;
    }

    /**
     * The correlation ID of the request that was in-flight.
     *
     * @return correlation ID
     */
    public String correlationId() {
      return this.correlationId;
    }
  }

  /** The RPC client is closed. */
  public static class RpcClientClosedException extends RpcException {

    public RpcClientClosedException(String message) {
      super(message, (Throwable) null);
    }
  }
}
