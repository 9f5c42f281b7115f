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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Client support class for RPC.
 *
 * <p>The client sends a request and matches the reply the responder sends back to it. The outcome
 * of a request is exactly one of: the reply, a {@link RpcException.RpcResponderException} if the
 * responder reported a failure, a {@link RpcException.RpcTimeoutException}, a {@link
 * RpcException.RpcConnectionLostException}, or the failure of the {@link Transport}.
 *
 * <p>Implementations are thread-safe.
 *
 * @see RpcClientBuilder
 */
public interface RpcClient extends AutoCloseable, Resource {

  /**
   * Create a request message.
   *
   * <p>Once sent with {@link #request(String, String, boolean, boolean, Duration, Message)} the
   * message instance should be not be modified or even reused.
   *
   * @return a message
   */
  Message message();

  /**
   * Create a request message.
   *
   * <p>Once sent with {@link #request(String, String, boolean, boolean, Duration, Message)} the
   * message instance should be not be modified or even reused.
   *
   * @param body message body
   * @return a message with the provided body
   */
  Message message(byte[] body);

  /**
   * Publish a request message and expect a reply.
   *
   * <p>The client sets the correlation ID, the reply-to queue, and the expiration of the request.
   *
   * <p>The mandatory and immediate flags are accepted for compatibility but the request is always
   * published with both flags off: an unroutable request is not returned and times out.
   *
   * @param exchange the exchange to publish the request to
   * @param routingKey the routing key of the request
   * @param mandatory ignored
   * @param immediate ignored
   * @param timeout the time-to-live of the request
   * @param request the request message
   * @return the reply as {@link CompletableFuture}
   * @throws IllegalArgumentException if the exchange, the routing key, or the request is null
   * @throws RpcException.RpcClientClosedException if the client is closed
   */
  CompletableFuture<Message> request(
      String exchange,
      String routingKey,
      boolean mandatory,
      boolean immediate,
      Duration timeout,
      Message request);

  /** Close the RPC client and its resources. */
  @Override
  void close();
}
