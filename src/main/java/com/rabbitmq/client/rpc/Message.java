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

import java.util.Map;

/**
 * Message going through the RPC client: an opaque body and its properties.
 *
 * <p>The properties that matter for RPC are the correlation ID, the reply-to queue and the
 * expiration. The client sets them on requests, so an application should not rely on the values
 * it sets on these fields before sending a request.
 *
 * <p>Header values can be strings, arrays of bytes, booleans, bytes, or numbers.
 *
 * <p>Implementations are not thread-safe. A request message should not be modified or reused once
 * sent.
 */
public interface Message {

  /**
   * The message body.
   *
   * @return the body, can be empty but not null
   */
  byte[] body();

  /**
   * Get the content type.
   *
   * @return the content type
   */
  String contentType();

  /**
   * Get the correlation ID.
   *
   * @return the correlation ID
   */
  String correlationId();

  /**
   * Get the reply-to queue.
   *
   * @return the reply-to queue name
   */
  String replyTo();

  /**
   * Get the expiration (per-message time-to-live), as a number of milliseconds.
   *
   * @return the expiration
   */
  String expiration();

  /**
   * Whether the message carries headers.
   *
   * @return true if the message has headers
   */
  boolean hasHeaders();

  /**
   * Get a header value.
   *
   * @param key header name
   * @return the value, null if the header is not present
   */
  Object header(String key);

  /**
   * Get a read-only view of the headers.
   *
   * @return the headers, empty if there is none
   */
  Map<String, Object> headers();

  /**
   * Set the content type.
   *
   * @param contentType content type
   * @return the message
   */
  Message contentType(String contentType);

  /**
   * Set the correlation ID.
   *
   * @param correlationId correlation ID
   * @return the message
   */
  Message correlationId(String correlationId);

  /**
   * Set the reply-to queue.
   *
   * @param replyTo queue name
   * @return the message
   */
  Message replyTo(String replyTo);

  /**
   * Set the expiration, as a number of milliseconds.
   *
   * @param expiration expiration
   * @return the message
   */
  Message expiration(String expiration);

  /**
   * Set a header.
   *
   * @param key header name
   * @param value header value
   * @return the message
   * @throws IllegalArgumentException if the value type is not supported
   */
  Message header(String key, Object value);
}
