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

import com.rabbitmq.client.rpc.Message;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default {@link Message} implementation.
 *
 * <p>{@link com.rabbitmq.client.rpc.Transport} implementations can use it to create the messages
 * they deliver.
 */
public final class RpcMessage implements Message {

  private static final byte[] EMPTY_BODY = new byte[0];

  private final byte[] body;
  private Map<String, Object> headers;
  private String contentType;
  private String correlationId;
  private String replyTo;
  private String expiration;

  public RpcMessage() {
    this(EMPTY_BODY);
  }

  public RpcMessage(byte[] body) {
    this.body = body == null ? EMPTY_BODY : body;
  }

  @Override
  public byte[] body() {
    return this.body;
  }

  @Override
  public String contentType() {
    return this.contentType;
  }

  @Override
  public String correlationId() {
    return this.correlationId;
  }

  @Override
  public String replyTo() {
    return this.replyTo;
  }

  @Override
  public String expiration() {
    return this.expiration;
  }

  @Override
  public boolean hasHeaders() {
    return this.headers != null && !this.headers.isEmpty();
  }

  @Override
  public Object header(String key) {
    return this.headers == null ? null : this.headers.get(key);
  }

  @Override
  public Map<String, Object> headers() {
    return this.headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(headers);
  }

  @Override
  public Message contentType(String contentType) {
    this.contentType = contentType;
    return this;
  }

  @Override
  public Message correlationId(String correlationId) {
    this.correlationId = correlationId;
    return this;
  }

  @Override
  public Message replyTo(String replyTo) {
    this.replyTo = replyTo;
    return this;
  }

  @Override
  public Message expiration(String expiration) {
    this.expiration = expiration;
    return this;
  }

  @Override
  public Message header(String key, Object value) {
    if (key == null) {
      throw new IllegalArgumentException("Header key cannot be null");
    }
    checkHeaderValue(key, value);
    if (this.headers == null) {
      this.headers = new LinkedHashMap<>();
    }
    this.headers.put(key, value);
    return this;
  }

  private static void checkHeaderValue(String key, Object value) {
    if (value == null
        || value instanceof String
        || value instanceof byte[]
        || value instanceof Boolean
        || value instanceof Number) {
      return;
    }
    throw new IllegalArgumentException(
        String.format(
            "Unsupported type for header '%s': %s", key, value.getClass().getSimpleName()));
  }

  @Override
  public String toString() {
    return "RpcMessage{"
        + "bodySize="
        + body.length
        + ", contentType='"
        + contentType
        + '\''
        + ", correlationId='"
        + correlationId
        + '\''
        + ", replyTo='"
        + replyTo
        + '\''
        + ", expiration='"
        + expiration
        + '\''
        + ", headers="
        + headers
        + '}';
  }
}
