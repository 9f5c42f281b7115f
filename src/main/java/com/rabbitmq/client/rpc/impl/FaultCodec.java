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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.rabbitmq.client.rpc.Message;
import com.rabbitmq.client.rpc.RpcHeaderKeys;

/**
 * Reads and writes the reply headers a responder uses to report a failure.
 *
 * @see RpcHeaderKeys
 */
final class FaultCodec {

  static final String UNSPECIFIED_EXCEPTION_MESSAGE =
      "The exception message has not been specified.";

  private final RpcHeaderKeys headerKeys;

  FaultCodec(RpcHeaderKeys headerKeys) {
    this.headerKeys = headerKeys;
  }

  Reply decode(Message message) {
    boolean faulted = false;
    String exceptionMessage = UNSPECIFIED_EXCEPTION_MESSAGE;
    if (message.hasHeaders()) {
      Object faultedValue = message.header(this.headerKeys.isFaultedKey());
      if (faultedValue != null) {
        faulted = toBoolean(faultedValue);
      }
      Object exceptionMessageValue = message.header(this.headerKeys.exceptionMessageKey());
      if (exceptionMessageValue != null) {
        exceptionMessage = asString(exceptionMessageValue);
      }
    }
    return new Reply(faulted, exceptionMessage, message);
  }

  Message encode(Message reply, String exceptionMessage) {
    reply.header(this.headerKeys.isFaultedKey(), true);
    if (exceptionMessage != null) {
      reply.header(this.headerKeys.exceptionMessageKey(), exceptionMessage.getBytes(UTF_8));
    }
    return reply;
  }

  private static boolean toBoolean(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    } else if (value instanceof Number) {
      return ((Number) value).doubleValue() != 0;
    } else if (value instanceof byte[] || value instanceof String) {
      return Boolean.parseBoolean(asString(value).trim());
    } else {
      return false;
    }
  }

  private static String asString(Object value) {
    if (value instanceof byte[]) {
      return new String((byte[]) value, UTF_8);
    } else {
      return value.toString();
    }
  }

  static final class Reply {

    private final boolean faulted;
    private final String exceptionMessage;
    private final Message message;

    private Reply(boolean faulted, String exceptionMessage, Message message) {
      this.faulted = faulted;
      this.exceptionMessage = exceptionMessage;
      this.message = message;
    }

    boolean faulted() {
      return this.faulted;
    }

    String exceptionMessage() {
      return this.exceptionMessage;
    }

    Message message() {
      return this.message;
    }
  }
}
