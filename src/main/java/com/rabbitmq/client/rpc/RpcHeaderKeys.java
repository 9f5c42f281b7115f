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

import java.util.Objects;

/**
 * Names of the reply headers a responder uses to report a failure.
 *
 * <p>A reply with the {@link #isFaultedKey()} header set to <code>true</code> is a failure, the
 * {@link #exceptionMessageKey()} header then carries the failure message as UTF-8 bytes.
 */
public final class RpcHeaderKeys {

  /** Default name of the header flagging a failed reply. */
  public static final String DEFAULT_IS_FAULTED_KEY = "IsFaulted";

  /** Default name of the header carrying the failure message. */
  public static final String DEFAULT_EXCEPTION_MESSAGE_KEY = "ExceptionMessage";

  private static final RpcHeaderKeys DEFAULTS =
      new RpcHeaderKeys(DEFAULT_IS_FAULTED_KEY, DEFAULT_EXCEPTION_MESSAGE_KEY);

  private final String isFaultedKey;
  private final String exceptionMessageKey;

  private RpcHeaderKeys(String isFaultedKey, String exceptionMessageKey) {
    this.isFaultedKey = isFaultedKey;
    this.exceptionMessageKey = exceptionMessageKey;
  }

  /**
   * The default header keys.
   *
   * @return default keys
   */
  public static RpcHeaderKeys defaults() {
    return DEFAULTS;
  }

  /**
   * Custom header keys.
   *
   * @param isFaultedKey name of the header flagging a failed reply
   * @param exceptionMessageKey name of the header carrying the failure message
   * @return the header keys
   */
  public static RpcHeaderKeys of(String isFaultedKey, String exceptionMessageKey) {
    if (isFaultedKey == null || isFaultedKey.isBlank()) {
      throw new IllegalArgumentException("Is-faulted header key cannot be null or blank");
    }
    if (exceptionMessageKey == null || exceptionMessageKey.isBlank()) {
      throw new IllegalArgumentException("Exception message header key cannot be null or blank");
    }
    return new RpcHeaderKeys(isFaultedKey, exceptionMessageKey);
  }

  public String isFaultedKey() {
    return this.isFaultedKey;
  }

  public String exceptionMessageKey() {
    return this.exceptionMessageKey;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    RpcHeaderKeys that = (RpcHeaderKeys) o;
    return isFaultedKey.equals(that.isFaultedKey)
        && exceptionMessageKey.equals(that.exceptionMessageKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(isFaultedKey, exceptionMessageKey);
  }

  @Override
  public String toString() {
    return "RpcHeaderKeys{"
        + "isFaultedKey='"
        + isFaultedKey
        + '\''
        + ", exceptionMessageKey='"
        + exceptionMessageKey
        + '\''
        + '}';
  }
}
