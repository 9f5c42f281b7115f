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
import java.lang.reflect.InvocationTargetException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class Utils {

  static final Supplier<String> NAME_SUPPLIER = new NameSupplier("rpc.client.gen-");

  private static final Logger LOGGER = LoggerFactory.getLogger(Utils.class);

  private static final Function<String, ExecutorService> EXECUTOR_SERVICE_FACTORY;

  static {
    if (isJava21OrMore()) {
      LOGGER.debug("Running Java 21 or more, using virtual threads");
      Class<?> builderClass =
          Arrays.stream(Thread.class.getDeclaredClasses())
              .filter(c -> "Builder".equals(c.getSimpleName()))
              .findFirst()
              .get();
      EXECUTOR_SERVICE_FACTORY =
          prefix -> {
            try {
              // Reflection code is the same as the 2 following lines:
              // ThreadFactory factory = Thread.ofVirtual().name(prefix, 0).factory();
              // Executors.newThreadPerTaskExecutor(factory);
              Object builder = Thread.class.getDeclaredMethod("ofVirtual").invoke(null);
              builder =
                  builderClass
                      .getDeclaredMethod("name", String.class, Long.TYPE)
                      .invoke(builder, prefix, 0L);
              ThreadFactory factory =
                  (ThreadFactory) builderClass.getDeclaredMethod("factory").invoke(builder);
              return (ExecutorService)
                  Executors.class
                      .getDeclaredMethod("newThreadPerTaskExecutor", ThreadFactory.class)
                      .invoke(null, factory);
            } catch (IllegalAccessException | InvocationTargetException | NoSuchMethodException e) {
              throw new RuntimeException(e);
            }
          };
    } else {
      EXECUTOR_SERVICE_FACTORY = prefix -> Executors.newCachedThreadPool(threadFactory(prefix));
    }
  }

  private Utils() {}

  static ExecutorService executorService(String prefixFormat, Object... args) {
    return EXECUTOR_SERVICE_FACTORY.apply(String.format(prefixFormat, args));
  }

  private static boolean isJava21OrMore() {
    return Runtime.version().compareTo(Runtime.Version.parse("21")) >= 0;
  }

  static ThreadFactory threadFactory(String prefix) {
    return new NamedThreadFactory(prefix);
  }

  /** Random UUID, to name fresh response queues. */
  static Supplier<String> uuidSupplier() {
    return () -> UUID.randomUUID().toString();
  }

  /** Fixed random prefix and a monotonic sequence. */
  static Supplier<String> sequenceSupplier() {
    String prefix = UUID.randomUUID().toString();
    AtomicLong sequence = new AtomicLong();
    return () -> prefix + "-" + sequence.getAndIncrement();
  }

  static void maybeClose(
      AutoCloseable closeable, Consumer<Exception> exceptionCallback) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        exceptionCallback.accept(e);
      }
    }
  }

  private static class NamedThreadFactory implements ThreadFactory {

    private final ThreadFactory backingThreadFactory = Executors.defaultThreadFactory();

    private final String prefix;

    private final AtomicLong count = new AtomicLong(0);

    private NamedThreadFactory(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = this.backingThreadFactory.newThread(r);
      thread.setName(prefix + count.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    }
  }

  private static class NameSupplier implements Supplier<String> {

    private final String prefix;

    private NameSupplier(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public String get() {
      String uuid = UUID.randomUUID().toString();
      MessageDigest md;
      try {
        md = MessageDigest.getInstance("MD5");
      } catch (NoSuchAlgorithmException e) {
        throw new RpcException(e);
      }
      byte[] digest = md.digest(uuid.getBytes(StandardCharsets.UTF_8));
      return prefix
          + Base64.getEncoder()
              .encodeToString(digest)
              .replace('+', '-')
              .replace('/', '_')
              .replace("=", "");
    }
  }
}
