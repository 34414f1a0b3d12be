/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.registry;

/**
 * 注册表操作异常
 *
 * <p>注册重复的对端或注销不存在的对端时抛出，抛出时注册表未被修改。
 */
public class RegistryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** 异常类型 */
  public enum Type {
    /** 对端已注册 */
    DUPLICATE_ENTRY,
    /** 对端未注册 */
    UNKNOWN_ENTRY
  }

  private final Type type;
  private final String peerId;

  /**
   * 创建注册表异常
   *
   * @param type 异常类型
   * @param peerId 对端 ID
   */
  public RegistryException(Type type, String peerId) {
    super(buildMessage(type, peerId));
    this.type = type;
    this.peerId = peerId;
  }

  /** 创建重复注册异常 */
  public static RegistryException duplicateEntry(String peerId) {
    return new RegistryException(Type.DUPLICATE_ENTRY, peerId);
  }

  /** 创建未知对端异常 */
  public static RegistryException unknownEntry(String peerId) {
    return new RegistryException(Type.UNKNOWN_ENTRY, peerId);
  }

  public Type getType() {
    return type;
  }

  public String getPeerId() {
    return peerId;
  }

  private static String buildMessage(Type type, String peerId) {
    switch (type) {
      case DUPLICATE_ENTRY:
        return "Peer " + peerId + " already registered";
      case UNKNOWN_ENTRY:
        return "Peer " + peerId + " is not registered";
    }
    return "[" + type + "] " + peerId;
  }
}
