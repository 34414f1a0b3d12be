/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 对端注册表。
 *
 * <p>以双向链表 + ID 索引保存所有 {@link PeerEntry}：
 *
 * <ul>
 *   <li>链表顺序即插入顺序，也就是轮询探测的顺序
 *   <li>按 ID 的注册、注销、查找均为 O(1)
 *   <li>链表与索引的所有修改都在同一把锁内完成，可与探测循环并发调用
 * </ul>
 *
 * <p>注销的条目会被标记为 detached，并记住注销时的后继条目，探测循环游标停留在已注销条目上时，
 * 通过 {@link #successorOf(PeerEntry)} 仍能安全前进。
 */
public final class PeerRegistry implements Iterable<PeerEntry> {

  private static final Logger logger = Logger.getLogger(PeerRegistry.class.getName());

  /** 注册表大小变更监听器 */
  @FunctionalInterface
  public interface SizeChangeListener {
    /**
     * 注册或注销完成后回调（在注册表锁内调用）
     *
     * @param activeCount 当前对端数量
     */
    void onSizeChanged(int activeCount);
  }

  private final Object lock = new Object();
  private final Map<String, PeerEntry> index = new HashMap<>();
  private final SizeChangeListener sizeChangeListener;

  @Nullable private PeerEntry head;
  @Nullable private PeerEntry tail;

  /** 创建无监听器的注册表 */
  public PeerRegistry() {
    this(activeCount -> {});
  }

  /**
   * 创建注册表
   *
   * @param sizeChangeListener 大小变更监听器
   */
  public PeerRegistry(SizeChangeListener sizeChangeListener) {
    this.sizeChangeListener = Objects.requireNonNull(sizeChangeListener, "sizeChangeListener");
  }

  /**
   * 注册对端，追加到链表尾部
   *
   * @param peerId 对端 ID
   * @return 新建的条目
   * @throws RegistryException 对端已注册（{@link RegistryException.Type#DUPLICATE_ENTRY}）
   */
  public PeerEntry register(String peerId) {
    checkPeerId(peerId);
    PeerEntry entry;
    int size;
    synchronized (lock) {
      if (index.containsKey(peerId)) {
        throw RegistryException.duplicateEntry(peerId);
      }

      entry = new PeerEntry(peerId);
      index.put(peerId, entry);

      if (head == null) {
        head = entry;
      }
      if (tail != null) {
        tail.next = entry;
        entry.prev = tail;
      }
      tail = entry;

      size = index.size();
      sizeChangeListener.onSizeChanged(size);
    }

    logger.log(Level.INFO, "Monitoring peer {0} (active peers: {1})", new Object[] {peerId, size});
    return entry;
  }

  /**
   * 注销对端，从链表中摘除
   *
   * @param peerId 对端 ID
   * @return 被摘除的条目
   * @throws RegistryException 对端未注册（{@link RegistryException.Type#UNKNOWN_ENTRY}）
   */
  public PeerEntry unregister(String peerId) {
    checkPeerId(peerId);
    PeerEntry entry;
    int size;
    synchronized (lock) {
      entry = index.remove(peerId);
      if (entry == null) {
        throw RegistryException.unknownEntry(peerId);
      }

      if (head == entry) {
        head = entry.next;
      }
      if (tail == entry) {
        tail = entry.prev;
      }
      if (entry.prev != null) {
        entry.prev.next = entry.next;
      }
      if (entry.next != null) {
        entry.next.prev = entry.prev;
      }

      entry.successorAtRemoval = entry.next;
      entry.detached = true;
      entry.prev = null;
      entry.next = null;

      size = index.size();
      sizeChangeListener.onSizeChanged(size);
    }

    logger.log(
        Level.INFO,
        "Peer {0} removed from monitoring (active peers: {1})",
        new Object[] {peerId, size});
    return entry;
  }

  /**
   * 按 ID 查找条目
   *
   * @param peerId 对端 ID
   * @return 条目，未注册时返回 null
   */
  @Nullable
  public PeerEntry lookup(String peerId) {
    synchronized (lock) {
      return index.get(peerId);
    }
  }

  public boolean contains(String peerId) {
    synchronized (lock) {
      return index.containsKey(peerId);
    }
  }

  public int size() {
    synchronized (lock) {
      return index.size();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /** 链表头（最早注册的条目），为空时返回 null */
  @Nullable
  public PeerEntry first() {
    synchronized (lock) {
      return head;
    }
  }

  /**
   * 获取轮询顺序中的下一个条目
   *
   * <p>若 {@code entry} 仍在注册表中，返回其当前后继；若已被注销，则沿注销时记录的后继链前进，
   * 跳过同样已注销的条目，直到找到仍在注册表中的条目或到达链表末尾。
   *
   * @param entry 当前条目
   * @return 下一个条目，到达末尾时返回 null
   */
  @Nullable
  public PeerEntry successorOf(PeerEntry entry) {
    synchronized (lock) {
      if (!entry.detached) {
        return entry.next;
      }
      PeerEntry candidate = entry.successorAtRemoval;
      while (candidate != null && candidate.detached) {
        candidate = candidate.successorAtRemoval;
      }
      return candidate;
    }
  }

  /**
   * 条目是否仍在注册表中
   *
   * @param entry 条目
   * @return 是否已注册
   */
  public boolean isRegistered(PeerEntry entry) {
    synchronized (lock) {
      return !entry.detached && index.get(entry.getId()) == entry;
    }
  }

  /**
   * 按插入顺序获取所有条目（快照）
   *
   * @return 条目列表
   */
  public List<PeerEntry> entries() {
    synchronized (lock) {
      List<PeerEntry> result = new ArrayList<>(index.size());
      for (PeerEntry e = head; e != null; e = e.next) {
        result.add(e);
      }
      return Collections.unmodifiableList(result);
    }
  }

  /**
   * 按插入顺序获取所有对端 ID（快照）
   *
   * @return 对端 ID 列表
   */
  public List<String> getPeerIds() {
    List<PeerEntry> snapshot = entries();
    List<String> ids = new ArrayList<>(snapshot.size());
    for (PeerEntry entry : snapshot) {
      ids.add(entry.getId());
    }
    return Collections.unmodifiableList(ids);
  }

  /** 按插入顺序遍历注册时刻的快照，遍历期间的修改不影响本次遍历 */
  @Override
  public Iterator<PeerEntry> iterator() {
    return entries().iterator();
  }

  /** 校验链表与索引的一致性 */
  boolean isConsistent() {
    synchronized (lock) {
      if ((head == null) != (tail == null)) {
        return false;
      }
      if (head != null && head.prev != null) {
        return false;
      }
      if (tail != null && tail.next != null) {
        return false;
      }
      int count = 0;
      PeerEntry last = null;
      for (PeerEntry e = head; e != null; e = e.next) {
        if (e.detached || e.prev != last || index.get(e.getId()) != e) {
          return false;
        }
        last = e;
        count++;
      }
      return last == tail && count == index.size();
    }
  }

  private static void checkPeerId(String peerId) {
    Objects.requireNonNull(peerId, "peerId");
    if (peerId.trim().isEmpty()) {
      throw new IllegalArgumentException("peerId must not be blank");
    }
  }

  @Override
  public String toString() {
    return "PeerRegistry{peers=" + getPeerIds() + "}";
  }
}
