/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.latencymonitor.probe.inprocess;

import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerHandle;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerLifecycleListener;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerResolver;
import io.opentelemetry.sdk.extension.latencymonitor.probe.PeerTransport;
import io.opentelemetry.sdk.extension.latencymonitor.probe.ProbeResult;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 进程内对端网络。
 *
 * <p>同时充当监控的三个外部协作者：
 *
 * <ul>
 *   <li>{@link PeerResolver} - 查找已连接的对端
 *   <li>{@link PeerTransport} - 调用对端的 {@link ClockResponder}
 *   <li>生命周期通知源 - 连接/断开时回调 {@link PeerLifecycleListener}
 * </ul>
 *
 * <p>每个对端的应答器只安装一次，重复连接同一 ID 不会替换已有应答器。{@link #dropConnection(String)}
 * 可模拟"对端已断开但离开通知尚未送达"的竞态。
 */
public final class InProcessPeerNetwork implements PeerResolver, PeerTransport {

  private static final Logger logger = Logger.getLogger(InProcessPeerNetwork.class.getName());

  private final Map<String, InProcessPeer> peers = new ConcurrentHashMap<>();
  private final Set<String> pendingLeaves = new LinkedHashSet<>();
  private final List<PeerLifecycleListener> listeners = new CopyOnWriteArrayList<>();

  /**
   * 添加生命周期监听器
   *
   * @param listener 监听器
   */
  public void addLifecycleListener(PeerLifecycleListener listener) {
    if (listener != null) {
      listeners.add(listener);
    }
  }

  public void removeLifecycleListener(PeerLifecycleListener listener) {
    listeners.remove(listener);
  }

  /**
   * 连接对端并通知加入
   *
   * @param peerId 对端 ID
   * @param responder 对端应答器
   * @return 是否新建连接；已连接时返回 false
   */
  public boolean connect(String peerId, ClockResponder responder) {
    Objects.requireNonNull(peerId, "peerId");
    Objects.requireNonNull(responder, "responder");
    InProcessPeer peer = new InProcessPeer(peerId, responder);
    if (peers.putIfAbsent(peerId, peer) != null) {
      logger.log(Level.FINE, "Peer {0} already connected, keeping existing responder", peerId);
      return false;
    }
    for (PeerLifecycleListener listener : listeners) {
      try {
        listener.onPeerJoined(peerId);
      } catch (RuntimeException e) {
        logger.log(
            Level.WARNING,
            "Error notifying peer join {0}: {1}",
            new Object[] {peerId, e.getMessage()});
      }
    }
    return true;
  }

  /**
   * 断开对端并通知离开
   *
   * @param peerId 对端 ID
   * @return 对端此前是否已连接
   */
  public boolean disconnect(String peerId) {
    if (peers.remove(peerId) == null) {
      return false;
    }
    notifyLeft(peerId);
    return true;
  }

  /**
   * 断开对端但暂不通知离开，直到 {@link #deliverPendingLeaves()}
   *
   * @param peerId 对端 ID
   * @return 对端此前是否已连接
   */
  public boolean dropConnection(String peerId) {
    if (peers.remove(peerId) == null) {
      return false;
    }
    synchronized (pendingLeaves) {
      pendingLeaves.add(peerId);
    }
    return true;
  }

  /**
   * 送达所有被推迟的离开通知
   *
   * @return 送达的通知数
   */
  public int deliverPendingLeaves() {
    List<String> toDeliver;
    synchronized (pendingLeaves) {
      toDeliver = new ArrayList<>(pendingLeaves);
      pendingLeaves.clear();
    }
    for (String peerId : toDeliver) {
      notifyLeft(peerId);
    }
    return toDeliver.size();
  }

  public boolean isConnected(String peerId) {
    return peers.containsKey(peerId);
  }

  public int getConnectedCount() {
    return peers.size();
  }

  @Nullable
  @Override
  public PeerHandle resolveLivePeer(String peerId) {
    return peers.get(peerId);
  }

  @Override
  public ProbeResult probe(PeerHandle peer) {
    InProcessPeer current = peers.get(peer.getPeerId());
    if (current == null || current != peer) {
      return ProbeResult.failure("peer " + peer.getPeerId() + " is not connected");
    }
    try {
      return ProbeResult.success(current.responder.respond());
    } catch (Exception e) {
      return ProbeResult.failure(e);
    }
  }

  private void notifyLeft(String peerId) {
    for (PeerLifecycleListener listener : listeners) {
      try {
        listener.onPeerLeft(peerId);
      } catch (RuntimeException e) {
        logger.log(
            Level.WARNING,
            "Error notifying peer leave {0}: {1}",
            new Object[] {peerId, e.getMessage()});
      }
    }
  }

  /** 进程内对端句柄 */
  private static final class InProcessPeer implements PeerHandle {
    private final String peerId;
    private final ClockResponder responder;

    InProcessPeer(String peerId, ClockResponder responder) {
      this.peerId = peerId;
      this.responder = responder;
    }

    @Override
    public String getPeerId() {
      return peerId;
    }

    @Override
    public String toString() {
      return "InProcessPeer{" + peerId + "}";
    }
  }
}
