/*
 * どこで: Notification WebSocket 層
 * 何を: 1 接続ぶんの状態/上限付き送信キュー/ハートビート計数を保持し、送信を直列に流す
 * なぜ: 配信側を遅いソケットで止めず、受信処理と送信処理を互いに待たせないため
 */
package io.eventboard.notification.websocket;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.web.socket.CloseStatus;

/**
 * One authenticated client socket.
 *
 * <p>State transitions ({@code CONNECTING -> ACTIVE -> CLOSING -> CLOSED}) and registry changes
 * gated by {@link #runIfActive} synchronize on the connection itself; nothing here takes a lock
 * shared with other connections.
 */
public final class ClientConnection {

  public enum OfferResult {
    ACCEPTED,
    QUEUE_FULL,
    NOT_ACTIVE
  }

  @FunctionalInterface
  interface WriteFailureListener {
    void onWriteFailure(ClientConnection connection, Exception cause);
  }

  private final ClientTransport transport;
  private final String userId;
  private final Instant connectedAt;
  private final BlockingQueue<OutboundFrame> outbound;
  private final Executor writerExecutor;
  private final WriteFailureListener failureListener;
  private final AtomicBoolean draining = new AtomicBoolean(false);

  private volatile ConnectionState state = ConnectionState.CONNECTING;
  private boolean awaitingPong;
  private int missedHeartbeats;
  private Instant lastPongAt;

  ClientConnection(
      ClientTransport transport,
      String userId,
      int queueCapacity,
      Executor writerExecutor,
      WriteFailureListener failureListener,
      Instant connectedAt) {
    this.transport = transport;
    this.userId = userId;
    this.outbound = new ArrayBlockingQueue<>(queueCapacity);
    this.writerExecutor = writerExecutor;
    this.failureListener = failureListener;
    this.connectedAt = connectedAt;
    this.lastPongAt = connectedAt;
  }

  public String id() {
    return transport.id();
  }

  public String userId() {
    return userId;
  }

  public Instant connectedAt() {
    return connectedAt;
  }

  public ConnectionState state() {
    return state;
  }

  public synchronized Instant lastPongAt() {
    return lastPongAt;
  }

  synchronized boolean activate() {
    if (state != ConnectionState.CONNECTING) {
      return false;
    }
    state = ConnectionState.ACTIVE;
    return true;
  }

  /** Runs the action only while the connection is active, atomically with respect to closing. */
  synchronized boolean runIfActive(Runnable action) {
    if (state != ConnectionState.ACTIVE) {
      return false;
    }
    action.run();
    return true;
  }

  /** Stops accepting frames; already queued frames keep draining. */
  synchronized boolean markClosing() {
    if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) {
      return false;
    }
    state = ConnectionState.CLOSING;
    return true;
  }

  /** Returns false when another caller already closed the connection. */
  synchronized boolean markClosed() {
    if (state == ConnectionState.CLOSED) {
      return false;
    }
    state = ConnectionState.CLOSED;
    outbound.clear();
    return true;
  }

  void closeTransport(CloseStatus status) {
    transport.close(status);
  }

  OfferResult offer(OutboundFrame frame) {
    if (state != ConnectionState.ACTIVE) {
      return OfferResult.NOT_ACTIVE;
    }
    if (!outbound.offer(frame)) {
      return OfferResult.QUEUE_FULL;
    }
    scheduleDrain();
    return OfferResult.ACCEPTED;
  }

  boolean isDrained() {
    return outbound.isEmpty() && !draining.get();
  }

  int queuedFrames() {
    return outbound.size();
  }

  /** Called once per heartbeat interval; returns the consecutive missed windows so far. */
  synchronized int recordHeartbeatTick() {
    if (awaitingPong) {
      missedHeartbeats++;
    } else {
      missedHeartbeats = 0;
    }
    return missedHeartbeats;
  }

  synchronized void markPingSent() {
    awaitingPong = true;
  }

  synchronized void markPong(Instant at) {
    awaitingPong = false;
    lastPongAt = at;
  }

  private void scheduleDrain() {
    if (!draining.compareAndSet(false, true)) {
      return;
    }
    try {
      writerExecutor.execute(this::drain);
    } catch (RejectedExecutionException ex) {
      draining.set(false);
      outbound.clear();
      failureListener.onWriteFailure(this, ex);
    }
  }

  private void drain() {
    try {
      OutboundFrame frame;
      while (state != ConnectionState.CLOSED && (frame = outbound.poll()) != null) {
        write(frame);
      }
    } catch (IOException | RuntimeException ex) {
      outbound.clear();
      failureListener.onWriteFailure(this, ex);
    } finally {
      draining.set(false);
      // drain 終了直前に offer された frame を取りこぼさない
      if (!outbound.isEmpty() && state != ConnectionState.CLOSED) {
        scheduleDrain();
      }
    }
  }

  private void write(OutboundFrame frame) throws IOException {
    if (frame.kind() == OutboundFrame.Kind.PING) {
      transport.sendPing();
    } else {
      transport.sendText(frame.payload());
    }
  }
}
