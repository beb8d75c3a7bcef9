// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

import static com.github.field_mesh.MeshLogger.LOGGER;

/// Drives [NodeAgent#tick()] at a fixed interval on a daemon thread. A tick that throws is logged and the next tick
/// runs as usual, except for a ledger integrity violation which stops the scheduler as the node must not continue on
/// a broken chain.
public class MeshScheduler implements AutoCloseable {

  private final NodeAgent agent;
  private final Duration interval;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile Thread tickThread;

  public MeshScheduler(NodeAgent agent, Duration interval) {
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive: " + interval);
    }
    this.agent = agent;
    this.interval = interval;
  }

  public MeshScheduler(NodeAgent agent, MeshConfig config) {
    this(agent, config.tickInterval());
  }

  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    LOGGER.fine(() -> "Node " + agent.self() + " ticking every " + interval.toMillis() + "ms");
    final var thread = new Thread(this::loop, "mesh-tick-" + agent.self());
    thread.setDaemon(true);
    tickThread = thread;
    thread.start();
  }

  private void loop() {
    try {
      while (running.get()) {
        long start = System.nanoTime();
        try {
          agent.tick();
        } catch (LedgerIntegrityException e) {
          LOGGER.log(Level.SEVERE, ErrorStrings.INTEGRITY + agent.self() + " stopping ticks: " + e.getMessage(), e);
          running.set(false);
          return;
        } catch (RuntimeException e) {
          LOGGER.log(Level.WARNING, "Node " + agent.self() + " tick failed: " + e, e);
        }
        long sleepTime = interval.toNanos() - (System.nanoTime() - start);
        if (sleepTime > 0) {
          //noinspection BusyWait
          Thread.sleep(sleepTime / 1_000_000, (int) (sleepTime % 1_000_000));
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  @Override
  public void close() {
    running.set(false);
    final var thread = tickThread;
    if (thread != null) {
      thread.interrupt();
      tickThread = null;
    }
  }
}
