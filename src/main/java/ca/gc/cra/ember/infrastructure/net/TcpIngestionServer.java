package ca.gc.cra.ember.infrastructure.net;

import ca.gc.cra.ember.application.port.ClockPort;
import ca.gc.cra.ember.application.port.ConnectionListener;
import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.application.port.MetricsPort;
import ca.gc.cra.ember.application.port.RecordSink;
import ca.gc.cra.ember.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.ember.infrastructure.protocol.SensorPacketDecoder;
import ca.gc.cra.ember.logging.LogThrottle;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> TCP server accepting field-unit connections and feeding decoded records to fusion.
 * <p><strong>Concurrency:</strong> one thread per connection from a bounded pool; a connection arriving while
 * every thread is busy is closed immediately and counted as {@value MetricNames#CONNECTIONS_REJECTED}. Records
 * are handed off through a non-blocking {@link RecordSink}, so a slow location never stalls a socket.</p>
 * <p><strong>Failure model:</strong> malformed packets and socket errors only affect their own connection.
 * Failing to bind is the only fatal error and surfaces from {@link #start()}.</p>
 *
 * @since 0.1.0
 */
public final class TcpIngestionServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TcpIngestionServer.class);
  private static final long ERROR_LOG_INTERVAL_MILLIS = 10_000L;

  private final IngestSettings settings;
  private final SensorPacketDecoder decoder;
  private final RecordSink sink;
  private final MetricsPort metrics;
  private final LogThrottle errorLog;
  private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
  private final Set<Socket> open = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicInteger active = new AtomicInteger();
  private volatile ServerSocket serverSocket;
  private volatile ExecutorService connectionPool;
  private volatile ExecutorService acceptor;

  public TcpIngestionServer(
      IngestSettings settings, SensorPacketDecoder decoder, RecordSink sink, MetricsPort metrics, ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.errorLog = new LogThrottle(Objects.requireNonNull(clock, "clock"), ERROR_LOG_INTERVAL_MILLIS);
  }

  public void addConnectionListener(ConnectionListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Binds the listening socket and starts accepting.
   *
   * @throws IOException when the address cannot be bound
   * @throws IllegalStateException when already started
   */
  public void start() throws IOException {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("ingestion server already started");
    }
    ServerSocket server = new ServerSocket();
    try {
      server.setReuseAddress(true);
      server.bind(new InetSocketAddress(settings.bindHost(), settings.port()), 128);
    } catch (IOException ex) {
      running.set(false);
      server.close();
      throw new IOException("cannot bind " + settings.bindHost() + ":" + settings.port() + ": " + ex.getMessage(), ex);
    }
    serverSocket = server;
    connectionPool = ExecutorFactories.newBoundedHandoffPool(settings.maxConnections(), "ember-conn");
    acceptor = ExecutorFactories.newFixedPool(1, "ember-accept");
    acceptor.execute(this::acceptLoop);
    metrics.gauge(MetricNames.CONNECTIONS_ACTIVE, null, 0);
    log.info("Ingestion listening on {}:{} (maxConnections={})",
        settings.bindHost(), server.getLocalPort(), settings.maxConnections());
  }

  /**
   * Bound port; useful when started with port {@code 0}.
   *
   * @return local port, or {@code -1} before {@link #start()}
   */
  public int port() {
    ServerSocket server = serverSocket;
    return server == null ? -1 : server.getLocalPort();
  }

  public int activeConnections() {
    return active.get();
  }

  public boolean isRunning() {
    return running.get();
  }

  private void acceptLoop() {
    ServerSocket server = serverSocket;
    while (running.get()) {
      Socket socket;
      try {
        socket = server.accept();
      } catch (SocketException ex) {
        if (running.get()) {
          log.error("Listening socket failed; ingestion stops accepting", ex);
        }
        return;
      } catch (IOException ex) {
        log.warn("Accept failed: {}", ex.getMessage());
        continue;
      }
      open.add(socket);
      active.incrementAndGet();
      ConnectionHandler handler = new ConnectionHandler(
          socket, settings, decoder, sink, metrics, listeners, errorLog, running::get, () -> release(socket));
      try {
        connectionPool.execute(handler);
        metrics.gauge(MetricNames.CONNECTIONS_ACTIVE, null, active.get());
      } catch (RejectedExecutionException ex) {
        metrics.increment(MetricNames.CONNECTIONS_REJECTED);
        log.warn("Refusing connection from {}: {} connections already active",
            socket.getInetAddress().getHostAddress(), settings.maxConnections());
        closeQuietly(socket);
        release(socket);
      }
    }
  }

  private void release(Socket socket) {
    if (open.remove(socket)) {
      metrics.gauge(MetricNames.CONNECTIONS_ACTIVE, null, active.decrementAndGet());
    }
  }

  /**
   * Stops accepting, closes every open connection, and waits for connection threads to exit.
   */
  @Override
  public void close() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    ServerSocket server = serverSocket;
    if (server != null) {
      try {
        server.close();
      } catch (IOException ex) {
        log.warn("Failed to close listening socket", ex);
      }
    }
    for (Socket socket : open) {
      closeQuietly(socket);
    }
    shutdown(acceptor, "acceptor");
    shutdown(connectionPool, "connection");
    log.info("Ingestion server stopped");
  }

  private static void shutdown(ExecutorService executor, String name) {
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("{} threads did not stop within 5s", name);
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Error closing socket", ex);
    }
  }
}
