package ca.gc.cra.ember.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ServeCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunPrintsPlanWithoutBinding() {
    ExitCode code = ServeCli.run(new String[] {
        "ingest.port=9100", "fusion.confidencePolicy=weighted", "streams.cam1=RoomA", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Serve dry-run"), out);
    assertTrue(out.contains(":9100"), out);
    assertTrue(out.contains("weighted"), out);
    assertTrue(out.contains("cam1=RoomA"), out);
  }

  @Test
  void yamlConfigIsMergedUnderCliOverrides() throws Exception {
    Path yaml = tempDir.resolve("ember.yaml");
    Files.writeString(yaml, """
        serve:
          ingest:
            port: 9200
          fusion:
            minSources: 3
        """);

    ExitCode code = ServeCli.run(new String[] {"config=" + yaml, "ingest.port=9300", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains(":9300"), out);
    assertTrue(out.contains("Min sources       : 3"), out);
  }

  @Test
  void missingConfigFileIsConfigError() {
    ExitCode code = ServeCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"});
    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void unknownPolicyIsConfigError() {
    ExitCode code = ServeCli.run(new String[] {"fusion.confidencePolicy=median", "--dry-run"});
    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void occupiedPortIsIoError() throws Exception {
    try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      ExitCode code = ServeCli.run(new String[] {
          "ingest.bindHost=127.0.0.1",
          "ingest.port=" + occupied.getLocalPort(),
          "scheduler.enabled=false",
          "metrics.exporter=none"}, new CountDownLatch(0));

      assertEquals(ExitCode.IO_ERROR, code);
    }
  }

  @Test
  void servesUntilStopSignal() {
    ExitCode code = ServeCli.run(new String[] {
        "ingest.bindHost=127.0.0.1",
        "ingest.port=0",
        "scheduler.enabled=false",
        "metrics.exporter=none"}, new CountDownLatch(0));

    assertEquals(ExitCode.SUCCESS, code);
  }
}
