package ca.gc.cra.nmapper.infrastructure.scanner;

import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.application.port.ScannerPort;
import ca.gc.cra.nmapper.domain.error.ScanException;
import ca.gc.cra.nmapper.domain.network.Device;
import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import ca.gc.cra.nmapper.domain.scan.ScanTarget;
import ca.gc.cra.nmapper.infrastructure.json.JsonCodec;
import ca.gc.cra.nmapper.logging.Logs;
import com.fasterxml.jackson.core.type.TypeReference;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ScannerPort} that runs an external command and reads a JSON device array from its
 * standard output.
 * <p><strong>Command template:</strong> tokens may contain {@code {target}}, {@code {profile}} and
 * {@code {timeoutSeconds}}, e.g. {@code ["nmap-json", "--profile", "{profile}", "{target}"]}. Tokens are passed
 * to the process as-is; no shell is involved.</p>
 * <p><strong>Output:</strong> a JSON array of device objects using the {@link Device} field names
 * ({@code ip}, {@code mac}, {@code ports[].number}, {@code ports[].protocol}, ...). Omitted booleans read as
 * {@code false}, so scanners should emit {@code "active": true} for hosts that answered.</p>
 * <p><strong>Failures:</strong>
 * <ul>
 *   <li>command cannot be started: non-retryable {@link ScanException};</li>
 *   <li>timeout: process and its descendants are terminated (then killed after a short grace), retryable;</li>
 *   <li>non-zero exit: retryable, message carries the truncated stderr;</li>
 *   <li>unparseable stdout: non-retryable.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless per call; concurrent scans run separate processes.</p>
 * <p><strong>Observability:</strong> {@code scanner.process.*} counters and {@code scanner.process.durationMillis}.</p>
 *
 * @since 0.1.0
 */
public final class CommandScannerAdapter implements ScannerPort {
  private static final Logger log = LoggerFactory.getLogger(CommandScannerAdapter.class);
  private static final TypeReference<List<Device>> DEVICE_LIST = new TypeReference<>() {};
  private static final Duration KILL_GRACE = Duration.ofSeconds(2);
  private static final int MAX_LOGGED_BYTES = 2_048;

  private final List<String> command;
  private final JsonCodec json;
  private final MetricsPort metrics;

  /**
   * Creates an adapter for the given command template.
   *
   * @param command executable followed by argument tokens; must not be empty
   * @param json codec used to parse the device array
   * @param metrics metrics sink
   * @throws IllegalArgumentException if {@code command} is empty or its executable is blank
   */
  public CommandScannerAdapter(List<String> command, JsonCodec json, MetricsPort metrics) {
    Objects.requireNonNull(command, "command");
    if (command.isEmpty() || command.get(0) == null || command.get(0).isBlank()) {
      throw new IllegalArgumentException("scanner command must name an executable");
    }
    this.command = List.copyOf(command);
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  @Override
  public List<Device> scan(ScanTarget target, ScanProfile profile, Duration timeout) throws InterruptedException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(timeout, "timeout");
    List<String> argv = render(target, profile, timeout);
    Path stdout = null;
    Path stderr = null;
    long started = System.nanoTime();
    try {
      stdout = Files.createTempFile("nmapper-scan-", ".out");
      stderr = Files.createTempFile("nmapper-scan-", ".err");
      Process process = start(argv, stdout, stderr);
      metrics.increment("scanner.process.started");
      log.debug("Started scan of {} ({}) with pid {}", target, profile.label(), process.pid());
      int exit = await(process, timeout, target);
      metrics.observe("scanner.process.durationMillis", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
      if (exit != 0) {
        metrics.increment("scanner.process.failed");
        String detail = Logs.truncate(read(stderr).trim(), MAX_LOGGED_BYTES);
        throw new ScanException("scanner exited with code " + exit + " for " + target + ": " + detail);
      }
      return parse(read(stdout), target);
    } catch (IOException ex) {
      metrics.increment("scanner.process.failed");
      throw new ScanException("scanner output could not be captured: " + ex.getMessage(), ex, false);
    } finally {
      deleteQuietly(stdout);
      deleteQuietly(stderr);
    }
  }

  @Override
  public boolean available() {
    String executable = command.get(0);
    if (executable.contains(File.separator)) {
      return Files.isExecutable(Paths.get(executable));
    }
    String path = System.getenv("PATH");
    if (path == null) {
      return false;
    }
    for (String dir : path.split(File.pathSeparator)) {
      if (!dir.isBlank() && Files.isExecutable(Paths.get(dir, executable))) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String describe() {
    return String.join(" ", command);
  }

  List<String> render(ScanTarget target, ScanProfile profile, Duration timeout) {
    List<String> argv = new ArrayList<>(command.size());
    String seconds = Long.toString(Math.max(1L, timeout.toSeconds()));
    for (String token : command) {
      argv.add(token
          .replace("{target}", target.value())
          .replace("{profile}", profile.label())
          .replace("{timeoutSeconds}", seconds));
    }
    return argv;
  }

  private static Process start(List<String> argv, Path stdout, Path stderr) {
    ProcessBuilder builder = new ProcessBuilder(argv)
        .redirectOutput(stdout.toFile())
        .redirectError(stderr.toFile())
        .redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
    try {
      return builder.start();
    } catch (IOException ex) {
      throw new ScanException("scanner command could not be started: " + ex.getMessage(), ex, false);
    }
  }

  private int await(Process process, Duration timeout, ScanTarget target) throws InterruptedException {
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        terminate(process);
        metrics.increment("scanner.process.timeout");
        throw new ScanException("scan of " + target + " timed out after " + timeout.toMillis() + " ms");
      }
      return process.exitValue();
    } catch (InterruptedException ex) {
      kill(process, process.descendants().collect(Collectors.toList()));
      metrics.increment("scanner.process.interrupted");
      throw ex;
    }
  }

  /** Signals the scanner and every process it spawned; survivors are killed after {@link #KILL_GRACE}. */
  private static void terminate(Process process) throws InterruptedException {
    List<ProcessHandle> children = process.descendants().collect(Collectors.toList());
    children.forEach(ProcessHandle::destroy);
    process.destroy();
    if (!process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
      log.warn("Scanner pid {} ignored termination; killing", process.pid());
      kill(process, children);
      return;
    }
    long deadline = System.nanoTime() + KILL_GRACE.toNanos();
    for (ProcessHandle child : children) {
      long remaining = deadline - System.nanoTime();
      if (child.isAlive() && (remaining <= 0 || !awaitExit(child, remaining))) {
        log.warn("Scanner child pid {} ignored termination; killing", child.pid());
        child.destroyForcibly();
      }
    }
  }

  private static void kill(Process process, List<ProcessHandle> children) {
    children.forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private static boolean awaitExit(ProcessHandle child, long timeoutNanos) throws InterruptedException {
    try {
      child.onExit().get(timeoutNanos, TimeUnit.NANOSECONDS);
      return true;
    } catch (ExecutionException | TimeoutException ex) {
      return false;
    }
  }

  private List<Device> parse(String output, ScanTarget target) {
    if (output.isBlank()) {
      return List.of();
    }
    try {
      List<Device> devices = json.read(output, DEVICE_LIST);
      return devices == null ? List.of() : devices;
    } catch (IllegalArgumentException ex) {
      metrics.increment("scanner.output.invalid");
      log.warn("Unparseable scanner output for {}: {}", target, Logs.truncate(output, MAX_LOGGED_BYTES));
      throw new ScanException("scanner output for " + target + " is not a device array: " + ex.getMessage(), ex,
          false);
    }
  }

  private static String read(Path file) throws IOException {
    return Files.readString(file, StandardCharsets.UTF_8);
  }

  private static File nullDevice() {
    return new File(System.getProperty("os.name", "").startsWith("Windows") ? "NUL" : "/dev/null");
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.warn("Could not delete scanner temp file {}: {}", file, ex.getMessage());
    }
  }
}
