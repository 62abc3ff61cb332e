package aiadmin.queue.executor.docker;

import aiadmin.queue.executor.ExecutionContext;
import aiadmin.queue.executor.ExecutionOutcome;
import aiadmin.queue.executor.RetryableExecutionException;
import aiadmin.queue.executor.TaskExecutor;
import aiadmin.queue.model.TaskKind;
import aiadmin.queue.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Pushes a local image to its registry with the {@code docker} CLI.
 * <p>
 * Parameters: {@code image_name} (required), {@code tag} (default {@code latest}),
 * {@code disable_content_trust}, {@code quiet}.
 * The contention key is {@code image_name:tag}, so two pushes of the same reference never
 * overlap. {@code all_tags} is refused: such a push writes every tag of the repository and
 * no single {@code image_name:tag} key can serialize it against the per-tag pushes.
 */
public class DockerPushExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(DockerPushExecutor.class);

    static final Pattern IMAGE_NAME = Pattern.compile(
            "^[a-z0-9]+(?:[._-][a-z0-9]+)*(?:/[a-z0-9]+(?:[._-][a-z0-9]+)*)*$");
    static final Pattern TAG = Pattern.compile("^[A-Za-z0-9_][A-Za-z0-9_.-]{0,127}$");
    static final String DEFAULT_TAG = "latest";

    private static final Set<String> KNOWN_PARAMS = Set.of(
            "image_name", "tag", "all_tags", "disable_content_trust", "quiet");

    // stderr fragments that another attempt will not fix
    private static final List<String> FATAL_MARKERS = List.of(
            "unauthorized", "denied", "invalid reference", "not found", "does not exist");

    /**
     * Runs an external command and collects its output.
     */
    @FunctionalInterface
    public interface CommandRunner {
        CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
    }

    public record CommandResult(int exitCode, String stdout, String stderr) {
    }

    private final CommandRunner runner;

    public DockerPushExecutor() {
        this(DockerPushExecutor::runProcess);
    }

    public DockerPushExecutor(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public Set<TaskKind> kinds() {
        return Set.of(TaskKind.DOCKER_PUSH);
    }

    @Override
    public void validate(TaskKind kind, Map<String, Object> params) {
        for (String name : params.keySet()) {
            if (!KNOWN_PARAMS.contains(name)) {
                throw new ValidationException("unknown parameter: " + name);
            }
        }
        Object image = params.get("image_name");
        if (!(image instanceof String imageName) || imageName.isBlank()) {
            throw new ValidationException("image_name is required");
        }
        if (!IMAGE_NAME.matcher(imageName).matches()) {
            throw new ValidationException("invalid image_name: " + imageName);
        }
        Object tag = params.get("tag");
        if (tag != null && (!(tag instanceof String t) || !TAG.matcher(t).matches())) {
            throw new ValidationException("invalid tag: " + tag);
        }
        if (flag(params, "all_tags")) {
            throw new ValidationException("all_tags is not supported, submit one push per tag");
        }
        for (String flag : List.of("all_tags", "disable_content_trust", "quiet")) {
            Object value = params.get(flag);
            if (value != null && !(value instanceof Boolean)) {
                throw new ValidationException(flag + " must be a boolean");
            }
        }
    }

    @Override
    public String deriveKey(TaskKind kind, Map<String, Object> params) {
        Object image = params.get("image_name");
        if (!(image instanceof String imageName) || imageName.isBlank()) {
            return null;
        }
        return imageName + ":" + tagOf(params);
    }

    @Override
    public ExecutionOutcome execute(TaskKind kind, Map<String, Object> params, ExecutionContext ctx)
            throws IOException, InterruptedException {
        String imageName = (String) params.get("image_name");
        String tag = tagOf(params);
        String reference = imageName + ":" + tag;

        List<String> command = new ArrayList<>(List.of("docker", "push"));
        if (flag(params, "disable_content_trust")) {
            command.add("--disable-content-trust");
        }
        if (flag(params, "quiet")) {
            command.add("--quiet");
        }
        command.add(reference);

        ctx.reportProgress(10, "Starting push of " + reference);
        if (ctx.isCancelRequested()) {
            return ExecutionOutcome.fatal("cancelled before push started");
        }

        Duration remaining = Duration.between(Instant.now(), ctx.deadline());
        if (remaining.isNegative() || remaining.isZero()) {
            throw new RetryableExecutionException("attempt deadline passed before push started");
        }

        log.info("Task {} attempt {}: {}", ctx.taskId(), ctx.attempt(), String.join(" ", command));
        ctx.reportProgress(25, "Pushing layers...");
        CommandResult res = runner.run(command, remaining);

        if (res.exitCode() != 0) {
            String error = res.stderr().isBlank() ? res.stdout().strip() : res.stderr().strip();
            String message = "Docker push failed: " + error;
            if (isFatal(error)) {
                return ExecutionOutcome.fatal(message);
            }
            return ExecutionOutcome.retryable(message);
        }

        ctx.reportProgress(90, "Finalizing push...");
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("image_name", imageName);
        result.put("tag", tag);
        result.put("full_image_name", reference);
        result.put("digest", parseDigest(res.stdout()));
        return ExecutionOutcome.success(result);
    }

    static String parseDigest(String stdout) {
        for (String line : stdout.split("\\R")) {
            int idx = line.indexOf("digest: ");
            if (idx >= 0) {
                String rest = line.substring(idx + "digest: ".length()).strip();
                int space = rest.indexOf(' ');
                return space > 0 ? rest.substring(0, space) : rest;
            }
        }
        return null;
    }

    static boolean isFatal(String error) {
        String lower = error.toLowerCase(Locale.ROOT);
        return FATAL_MARKERS.stream().anyMatch(lower::contains);
    }

    private static String tagOf(Map<String, Object> params) {
        Object tag = params.get("tag");
        return tag instanceof String t && !t.isBlank() ? t : DEFAULT_TAG;
    }

    private static boolean flag(Map<String, Object> params, String name) {
        return Boolean.TRUE.equals(params.get(name));
    }

    private static CommandResult runProcess(List<String> command, Duration timeout)
            throws IOException, InterruptedException {
        return await(new ProcessBuilder(command).start(), timeout);
    }

    /**
     * Wait for a started process, draining both pipes on pump threads so the only blocking
     * call is the interruptible {@link Process#waitFor(long, TimeUnit)}. The process is
     * killed on timeout, interrupt or any other early exit.
     */
    static CommandResult await(Process process, Duration timeout) throws InterruptedException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        Thread outPump = pump(process.getInputStream(), out, "docker-push-stdout");
        Thread errPump = pump(process.getErrorStream(), err, "docker-push-stderr");
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RetryableExecutionException("docker push timed out after " + timeout);
            }
            outPump.join(1000);
            errPump.join(1000);
            return new CommandResult(process.exitValue(), drain(out), drain(err));
        } finally {
            if (process.isAlive()) {
                log.warn("Killing abandoned process {}", process.pid());
                process.destroyForcibly();
            }
        }
    }

    private static Thread pump(InputStream in, ByteArrayOutputStream sink, String name) {
        Thread t = new Thread(() -> copy(in, sink), name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static String drain(ByteArrayOutputStream sink) {
        synchronized (sink) {
            return sink.toString(StandardCharsets.UTF_8);
        }
    }

    private static void copy(InputStream in, ByteArrayOutputStream out) {
        byte[] buf = new byte[4096];
        try (in) {
            int n;
            while ((n = in.read(buf)) > 0) {
                synchronized (out) {
                    out.write(buf, 0, n);
                }
            }
        } catch (IOException e) {
            log.debug("Output pump stopped: {}", e.getMessage());
        }
    }
}
