package com.zzf.relay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.relay.config.RelayConfig;
import com.zzf.relay.core.util.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the agent CLI in streaming JSON mode and reads its stdout one record per line.
 * Aborting destroys the child process; the run then reports {@link AgentTaskResult#CANCELLED}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CliAgentTask implements AgentTask {

    private static final long EXIT_WAIT_MS = 10_000L;
    private static final int STDERR_TAIL_CHARS = 500;

    private final RelayConfig config;
    private final ObjectMapper objectMapper;

    @Override
    public AgentTaskResult run(AgentTaskRequest request, AbortSignal abort, Consumer<JsonNode> onEvent) {
        if (abort.isAborted()) {
            return AgentTaskResult.CANCELLED;
        }
        List<String> command = buildCommand(request);
        ProcessBuilder pb = new ProcessBuilder(command);
        String workDir = StringUtils.isBlank(request.getWorkDir()) ? config.getAgent().getWorkDir() : request.getWorkDir();
        if (!StringUtils.isBlank(workDir)) {
            pb.directory(new File(workDir.trim()));
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new AgentTaskException("Failed to start agent process: " + command.get(0), e);
        }
        log.info("agent.started pid={} resume={}", process.pid(), request.getResumeSessionId());

        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        Thread stderrReader = new Thread(() -> drain(process.getErrorStream(), stderr), "agent-stderr");
        stderrReader.setDaemon(true);
        stderrReader.start();

        Runnable killer = process::destroy;
        abort.onAbort(killer);

        String sessionId = request.getResumeSessionId();
        String response = null;
        String reportedError = null;
        boolean sawResult = false;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (abort.isAborted()) {
                    break;
                }
                JsonNode record = parseLine(line);
                if (record == null) {
                    continue;
                }
                JsonNode sid = record.get("session_id");
                if (sid != null && sid.isTextual() && !sid.asText().isBlank()) {
                    sessionId = sid.asText();
                }
                if ("result".equals(record.path("type").asText(""))) {
                    sawResult = true;
                    if (record.path("is_error").asBoolean(false)) {
                        reportedError = record.path("result").asText(record.path("subtype").asText("error"));
                    } else {
                        response = record.path("result").asText("");
                    }
                }
                dispatch(onEvent, record);
            }
        } catch (IOException e) {
            if (!abort.isAborted()) {
                process.destroyForcibly();
                throw new AgentTaskException("Agent output stream failed", e);
            }
        } finally {
            abort.removeListener(killer);
        }

        if (abort.isAborted()) {
            process.destroyForcibly();
            log.info("agent.cancelled pid={}", process.pid());
            return AgentTaskResult.CANCELLED;
        }

        int exitCode = awaitExit(process);
        if (reportedError != null) {
            throw new AgentTaskException("Agent reported an error: " + reportedError);
        }
        if (!sawResult) {
            String tail = tail(stderr.toString(StandardCharsets.UTF_8));
            throw new AgentTaskException("Agent exited with code " + exitCode + " without a result"
                    + (tail.isEmpty() ? "" : ": " + tail));
        }
        log.info("agent.finished pid={} exit={} session={}", process.pid(), exitCode, sessionId);
        return AgentTaskResult.completed(response, sessionId);
    }

    List<String> buildCommand(AgentTaskRequest request) {
        List<String> base = config.getAgent().getCommand();
        if (base == null || base.isEmpty()) {
            throw new AgentTaskException("relay.agent.command is empty");
        }
        List<String> command = new ArrayList<>(base);
        String permissionMode = config.getAgent().getPermissionMode();
        if (!StringUtils.isBlank(permissionMode)) {
            command.add("--permission-mode");
            command.add(permissionMode.trim());
        }
        if (!StringUtils.isBlank(request.getResumeSessionId())) {
            command.add("--resume");
            command.add(request.getResumeSessionId().trim());
        }
        command.add(request.getPrompt() == null ? "" : request.getPrompt());
        return command;
    }

    private JsonNode parseLine(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (IOException e) {
            log.debug("agent.stream.unparsable len={} err={}", trimmed.length(), e.getMessage());
            return null;
        }
    }

    private static void dispatch(Consumer<JsonNode> onEvent, JsonNode record) {
        if (onEvent == null) {
            return;
        }
        try {
            onEvent.accept(record);
        } catch (RuntimeException e) {
            log.warn("agent.event.listener_failed err={}", e.toString());
        }
    }

    private static int awaitExit(Process process) {
        try {
            if (!process.waitFor(EXIT_WAIT_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return -1;
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new AgentTaskException("Interrupted while waiting for agent exit", e);
        }
    }

    private static String tail(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.length() <= STDERR_TAIL_CHARS ? trimmed : trimmed.substring(trimmed.length() - STDERR_TAIL_CHARS);
    }

    private static void drain(InputStream in, ByteArrayOutputStream out) {
        byte[] buf = new byte[4096];
        try {
            int read;
            while ((read = in.read(buf)) >= 0) {
                synchronized (out) {
                    out.write(buf, 0, read);
                }
            }
        } catch (IOException e) {
            log.debug("agent.stderr.closed err={}", e.getMessage());
        }
    }
}
