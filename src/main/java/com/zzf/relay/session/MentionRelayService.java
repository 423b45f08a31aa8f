package com.zzf.relay.session;

import com.zzf.relay.agent.AgentTask;
import com.zzf.relay.agent.AgentTaskRequest;
import com.zzf.relay.agent.AgentTaskResult;
import com.zzf.relay.cancel.CancellationRegistry;
import com.zzf.relay.channel.ReplyChannel;
import com.zzf.relay.channel.ReplySplitter;
import com.zzf.relay.config.RelayConfig;
import com.zzf.relay.core.time.RelayScheduler;
import com.zzf.relay.core.util.StringUtils;
import com.zzf.relay.id.Identifier;
import com.zzf.relay.model.MentionRequest;
import com.zzf.relay.progress.ProgressClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for inbound mentions. Runs the agent task for one mention while streaming its progress
 * into a single debounced message, and guarantees the session is cleaned up on every exit path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MentionRelayService {

    static final String EMPTY_MENTION_HINT = "Please include a message with your mention!";
    static final String EMPTY_RESPONSE = "No response was returned.";
    static final String GENERIC_ERROR = "An error occurred while processing your request. Please try again later.";

    private final AgentTask agentTask;
    private final ProgressClassifier classifier;
    private final CancellationRegistry cancellationRegistry;
    private final ChannelSessionStore channelSessions;
    private final RelayScheduler scheduler;
    private final RelayConfig config;
    private final MeterRegistry meterRegistry;

    @Async
    public CompletableFuture<Optional<SessionState>> handleAsync(MentionRequest request, ReplyChannel channel) {
        return CompletableFuture.completedFuture(handle(request, channel));
    }

    /**
     * Handles one mention to completion on the calling thread.
     *
     * @return the terminal state reached, or empty when the mention carried nothing to work on
     */
    public Optional<SessionState> handle(MentionRequest request, ReplyChannel channel) {
        if (StringUtils.isBlank(request.getPrompt()) && !request.hasImages()) {
            replyQuietly(channel, EMPTY_MENTION_HINT);
            return Optional.empty();
        }

        RelayConfig.Progress progressConfig = config.getProgress();
        String token = Identifier.random("cancel");
        MDC.put("cancelToken", token);
        MDC.put("channelId", request.getChannelId());
        ProgressSession session = new ProgressSession(
                token, channel, cancellationRegistry, scheduler, classifier, progressConfig.getEditDebounceMs());
        try {
            log.info("relay.session.start token={} channel={} user={}", token, request.getChannelId(), request.getUsername());
            session.open(progressConfig.getKeepaliveIntervalMs(),
                    progressConfig.isPlaceholderEnabled() ? progressConfig.getPlaceholderText() : null);

            AgentTaskResult result;
            try {
                AgentTaskRequest taskRequest = AgentTaskRequest.builder()
                        .prompt(MentionPromptBuilder.build(request))
                        .workDir(config.getAgent().getWorkDir())
                        .resumeSessionId(channelSessions.get(request.getChannelId()).orElse(null))
                        .build();
                result = agentTask.run(taskRequest, session.getAbortSignal(), session::onEvent);
            } catch (RuntimeException e) {
                if (session.isCancelRequested()) {
                    log.debug("relay.session.task_stopped_after_cancel err={}", e.toString());
                    return Optional.of(finishCancelled(session));
                }
                return Optional.of(finishFailed(session, channel, e));
            }

            if (result == null || result.isCancelled() || session.isCancelRequested()) {
                return Optional.of(finishCancelled(session));
            }
            return Optional.of(finishCompleted(session, channel, request, result));
        } finally {
            session.cleanup();
            MDC.remove("cancelToken");
            MDC.remove("channelId");
        }
    }

    private SessionState finishCompleted(ProgressSession session, ReplyChannel channel,
                                         MentionRequest request, AgentTaskResult result) {
        session.finish(SessionState.COMPLETED);
        channelSessions.put(request.getChannelId(), result.getSessionId());

        String response = StringUtils.isBlank(result.getResponse()) ? EMPTY_RESPONSE : result.getResponse();
        List<String> chunks = ReplySplitter.split(response, config.getReply().getChunkLimit());
        try {
            for (int i = 0; i < chunks.size(); i++) {
                if (i == 0) {
                    channel.reply(chunks.get(i));
                } else {
                    channel.send(chunks.get(i));
                }
            }
        } catch (RuntimeException e) {
            log.warn("relay.reply.failed token={} chunks={} err={}", session.getCancelToken(), chunks.size(), e.toString());
        }
        log.info("relay.session.completed token={} chars={}", session.getCancelToken(), response.length());
        return record(SessionState.COMPLETED);
    }

    private SessionState finishCancelled(ProgressSession session) {
        session.finish(SessionState.CANCELLED);
        log.info("relay.session.cancelled token={}", session.getCancelToken());
        return record(SessionState.CANCELLED);
    }

    private SessionState finishFailed(ProgressSession session, ReplyChannel channel, RuntimeException cause) {
        session.finish(SessionState.FAILED);
        log.error("relay.session.failed token={}", session.getCancelToken(), cause);
        replyQuietly(channel, GENERIC_ERROR);
        return record(SessionState.FAILED);
    }

    private SessionState record(SessionState outcome) {
        meterRegistry.counter("relay.sessions", "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
        return outcome;
    }

    private void replyQuietly(ReplyChannel channel, String text) {
        try {
            channel.reply(text);
        } catch (RuntimeException e) {
            log.warn("relay.reply.failed err={}", e.toString());
        }
    }
}
