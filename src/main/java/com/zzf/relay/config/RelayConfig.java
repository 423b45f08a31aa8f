package com.zzf.relay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "relay")
public class RelayConfig {
    private final Progress progress = new Progress();
    private final Reply reply = new Reply();
    private final Agent agent = new Agent();
    private final Timer timer = new Timer();

    public Progress getProgress() {
        return progress;
    }

    public Reply getReply() {
        return reply;
    }

    public Agent getAgent() {
        return agent;
    }

    public Timer getTimer() {
        return timer;
    }

    public static class Progress {
        private long editDebounceMs = 2000L;
        private long keepaliveIntervalMs = 8000L;
        private boolean placeholderEnabled = true;
        private String placeholderText = "🤔 Thinking...";

        public long getEditDebounceMs() {
            return editDebounceMs;
        }

        public void setEditDebounceMs(long editDebounceMs) {
            this.editDebounceMs = editDebounceMs;
        }

        public long getKeepaliveIntervalMs() {
            return keepaliveIntervalMs;
        }

        public void setKeepaliveIntervalMs(long keepaliveIntervalMs) {
            this.keepaliveIntervalMs = keepaliveIntervalMs;
        }

        public boolean isPlaceholderEnabled() {
            return placeholderEnabled;
        }

        public void setPlaceholderEnabled(boolean placeholderEnabled) {
            this.placeholderEnabled = placeholderEnabled;
        }

        public String getPlaceholderText() {
            return placeholderText;
        }

        public void setPlaceholderText(String placeholderText) {
            this.placeholderText = placeholderText;
        }
    }

    public static class Reply {
        private int chunkLimit = 2000;

        public int getChunkLimit() {
            return chunkLimit;
        }

        public void setChunkLimit(int chunkLimit) {
            this.chunkLimit = chunkLimit;
        }
    }

    public static class Agent {
        private List<String> command = new ArrayList<>(List.of("claude", "-p", "--output-format", "stream-json", "--verbose"));
        private String workDir = System.getProperty("user.dir");
        private String permissionMode = "bypassPermissions";

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public String getWorkDir() {
            return workDir;
        }

        public void setWorkDir(String workDir) {
            this.workDir = workDir;
        }

        public String getPermissionMode() {
            return permissionMode;
        }

        public void setPermissionMode(String permissionMode) {
            this.permissionMode = permissionMode;
        }
    }

    public static class Timer {
        private int poolSize = 2;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
