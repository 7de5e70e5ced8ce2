package com.planforge.core.config;

import com.planforge.core.policy.OnAllReviewersFailed;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "planforge")
public class PlanforgeProperties {

    /** Root directory for session state, session files and daemon bookkeeping. */
    private String home = System.getProperty("user.home") + "/.planforge";

    private final Workflow workflow = new Workflow();
    private final Daemon daemon = new Daemon();

    public String getHome() {
        return home;
    }

    public void setHome(String home) {
        this.home = home;
    }

    public Path homePath() {
        return Path.of(home);
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public Daemon getDaemon() {
        return daemon;
    }

    public static class Workflow {

        private int snapshotEvery = 50;
        private int broadcastCapacity = 64;
        private int maxRestarts = 5;
        private int maxRetries = 2;
        private long backoffSecs = 5;
        private OnAllReviewersFailed onAllReviewersFailed = OnAllReviewersFailed.SAVE_STATE;

        public int getSnapshotEvery() {
            return snapshotEvery;
        }

        public void setSnapshotEvery(int snapshotEvery) {
            this.snapshotEvery = snapshotEvery;
        }

        public int getBroadcastCapacity() {
            return broadcastCapacity;
        }

        public void setBroadcastCapacity(int broadcastCapacity) {
            this.broadcastCapacity = broadcastCapacity;
        }

        public int getMaxRestarts() {
            return maxRestarts;
        }

        public void setMaxRestarts(int maxRestarts) {
            this.maxRestarts = maxRestarts;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBackoffSecs() {
            return backoffSecs;
        }

        public void setBackoffSecs(long backoffSecs) {
            this.backoffSecs = backoffSecs;
        }

        public OnAllReviewersFailed getOnAllReviewersFailed() {
            return onAllReviewersFailed;
        }

        public void setOnAllReviewersFailed(OnAllReviewersFailed onAllReviewersFailed) {
            this.onAllReviewersFailed = onAllReviewersFailed;
        }
    }

    public static class Daemon {

        private long unresponsiveSecs = 25;
        private long staleSecs = 60;
        private long sweepIntervalSecs = 5;
        private long subscriberPingSecs = 30;
        /** Unauthenticated RPC connections silent for longer are closed. */
        private long authenticationTimeoutSecs = 10;
        /** Authenticated RPC connections silent for longer are closed. */
        private long idleTimeoutSecs = 300;
        private String bindAddress = "127.0.0.1";
        private String buildSha = "dev";
        /** Build time in epoch seconds; 0 means unknown and never wins an upgrade negotiation. */
        private long buildTimestamp = 0;

        public long getUnresponsiveSecs() {
            return unresponsiveSecs;
        }

        public void setUnresponsiveSecs(long unresponsiveSecs) {
            this.unresponsiveSecs = unresponsiveSecs;
        }

        public long getStaleSecs() {
            return staleSecs;
        }

        public void setStaleSecs(long staleSecs) {
            this.staleSecs = staleSecs;
        }

        public long getSweepIntervalSecs() {
            return sweepIntervalSecs;
        }

        public void setSweepIntervalSecs(long sweepIntervalSecs) {
            this.sweepIntervalSecs = sweepIntervalSecs;
        }

        public long getSubscriberPingSecs() {
            return subscriberPingSecs;
        }

        public void setSubscriberPingSecs(long subscriberPingSecs) {
            this.subscriberPingSecs = subscriberPingSecs;
        }

        public long getAuthenticationTimeoutSecs() {
            return authenticationTimeoutSecs;
        }

        public void setAuthenticationTimeoutSecs(long authenticationTimeoutSecs) {
            this.authenticationTimeoutSecs = authenticationTimeoutSecs;
        }

        public long getIdleTimeoutSecs() {
            return idleTimeoutSecs;
        }

        public void setIdleTimeoutSecs(long idleTimeoutSecs) {
            this.idleTimeoutSecs = idleTimeoutSecs;
        }

        public String getBindAddress() {
            return bindAddress;
        }

        public void setBindAddress(String bindAddress) {
            this.bindAddress = bindAddress;
        }

        public String getBuildSha() {
            return buildSha;
        }

        public void setBuildSha(String buildSha) {
            this.buildSha = buildSha;
        }

        public long getBuildTimestamp() {
            return buildTimestamp;
        }

        public void setBuildTimestamp(long buildTimestamp) {
            this.buildTimestamp = buildTimestamp;
        }
    }
}
