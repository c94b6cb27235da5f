package com.autoflow.api.config;

import com.autoflow.core.model.ActionKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Settings under the {@code autoflow} prefix.
 */
@ConfigurationProperties(prefix = "autoflow")
public class AutoflowProperties {

    /** Repository implementations: memory or jdbc. */
    private String store = "memory";

    /** Workflow id per action kind. Unset kinds use the built-in kind workflows. */
    private Map<ActionKind, String> routing = new EnumMap<>(ActionKind.class);

    private final Approval approval = new Approval();
    private final Executor executor = new Executor();
    private final Supervisor supervisor = new Supervisor();
    private final Scheduler scheduler = new Scheduler();

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Map<ActionKind, String> getRouting() {
        return routing;
    }

    public void setRouting(Map<ActionKind, String> routing) {
        this.routing = routing;
    }

    public Approval getApproval() {
        return approval;
    }

    public Executor getExecutor() {
        return executor;
    }

    public Supervisor getSupervisor() {
        return supervisor;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public static class Approval {

        private double autoApprovalThreshold = 0.8;
        private String defaultApprover = "manager@company.com";
        private Map<ActionKind, String> approvers = new EnumMap<>(ActionKind.class);
        /** Who escalation actions are routed to. */
        private String escalateTo = "oncall@company.com";

        public double getAutoApprovalThreshold() {
            return autoApprovalThreshold;
        }

        public void setAutoApprovalThreshold(double autoApprovalThreshold) {
            this.autoApprovalThreshold = autoApprovalThreshold;
        }

        public String getDefaultApprover() {
            return defaultApprover;
        }

        public void setDefaultApprover(String defaultApprover) {
            this.defaultApprover = defaultApprover;
        }

        public Map<ActionKind, String> getApprovers() {
            return approvers;
        }

        public void setApprovers(Map<ActionKind, String> approvers) {
            this.approvers = approvers;
        }

        public String getEscalateTo() {
            return escalateTo;
        }

        public void setEscalateTo(String escalateTo) {
            this.escalateTo = escalateTo;
        }
    }

    public static class Executor {

        /** Threads walking executions. */
        private int poolSize = 8;
        /** Longest delay step slept inline; longer delays fail the step. */
        private Duration maxInlineDelay = Duration.ofMinutes(5);
        private Duration webhookTimeout = Duration.ofSeconds(10);

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public Duration getMaxInlineDelay() {
            return maxInlineDelay;
        }

        public void setMaxInlineDelay(Duration maxInlineDelay) {
            this.maxInlineDelay = maxInlineDelay;
        }

        public Duration getWebhookTimeout() {
            return webhookTimeout;
        }

        public void setWebhookTimeout(Duration webhookTimeout) {
            this.webhookTimeout = webhookTimeout;
        }
    }

    public static class Supervisor {

        private Duration sweepInterval = Duration.ofSeconds(30);
        private Duration runningTimeout = Duration.ofMinutes(30);
        private Duration startupGrace = Duration.ofMinutes(5);
        private Duration baseBackoff = Duration.ofMinutes(1);
        private int maxRetries = 3;
        private Duration retention = Duration.ofDays(90);
        private Duration purgeInterval = Duration.ofDays(1);
        private int batchSize = 100;

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public Duration getRunningTimeout() {
            return runningTimeout;
        }

        public void setRunningTimeout(Duration runningTimeout) {
            this.runningTimeout = runningTimeout;
        }

        public Duration getStartupGrace() {
            return startupGrace;
        }

        public void setStartupGrace(Duration startupGrace) {
            this.startupGrace = startupGrace;
        }

        public Duration getBaseBackoff() {
            return baseBackoff;
        }

        public void setBaseBackoff(Duration baseBackoff) {
            this.baseBackoff = baseBackoff;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getPurgeInterval() {
            return purgeInterval;
        }

        public void setPurgeInterval(Duration purgeInterval) {
            this.purgeInterval = purgeInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Scheduler {

        private Duration pollInterval = Duration.ofSeconds(1);

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }
}
