package com.delta.opportunities.config;

import com.delta.opportunities.pipeline.model.AutomationLevel;
import com.delta.opportunities.pipeline.model.QuotaExhaustedPolicy;
import com.delta.opportunities.pipeline.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "delta-opportunity-engine/0.1 (+contact)";

    private String userAgent;
    private Orchestrator orchestrator = new Orchestrator();
    private Admission admission = new Admission();
    private Automation automation = new Automation();
    private Generator generator = new Generator();
    private Submission submission = new Submission();
    private Tracker tracker = new Tracker();
    private Feedback feedback = new Feedback();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Admission getAdmission() {
        return admission;
    }

    public void setAdmission(Admission admission) {
        this.admission = admission;
    }

    public Automation getAutomation() {
        return automation;
    }

    public void setAutomation(Automation automation) {
        this.automation = automation;
    }

    public Generator getGenerator() {
        return generator;
    }

    public void setGenerator(Generator generator) {
        this.generator = generator;
    }

    public Submission getSubmission() {
        return submission;
    }

    public void setSubmission(Submission submission) {
        this.submission = submission;
    }

    public Tracker getTracker() {
        return tracker;
    }

    public void setTracker(Tracker tracker) {
        this.tracker = tracker;
    }

    public Feedback getFeedback() {
        return feedback;
    }

    public void setFeedback(Feedback feedback) {
        this.feedback = feedback;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Orchestrator {
        private int workerPoolSize = 8;
        private boolean resumeOnStartup = true;
        private int conflictRetryLimit = 10;

        public int getWorkerPoolSize() {
            return Math.max(1, workerPoolSize);
        }

        public void setWorkerPoolSize(int workerPoolSize) {
            this.workerPoolSize = Math.max(1, workerPoolSize);
        }

        public boolean isResumeOnStartup() {
            return resumeOnStartup;
        }

        public void setResumeOnStartup(boolean resumeOnStartup) {
            this.resumeOnStartup = resumeOnStartup;
        }

        public int getConflictRetryLimit() {
            return Math.max(1, conflictRetryLimit);
        }

        public void setConflictRetryLimit(int conflictRetryLimit) {
            this.conflictRetryLimit = Math.max(1, conflictRetryLimit);
        }
    }

    public static class Admission {
        private int dailyQuota = 25;
        private QuotaExhaustedPolicy quotaExhaustedPolicy = QuotaExhaustedPolicy.SKIP;

        public int getDailyQuota() {
            return Math.max(0, dailyQuota);
        }

        public void setDailyQuota(int dailyQuota) {
            this.dailyQuota = Math.max(0, dailyQuota);
        }

        public QuotaExhaustedPolicy getQuotaExhaustedPolicy() {
            return quotaExhaustedPolicy == null ? QuotaExhaustedPolicy.SKIP : quotaExhaustedPolicy;
        }

        public void setQuotaExhaustedPolicy(QuotaExhaustedPolicy quotaExhaustedPolicy) {
            this.quotaExhaustedPolicy = quotaExhaustedPolicy;
        }
    }

    public static class Automation {
        private AutomationLevel level = AutomationLevel.SEMI_AUTO;
        private double qualityThreshold = 0.7;

        public AutomationLevel getLevel() {
            return level == null ? AutomationLevel.SEMI_AUTO : level;
        }

        public void setLevel(AutomationLevel level) {
            this.level = level;
        }

        public double getQualityThreshold() {
            return Math.min(1.0, Math.max(0.0, qualityThreshold));
        }

        public void setQualityThreshold(double qualityThreshold) {
            this.qualityThreshold = qualityThreshold;
        }
    }

    public static class Generator {
        private String endpoint;
        private int timeoutSeconds = 120;
        private int maxAttempts = 3;
        private long retryBaseDelayMs = 5000;
        private long retryMaxDelayMs = 60000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getRetryBaseDelayMs() {
            return Math.max(1, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(1, retryBaseDelayMs);
        }

        public long getRetryMaxDelayMs() {
            return Math.max(getRetryBaseDelayMs(), retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public RetryPolicy retryPolicy() {
            return new RetryPolicy(
                getMaxAttempts(),
                Duration.ofMillis(getRetryBaseDelayMs()),
                2.0,
                Duration.ofMillis(getRetryMaxDelayMs())
            );
        }
    }

    public static class Submission {
        private String defaultPlatform = "email";
        private int maxAttempts = 6;
        private long retryBaseDelayMs = 30000;
        private double retryMultiplier = 2.0;
        private long retryMaxDelayMs = 3_600_000;
        private int requestTimeoutSeconds = 20;
        private boolean recoverOnStartup = true;
        private Map<String, Platform> platforms = new LinkedHashMap<>();

        public String getDefaultPlatform() {
            return defaultPlatform == null || defaultPlatform.isBlank() ? "email" : defaultPlatform.trim();
        }

        public void setDefaultPlatform(String defaultPlatform) {
            this.defaultPlatform = defaultPlatform;
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getRetryBaseDelayMs() {
            return Math.max(1, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(1, retryBaseDelayMs);
        }

        public double getRetryMultiplier() {
            return Math.max(1.0, retryMultiplier);
        }

        public void setRetryMultiplier(double retryMultiplier) {
            this.retryMultiplier = retryMultiplier;
        }

        public long getRetryMaxDelayMs() {
            return Math.max(getRetryBaseDelayMs(), retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public boolean isRecoverOnStartup() {
            return recoverOnStartup;
        }

        public void setRecoverOnStartup(boolean recoverOnStartup) {
            this.recoverOnStartup = recoverOnStartup;
        }

        public Map<String, Platform> getPlatforms() {
            return platforms;
        }

        public void setPlatforms(Map<String, Platform> platforms) {
            this.platforms = platforms == null ? new LinkedHashMap<>() : platforms;
        }

        public Platform platform(String name) {
            Platform platform = platforms.get(name);
            return platform == null ? new Platform() : platform;
        }

        public RetryPolicy retryPolicy() {
            return new RetryPolicy(
                getMaxAttempts(),
                Duration.ofMillis(getRetryBaseDelayMs()),
                getRetryMultiplier(),
                Duration.ofMillis(getRetryMaxDelayMs())
            );
        }
    }

    public static class Platform {
        private String endpoint;
        private int workers = 2;
        private int queueCapacity = 500;
        private double ratePerSecond = 1.0;
        private int burst = 5;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public int getWorkers() {
            return Math.max(1, workers);
        }

        public void setWorkers(int workers) {
            this.workers = Math.max(1, workers);
        }

        public int getQueueCapacity() {
            return Math.max(1, queueCapacity);
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = Math.max(1, queueCapacity);
        }

        public double getRatePerSecond() {
            return ratePerSecond <= 0 ? 1.0 : ratePerSecond;
        }

        public void setRatePerSecond(double ratePerSecond) {
            this.ratePerSecond = ratePerSecond;
        }

        public int getBurst() {
            return Math.max(1, burst);
        }

        public void setBurst(int burst) {
            this.burst = Math.max(1, burst);
        }
    }

    public static class Tracker {
        private boolean sweepEnabled = true;
        private int sweepIntervalSeconds = 60;
        private int noResponseDays = 30;
        private List<Integer> followUpDays = new ArrayList<>(List.of(7, 14));
        private int opportunityRetentionDays = 180;
        private int sweepBatchSize = 200;

        public boolean isSweepEnabled() {
            return sweepEnabled;
        }

        public void setSweepEnabled(boolean sweepEnabled) {
            this.sweepEnabled = sweepEnabled;
        }

        public int getSweepIntervalSeconds() {
            return Math.max(1, sweepIntervalSeconds);
        }

        public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
            this.sweepIntervalSeconds = Math.max(1, sweepIntervalSeconds);
        }

        public int getNoResponseDays() {
            return Math.max(1, noResponseDays);
        }

        public void setNoResponseDays(int noResponseDays) {
            this.noResponseDays = Math.max(1, noResponseDays);
        }

        public List<Integer> getFollowUpDays() {
            return followUpDays;
        }

        public void setFollowUpDays(List<Integer> followUpDays) {
            this.followUpDays = followUpDays == null ? new ArrayList<>() : followUpDays;
        }

        public int getOpportunityRetentionDays() {
            return Math.max(1, opportunityRetentionDays);
        }

        public void setOpportunityRetentionDays(int opportunityRetentionDays) {
            this.opportunityRetentionDays = Math.max(1, opportunityRetentionDays);
        }

        public int getSweepBatchSize() {
            return Math.max(1, sweepBatchSize);
        }

        public void setSweepBatchSize(int sweepBatchSize) {
            this.sweepBatchSize = Math.max(1, sweepBatchSize);
        }
    }

    public static class Feedback {
        private double learningRate = 0.05;

        public double getLearningRate() {
            return learningRate <= 0 ? 0.05 : learningRate;
        }

        public void setLearningRate(double learningRate) {
            this.learningRate = learningRate;
        }
    }

    public static class Cli {
        private boolean run;
        private String userId = "";
        private String file = "../data/opportunities.csv";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getUserId() {
            return userId;
        }

        public void setUserId(String userId) {
            this.userId = userId;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
