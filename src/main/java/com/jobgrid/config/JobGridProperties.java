package com.jobgrid.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@ConfigurationProperties(prefix = "jobgrid")
public class JobGridProperties {

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final Worker worker = new Worker();
    private final Scheduler scheduler = new Scheduler();
    private final Logs logs = new Logs();
    private final Results results = new Results();

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Worker getWorker() {
        return worker;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Logs getLogs() {
        return logs;
    }

    public Results getResults() {
        return results;
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Jobs {
        private String defaultQueue = "default";
        private int maxNameLength = 100;
        private int maxGroupingLength = 255;
        private boolean reconcileOnStartup = true;

        public String getDefaultQueue() {
            return defaultQueue;
        }

        public void setDefaultQueue(String defaultQueue) {
            this.defaultQueue = defaultQueue;
        }

        public int getMaxNameLength() {
            return maxNameLength;
        }

        public void setMaxNameLength(int maxNameLength) {
            this.maxNameLength = maxNameLength;
        }

        public int getMaxGroupingLength() {
            return maxGroupingLength;
        }

        public void setMaxGroupingLength(int maxGroupingLength) {
            this.maxGroupingLength = maxGroupingLength;
        }

        public boolean isReconcileOnStartup() {
            return reconcileOnStartup;
        }

        public void setReconcileOnStartup(boolean reconcileOnStartup) {
            this.reconcileOnStartup = reconcileOnStartup;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
        private String workerName = defaultWorkerName();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public String getWorkerName() {
            return workerName;
        }

        public void setWorkerName(String workerName) {
            this.workerName = workerName;
        }

        private static String defaultWorkerName() {
            String host;
            try {
                host = InetAddress.getLocalHost().getHostName();
            } catch (Exception e) {
                host = "localhost";
            }
            return host + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickIntervalInSeconds = 5;
        private String heartbeatFile = "";
        private String timeZone = "UTC";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickIntervalInSeconds() {
            return tickIntervalInSeconds;
        }

        public void setTickIntervalInSeconds(long tickIntervalInSeconds) {
            this.tickIntervalInSeconds = tickIntervalInSeconds;
        }

        public String getHeartbeatFile() {
            return heartbeatFile;
        }

        public void setHeartbeatFile(String heartbeatFile) {
            this.heartbeatFile = heartbeatFile;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }
    }

    public static class Logs {
        private boolean usePrimaryStore = false;
        private String sanitizerReplacement = "(redacted)";
        private List<SanitizerPattern> sanitizerPatterns = new ArrayList<>(List.of(
                new SanitizerPattern("(https?://)?\\S+\\s*@", "$1{replacement}@"),
                new SanitizerPattern(
                        "(username|password|passwd|pwd|secret|secrets)([\"']?(?:\\s+is.?\\s+|\\s*[:=]\\s*|\\s+))\\S+",
                        "$1$2{replacement}")));

        public boolean isUsePrimaryStore() {
            return usePrimaryStore;
        }

        public void setUsePrimaryStore(boolean usePrimaryStore) {
            this.usePrimaryStore = usePrimaryStore;
        }

        public String getSanitizerReplacement() {
            return sanitizerReplacement;
        }

        public void setSanitizerReplacement(String sanitizerReplacement) {
            this.sanitizerReplacement = sanitizerReplacement;
        }

        public List<SanitizerPattern> getSanitizerPatterns() {
            return sanitizerPatterns;
        }

        public void setSanitizerPatterns(List<SanitizerPattern> sanitizerPatterns) {
            this.sanitizerPatterns = sanitizerPatterns;
        }
    }

    /**
     * A regular expression and the replacement template applied to each match.
     * {@code {replacement}} in the template expands to the configured sanitizer replacement.
     */
    public static class SanitizerPattern {
        private String regex;
        private String replacement;

        public SanitizerPattern() {
        }

        public SanitizerPattern(String regex, String replacement) {
            this.regex = regex;
            this.replacement = replacement;
        }

        public String getRegex() {
            return regex;
        }

        public void setRegex(String regex) {
            this.regex = regex;
        }

        public String getReplacement() {
            return replacement;
        }

        public void setReplacement(String replacement) {
            this.replacement = replacement;
        }
    }

    public static class Results {
        private String deleteCompletedAfter = "";

        public String getDeleteCompletedAfter() {
            return deleteCompletedAfter;
        }

        public void setDeleteCompletedAfter(String deleteCompletedAfter) {
            this.deleteCompletedAfter = deleteCompletedAfter;
        }
    }
}
