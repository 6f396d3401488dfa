package com.kmg.sync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {
    @NotBlank
    private String baseDir;
    @NotNull
    @Valid
    private State state = new State();
    @NotNull
    @Valid
    private Logs logs = new Logs();
    @NotNull
    @Valid
    private Scheduler scheduler = new Scheduler();
    @NotNull
    @Valid
    private Batch batch = new Batch();
    @NotNull
    @Valid
    private Execution execution = new Execution();
    @NotNull
    private Map<String, Store> stores = new LinkedHashMap<>();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Execution getExecution() {
        return execution;
    }

    public void setExecution(Execution execution) {
        this.execution = execution;
    }

    public Map<String, Store> getStores() {
        return stores;
    }

    public void setStores(Map<String, Store> stores) {
        this.stores = stores;
    }

    public Path baseDirPath() {
        return Path.of(baseDir);
    }

    public static class State {
        @NotBlank
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Scheduler {
        @Min(1)
        private int poolSize = 1;
        @Min(1)
        private int workerPoolSize = 4;
        @NotBlank
        private String timezone = "UTC";
        private boolean allowOverlap = false;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getWorkerPoolSize() {
            return workerPoolSize;
        }

        public void setWorkerPoolSize(int workerPoolSize) {
            this.workerPoolSize = workerPoolSize;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public boolean isAllowOverlap() {
            return allowOverlap;
        }

        public void setAllowOverlap(boolean allowOverlap) {
            this.allowOverlap = allowOverlap;
        }
    }

    public static class Batch {
        @Min(1)
        private int defaultSize = 100;

        public int getDefaultSize() {
            return defaultSize;
        }

        public void setDefaultSize(int defaultSize) {
            this.defaultSize = defaultSize;
        }
    }

    public static class Execution {
        @Min(64)
        private int maxErrorLength = 2000;

        public int getMaxErrorLength() {
            return maxErrorLength;
        }

        public void setMaxErrorLength(int maxErrorLength) {
            this.maxErrorLength = maxErrorLength;
        }
    }

    /**
     * Connection parameters of one named backing store. Checked when a connection manager is built, not at boot,
     * so an unused store may stay unconfigured.
     */
    public static class Store {
        private String url;
        private String username;
        private String password;

        public Store() {
        }

        public Store(String url, String username, String password) {
            this.url = url;
            this.username = username;
            this.password = password;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }
}
