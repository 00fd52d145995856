package com.questrail.bamboo.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Application-wide configuration handed to the rendering engine at startup.
 *
 * <p>Semantic validation (blank name, debug port range) happens in
 * {@code BambooApp.create} so that it can be reported as an invalid-arguments
 * error instead of an exception from a constructor.</p>
 *
 * @param userAgent      empty means "derive from name and version"
 * @param chromiumFlags  extra engine switches, with or without a leading {@code --}
 */
public record AppConfig(
    String name,
    String version,
    String userAgent,
    String cachePath,
    String logPath,
    boolean enableGpu,
    boolean enableWebGl,
    boolean enableMedia,
    boolean enableNotifications,
    boolean ignoreCertificateErrors,
    boolean remoteDebugging,
    int remoteDebugPort,
    boolean logToConsole,
    List<String> chromiumFlags
) {
    public AppConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(cachePath, "cachePath");
        Objects.requireNonNull(logPath, "logPath");
        chromiumFlags = List.copyOf(Objects.requireNonNull(chromiumFlags, "chromiumFlags"));
    }

    /**
     * @return the configured user agent, or {@code "<name>/<version> Bamboo/<frameworkVersion>"}
     */
    public String effectiveUserAgent(String frameworkVersion) {
        if (!userAgent.isEmpty()) {
            return userAgent;
        }
        return name + "/" + version + " Bamboo/" + frameworkVersion;
    }

    /**
     * Engine command-line switches derived from the flags, without leading dashes.
     */
    public List<String> engineSwitches() {
        List<String> switches = new ArrayList<>();
        if (!enableGpu) {
            switches.add("disable-gpu");
        }
        if (!enableWebGl) {
            switches.add("disable-webgl");
        }
        if (ignoreCertificateErrors) {
            switches.add("ignore-certificate-errors");
        }
        for (String flag : chromiumFlags) {
            switches.add(flag.startsWith("--") ? flag.substring(2) : flag);
        }
        return List.copyOf(switches);
    }

    public static AppConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = "BambooApp";
        private String version = "1.0.0";
        private String userAgent = "";
        private String cachePath = "./bamboo_cache";
        private String logPath = "./bamboo.log";
        private boolean enableGpu = true;
        private boolean enableWebGl = true;
        private boolean enableMedia = true;
        private boolean enableNotifications = false;
        private boolean ignoreCertificateErrors = false;
        private boolean remoteDebugging = false;
        private int remoteDebugPort = 9222;
        private boolean logToConsole = true;
        private List<String> chromiumFlags = List.of();

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withVersion(String version) {
            this.version = version;
            return this;
        }

        public Builder withUserAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder withCachePath(String cachePath) {
            this.cachePath = cachePath;
            return this;
        }

        public Builder withLogPath(String logPath) {
            this.logPath = logPath;
            return this;
        }

        public Builder withGpu(boolean enabled) {
            this.enableGpu = enabled;
            return this;
        }

        public Builder withWebGl(boolean enabled) {
            this.enableWebGl = enabled;
            return this;
        }

        public Builder withMedia(boolean enabled) {
            this.enableMedia = enabled;
            return this;
        }

        public Builder withNotifications(boolean enabled) {
            this.enableNotifications = enabled;
            return this;
        }

        public Builder withIgnoreCertificateErrors(boolean ignore) {
            this.ignoreCertificateErrors = ignore;
            return this;
        }

        public Builder withRemoteDebugging(boolean enabled, int port) {
            this.remoteDebugging = enabled;
            this.remoteDebugPort = port;
            return this;
        }

        public Builder withLogToConsole(boolean logToConsole) {
            this.logToConsole = logToConsole;
            return this;
        }

        public Builder withChromiumFlags(List<String> chromiumFlags) {
            this.chromiumFlags = chromiumFlags;
            return this;
        }

        public AppConfig build() {
            return new AppConfig(name, version, userAgent, cachePath, logPath, enableGpu, enableWebGl,
                    enableMedia, enableNotifications, ignoreCertificateErrors, remoteDebugging,
                    remoteDebugPort, logToConsole, chromiumFlags);
        }
    }
}
