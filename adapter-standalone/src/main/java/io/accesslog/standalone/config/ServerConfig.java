package io.accesslog.standalone.config;

import io.accesslog.core.engine.AccessLogFormat;
import java.util.List;

/**
 * Root configuration for the standalone access-logging server.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param host              bind address for the HTTP server
 * @param port              listen port; {@code 0} picks a free port
 * @param accessLogFormat   access log format string
 * @param accessLogLogger   SLF4J logger name the access log lines go to
 * @param excludePaths      paths that are never logged (exact match)
 * @param excludeRegexes    regular expressions; matching paths are never logged
 * @param headerDumpTags    register {@code ALL_REQ_HEADERS} / {@code ALL_RES_HEADERS}
 * @param spanEnabled       open a correlation span per logged request
 * @param spanHeader        request header whose value becomes the span id
 * @param healthEnabled     expose the liveness endpoint
 * @param healthPath        liveness endpoint path
 * @param loggingFormat     json or text
 * @param loggingLevel      root log level
 */
public record ServerConfig(
        String host,
        int port,
        String accessLogFormat,
        String accessLogLogger,
        List<String> excludePaths,
        List<String> excludeRegexes,
        boolean headerDumpTags,
        boolean spanEnabled,
        String spanHeader,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    public ServerConfig {
        excludePaths = excludePaths != null ? List.copyOf(excludePaths) : List.of();
        excludeRegexes = excludeRegexes != null ? List.copyOf(excludeRegexes) : List.of();
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private String accessLogFormat = AccessLogFormat.DEFAULT_PATTERN;
        private String accessLogLogger = "access-log";
        private List<String> excludePaths = List.of();
        private List<String> excludeRegexes = List.of();
        private boolean headerDumpTags;
        private boolean spanEnabled = true;
        private String spanHeader = "X-Request-ID";
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder accessLogFormat(String accessLogFormat) {
            this.accessLogFormat = accessLogFormat;
            return this;
        }

        public Builder accessLogLogger(String accessLogLogger) {
            this.accessLogLogger = accessLogLogger;
            return this;
        }

        public Builder excludePaths(List<String> excludePaths) {
            this.excludePaths = excludePaths;
            return this;
        }

        public Builder excludeRegexes(List<String> excludeRegexes) {
            this.excludeRegexes = excludeRegexes;
            return this;
        }

        public Builder headerDumpTags(boolean headerDumpTags) {
            this.headerDumpTags = headerDumpTags;
            return this;
        }

        public Builder spanEnabled(boolean spanEnabled) {
            this.spanEnabled = spanEnabled;
            return this;
        }

        public Builder spanHeader(String spanHeader) {
            this.spanHeader = spanHeader;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(
                    host,
                    port,
                    accessLogFormat,
                    accessLogLogger,
                    excludePaths,
                    excludeRegexes,
                    headerDumpTags,
                    spanEnabled,
                    spanHeader,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
