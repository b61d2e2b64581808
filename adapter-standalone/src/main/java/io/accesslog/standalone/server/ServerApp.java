package io.accesslog.standalone.server;

import io.accesslog.core.engine.AccessLogFormat;
import io.accesslog.core.parser.TemplateParser;
import io.accesslog.core.tags.HeaderDumpTags;
import io.accesslog.standalone.adapter.JavalinExchangeAdapter;
import io.accesslog.standalone.config.ConfigLoader;
import io.accesslog.standalone.config.ServerConfig;
import io.accesslog.standalone.logging.LogbackConfigurator;
import io.accesslog.standalone.logging.MdcSpanFactory;
import io.accesslog.standalone.logging.Slf4jAccessLogSink;
import io.javalin.Javalin;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the standalone server startup sequence.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback</li>
 * <li>Compile the access log format (fails fast on a malformed template)</li>
 * <li>Start the Javalin HTTP server with access logging around every route</li>
 * </ol>
 *
 * <p>
 * This class is separate from {@link io.accesslog.standalone.StandaloneMain}
 * to allow clean integration testing without going through {@code main()}.
 */
public final class ServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(ServerApp.class);

    private final Javalin app;
    private final AccessLogFormat format;
    private final ServerConfig config;

    private ServerApp(Javalin app, AccessLogFormat format, ServerConfig config) {
        this.app = app;
        this.format = format;
        this.config = config;
    }

    /**
     * Loads configuration from the command line and starts the server.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/config.yaml})
     * @return a running server
     */
    public static ServerApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel(), config.accessLogLogger());
        LOG.info("Configuration loaded from {}", configPath);

        return start(config);
    }

    /**
     * Starts the server with an already loaded configuration. Logback is left
     * as it is.
     *
     * @param config the server configuration
     * @return a running server
     * @throws io.accesslog.core.error.TemplateSyntaxException if the format is malformed
     */
    public static ServerApp start(ServerConfig config) {
        long startTime = System.nanoTime();

        AccessLogFormat format = buildFormat(config);
        AccessLogHandlers accessLog = new AccessLogHandlers(
                format, new JavalinExchangeAdapter(), new Slf4jAccessLogSink(config.accessLogLogger()));

        Javalin app = Javalin.create(javalinConfig -> javalinConfig.showJavalinBanner = false);
        accessLog.register(app);

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }
        app.get(IndexHandler.PATH, new IndexHandler());

        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "access-log-server started: port={}, format='{}', logger={}, span={}, excluded={}, startupMs={}",
                app.port(),
                format.template().source(),
                config.accessLogLogger(),
                config.spanEnabled(),
                config.excludePaths().size() + config.excludeRegexes().size(),
                elapsedMs);

        return new ServerApp(app, format, config);
    }

    /** Compiles the configured format with its exclusions, tags and span factory. */
    static AccessLogFormat buildFormat(ServerConfig config) {
        AccessLogFormat.Builder builder = AccessLogFormat.builder(config.accessLogFormat());
        config.excludePaths().forEach(builder::exclude);
        config.excludeRegexes().forEach(builder::excludeRegex);
        if (config.headerDumpTags()) {
            HeaderDumpTags.registerReferenced(builder, TemplateParser.compile(config.accessLogFormat()));
        }
        if (config.spanEnabled()) {
            builder.spanFactory(new MdcSpanFactory(config.spanHeader()));
        }
        return builder.build();
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    /** Returns the Javalin application. */
    public Javalin javalin() {
        return app;
    }

    /** Returns the compiled access log format. */
    public AccessLogFormat format() {
        return format;
    }

    /** Returns the server configuration. */
    public ServerConfig config() {
        return config;
    }

    /** Stops the Javalin server. */
    public void stop() {
        app.stop();
        LOG.info("access-log-server stopped");
    }
}
