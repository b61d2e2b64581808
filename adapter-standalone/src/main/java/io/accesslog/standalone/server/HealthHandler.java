package io.accesslog.standalone.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Liveness probe handler.
 *
 * <p>
 * Returns a fixed {@code 200 OK} with {@code {"status": "UP"}} when the JVM
 * and HTTP server are running. Like every route it is access-logged unless
 * its path is excluded.
 */
public final class HealthHandler implements Handler {

    private static final String HEALTH_RESPONSE = "{\"status\":\"UP\"}";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(HEALTH_RESPONSE);
    }
}
