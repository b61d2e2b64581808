package io.accesslog.standalone.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/** Demo route: {@code GET /index} answers {@code hello world!}. */
public final class IndexHandler implements Handler {

    public static final String PATH = "/index";

    static final String BODY = "hello world!";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("text/plain");
        ctx.result(BODY);
    }
}
