package io.avscheduler.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.avscheduler.config.JobDefinition;
import io.avscheduler.config.SchedulerConfig;
import io.avscheduler.exception.ConfigException;
import io.avscheduler.exception.LogStoreException;
import io.avscheduler.model.ExecutionRecord;
import io.avscheduler.model.JobStatusView;
import io.avscheduler.storage.ExecutionLogStore;
import io.avscheduler.trigger.TriggerEngine;
import io.avscheduler.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Read-only HTTP view over the execution log. Runs in its own process and shares nothing
 * with the daemon except the database file, so "running" is never reported here.
 */
public final class StatusServer {
    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);
    static final int DEFAULT_LIMIT = 100;
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Supplier<SchedulerConfig> config;
    private final ExecutionLogStore logStore;
    private final Clock clock;
    private final String host;
    private final int requestedPort;
    private HttpServer server;

    public StatusServer(Supplier<SchedulerConfig> config, ExecutionLogStore logStore, Clock clock, String host, int port) {
        this.config = config;
        this.logStore = logStore;
        this.clock = clock;
        this.host = host;
        this.requestedPort = port;
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("status server already started");
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(host, requestedPort), 0);
        created.createContext("/", exchange -> handle(exchange, () -> {
            if (!"/".equals(exchange.getRequestURI().getPath())) {
                writeJson(exchange, Map.of("error", "not_found"), 404);
                return;
            }
            writeHtml(exchange, dashboardHtml(logStore.list(null, null, null, DEFAULT_LIMIT)));
        }));
        created.createContext("/api/logs", exchange -> handle(exchange, () -> {
            Map<String, String> q = parseQuery(exchange.getRequestURI());
            String jobId = blankToNull(q.get("job_id"));
            int limit;
            try {
                limit = q.containsKey("limit") ? Integer.parseInt(q.get("limit").trim()) : DEFAULT_LIMIT;
            } catch (NumberFormatException e) {
                writeJson(exchange, Map.of("error", "invalid_limit", "value", q.get("limit")), 400);
                return;
            }
            writeJson(exchange, logStore.list(jobId, null, null, limit), 200);
        }));
        created.createContext("/api/jobs", exchange -> handle(exchange, () -> writeJson(exchange, jobViews(), 200)));
        created.setExecutor(null);
        created.start();
        server = created;
        LOG.info("Status server listening on http://{}:{}", host, port());
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
    }

    /** Bound port; differs from the requested one when that was 0. */
    public synchronized int port() {
        return server == null ? requestedPort : server.getAddress().getPort();
    }

    List<JobStatusView> jobViews() {
        SchedulerConfig current = config.get();
        TriggerEngine trigger = new TriggerEngine(current.settings().timezone());
        Instant now = clock.instant();
        List<JobStatusView> out = new ArrayList<>();
        for (JobDefinition job : current.jobs().values()) {
            Long next = null;
            String rejection = null;
            try {
                next = trigger.nextFireTime(job.scheduleSpec(), now).toEpochMilli();
                if (current.interpreterFor(job).isEmpty()) {
                    rejection = "Interpreter '" + job.type() + "' for job '" + job.jobId() + "' is not configured";
                    next = null;
                }
            } catch (ConfigException e) {
                rejection = e.getMessage();
            }
            out.add(new JobStatusView(
                    job.jobId(),
                    job.displayName(),
                    logStore.latest(job.jobId()).orElse(null),
                    next,
                    null,
                    job.condition(),
                    false,
                    rejection == null,
                    rejection
            ));
        }
        out.sort((a, b) -> a.jobId().compareTo(b.jobId()));
        return out;
    }

    private void handle(HttpExchange exchange, ExchangeAction action) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET");
                writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                return;
            }
            action.run();
        } catch (LogStoreException | ConfigException e) {
            LOG.error("Status request {} failed", exchange.getRequestURI(), e);
            writeJson(exchange, Map.of("error", "internal_error", "message", String.valueOf(e.getMessage())), 500);
        } finally {
            exchange.close();
        }
    }

    private String dashboardHtml(List<ExecutionRecord> records) {
        SchedulerConfig current = config.get();
        StringBuilder rows = new StringBuilder();
        for (ExecutionRecord r : records) {
            JobDefinition job = current.jobs().get(r.jobId());
            String name = job == null ? r.jobId() : job.displayName();
            rows.append("<tr class=\"").append(r.successful() ? "ok" : "fail").append("\">")
                    .append("<td>").append(r.id()).append("</td>")
                    .append("<td>").append(escape(r.jobId())).append("</td>")
                    .append("<td>").append(escape(name)).append("</td>")
                    .append("<td>").append(r.exitCode()).append("</td>")
                    .append("<td>").append(String.format(Locale.ROOT, "%.2f", r.durationSeconds())).append("</td>")
                    .append("<td>").append(TIMESTAMP.format(r.startedAt().atZone(current.settings().timezone()))).append("</td>")
                    .append("</tr>\n");
        }
        return """
                <!doctype html>
                <html lang="en">
                <head>
                  <meta charset="utf-8">
                  <title>avscheduler</title>
                  <style>
                    body { font-family: sans-serif; margin: 2em; }
                    table { border-collapse: collapse; }
                    th, td { border: 1px solid #ccc; padding: 4px 10px; text-align: left; }
                    tr.fail td { background: #fbe3e3; }
                  </style>
                </head>
                <body>
                  <h1>Recent executions</h1>
                  <table>
                    <tr><th>ID</th><th>Job</th><th>Name</th><th>Exit code</th><th>Time (s)</th><th>Started</th></tr>
                %s  </table>
                </body>
                </html>
                """.formatted(rows);
    }

    private static void writeHtml(HttpExchange exchange, String html) throws IOException {
        byte[] body = html.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                out.put(
                        URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8)
                );
            }
        }
        return out;
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static String escape(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    @FunctionalInterface
    private interface ExchangeAction {
        void run() throws IOException;
    }
}
