package com.feedcron.core;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * HTTP endpoint exposing job metrics in Prometheus text format on {@code /metrics}.
 */
public final class MetricsServer {
    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);

    private static HttpServer server;
    private static int port;

    private MetricsServer() {}

    /** Starts the server on the given port if not already running. Port 0 picks a free port. */
    public static synchronized void start(int port) {
        if (server != null) {
            return;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            MetricsServer.port = server.getAddress().getPort();
            server.createContext("/metrics", exchange -> {
                byte[] body = buildMetrics().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
                exchange.sendResponseHeaders(200, body.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(body);
                }
            });
            server.start();
            log.info("Metrics endpoint listening on port {}", MetricsServer.port);
        } catch (IOException e) {
            log.error("Could not start metrics endpoint on port {}", port, e);
            server = null;
        }
    }

    public static synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
    }

    /** Returns the port the server is bound to, or -1 if not running. */
    public static synchronized int getPort() {
        return server == null ? -1 : port;
    }

    static String buildMetrics() {
        Metrics m = Metrics.getInstance();
        StringBuilder sb = new StringBuilder();
        counter(sb, "feedcron_job_success_total", "Number of successful job executions", m.getSuccessCount());
        counter(sb, "feedcron_job_failure_total", "Number of failed job executions", m.getFailureCount());
        counter(sb, "feedcron_job_cancelled_total", "Number of job executions stopped by cancellation",
                m.getCancelledCount());
        counter(sb, "feedcron_job_vetoed_total", "Number of firings vetoed because the job was still running",
                m.getVetoedCount());
        counter(sb, "feedcron_job_retries_scheduled_total", "Number of retry firings scheduled",
                m.getRetriesScheduled());
        counter(sb, "feedcron_job_retries_exhausted_total", "Number of failures with no retries left",
                m.getRetriesExhausted());
        counter(sb, "feedcron_job_duration_millis_total", "Total time spent running jobs in milliseconds",
                m.getTotalDurationMillis());
        sb.append("# HELP feedcron_job_duration_millis_avg Average job execution time in milliseconds\n");
        sb.append("# TYPE feedcron_job_duration_millis_avg gauge\n");
        sb.append("feedcron_job_duration_millis_avg ").append(m.getAverageDurationMillis()).append('\n');
        return sb.toString();
    }

    private static void counter(StringBuilder sb, String name, String help, long value) {
        sb.append("# HELP ").append(name).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(name).append(" counter\n");
        sb.append(name).append(' ').append(value).append('\n');
    }
}
