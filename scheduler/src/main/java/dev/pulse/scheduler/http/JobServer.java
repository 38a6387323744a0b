package dev.pulse.scheduler.http;

import dev.pulse.scheduler.exceptions.PulseJobNotFoundException;
import dev.pulse.scheduler.execution.JobManager;
import dev.pulse.scheduler.job.Job;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front end of the scheduler. Parameters are read from the query string and from an {@code
 * application/x-www-form-urlencoded} body.
 */
public class JobServer implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(JobServer.class);
  private static final ObjectMapper mapper = new ObjectMapper();

  private final HttpServer server;
  private final ExecutorService executor;
  private final JobManager jobManager;

  public JobServer(String host, int port, JobManager jobManager) throws IOException {
    this.jobManager = jobManager;

    Map<String, HttpHandler> routes = new HashMap<>();
    routes.put("/healthz", x -> healthCheck(x));
    routes.put("/schedule", x -> schedule(x)); // post
    routes.put("/trigger", x -> trigger(x)); // post
    routes.put("/cancel", x -> cancel(x)); // post
    routes.put("/job", x -> getJob(x));
    routes.put("/status", x -> status(x));

    var address = host == null ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    server = HttpServer.create(address, 0);
    executor = Executors.newCachedThreadPool();
    server.setExecutor(executor);

    server.createContext(
        "/",
        exchange -> {
          try {
            var handler = routes.get(exchange.getRequestURI().getPath());
            if (handler != null) {
              handler.handle(exchange);
              return;
            }
            exchange.sendResponseHeaders(404, -1);
          } catch (IllegalArgumentException e) {
            sendText(exchange, 400, e.getMessage());
          } catch (PulseJobNotFoundException e) {
            sendText(exchange, 404, e.getMessage());
          } catch (Exception e) {
            logger.error(e.getMessage(), e);
            sendText(exchange, 500, String.valueOf(e.getMessage()));
          } finally {
            exchange.close();
          }
        });
  }

  public void start() {
    logger.info("HTTP server listening on {}", server.getAddress());
    server.start();
  }

  public void stop() {
    logger.debug("stop");
    server.stop(0);
    executor.shutdownNow();
  }

  @Override
  public void close() {
    stop();
  }

  /** Port actually bound, useful when the server was created with port 0. */
  public int port() {
    return server.getAddress().getPort();
  }

  private void healthCheck(HttpExchange exchange) throws IOException {
    sendJson(
        exchange,
        200,
        """
        {"status":"healthy"}""");
  }

  private void schedule(HttpExchange exchange) throws IOException {
    if (!ensurePost(exchange)) return;

    var params = readParams(exchange);
    var intervalString = params.get("interval");
    long interval;
    try {
      interval = Long.parseLong(intervalString == null ? "" : intervalString.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Cannot parse interval");
    }
    var oneOff = parseFlag(params.get("one_off"));

    logger.debug("/schedule {} {}", params.get("routing_key"), params.get("body"));
    var job =
        jobManager.schedule(
            params.get("routing_key"), params.getOrDefault("body", ""), interval, oneOff);
    sendMappedJson(exchange, 200, JobOutput.of(job));
  }

  private void trigger(HttpExchange exchange) throws IOException {
    if (!ensurePost(exchange)) return;

    var params = readParams(exchange);
    logger.debug("/trigger {} {}", params.get("routing_key"), params.get("body"));
    var job = jobManager.trigger(params.get("routing_key"), params.getOrDefault("body", ""));
    sendMappedJson(exchange, 200, JobOutput.of(job));
  }

  private void cancel(HttpExchange exchange) throws IOException {
    if (!ensurePost(exchange)) return;

    var params = readParams(exchange);
    logger.debug("/cancel {} {}", params.get("routing_key"), params.get("body"));
    jobManager.cancel(params.get("routing_key"), params.getOrDefault("body", ""));
    exchange.sendResponseHeaders(204, -1);
  }

  private void getJob(HttpExchange exchange) throws IOException {
    var params = readParams(exchange);
    var job = jobManager.get(params.get("routing_key"), params.getOrDefault("body", ""));
    sendMappedJson(exchange, 200, JobOutput.of(job));
  }

  private void status(HttpExchange exchange) throws IOException {
    sendMappedJson(exchange, 200, new StatusOutput(jobManager.total(), jobManager.running()));
  }

  static boolean parseFlag(String value) {
    if (value == null) {
      return false;
    }
    return switch (value.trim().toLowerCase()) {
      case "1", "true", "yes", "on" -> true;
      case "", "0", "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException("Cannot parse one_off");
    };
  }

  static Map<String, String> readParams(HttpExchange exchange) throws IOException {
    Map<String, String> params = new HashMap<>();
    parseQuery(exchange.getRequestURI().getRawQuery(), params);

    var contentType = exchange.getRequestHeaders().getFirst("Content-Type");
    if (contentType != null && contentType.startsWith("application/x-www-form-urlencoded")) {
      var body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
      parseQuery(body, params);
    }
    return params;
  }

  static void parseQuery(String query, Map<String, String> params) {
    if (query == null || query.isEmpty()) {
      return;
    }
    for (var pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      var name = eq >= 0 ? pair.substring(0, eq) : pair;
      var value = eq >= 0 ? pair.substring(eq + 1) : "";
      params.putIfAbsent(
          URLDecoder.decode(name, StandardCharsets.UTF_8),
          URLDecoder.decode(value, StandardCharsets.UTF_8));
    }
  }

  private static void sendText(HttpExchange exchange, int statusCode, String text)
      throws IOException {
    exchange.getResponseHeaders().add("Content-Type", "text/plain");
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private static void sendJson(HttpExchange exchange, int statusCode, String json)
      throws IOException {
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private static void sendMappedJson(HttpExchange exchange, int statusCode, Object json)
      throws IOException {
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    byte[] bytes = mapper.writeValueAsBytes(json);
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private static boolean ensurePost(HttpExchange exchange) throws IOException {
    if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      exchange.sendResponseHeaders(405, -1); // Method Not Allowed
      return false;
    }
    return true;
  }

  record JobOutput(
      String routing_key, String body, long interval, String next_run, boolean one_off) {
    static JobOutput of(Job job) {
      return new JobOutput(
          job.routingKey(),
          job.body(),
          job.intervalSeconds(),
          job.nextRun().toString(),
          job.oneOff());
    }
  }

  record StatusOutput(long total_jobs, int running_jobs) {}
}
