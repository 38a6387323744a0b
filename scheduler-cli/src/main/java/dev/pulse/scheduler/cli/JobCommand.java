package dev.pulse.scheduler.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "job",
    description = "Manage the jobs of a running scheduler",
    subcommands = {
      ScheduleCommand.class,
      TriggerCommand.class,
      CancelCommand.class,
      GetCommand.class,
      StatusCommand.class,
    })
public class JobCommand implements Runnable {

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }
}

class ServerOptions {
  static final String DEFAULT_URL = "http://localhost:17500";
  private static final ObjectMapper mapper = new ObjectMapper();
  private static final HttpClient client =
      HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();

  @Option(
      names = {"-u", "--url"},
      description = "base URL of the scheduler's HTTP front end (default: ${DEFAULT-VALUE})",
      defaultValue = DEFAULT_URL)
  String url;

  HttpResponse<String> post(String path, Map<String, String> params)
      throws IOException, InterruptedException {
    var request =
        HttpRequest.newBuilder(URI.create(url + path))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(encode(params)))
            .build();
    return client.send(request, HttpResponse.BodyHandlers.ofString());
  }

  HttpResponse<String> get(String path, Map<String, String> params)
      throws IOException, InterruptedException {
    var query = params.isEmpty() ? "" : "?" + encode(params);
    var request = HttpRequest.newBuilder(URI.create(url + path + query)).GET().build();
    return client.send(request, HttpResponse.BodyHandlers.ofString());
  }

  /** Print the response body (pretty-printed if JSON) and map the status to an exit code. */
  static int report(HttpResponse<String> response, PrintWriter out, PrintWriter err)
      throws IOException {
    int status = response.statusCode();
    var body = response.body();
    if (status >= 200 && status < 300) {
      if (body != null && !body.isEmpty()) {
        out.println(PulseCommand.prettyPrint(mapper.readTree(body)));
      }
      return 0;
    }
    err.format("Request failed (HTTP %d): %s%n", status, body == null ? "" : body);
    return 1;
  }

  static Map<String, String> jobParams(String routingKey, String body) {
    var params = new LinkedHashMap<String, String>();
    params.put("routing_key", routingKey);
    params.put("body", body);
    return params;
  }

  static String encode(Map<String, String> params) {
    return params.entrySet().stream()
        .map(
            e ->
                URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }
}

@Command(name = "schedule", description = "Create a job or change its interval")
class ScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "routing key the job publishes to")
  String routingKey;

  @Parameters(
      index = "1",
      arity = "0..1",
      description = "payload of the job",
      defaultValue = "")
  String body;

  @Option(
      names = {"-i", "--interval"},
      description = "seconds between runs",
      required = true)
  long interval;

  @Option(
      names = {"-o", "--one-off"},
      description = "run once, then delete the job")
  boolean oneOff;

  @Mixin ServerOptions server;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var params = ServerOptions.jobParams(routingKey, body);
    params.put("interval", Long.toString(interval));
    params.put("one_off", Boolean.toString(oneOff));
    var response = server.post("/schedule", params);
    return ServerOptions.report(
        response, spec.commandLine().getOut(), spec.commandLine().getErr());
  }
}

@Command(name = "trigger", description = "Run a job now")
class TriggerCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "routing key of the job")
  String routingKey;

  @Parameters(
      index = "1",
      arity = "0..1",
      description = "payload of the job",
      defaultValue = "")
  String body;

  @Mixin ServerOptions server;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var response = server.post("/trigger", ServerOptions.jobParams(routingKey, body));
    return ServerOptions.report(
        response, spec.commandLine().getOut(), spec.commandLine().getErr());
  }
}

@Command(name = "cancel", description = "Delete a job")
class CancelCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "routing key of the job")
  String routingKey;

  @Parameters(
      index = "1",
      arity = "0..1",
      description = "payload of the job",
      defaultValue = "")
  String body;

  @Mixin ServerOptions server;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var response = server.post("/cancel", ServerOptions.jobParams(routingKey, body));
    var exitCode =
        ServerOptions.report(response, spec.commandLine().getOut(), spec.commandLine().getErr());
    if (exitCode == 0) {
      spec.commandLine().getOut().format("Job %s/%s cancelled%n", routingKey, body);
    }
    return exitCode;
  }
}

@Command(name = "get", description = "Show a job")
class GetCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "routing key of the job")
  String routingKey;

  @Parameters(
      index = "1",
      arity = "0..1",
      description = "payload of the job",
      defaultValue = "")
  String body;

  @Mixin ServerOptions server;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var response = server.get("/job", ServerOptions.jobParams(routingKey, body));
    return ServerOptions.report(
        response, spec.commandLine().getOut(), spec.commandLine().getErr());
  }
}

@Command(name = "status", description = "Show the number of jobs and of publishes in flight")
class StatusCommand implements Callable<Integer> {

  @Mixin ServerOptions server;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var response = server.get("/status", Map.of());
    return ServerOptions.report(
        response, spec.commandLine().getOut(), spec.commandLine().getErr());
  }
}
