package dev.pulse.scheduler.cli;

import dev.pulse.scheduler.Pulse;

import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Scanner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;

@Command(
    name = "pulse",
    description = "Pulse is a durable interval scheduler that publishes jobs to a message broker",
    mixinStandardHelpOptions = true,
    subcommands = {
      StartCommand.class,
      MigrateCommand.class,
      ResetCommand.class,
      JobCommand.class
    },
    versionProvider = PulseCommand.class)
public class PulseCommand implements Runnable, IVersionProvider {

  private static final Logger logger = LoggerFactory.getLogger(PulseCommand.class);

  /** Command line whose failures print the error message and exit with 1. */
  public static CommandLine commandLine() {
    var cmd = new CommandLine(new PulseCommand());
    cmd.setExecutionExceptionHandler(
        (ex, commandLine, parseResult) -> {
          logger.debug("Command failed", ex);
          commandLine.getErr().println(commandLine.getColorScheme().errorText(String.valueOf(ex.getMessage())));
          return commandLine.getCommandSpec().exitCodeOnExecutionException();
        });
    return cmd;
  }

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }

  @Override
  public String[] getVersion() throws Exception {
    var ver = Pulse.version();
    return new String[] {
      "${COMMAND-FULL-NAME} " + Objects.requireNonNullElse(ver, "<unknown version>")
    };
  }

  public static String prettyPrint(Object object) {
    var mapper = new ObjectMapper();
    var writer = mapper.writerWithDefaultPrettyPrinter();
    try {
      return writer.writeValueAsString(Objects.requireNonNull(object));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static boolean confirm(String prompt) {
    try (var scanner = new Scanner(System.in)) {
      System.out.print(prompt);
      if (!scanner.hasNextLine()) {
        return false;
      }
      String input = scanner.nextLine().trim();
      return input.equalsIgnoreCase("y") || input.equalsIgnoreCase("yes");
    }
  }
}
