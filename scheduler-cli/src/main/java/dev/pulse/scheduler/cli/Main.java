package dev.pulse.scheduler.cli;

public class Main {
  public static void main(String[] args) {
    var cmd = PulseCommand.commandLine();
    var exitCode = cmd.execute(args);
    System.exit(exitCode);
  }
}
