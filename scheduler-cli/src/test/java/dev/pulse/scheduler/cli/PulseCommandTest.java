package dev.pulse.scheduler.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class PulseCommandTest {

  @Test
  public void version() {
    var cmd = PulseCommand.commandLine();
    var sw = new StringWriter();
    cmd.setOut(new PrintWriter(sw));

    assertEquals(0, cmd.execute("--version"));
    assertTrue(sw.toString().startsWith("pulse "), sw.toString());
  }

  @Test
  public void helpListsSubcommands() {
    var cmd = PulseCommand.commandLine();
    var sw = new StringWriter();
    cmd.setOut(new PrintWriter(sw));

    assertEquals(0, cmd.execute("--help"));
    var usage = sw.toString();
    for (var sub : new String[] {"start", "migrate", "reset", "job"}) {
      assertTrue(usage.contains(sub), "usage should mention " + sub);
    }
  }

  @Test
  public void unknownSubcommandIsUsageError() {
    var cmd = PulseCommand.commandLine();
    cmd.setErr(new PrintWriter(new StringWriter()));
    assertEquals(2, cmd.execute("frobnicate"));
  }

  @Test
  public void scheduleRequiresInterval() {
    var cmd = PulseCommand.commandLine();
    var sw = new StringWriter();
    cmd.setErr(new PrintWriter(sw));

    assertEquals(2, cmd.execute("job", "schedule", "orders.created"));
    assertTrue(sw.toString().contains("--interval"));
  }

  @Test
  public void prettyPrint() {
    var text = PulseCommand.prettyPrint(Map.of("total_jobs", 3));
    assertTrue(text.contains("\"total_jobs\" : 3"));
  }
}
