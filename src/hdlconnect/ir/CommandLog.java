package hdlconnect.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** List-backed {@link CommandSink}. */
public class CommandLog implements CommandSink {
  private final ArrayList<Command> commands = new ArrayList<>();

  @Override
  public void pushCommand(Command command) {
    commands.add(command);
  }

  /**
   * @return read-only view of the commands in emission order
   */
  public List<Command> getCommands() { return Collections.unmodifiableList(commands); }

  public int size() { return commands.size(); }

  public boolean isEmpty() { return commands.isEmpty(); }

  /**
   * Forwards all commands to another sink, in order, and clears this log.
   * @param target the receiving sink
   */
  public void commit(CommandSink target) {
    commands.forEach(target::pushCommand);
    commands.clear();
  }

  /**
   * @return one serialized line per command
   */
  public String serialize() { return commands.stream().map(Command::serialize).collect(Collectors.joining("\n")); }
}
