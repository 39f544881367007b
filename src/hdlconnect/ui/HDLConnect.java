package hdlconnect.ui;

import hdlconnect.connect.ConnectOptions;
import hdlconnect.connect.MonoConnect;
import hdlconnect.connect.MonoConnectException;
import hdlconnect.ir.CommandLog;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Resolves all connect statements of a {@link Design} into a command log. */
public class HDLConnect {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A connect statement that was rejected, with the reason. */
  public static class Failure {
    public final Design.ConnectStatement statement;
    public final MonoConnectException cause;

    public Failure(Design.ConnectStatement statement, MonoConnectException cause) {
      this.statement = statement;
      this.cause = cause;
    }

    @Override
    public String toString() {
      return statement + ": " + cause.getMessage();
    }
  }

  public static class Result {
    private final CommandLog commands;
    private final List<Failure> failures;

    Result(CommandLog commands, List<Failure> failures) {
      this.commands = commands;
      this.failures = Collections.unmodifiableList(failures);
    }

    public CommandLog getCommands() { return commands; }
    public List<Failure> getFailures() { return failures; }
    public boolean isSuccess() { return failures.isEmpty(); }
  }

  private final HDLConnectConfig cfg;
  private final MonoConnect monoConnect;

  public HDLConnect(HDLConnectConfig cfg) { this(cfg, new MonoConnect()); }
  public HDLConnect(HDLConnectConfig cfg, MonoConnect monoConnect) {
    this.cfg = cfg;
    this.monoConnect = monoConnect;
  }

  /**
   * Resolves each statement in order. Failing statements are reported and do not stop the remaining ones.
   * @param design the elaborated design
   * @return the emitted commands and the rejected statements
   */
  public Result Resolve(Design design) {
    ConnectOptions options = cfg.toConnectOptions();
    logger.debug("Resolving {} connect statements with {}", design.getStatements().size(), options);
    CommandLog commands = new CommandLog();
    List<Failure> failures = new ArrayList<>();
    for (Design.ConnectStatement statement : design.getStatements()) {
      try {
        if (cfg.atomic)
          monoConnect.connectAtomically(statement.sink, statement.source, statement.context, options, commands);
        else
          monoConnect.connect(statement.sink, statement.source, statement.context, options, commands);
      } catch (MonoConnectException e) {
        logger.error("{}: {}", statement, e.getMessage());
        failures.add(new Failure(statement, e));
      }
    }
    logger.info("Resolved {} of {} connect statements into {} commands", design.getStatements().size() - failures.size(),
                design.getStatements().size(), commands.size());
    return new Result(commands, failures);
  }
}
