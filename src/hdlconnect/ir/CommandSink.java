package hdlconnect.ir;

/** Receives the commands emitted during elaboration, in emission order. */
public interface CommandSink {
  void pushCommand(Command command);
}
