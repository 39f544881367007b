package hdlconnect.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Record of named fields. The order in which fields are added is the canonical traversal order.
 * Fields can only be added while the record is unbound.
 */
public class RecordSignal extends Signal {
  private final LinkedHashMap<String, Signal> fields = new LinkedHashMap<>();

  public RecordSignal() {}

  /**
   * Adds a field (a copy of the given type).
   * @param name the field name, unique within the record
   * @param type the field type, optionally with a direction annotation
   * @return this record
   */
  public RecordSignal field(String name, Signal type) {
    requireUnbound();
    if (fields.containsKey(name))
      throw new IllegalArgumentException("Duplicate record field " + name);
    fields.put(name, type.cloneType());
    return this;
  }

  /**
   * @return read-only view of the fields by name, in canonical order
   */
  public Map<String, Signal> getFields() { return Collections.unmodifiableMap(fields); }

  public Optional<Signal> getField(String name) { return Optional.ofNullable(fields.get(name)); }

  @Override
  public SignalVariant getVariant() {
    return SignalVariant.RECORD;
  }

  @Override
  public List<Signal> getElements() {
    return Collections.unmodifiableList(new ArrayList<>(fields.values()));
  }

  @Override
  public String typeDescription() {
    return fields.entrySet()
        .stream()
        .map(entry
             -> (entry.getValue().getSpecifiedDirection().isFlipped() ? "flip " : "") + entry.getKey() + " : " +
                    entry.getValue().typeDescription())
        .collect(Collectors.joining(", ", "{", "}"));
  }

  @Override
  protected Signal cloneUnbound() {
    RecordSignal copy = new RecordSignal();
    fields.forEach((name, type) -> copy.fields.put(name, type.cloneType()));
    return copy;
  }

  @Override
  protected List<String> childNameSuffixes() {
    return fields.keySet().stream().map(name -> "." + name).collect(Collectors.toList());
  }
}
