package hdlconnect.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Fixed-length vector of signals of the same type. */
public class VecSignal extends Signal {
  private final Signal sample;
  private final List<Signal> elements;

  /**
   * @param length the number of elements
   * @param elementType the type of each element; copied for every index
   */
  public VecSignal(int length, Signal elementType) {
    if (length < 0)
      throw new IllegalArgumentException("Negative Vec length " + length);
    this.sample = elementType.cloneType();
    ArrayList<Signal> elements = new ArrayList<>(length);
    for (int i = 0; i < length; ++i)
      elements.add(elementType.cloneType());
    this.elements = Collections.unmodifiableList(elements);
  }

  public int length() { return elements.size(); }

  public Signal get(int index) { return elements.get(index); }

  @Override
  public SignalVariant getVariant() {
    return SignalVariant.VECTOR;
  }

  @Override
  public List<Signal> getElements() {
    return elements;
  }

  @Override
  public String typeDescription() {
    return sample.typeDescription() + "[" + elements.size() + "]";
  }

  @Override
  protected Signal cloneUnbound() {
    return new VecSignal(elements.size(), sample);
  }

  @Override
  protected List<String> childNameSuffixes() {
    ArrayList<String> suffixes = new ArrayList<>(length());
    for (int i = 0; i < length(); ++i)
      suffixes.add("[" + i + "]");
    return suffixes;
  }
}
