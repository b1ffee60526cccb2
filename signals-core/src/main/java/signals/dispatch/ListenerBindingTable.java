package signals.dispatch;

import signals.Listener;
import signals.Signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-owner record of the listeners a {@link SignalDispatcher} has attached, so that
 * {@link SignalDispatcher#unbind(Object)} can detach exactly those.
 *
 * <p>Owners are keyed by identity. An owner is present only while it holds at least one
 * binding. Mutated only by the owning dispatcher.
 */
public final class ListenerBindingTable {

  /**
   * One listener attached to one signal.
   *
   * @param signal   the signal the listener was added to
   * @param listener the attached listener
   */
  public record Entry(Signal signal, Listener listener) {
  }

  private final Map<Object, List<Entry>> entries = new IdentityHashMap<>();

  ListenerBindingTable() {
  }

  void record(Object owner, Signal signal, Listener listener) {
    entries.computeIfAbsent(owner, ignored -> new ArrayList<>()).add(new Entry(signal, listener));
  }

  /**
   * Drops every entry of an owner.
   *
   * @return the dropped entries, in the order they were recorded
   */
  List<Entry> remove(Object owner) {
    List<Entry> removed = entries.remove(owner);
    return removed != null ? removed : List.of();
  }

  /**
   * Drops the entry for one listener whose binding was discarded during dispatch.
   *
   * @return {@code true} if an entry was dropped
   */
  boolean forget(Listener listener) {
    List<Entry> owned = entries.get(listener.owner());
    if (owned == null) {
      return false;
    }
    boolean removed = false;
    Iterator<Entry> it = owned.iterator();
    while (it.hasNext()) {
      Entry entry = it.next();
      if (entry.listener().equals(listener) && entry.signal().getClass() == listener.signalType()) {
        it.remove();
        removed = true;
        break;
      }
    }
    if (owned.isEmpty()) {
      entries.remove(listener.owner());
    }
    return removed;
  }

  /**
   * @return the entries recorded for an owner, empty if it holds none
   */
  public List<Entry> entriesFor(Object owner) {
    Objects.requireNonNull(owner, "owner");
    List<Entry> owned = entries.get(owner);
    return owned != null ? Collections.unmodifiableList(new ArrayList<>(owned)) : List.of();
  }

  public boolean contains(Object owner) {
    return entries.containsKey(owner);
  }

  /**
   * @return a snapshot of the owners holding bindings
   */
  public List<Object> owners() {
    return new ArrayList<>(entries.keySet());
  }

  /**
   * @return number of owners holding bindings
   */
  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
