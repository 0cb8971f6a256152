package hdlower.util;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Utility class: stack of per-scope state for tree transformers.
 * The innermost scope is on top. Iteration runs from the innermost scope outwards.
 */
public class ScopeStack<T> implements Iterable<T> {
  private final ArrayDeque<T> scopes = new ArrayDeque<>();

  public void push(T scope) { scopes.push(scope); }

  public T pop() {
    if (scopes.isEmpty())
      throw new NoSuchElementException("ScopeStack underflow");
    return scopes.pop();
  }

  public T top() {
    if (scopes.isEmpty())
      throw new NoSuchElementException("ScopeStack is empty");
    return scopes.peek();
  }

  public int depth() { return scopes.size(); }
  public boolean isEmpty() { return scopes.isEmpty(); }

  @Override
  public Iterator<T> iterator() {
    return scopes.iterator();
  }
}
