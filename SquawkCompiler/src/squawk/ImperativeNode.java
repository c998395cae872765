package squawk;

/** Base interface of the imperative IR family: instructions and the values they read. */
public interface ImperativeNode {
  <V> V accept(ImperativeVisitor<V> visitor, V value);

  <V> V visitChildren(ImperativeVisitor<V> visitor, V value);
}
