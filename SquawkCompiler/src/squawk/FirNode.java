package squawk;

/** Base interface of the functional IR expression family. */
public interface FirNode {
  <V> V accept(FirVisitor<V> visitor, V value);

  <V> V visitChildren(FirVisitor<V> visitor, V value);
}
