package squawk.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a node class for visitor generation. The value names the node family; all nodes of one
 * family share a generated {@code <Family>Visitor} and {@code <Family>Node} interface.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ASTNode {
  String value();
}
