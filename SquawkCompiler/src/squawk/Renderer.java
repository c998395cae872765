package squawk;

import java.util.stream.Collectors;

/**
 * Renders imperative IR as pseudo-assembly, one instruction per line (a conditional jump takes
 * two). Output is deterministic for a given program.
 */
public class Renderer implements ImperativeVisitor<StringBuilder> {

  private static final String INDENT = "    ";

  public static final String HEADER = "; Squawk Compiler Output\n; Generated from functional code";

  public String render(Imperative.Program program) {
    StringBuilder out = new StringBuilder(HEADER);
    for (Imperative.Function function : program.functions()) {
      out.append("\n\nfunction ")
          .append(function.name())
          .append(function.params().stream().collect(Collectors.joining(", ", "(", "):")));
      for (Imperative.Instruction instruction : function.instructions()) {
        instruction.accept(this, out);
      }
    }
    return out.toString();
  }

  private StringBuilder line(StringBuilder out) {
    return out.append('\n').append(INDENT);
  }

  private String value(Imperative.Value value) {
    return value.accept(this, new StringBuilder()).toString();
  }

  @Override
  public StringBuilder visit(Imperative.IntLiteral node, StringBuilder out) {
    return out.append(node.value());
  }

  @Override
  public StringBuilder visit(Imperative.BoolLiteral node, StringBuilder out) {
    return out.append(node.value() ? '1' : '0');
  }

  @Override
  public StringBuilder visit(Imperative.Variable node, StringBuilder out) {
    return out.append(node.name());
  }

  @Override
  public StringBuilder visit(Imperative.Assign node, StringBuilder out) {
    line(out).append("mov ").append(node.dest()).append(", ");
    return node.value().accept(this, out);
  }

  @Override
  public StringBuilder visit(Imperative.BinaryOp node, StringBuilder out) {
    return line(out)
        .append(node.opcode().mnemonic())
        .append(' ')
        .append(node.dest())
        .append(", ")
        .append(value(node.left()))
        .append(", ")
        .append(value(node.right()));
  }

  @Override
  public StringBuilder visit(Imperative.Label node, StringBuilder out) {
    return out.append('\n').append(node.name()).append(':');
  }

  @Override
  public StringBuilder visit(Imperative.Jump node, StringBuilder out) {
    return line(out).append("jmp ").append(node.target());
  }

  @Override
  public StringBuilder visit(Imperative.CondJump node, StringBuilder out) {
    line(out)
        .append("jmpif ")
        .append(value(node.condition()))
        .append(", ")
        .append(node.trueTarget());
    return line(out).append("jmp ").append(node.falseTarget());
  }

  @Override
  public StringBuilder visit(Imperative.Call node, StringBuilder out) {
    String args =
        node.args().stream().map(this::value).collect(Collectors.joining(", ", "(", ")"));
    line(out).append("call ");
    if (node.dest().isPresent()) {
      out.append(node.dest().get()).append(" = ");
    }
    return out.append(node.function()).append(args);
  }

  @Override
  public StringBuilder visit(Imperative.Return node, StringBuilder out) {
    return line(out).append("ret ").append(value(node.value()));
  }
}
