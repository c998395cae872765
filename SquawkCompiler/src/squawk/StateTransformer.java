package squawk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;

/**
 * Lowers functional IR to imperative IR.
 *
 * <p>Every expression is lowered into a destination name: operands go to fresh temporaries, both
 * arms of an {@code if} write the same destination, and a {@code let} assigns the bound name
 * itself. Let-bound names share one flat namespace per function, so an inner binding of a name
 * overwrites an outer one for the rest of the function.
 *
 * <p>Functions are lowered independently: temporary and label numbering restarts at zero for each
 * one.
 */
public class StateTransformer {

  public Imperative.Program transform(Fir.Program program) {
    return Imperative.Program.of(
        program
            .functions()
            .stream()
            .map(StateTransformer::transformFunction)
            .collect(ImmutableList.toImmutableList()));
  }

  public static Imperative.Function transformFunction(Fir.Function function) {
    return new FunctionLowering().lower(function);
  }

  /** Per-function state: the counters and the instructions emitted so far. */
  private static final class FunctionLowering implements FirVisitor<String> {
    private int tempCounter = 0;
    private int labelCounter = 0;
    private final List<Imperative.Instruction> instructions = new ArrayList<>();

    private Imperative.Function lower(Fir.Function function) {
      String result = freshTemp();
      lowerInto(function.body(), result);
      emit(Imperative.Return.of(Imperative.Variable.of(result)));

      return Imperative.Function.of(
          function.name(),
          function
              .parameters()
              .stream()
              .map(Fir.Parameter::name)
              .collect(ImmutableList.toImmutableList()),
          instructions);
    }

    private String freshTemp() {
      return "t" + tempCounter++;
    }

    private String freshLabel(String prefix) {
      return prefix + labelCounter++;
    }

    private void emit(Imperative.Instruction instruction) {
      instructions.add(instruction);
    }

    private void lowerInto(Fir.Expression expression, String dest) {
      expression.accept(this, dest);
    }

    // Lowers into a fresh temporary and returns a reference to it.
    private Imperative.Variable lowerToTemp(Fir.Expression expression) {
      String temp = freshTemp();
      lowerInto(expression, temp);
      return Imperative.Variable.of(temp);
    }

    @Override
    public String visit(Fir.IntLiteral node, String dest) {
      emit(Imperative.Assign.of(dest, Imperative.IntLiteral.of(node.value())));
      return dest;
    }

    @Override
    public String visit(Fir.BoolLiteral node, String dest) {
      emit(Imperative.Assign.of(dest, Imperative.BoolLiteral.of(node.value())));
      return dest;
    }

    @Override
    public String visit(Fir.Variable node, String dest) {
      emit(Imperative.Assign.of(dest, Imperative.Variable.of(node.name())));
      return dest;
    }

    // Walks the left spine of a chain such as a + b + c in a loop. Temporaries are allocated and
    // instructions emitted in the same order as lowering each lhs recursively would.
    @Override
    public String visit(Fir.Binary node, String dest) {
      List<Fir.Binary> chain = new ArrayList<>();
      List<String> dests = new ArrayList<>();
      dests.add(dest);
      Fir.Expression left = node;
      while (left instanceof Fir.Binary) {
        chain.add((Fir.Binary) left);
        left = ((Fir.Binary) left).lhs();
        dests.add(freshTemp());
      }
      lowerInto(left, dests.get(chain.size()));

      for (int i = chain.size() - 1; i >= 0; i--) {
        Fir.Binary binary = chain.get(i);
        Imperative.Variable right = lowerToTemp(binary.rhs());
        emit(
            Imperative.BinaryOp.of(
                dests.get(i),
                opcode(binary.op()),
                Imperative.Variable.of(dests.get(i + 1)),
                right));
      }
      return dest;
    }

    @Override
    public String visit(Fir.If node, String dest) {
      Imperative.Variable condition = lowerToTemp(node.condition());

      String thenLabel = freshLabel("then");
      String elseLabel = freshLabel("else");
      String endLabel = freshLabel("end_if");

      emit(Imperative.CondJump.of(condition, thenLabel, elseLabel));

      emit(Imperative.Label.of(thenLabel));
      lowerInto(node.thenBranch(), dest);
      emit(Imperative.Jump.of(endLabel));

      emit(Imperative.Label.of(elseLabel));
      lowerInto(node.elseBranch(), dest);

      emit(Imperative.Label.of(endLabel));
      return dest;
    }

    @Override
    public String visit(Fir.Call node, String dest) {
      List<Imperative.Variable> args = new ArrayList<>();
      for (Fir.Expression arg : node.args()) {
        args.add(lowerToTemp(arg));
      }
      emit(Imperative.Call.of(Optional.of(dest), node.function(), args));
      return dest;
    }

    @Override
    public String visit(Fir.Let node, String dest) {
      Imperative.Variable value = lowerToTemp(node.value());
      emit(Imperative.Assign.of(node.name(), value));
      lowerInto(node.body(), dest);
      return dest;
    }
  }

  static Imperative.Opcode opcode(Fir.BinaryOp op) {
    switch (op) {
      case ADD:
        return Imperative.Opcode.ADD;
      case SUB:
        return Imperative.Opcode.SUB;
      case MUL:
        return Imperative.Opcode.MUL;
      case DIV:
        return Imperative.Opcode.DIV;
      case EQ:
        return Imperative.Opcode.EQ;
      case NEQ:
        return Imperative.Opcode.NEQ;
      case LT:
        return Imperative.Opcode.LT;
      case GT:
        return Imperative.Opcode.GT;
      case LEQ:
        return Imperative.Opcode.LEQ;
      case GEQ:
        return Imperative.Opcode.GEQ;
    }
    throw new VerifyException("unmapped operator: " + op);
  }
}
