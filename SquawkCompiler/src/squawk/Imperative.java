package squawk;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import squawk.processor.ASTChild;
import squawk.processor.ASTNode;

/**
 * Imperative IR: functions as flat instruction lists over named storage. Names are either compiler
 * temporaries ({@code t0}, {@code t1}, ...), labels, or user names passed through verbatim.
 */
public final class Imperative {
  private Imperative() {}

  public enum Opcode {
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    DIV("div"),
    EQ("eq"),
    NEQ("neq"),
    LT("lt"),
    GT("gt"),
    LEQ("leq"),
    GEQ("geq");

    private final String mnemonic;

    Opcode(String mnemonic) {
      this.mnemonic = mnemonic;
    }

    public String mnemonic() {
      return mnemonic;
    }
  }

  public abstract static class Value implements ImperativeNode {}

  @ASTNode("Imperative")
  @AutoValue
  public abstract static class IntLiteral extends Value implements Imperative_IntLiteral_ASTNode {
    public abstract int value();

    public static IntLiteral of(int value) {
      return new AutoValue_Imperative_IntLiteral(value);
    }
  }

  @ASTNode("Imperative")
  @AutoValue
  public abstract static class BoolLiteral extends Value
      implements Imperative_BoolLiteral_ASTNode {
    public abstract boolean value();

    public static BoolLiteral of(boolean value) {
      return new AutoValue_Imperative_BoolLiteral(value);
    }
  }

  @ASTNode("Imperative")
  @AutoValue
  public abstract static class Variable extends Value implements Imperative_Variable_ASTNode {
    public abstract String name();

    public static Variable of(String name) {
      return new AutoValue_Imperative_Variable(name);
    }
  }

  public abstract static class Instruction implements ImperativeNode {}

  // Value children are declared first throughout so that the generated constructors take them
  // first.
  @ASTNode("Imperative")
  @AutoValue
  public abstract static class Assign extends Instruction implements Imperative_Assign_ASTNode {
    @ASTChild
    @Override
    public abstract Value value();

    public abstract String dest();

    public static Assign of(String dest, Value value) {
      return new AutoValue_Imperative_Assign(value, dest);
    }
  }

  @ASTNode("Imperative")
  @AutoValue
  public abstract static class BinaryOp extends Instruction
      implements Imperative_BinaryOp_ASTNode {
    @ASTChild
    @Override
    public abstract Value left();

    @ASTChild
    @Override
    public abstract Value right();

    public abstract String dest();

    public abstract Opcode opcode();

    public static BinaryOp of(String dest, Opcode opcode, Value left, Value right) {
      return new AutoValue_Imperative_BinaryOp(left, right, dest, opcode);
    }
  }

  @ASTNode("Imperative")
  @AutoValue
  public abstract static class Label extends Instruction implements Imperative_Label_ASTNode {
    public abstract String name();

    public static Label of(String name) {
      return new AutoValue_Imperative_Label(name);
    }
  }

  @ASTNode("Imperative")
  @AutoValue
  public abstract static class Jump extends Instruction implements Imperative_Jump_ASTNode {
    public abstract String target();

    public static Jump of(String target) {
      return new AutoValue_Imperative_Jump(target);
    }
  }

  /**
   * Two-way branch: control moves to {@code trueTarget} when the condition holds and to {@code
   * falseTarget} otherwise.
   */
  @ASTNode("Imperative")
  @AutoValue
  public abstract static class CondJump extends Instruction implements Imperative_CondJump_ASTNode {
    @ASTChild
    @Override
    public abstract Value condition();

    public abstract String trueTarget();

    public abstract String falseTarget();

    public static CondJump of(Value condition, String trueTarget, String falseTarget) {
      return new AutoValue_Imperative_CondJump(condition, trueTarget, falseTarget);
    }
  }

  @ASTNode("Imperative")
  @AutoValue
  public abstract static class Call extends Instruction implements Imperative_Call_ASTNode {
    @ASTChild
    @Override
    public abstract ImmutableList<Value> args();

    public abstract Optional<String> dest();

    public abstract String function();

    public static Call of(Optional<String> dest, String function, List<? extends Value> args) {
      return new AutoValue_Imperative_Call(ImmutableList.copyOf(args), dest, function);
    }
  }

  @ASTNode("Imperative")
  @AutoValue
  public abstract static class Return extends Instruction implements Imperative_Return_ASTNode {
    @ASTChild
    @Override
    public abstract Value value();

    public static Return of(Value value) {
      return new AutoValue_Imperative_Return(value);
    }
  }

  @AutoValue
  public abstract static class Function {
    public abstract String name();

    public abstract ImmutableList<String> params();

    public abstract ImmutableList<Instruction> instructions();

    public static Function of(String name, List<String> params, List<Instruction> instructions) {
      return new AutoValue_Imperative_Function(
          name, ImmutableList.copyOf(params), ImmutableList.copyOf(instructions));
    }
  }

  @AutoValue
  public abstract static class Program {
    public abstract ImmutableList<Function> functions();

    public static Program of(List<Function> functions) {
      return new AutoValue_Imperative_Program(ImmutableList.copyOf(functions));
    }
  }
}
