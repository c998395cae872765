package squawk;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import squawk.processor.ASTChild;
import squawk.processor.ASTNode;

/**
 * Functional IR: the side-effect-free expression trees the state transformer consumes. Mirrors the
 * AST shape without source positions.
 */
public final class Fir {
  private Fir() {}

  public enum Type {
    INT,
    BOOL;
  }

  public enum BinaryOp {
    ADD,
    SUB,
    MUL,
    DIV,
    EQ,
    NEQ,
    LT,
    GT,
    LEQ,
    GEQ;
  }

  public abstract static class Expression implements FirNode {}

  @ASTNode("Fir")
  @AutoValue
  public abstract static class IntLiteral extends Expression implements Fir_IntLiteral_ASTNode {
    public abstract int value();

    public static IntLiteral of(int value) {
      return new AutoValue_Fir_IntLiteral(value);
    }
  }

  @ASTNode("Fir")
  @AutoValue
  public abstract static class BoolLiteral extends Expression implements Fir_BoolLiteral_ASTNode {
    public abstract boolean value();

    public static BoolLiteral of(boolean value) {
      return new AutoValue_Fir_BoolLiteral(value);
    }
  }

  @ASTNode("Fir")
  @AutoValue
  public abstract static class Variable extends Expression implements Fir_Variable_ASTNode {
    public abstract String name();

    public static Variable of(String name) {
      return new AutoValue_Fir_Variable(name);
    }
  }

  // Children are declared first throughout so that the generated constructors take them first.
  @ASTNode("Fir")
  @AutoValue
  public abstract static class Binary extends Expression implements Fir_Binary_ASTNode {
    @ASTChild
    @Override
    public abstract Expression lhs();

    @ASTChild
    @Override
    public abstract Expression rhs();

    public abstract BinaryOp op();

    public static Binary of(BinaryOp op, Expression lhs, Expression rhs) {
      return new AutoValue_Fir_Binary(lhs, rhs, op);
    }
  }

  @ASTNode("Fir")
  @AutoValue
  public abstract static class If extends Expression implements Fir_If_ASTNode {
    @ASTChild
    @Override
    public abstract Expression condition();

    @ASTChild
    @Override
    public abstract Expression thenBranch();

    @ASTChild
    @Override
    public abstract Expression elseBranch();

    public static If of(Expression condition, Expression thenBranch, Expression elseBranch) {
      return new AutoValue_Fir_If(condition, thenBranch, elseBranch);
    }
  }

  @ASTNode("Fir")
  @AutoValue
  public abstract static class Call extends Expression implements Fir_Call_ASTNode {
    @ASTChild
    @Override
    public abstract ImmutableList<Expression> args();

    public abstract String function();

    public static Call of(String function, List<? extends Expression> args) {
      return new AutoValue_Fir_Call(ImmutableList.copyOf(args), function);
    }
  }

  @ASTNode("Fir")
  @AutoValue
  public abstract static class Let extends Expression implements Fir_Let_ASTNode {
    @ASTChild
    @Override
    public abstract Expression value();

    @ASTChild
    @Override
    public abstract Expression body();

    public abstract String name();

    public static Let of(String name, Expression value, Expression body) {
      return new AutoValue_Fir_Let(value, body, name);
    }
  }

  @AutoValue
  public abstract static class Parameter {
    public abstract String name();

    public abstract Type type();

    public static Parameter of(String name, Type type) {
      return new AutoValue_Fir_Parameter(name, type);
    }
  }

  @AutoValue
  public abstract static class Function {
    public abstract String name();

    public abstract ImmutableList<Parameter> parameters();

    public abstract Type returnType();

    public abstract Expression body();

    public static Function of(
        String name, List<Parameter> parameters, Type returnType, Expression body) {
      return new AutoValue_Fir_Function(name, ImmutableList.copyOf(parameters), returnType, body);
    }
  }

  @AutoValue
  public abstract static class Program {
    public abstract ImmutableList<Function> functions();

    public static Program of(List<Function> functions) {
      return new AutoValue_Fir_Program(ImmutableList.copyOf(functions));
    }
  }
}
