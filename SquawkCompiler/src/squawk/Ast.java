package squawk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

/**
 * Syntax tree produced by the {@link Parser}. Nodes are immutable; each one converts itself to the
 * functional IR.
 */
public final class Ast {
  private Ast() {}

  public enum Type {
    INT(Fir.Type.INT),
    BOOL(Fir.Type.BOOL);

    private final Fir.Type firType;

    Type(Fir.Type firType) {
      this.firType = firType;
    }

    public Fir.Type toFunctionalIr() {
      return firType;
    }
  }

  public enum BinaryOperator {
    // Comparison
    EQUAL(Token.Type.DOUBLE_EQUALS, Fir.BinaryOp.EQ),
    NOT_EQUAL(Token.Type.NOT_EQUALS, Fir.BinaryOp.NEQ),
    LESS_THAN(Token.Type.LESS_THAN, Fir.BinaryOp.LT),
    GREATER_THAN(Token.Type.GREATER_THAN, Fir.BinaryOp.GT),
    LESS_EQUAL(Token.Type.LESS_EQUAL, Fir.BinaryOp.LEQ),
    GREATER_EQUAL(Token.Type.GREATER_EQUAL, Fir.BinaryOp.GEQ),

    // Mathematical
    ADD(Token.Type.PLUS, Fir.BinaryOp.ADD),
    SUBTRACT(Token.Type.MINUS, Fir.BinaryOp.SUB),
    MULTIPLY(Token.Type.MULTIPLY, Fir.BinaryOp.MUL),
    DIVIDE(Token.Type.DIVIDE, Fir.BinaryOp.DIV);

    private final Token.Type tokenType;
    private final Fir.BinaryOp firOp;

    BinaryOperator(Token.Type tokenType, Fir.BinaryOp firOp) {
      this.tokenType = tokenType;
      this.firOp = firOp;
    }

    public Token.Type tokenType() {
      return tokenType;
    }

    public Fir.BinaryOp toFunctionalIr() {
      return firOp;
    }

    private static final ImmutableMap<Token.Type, BinaryOperator> TOKEN_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), b -> b.tokenType);

    public static Optional<BinaryOperator> forToken(Token.Type tokenType) {
      return Optional.ofNullable(TOKEN_MAP.get(tokenType));
    }

    // Loosest binding first; every level is left-associative.
    private static final ImmutableList<ImmutableSet<BinaryOperator>> ORDER_OF_OPERATIONS =
        ImmutableList.of(
            ImmutableSet.of(EQUAL, NOT_EQUAL, LESS_THAN, GREATER_THAN, LESS_EQUAL, GREATER_EQUAL),
            ImmutableSet.of(ADD, SUBTRACT),
            ImmutableSet.of(MULTIPLY, DIVIDE));

    static {
      // Ensure each operator is listed exactly once.
      Verify.verify(
          Arrays.asList(values())
              .stream()
              .allMatch(b -> ORDER_OF_OPERATIONS.stream().filter(s -> s.contains(b)).count() == 1));
    }

    public static ImmutableList<ImmutableSet<BinaryOperator>> orderOfOperations() {
      return ORDER_OF_OPERATIONS;
    }
  }

  public abstract static class Expression {
    public abstract Tokenizer.Pos pos();

    public abstract Fir.Expression toFunctionalIr();
  }

  @AutoValue
  public abstract static class IntLiteral extends Expression {
    @Override
    public abstract Tokenizer.Pos pos();

    public abstract int value();

    public static IntLiteral create(Tokenizer.Pos pos, int value) {
      return new AutoValue_Ast_IntLiteral(pos, value);
    }

    @Override
    public Fir.Expression toFunctionalIr() {
      return Fir.IntLiteral.of(value());
    }
  }

  @AutoValue
  public abstract static class BoolLiteral extends Expression {
    @Override
    public abstract Tokenizer.Pos pos();

    public abstract boolean value();

    public static BoolLiteral create(Tokenizer.Pos pos, boolean value) {
      return new AutoValue_Ast_BoolLiteral(pos, value);
    }

    @Override
    public Fir.Expression toFunctionalIr() {
      return Fir.BoolLiteral.of(value());
    }
  }

  @AutoValue
  public abstract static class Variable extends Expression {
    @Override
    public abstract Tokenizer.Pos pos();

    public abstract String name();

    public static Variable create(Tokenizer.Pos pos, String name) {
      return new AutoValue_Ast_Variable(pos, name);
    }

    @Override
    public Fir.Expression toFunctionalIr() {
      return Fir.Variable.of(name());
    }
  }

  @AutoValue
  public abstract static class Binary extends Expression {
    @Override
    public abstract Tokenizer.Pos pos();

    public abstract BinaryOperator op();

    public abstract Expression lhs();

    public abstract Expression rhs();

    public static Binary create(
        Tokenizer.Pos pos, BinaryOperator op, Expression lhs, Expression rhs) {
      return new AutoValue_Ast_Binary(pos, op, lhs, rhs);
    }

    // Left-associative chains such as a + b + c are converted without recursing down the lhs.
    @Override
    public Fir.Expression toFunctionalIr() {
      List<Binary> chain = new ArrayList<>();
      Expression left = this;
      while (left instanceof Binary) {
        chain.add((Binary) left);
        left = ((Binary) left).lhs();
      }

      Fir.Expression result = left.toFunctionalIr();
      for (int i = chain.size() - 1; i >= 0; i--) {
        Binary binary = chain.get(i);
        result = Fir.Binary.of(binary.op().toFunctionalIr(), result, binary.rhs().toFunctionalIr());
      }
      return result;
    }
  }

  @AutoValue
  public abstract static class Conditional extends Expression {
    @Override
    public abstract Tokenizer.Pos pos();

    public abstract Expression condition();

    public abstract Expression thenBranch();

    public abstract Expression elseBranch();

    public static Conditional create(
        Tokenizer.Pos pos, Expression condition, Expression thenBranch, Expression elseBranch) {
      return new AutoValue_Ast_Conditional(pos, condition, thenBranch, elseBranch);
    }

    @Override
    public Fir.Expression toFunctionalIr() {
      return Fir.If.of(
          condition().toFunctionalIr(),
          thenBranch().toFunctionalIr(),
          elseBranch().toFunctionalIr());
    }
  }

  @AutoValue
  public abstract static class Call extends Expression {
    @Override
    public abstract Tokenizer.Pos pos();

    public abstract String function();

    public abstract ImmutableList<Expression> args();

    public static Call create(Tokenizer.Pos pos, String function, List<Expression> args) {
      return new AutoValue_Ast_Call(pos, function, ImmutableList.copyOf(args));
    }

    @Override
    public Fir.Expression toFunctionalIr() {
      return Fir.Call.of(
          function(),
          args().stream().map(Expression::toFunctionalIr).collect(ImmutableList.toImmutableList()));
    }
  }

  @AutoValue
  public abstract static class Let extends Expression {
    @Override
    public abstract Tokenizer.Pos pos();

    public abstract String name();

    public abstract Expression value();

    public abstract Expression body();

    public static Let create(Tokenizer.Pos pos, String name, Expression value, Expression body) {
      return new AutoValue_Ast_Let(pos, name, value, body);
    }

    @Override
    public Fir.Expression toFunctionalIr() {
      return Fir.Let.of(name(), value().toFunctionalIr(), body().toFunctionalIr());
    }
  }

  @AutoValue
  public abstract static class Parameter {
    public abstract Tokenizer.Pos pos();

    public abstract String name();

    public abstract Type type();

    public static Parameter create(Tokenizer.Pos pos, String name, Type type) {
      return new AutoValue_Ast_Parameter(pos, name, type);
    }

    public Fir.Parameter toFunctionalIr() {
      return Fir.Parameter.of(name(), type().toFunctionalIr());
    }
  }

  @AutoValue
  public abstract static class FunctionDefinition {
    public abstract Tokenizer.Pos pos();

    public abstract String name();

    public abstract ImmutableList<Parameter> parameters();

    public abstract Type returnType();

    public abstract Expression body();

    public static FunctionDefinition create(
        Tokenizer.Pos pos,
        String name,
        List<Parameter> parameters,
        Type returnType,
        Expression body) {
      return new AutoValue_Ast_FunctionDefinition(
          pos, name, ImmutableList.copyOf(parameters), returnType, body);
    }

    public Fir.Function toFunctionalIr() {
      return Fir.Function.of(
          name(),
          parameters()
              .stream()
              .map(Parameter::toFunctionalIr)
              .collect(ImmutableList.toImmutableList()),
          returnType().toFunctionalIr(),
          body().toFunctionalIr());
    }
  }

  @AutoValue
  public abstract static class Program {
    public abstract ImmutableList<FunctionDefinition> functions();

    public static Program create(List<FunctionDefinition> functions) {
      return new AutoValue_Ast_Program(ImmutableList.copyOf(functions));
    }

    public Fir.Program toFunctionalIr() {
      return Fir.Program.of(
          functions()
              .stream()
              .map(FunctionDefinition::toFunctionalIr)
              .collect(ImmutableList.toImmutableList()));
    }
  }
}
