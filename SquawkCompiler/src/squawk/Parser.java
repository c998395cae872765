package squawk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Recursive-descent parser over a token list. Binary operators are folded left-associatively per
 * precedence level, see {@link Ast.BinaryOperator#orderOfOperations()}.
 *
 * <p>Nesting is bounded by the number of open sub-expressions (parentheses, call arguments,
 * {@code if} and {@code let} parts). Operator chains such as {@code 1 + 2 + 3} are folded in a
 * loop and do not count towards it.
 *
 * <p>Newlines are only skipped where the grammar allows a line break: before a function, a
 * parameter, a type, a primary expression, and before {@code then}, {@code else} and {@code in}.
 */
public class Parser {

  public static final int DEFAULT_MAX_NESTING_DEPTH = 200;

  private final ImmutableList<Token> tokens;
  private final int maxNestingDepth;
  private int index = 0;
  private int nesting = 0;

  public Parser(List<Token> tokens) {
    this(tokens, DEFAULT_MAX_NESTING_DEPTH);
  }

  public Parser(List<Token> tokens, int maxNestingDepth) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == Token.Type.EOF,
        "token list must end with EOF");
    Preconditions.checkArgument(maxNestingDepth > 0, "maxNestingDepth: %s", maxNestingDepth);
    this.tokens = ImmutableList.copyOf(tokens);
    this.maxNestingDepth = maxNestingDepth;
  }

  public Ast.Program parseProgram() throws ParseException {
    List<Ast.FunctionDefinition> functions = new ArrayList<>();

    skipNewlines();
    while (current().type() != Token.Type.EOF) {
      functions.add(parseFunction());
      skipNewlines();
    }
    return Ast.Program.create(functions);
  }

  private Ast.FunctionDefinition parseFunction() throws ParseException {
    skipNewlines();
    Token fn = expect(Token.Type.FN);
    String name = expect(Token.Type.IDENTIFIER, "a function name").identifier();
    expect(Token.Type.LPAREN);

    List<Ast.Parameter> parameters = new ArrayList<>();
    if (current().type() != Token.Type.RPAREN) {
      parameters.add(parseParameter());
      while (current().type() == Token.Type.COMMA) {
        advance();
        parameters.add(parseParameter());
      }
    }

    expect(Token.Type.RPAREN);
    expect(Token.Type.ARROW);
    Ast.Type returnType = parseType();
    expect(Token.Type.EQUALS);

    Ast.Expression body = parseExpression();
    return Ast.FunctionDefinition.create(fn.pos(), name, parameters, returnType, body);
  }

  private Ast.Parameter parseParameter() throws ParseException {
    skipNewlines();
    Token name = expect(Token.Type.IDENTIFIER, "a parameter name");
    expect(Token.Type.COLON);
    return Ast.Parameter.create(name.pos(), name.identifier(), parseType());
  }

  private Ast.Type parseType() throws ParseException {
    skipNewlines();
    Token token = current();
    switch (token.type()) {
      case INT_TYPE:
        advance();
        return Ast.Type.INT;
      case BOOL_TYPE:
        advance();
        return Ast.Type.BOOL;
      default:
        throw new ParseException(token.pos(), "a type", token.type());
    }
  }

  public Ast.Expression parseExpression() throws ParseException {
    if (++nesting > maxNestingDepth) {
      throw tooDeep(current());
    }
    try {
      return parseBinary(0);
    } finally {
      nesting--;
    }
  }

  private Ast.Expression parseBinary(int level) throws ParseException {
    ImmutableList<ImmutableSet<Ast.BinaryOperator>> levels =
        Ast.BinaryOperator.orderOfOperations();
    if (level == levels.size()) {
      return parsePrimary();
    }

    Ast.Expression lhs = parseBinary(level + 1);
    while (true) {
      Optional<Ast.BinaryOperator> op =
          Ast.BinaryOperator.forToken(current().type()).filter(levels.get(level)::contains);
      if (!op.isPresent()) {
        return lhs;
      }

      Token opToken = advance();
      Ast.Expression rhs = parseBinary(level + 1);
      lhs = Ast.Binary.create(opToken.pos(), op.get(), lhs, rhs);
    }
  }

  private Ast.Expression parsePrimary() throws ParseException {
    skipNewlines();
    Token token = current();
    switch (token.type()) {
      case INTEGER:
        advance();
        return Ast.IntLiteral.create(token.pos(), token.integerValue());
      case TRUE:
      case FALSE:
        advance();
        return Ast.BoolLiteral.create(token.pos(), token.booleanValue());
      case LPAREN:
        {
          advance();
          Ast.Expression inner = parseExpression();
          expect(Token.Type.RPAREN);
          return inner;
        }
      case IF:
        return parseConditional();
      case LET:
        return parseLet();
      case IDENTIFIER:
        advance();
        if (current().type() == Token.Type.LPAREN) {
          return parseCall(token);
        }
        return Ast.Variable.create(token.pos(), token.identifier());
      default:
        throw new ParseException(token.pos(), "an expression", token.type());
    }
  }

  private Ast.Expression parseCall(Token name) throws ParseException {
    expect(Token.Type.LPAREN);

    List<Ast.Expression> args = new ArrayList<>();
    if (current().type() != Token.Type.RPAREN) {
      args.add(parseExpression());
      while (current().type() == Token.Type.COMMA) {
        advance();
        args.add(parseExpression());
      }
    }

    expect(Token.Type.RPAREN);
    return Ast.Call.create(name.pos(), name.identifier(), args);
  }

  private Ast.Expression parseConditional() throws ParseException {
    Token start = expect(Token.Type.IF);
    Ast.Expression condition = parseExpression();
    skipNewlines();
    expect(Token.Type.THEN);
    Ast.Expression thenBranch = parseExpression();
    skipNewlines();
    expect(Token.Type.ELSE);
    Ast.Expression elseBranch = parseExpression();
    return Ast.Conditional.create(start.pos(), condition, thenBranch, elseBranch);
  }

  private Ast.Expression parseLet() throws ParseException {
    Token start = expect(Token.Type.LET);
    String name = expect(Token.Type.IDENTIFIER, "a variable name").identifier();
    expect(Token.Type.EQUALS);
    Ast.Expression value = parseExpression();
    skipNewlines();
    expect(Token.Type.IN);
    Ast.Expression body = parseExpression();
    return Ast.Let.create(start.pos(), name, value, body);
  }

  private ParseException tooDeep(Token token) {
    return new ParseException(
        token.pos(),
        String.format("at most %d levels of nesting", maxNestingDepth),
        token.type(),
        String.format("expression nesting exceeds %d levels", maxNestingDepth));
  }

  private Token current() {
    return tokens.get(index);
  }

  // Never moves past EOF.
  private Token advance() {
    Token token = current();
    if (token.type() != Token.Type.EOF) {
      index++;
    }
    return token;
  }

  private Token expect(Token.Type type) throws ParseException {
    return expect(type, type.description());
  }

  private Token expect(Token.Type type, String expected) throws ParseException {
    Token token = current();
    if (token.type() != type) {
      throw new ParseException(token.pos(), expected, token.type());
    }
    return advance();
  }

  private void skipNewlines() {
    while (current().type() == Token.Type.NEWLINE) {
      advance();
    }
  }
}
