package squawk;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TokenizerTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private void print(String text) {
    file.append(text);
  }

  private ImmutableList<Token> tokenize() throws CompilerException {
    return new Tokenizer("/test/file.sq", file.toString()).tokenize();
  }

  private static ImmutableList<Token.Type> types(ImmutableList<Token> tokens) {
    return tokens.stream().map(Token::type).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void emptyFile() throws CompilerException {
    ImmutableList<Token> tokens = tokenize();

    assertThat(types(tokens)).containsExactly(Token.Type.EOF);
    assertThat(tokens.get(0).pos()).isEqualTo(Tokenizer.Pos.create("/test/file.sq", 0, 0));
  }

  @Test
  public void literals() throws CompilerException {
    print("42 true false");

    ImmutableList<Token> tokens = tokenize();

    assertThat(types(tokens))
        .containsExactly(Token.Type.INTEGER, Token.Type.TRUE, Token.Type.FALSE, Token.Type.EOF)
        .inOrder();
    assertThat(tokens.get(0).integerValue()).isEqualTo(42);
    assertThat(tokens.get(1).booleanValue()).isTrue();
    assertThat(tokens.get(2).booleanValue()).isFalse();
  }

  @Test
  public void keywordsAndIdentifiers() throws CompilerException {
    print("fn if then else let in return Int Bool fnord _x1 iffy");

    ImmutableList<Token> tokens = tokenize();

    assertThat(types(tokens))
        .containsExactly(
            Token.Type.FN,
            Token.Type.IF,
            Token.Type.THEN,
            Token.Type.ELSE,
            Token.Type.LET,
            Token.Type.IN,
            Token.Type.RETURN,
            Token.Type.INT_TYPE,
            Token.Type.BOOL_TYPE,
            Token.Type.IDENTIFIER,
            Token.Type.IDENTIFIER,
            Token.Type.IDENTIFIER,
            Token.Type.EOF)
        .inOrder();
    assertThat(tokens.get(9).identifier()).isEqualTo("fnord");
    assertThat(tokens.get(10).identifier()).isEqualTo("_x1");
    assertThat(tokens.get(11).identifier()).isEqualTo("iffy");
    assertThat(tokens.get(0).type().category()).isEqualTo(Token.Category.KEYWORD);
  }

  @Test
  public void twoCharOperatorsAreGreedy() throws CompilerException {
    print("== != <= >= -> = < > + - * / ( ) { } , : ;");

    assertThat(types(tokenize()))
        .containsExactly(
            Token.Type.DOUBLE_EQUALS,
            Token.Type.NOT_EQUALS,
            Token.Type.LESS_EQUAL,
            Token.Type.GREATER_EQUAL,
            Token.Type.ARROW,
            Token.Type.EQUALS,
            Token.Type.LESS_THAN,
            Token.Type.GREATER_THAN,
            Token.Type.PLUS,
            Token.Type.MINUS,
            Token.Type.MULTIPLY,
            Token.Type.DIVIDE,
            Token.Type.LPAREN,
            Token.Type.RPAREN,
            Token.Type.LBRACE,
            Token.Type.RBRACE,
            Token.Type.COMMA,
            Token.Type.COLON,
            Token.Type.SEMICOLON,
            Token.Type.EOF)
        .inOrder();
  }

  @Test
  public void operatorsWithoutSpaces() throws CompilerException {
    print("a<=b->c");

    assertThat(types(tokenize()))
        .containsExactly(
            Token.Type.IDENTIFIER,
            Token.Type.LESS_EQUAL,
            Token.Type.IDENTIFIER,
            Token.Type.ARROW,
            Token.Type.IDENTIFIER,
            Token.Type.EOF)
        .inOrder();
  }

  @Test
  public void minusFollowedByDigitIsNegativeLiteral() throws CompilerException {
    print("a-1 a - 1 -7");

    ImmutableList<Token> tokens = tokenize();

    assertThat(types(tokens))
        .containsExactly(
            Token.Type.IDENTIFIER,
            Token.Type.INTEGER,
            Token.Type.IDENTIFIER,
            Token.Type.MINUS,
            Token.Type.INTEGER,
            Token.Type.INTEGER,
            Token.Type.EOF)
        .inOrder();
    assertThat(tokens.get(1).integerValue()).isEqualTo(-1);
    assertThat(tokens.get(4).integerValue()).isEqualTo(1);
    assertThat(tokens.get(5).integerValue()).isEqualTo(-7);
  }

  @Test
  public void newlinesAreTokens() throws CompilerException {
    println("x");
    println("");
    print("y");

    assertThat(types(tokenize()))
        .containsExactly(
            Token.Type.IDENTIFIER,
            Token.Type.NEWLINE,
            Token.Type.NEWLINE,
            Token.Type.IDENTIFIER,
            Token.Type.EOF)
        .inOrder();
  }

  @Test
  public void commentsRunToEndOfLine() throws CompilerException {
    println("# leading comment");
    println("x # trailing == comment");
    print("y # no newline at the end");

    ImmutableList<Token> tokens = tokenize();

    assertThat(types(tokens))
        .containsExactly(
            Token.Type.NEWLINE,
            Token.Type.IDENTIFIER,
            Token.Type.NEWLINE,
            Token.Type.IDENTIFIER,
            Token.Type.EOF)
        .inOrder();
    assertThat(tokens.get(1).identifier()).isEqualTo("x");
    assertThat(tokens.get(3).identifier()).isEqualTo("y");
  }

  @Test
  public void positions() throws CompilerException {
    println("fn f");
    print("\t  x + 10");

    ImmutableList<Token> tokens = tokenize();

    assertThat(tokens.stream().map(t -> t.pos().toString()).collect(Collectors.toList()))
        .containsExactly(
            "/test/file.sq@1:1",
            "/test/file.sq@1:4",
            "/test/file.sq@1:5",
            "/test/file.sq@2:4",
            "/test/file.sq@2:6",
            "/test/file.sq@2:8",
            "/test/file.sq@2:10")
        .inOrder();
  }

  @Test
  public void carriageReturnsAreWhitespace() throws CompilerException {
    print("x\r\ny\r\n");

    assertThat(types(tokenize()))
        .containsExactly(
            Token.Type.IDENTIFIER,
            Token.Type.NEWLINE,
            Token.Type.IDENTIFIER,
            Token.Type.NEWLINE,
            Token.Type.EOF)
        .inOrder();
  }

  @Test
  public void unexpectedCharacter() {
    println("fn f() -> Int = 1");
    print("fn g() -> Int = 2 @ 3");

    LexException ex = assertThrows(LexException.class, this::tokenize);

    assertThat(ex.offendingChar()).isEqualTo('@');
    assertThat(ex.pos()).isEqualTo(Tokenizer.Pos.create("/test/file.sq", 1, 18));
    assertThat(ex.describe()).isEqualTo("ERROR: /test/file.sq@2:19 unexpected character '@'");
  }

  @Test
  public void bangAloneIsNotAnOperator() {
    print("a ! b");

    LexException ex = assertThrows(LexException.class, this::tokenize);

    assertThat(ex.offendingChar()).isEqualTo('!');
  }

  @Test
  public void integerOutOfRange() {
    print("2147483648");

    LexException ex = assertThrows(LexException.class, this::tokenize);

    assertThat(ex.errorMsg()).contains("integer literal out of range");
  }

  @Test
  public void integerBounds() throws CompilerException {
    print("2147483647 -2147483648");

    ImmutableList<Token> tokens = tokenize();

    assertThat(tokens.get(0).integerValue()).isEqualTo(Integer.MAX_VALUE);
    assertThat(tokens.get(1).integerValue()).isEqualTo(Integer.MIN_VALUE);
  }

  @Test
  public void valueAccessorsCheckType() throws CompilerException {
    print("x");

    Token token = tokenize().get(0);

    assertThrows(IllegalStateException.class, token::integerValue);
    assertThat(token.toString()).isEqualTo("[IDENTIFIER: x]");
  }
}
