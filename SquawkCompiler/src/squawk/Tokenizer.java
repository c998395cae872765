package squawk;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** Produces a tokenization of the input. */
public class Tokenizer {
  @AutoValue
  public abstract static class Pos {
    public abstract String file();

    // Both are 0-based; messages print them 1-based.
    public abstract int lineNumber();

    public abstract int column();

    public static Pos create(String file, int lineNumber, int column) {
      return new AutoValue_Tokenizer_Pos(file, lineNumber, column);
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file(), lineNumber() + 1, column() + 1);
    }
  }

  private static final ImmutableMap<String, Token.Type> KEYWORDS =
      ImmutableMap.<String, Token.Type>builder()
          .put("fn", Token.Type.FN)
          .put("if", Token.Type.IF)
          .put("then", Token.Type.THEN)
          .put("else", Token.Type.ELSE)
          .put("let", Token.Type.LET)
          .put("in", Token.Type.IN)
          .put("return", Token.Type.RETURN)
          .put("Int", Token.Type.INT_TYPE)
          .put("Bool", Token.Type.BOOL_TYPE)
          .put("true", Token.Type.TRUE)
          .put("false", Token.Type.FALSE)
          .build();

  // Matched before their single-character prefixes.
  private static final ImmutableMap<String, Token.Type> TWO_CHAR_OPERATORS =
      ImmutableMap.of(
          "==", Token.Type.DOUBLE_EQUALS,
          "!=", Token.Type.NOT_EQUALS,
          "<=", Token.Type.LESS_EQUAL,
          ">=", Token.Type.GREATER_EQUAL,
          "->", Token.Type.ARROW);

  private static final ImmutableMap<Character, Token.Type> SINGLE_CHAR_TOKENS =
      ImmutableMap.<Character, Token.Type>builder()
          .put('+', Token.Type.PLUS)
          .put('-', Token.Type.MINUS)
          .put('*', Token.Type.MULTIPLY)
          .put('/', Token.Type.DIVIDE)
          .put('=', Token.Type.EQUALS)
          .put('<', Token.Type.LESS_THAN)
          .put('>', Token.Type.GREATER_THAN)
          .put('(', Token.Type.LPAREN)
          .put(')', Token.Type.RPAREN)
          .put('{', Token.Type.LBRACE)
          .put('}', Token.Type.RBRACE)
          .put(',', Token.Type.COMMA)
          .put(':', Token.Type.COLON)
          .put(';', Token.Type.SEMICOLON)
          .build();

  private static final String HORIZONTAL_WHITESPACE = " \t\r";
  private static final char COMMENT = '#';

  private final String file;
  private final ImmutableList<String> lines;
  private int line = 0;
  private int col = -1; // In the initial state we have not read anything yet.
  private char ch = ' ';

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();

  public Tokenizer(String file, String content) {
    this.file = file;

    // Every line but the last keeps its '\n' so that newlines are tokenized like any other char.
    List<String> split = Splitter.on('\n').splitToList(content);
    ImmutableList.Builder<String> linesBuilder = ImmutableList.builder();
    for (int i = 0; i < split.size(); i++) {
      linesBuilder.add(i < split.size() - 1 ? split.get(i) + "\n" : split.get(i));
    }
    this.lines = linesBuilder.build();
  }

  public ImmutableList<Token> tokenize() throws LexException {
    while (advance()) {
      if (HORIZONTAL_WHITESPACE.indexOf(ch) >= 0) {
        continue;
      } else if (ch == COMMENT) {
        skipComment();
        continue;
      }

      Pos start = pos();
      if (ch == '\n') {
        tokensBuilder.add(Token.of(Token.Type.NEWLINE, start));
      } else if (Character.isDigit(ch) || (ch == '-' && canPeek() && Character.isDigit(peek()))) {
        readNumber(start);
      } else if (Character.isLetter(ch) || ch == '_') {
        readWord(start);
      } else if (canPeek() && TWO_CHAR_OPERATORS.containsKey("" + ch + peek())) {
        Token.Type type = TWO_CHAR_OPERATORS.get("" + ch + peek());
        advance();
        tokensBuilder.add(Token.of(type, start));
      } else if (SINGLE_CHAR_TOKENS.containsKey(ch)) {
        tokensBuilder.add(Token.of(SINGLE_CHAR_TOKENS.get(ch), start));
      } else {
        throw new LexException(start, ch, String.format("unexpected character '%c'", ch));
      }
    }

    tokensBuilder.add(Token.of(Token.Type.EOF, endPos()));
    return tokensBuilder.build();
  }

  private boolean canPeek() {
    if (line >= lines.size()) {
      return false;
    }

    int nCol = col + 1;
    int nLine = line;
    while (nCol >= lines.get(nLine).length()) {
      nCol -= lines.get(nLine).length();
      if (++nLine == lines.size()) return false;
    }
    return true;
  }

  private char peek() {
    int nCol = col + 1;
    int nLine = line;
    while (nCol >= lines.get(nLine).length()) {
      nCol -= lines.get(nLine++).length();
    }
    return lines.get(nLine).charAt(nCol);
  }

  private boolean advance() {
    if (line >= lines.size()) return false;

    col++;
    while (col >= lines.get(line).length()) {
      col -= lines.get(line).length();
      if (++line == lines.size()) return false;
    }

    ch = lines.get(line).charAt(col);
    return true;
  }

  private Pos pos() {
    return Pos.create(file, line, col);
  }

  private Pos endPos() {
    int lastLine = lines.size() - 1;
    return Pos.create(file, lastLine, lines.get(lastLine).length());
  }

  // Stops in front of the '\n' so that it is still emitted as a token.
  private void skipComment() {
    while (canPeek() && peek() != '\n') {
      advance();
    }
  }

  private void readNumber(Pos start) throws LexException {
    StringBuilder digits = new StringBuilder();
    char first = ch;
    if (ch == '-') {
      digits.append(ch);
      advance();
    }
    digits.append(ch);
    while (canPeek() && Character.isDigit(peek())) {
      advance();
      digits.append(ch);
    }

    try {
      tokensBuilder.add(Token.integer(Integer.parseInt(digits.toString()), start));
    } catch (NumberFormatException ex) {
      throw new LexException(
          start, first, String.format("integer literal out of range: %s", digits));
    }
  }

  private void readWord(Pos start) {
    StringBuilder word = new StringBuilder().append(ch);
    while (canPeek() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
      advance();
      word.append(ch);
    }

    String text = word.toString();
    Token.Type keyword = KEYWORDS.get(text);
    if (keyword != null) {
      tokensBuilder.add(Token.of(keyword, start));
    } else {
      tokensBuilder.add(Token.identifier(text, start));
    }
  }
}
