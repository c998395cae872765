package squawk;

/** Raised when the parser does not find the construct it expects at the current token. */
public class ParseException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final String expected;
  private final Token.Type actual;

  public ParseException(Tokenizer.Pos pos, String expected, Token.Type actual) {
    this(
        pos,
        expected,
        actual,
        String.format("expected %s but got %s", expected, actual.description()));
  }

  public ParseException(Tokenizer.Pos pos, String expected, Token.Type actual, String errorMsg) {
    super(pos, errorMsg);
    this.expected = expected;
    this.actual = actual;
  }

  public String expected() {
    return expected;
  }

  public Token.Type actual() {
    return actual;
  }
}
