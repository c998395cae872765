package squawk;

/** Raised when the tokenizer meets input that no token rule accepts. */
public class LexException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final char offendingChar;

  public LexException(Tokenizer.Pos pos, char offendingChar, String errorMsg) {
    super(pos, errorMsg);
    this.offendingChar = offendingChar;
  }

  public char offendingChar() {
    return offendingChar;
  }
}
