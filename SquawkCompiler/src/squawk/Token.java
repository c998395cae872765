package squawk;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** A single lexical token. Literal and identifier tokens carry their value. */
@AutoValue
public abstract class Token {

  public enum Category {
    KEYWORD,
    LITERAL,
    IDENTIFIER,
    OPERATOR,
    DELIMITER,
    END_OF_INPUT,
    NEWLINE;
  }

  public enum Type {
    // Keywords
    FN(Category.KEYWORD, "'fn'"),
    IF(Category.KEYWORD, "'if'"),
    THEN(Category.KEYWORD, "'then'"),
    ELSE(Category.KEYWORD, "'else'"),
    LET(Category.KEYWORD, "'let'"),
    IN(Category.KEYWORD, "'in'"),
    RETURN(Category.KEYWORD, "'return'"),
    INT_TYPE(Category.KEYWORD, "'Int'"),
    BOOL_TYPE(Category.KEYWORD, "'Bool'"),

    // Literals
    INTEGER(Category.LITERAL, "an integer"),
    TRUE(Category.LITERAL, "'true'"),
    FALSE(Category.LITERAL, "'false'"),

    IDENTIFIER(Category.IDENTIFIER, "an identifier"),

    // Operators
    PLUS(Category.OPERATOR, "'+'"),
    MINUS(Category.OPERATOR, "'-'"),
    MULTIPLY(Category.OPERATOR, "'*'"),
    DIVIDE(Category.OPERATOR, "'/'"),
    EQUALS(Category.OPERATOR, "'='"),
    DOUBLE_EQUALS(Category.OPERATOR, "'=='"),
    NOT_EQUALS(Category.OPERATOR, "'!='"),
    LESS_THAN(Category.OPERATOR, "'<'"),
    GREATER_THAN(Category.OPERATOR, "'>'"),
    LESS_EQUAL(Category.OPERATOR, "'<='"),
    GREATER_EQUAL(Category.OPERATOR, "'>='"),
    ARROW(Category.OPERATOR, "'->'"),

    // Delimiters
    LPAREN(Category.DELIMITER, "'('"),
    RPAREN(Category.DELIMITER, "')'"),
    LBRACE(Category.DELIMITER, "'{'"),
    RBRACE(Category.DELIMITER, "'}'"),
    COMMA(Category.DELIMITER, "','"),
    COLON(Category.DELIMITER, "':'"),
    SEMICOLON(Category.DELIMITER, "';'"),

    EOF(Category.END_OF_INPUT, "end of input"),
    NEWLINE(Category.NEWLINE, "a newline");

    private final Category category;
    private final String description;

    Type(Category category, String description) {
      this.category = category;
      this.description = description;
    }

    public Category category() {
      return category;
    }

    public String description() {
      return description;
    }
  }

  public abstract Type type();

  abstract Optional<Object> value();

  public abstract Tokenizer.Pos pos();

  public int integerValue() {
    Preconditions.checkState(type() == Type.INTEGER, "not an integer token: %s", this);
    return (Integer) value().get();
  }

  public boolean booleanValue() {
    Preconditions.checkState(
        type() == Type.TRUE || type() == Type.FALSE, "not a boolean token: %s", this);
    return (Boolean) value().get();
  }

  public String identifier() {
    Preconditions.checkState(type() == Type.IDENTIFIER, "not an identifier token: %s", this);
    return (String) value().get();
  }

  public static Token of(Type type, Tokenizer.Pos pos) {
    Preconditions.checkArgument(
        type != Type.INTEGER && type != Type.IDENTIFIER, "%s tokens carry a value", type);
    if (type == Type.TRUE || type == Type.FALSE) {
      return new AutoValue_Token(type, Optional.of(type == Type.TRUE), pos);
    }
    return new AutoValue_Token(type, Optional.empty(), pos);
  }

  public static Token integer(int value, Tokenizer.Pos pos) {
    return new AutoValue_Token(Type.INTEGER, Optional.of(value), pos);
  }

  public static Token identifier(String name, Tokenizer.Pos pos) {
    return new AutoValue_Token(Type.IDENTIFIER, Optional.of(name), pos);
  }

  @Override
  public String toString() {
    return value().map(v -> "[" + type() + ": " + v + "]").orElse("[" + type() + "]");
  }
}
