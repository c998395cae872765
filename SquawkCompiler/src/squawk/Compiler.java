package squawk;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * The compilation pipeline: source text, tokens, AST, functional IR, imperative IR, rendered text.
 * Each stage is exposed separately so drivers can report on them.
 */
public class Compiler {

  @AutoValue
  public abstract static class Options {
    /** Name used for positions in error messages. */
    public abstract String fileName();

    public abstract int maxNestingDepth();

    /** Whether lowered output is checked against the imperative IR invariants. */
    public abstract boolean validateOutput();

    public static Builder builder() {
      return new AutoValue_Compiler_Options.Builder()
          .setFileName("<input>")
          .setMaxNestingDepth(Parser.DEFAULT_MAX_NESTING_DEPTH)
          .setValidateOutput(true);
    }

    public static Options defaults() {
      return builder().build();
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setFileName(String fileName);

      public abstract Builder setMaxNestingDepth(int maxNestingDepth);

      public abstract Builder setValidateOutput(boolean validateOutput);

      public abstract Options build();
    }
  }

  private final Options options;

  public Compiler(Options options) {
    this.options = options;
  }

  public Compiler() {
    this(Options.defaults());
  }

  public Options options() {
    return options;
  }

  public ImmutableList<Token> tokenize(String source) throws LexException {
    return new Tokenizer(options.fileName(), source).tokenize();
  }

  public Ast.Program parse(List<Token> tokens) throws ParseException {
    return new Parser(tokens, options.maxNestingDepth()).parseProgram();
  }

  public Fir.Program toFunctionalIr(Ast.Program program) {
    return program.toFunctionalIr();
  }

  public Imperative.Program lower(Fir.Program program) {
    Imperative.Program lowered = new StateTransformer().transform(program);
    if (options.validateOutput()) {
      InstructionValidator.verify(lowered);
    }
    return lowered;
  }

  public String render(Imperative.Program program) {
    return new Renderer().render(program);
  }

  public Imperative.Program compile(String source) throws CompilerException {
    return lower(toFunctionalIr(parse(tokenize(source))));
  }

  public String compileToText(String source) throws CompilerException {
    return render(compile(source));
  }
}
