package squawk;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class CompilerMain {

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /** Runs the compiler and returns the process exit code. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length < 1 || args.length > 2) {
      err.println("Usage: $COMPILER squawk_file [output_file]");
      return 1;
    }

    File inFile = new File(args[0]);
    String source;
    try {
      source = read(inFile);
    } catch (IOException ex) {
      err.println(String.format("ERROR: could not read '%s': %s", inFile, ex.getMessage()));
      return 1;
    }

    Compiler compiler =
        new Compiler(Compiler.Options.builder().setFileName(inFile.toString()).build());
    String output;
    try {
      ImmutableList<Token> tokens = compiler.tokenize(source);
      err.println(String.format("Tokenized %d tokens", tokens.size()));

      Ast.Program ast = compiler.parse(tokens);
      err.println(String.format("Parsed %d function(s)", ast.functions().size()));

      Fir.Program fir = compiler.toFunctionalIr(ast);
      Imperative.Program lowered = compiler.lower(fir);
      err.println(
          String.format(
              "Lowered to imperative IR with %d function(s)", lowered.functions().size()));

      output = compiler.render(lowered);
      err.println(String.format("Generated %d lines of code", output.split("\n").length));
    } catch (CompilerException ex) {
      ex.print(err);
      err.println("Compilation failed.  See errors above.");
      return 1;
    }

    if (args.length == 2) {
      File outFile = new File(args[1]);
      try {
        write(output + "\n", outFile);
      } catch (IOException ex) {
        err.println(String.format("ERROR: could not write '%s': %s", outFile, ex.getMessage()));
        return 1;
      }
    } else {
      out.println(output);
    }

    err.println("Compilation succeeded!");
    return 0;
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
