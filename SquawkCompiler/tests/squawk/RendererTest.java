package squawk;

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

public class RendererTest {

  private static String render(String content) throws CompilerException {
    return new Renderer().render(new Compiler().compile(content));
  }

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines);
  }

  @Test
  public void emptyProgram() {
    assertThat(new Renderer().render(Imperative.Program.of(ImmutableList.of())))
        .isEqualTo("; Squawk Compiler Output\n; Generated from functional code");
  }

  @Test
  public void identity() throws CompilerException {
    assertThat(render("fn identity(x: Int) -> Int = x"))
        .isEqualTo(
            lines(
                "; Squawk Compiler Output",
                "; Generated from functional code",
                "",
                "function identity(x):",
                "    mov t0, x",
                "    ret t0"));
  }

  @Test
  public void factorial() throws CompilerException {
    assertThat(render("fn factorial(n: Int) -> Int = if n <= 1 then 1 else n * factorial(n - 1)"))
        .isEqualTo(
            lines(
                "; Squawk Compiler Output",
                "; Generated from functional code",
                "",
                "function factorial(n):",
                "    mov t2, n",
                "    mov t3, 1",
                "    leq t1, t2, t3",
                "    jmpif t1, then0",
                "    jmp else1",
                "then0:",
                "    mov t0, 1",
                "    jmp end_if2",
                "else1:",
                "    mov t4, n",
                "    mov t7, n",
                "    mov t8, 1",
                "    sub t6, t7, t8",
                "    call t5 = factorial(t6)",
                "    mul t0, t4, t5",
                "end_if2:",
                "    ret t0"));
  }

  @Test
  public void functionsAreSeparatedByBlankLines() throws CompilerException {
    String source =
        lines(
            "fn one() -> Int = 1",
            "fn yes() -> Bool = true",
            "fn both(a: Int, b: Bool) -> Bool = b");

    assertThat(render(source))
        .isEqualTo(
            lines(
                "; Squawk Compiler Output",
                "; Generated from functional code",
                "",
                "function one():",
                "    mov t0, 1",
                "    ret t0",
                "",
                "function yes():",
                "    mov t0, 1",
                "    ret t0",
                "",
                "function both(a, b):",
                "    mov t0, b",
                "    ret t0"));
  }

  @Test
  public void everyInstruction() {
    Imperative.Program program =
        Imperative.Program.of(
            ImmutableList.of(
                Imperative.Function.of(
                    "f",
                    ImmutableList.of("p"),
                    ImmutableList.of(
                        Imperative.Assign.of("t0", Imperative.BoolLiteral.of(false)),
                        Imperative.BinaryOp.of(
                            "t1",
                            Imperative.Opcode.NEQ,
                            Imperative.Variable.of("p"),
                            Imperative.IntLiteral.of(-3)),
                        Imperative.CondJump.of(Imperative.Variable.of("t1"), "a", "b"),
                        Imperative.Label.of("a"),
                        Imperative.Call.of(
                            Optional.empty(),
                            "log",
                            ImmutableList.of(
                                Imperative.Variable.of("p"), Imperative.BoolLiteral.of(true))),
                        Imperative.Jump.of("b"),
                        Imperative.Label.of("b"),
                        Imperative.Call.of(Optional.of("t2"), "g", ImmutableList.of()),
                        Imperative.Return.of(Imperative.Variable.of("t2"))))));

    assertThat(new Renderer().render(program))
        .isEqualTo(
            lines(
                "; Squawk Compiler Output",
                "; Generated from functional code",
                "",
                "function f(p):",
                "    mov t0, 0",
                "    neq t1, p, -3",
                "    jmpif t1, a",
                "    jmp b",
                "a:",
                "    call log(p, 1)",
                "    jmp b",
                "b:",
                "    call t2 = g()",
                "    ret t2"));
  }

  @Test
  public void mnemonics() {
    assertThat(
            ImmutableList.copyOf(Imperative.Opcode.values())
                .stream()
                .map(Imperative.Opcode::mnemonic)
                .collect(ImmutableList.toImmutableList()))
        .containsExactly("add", "sub", "mul", "div", "eq", "neq", "lt", "gt", "leq", "geq")
        .inOrder();
  }
}
