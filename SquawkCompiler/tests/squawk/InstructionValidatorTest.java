package squawk;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;

public class InstructionValidatorTest {

  private static Imperative.Variable var(String name) {
    return Imperative.Variable.of(name);
  }

  private static Imperative.Function function(Imperative.Instruction... instructions) {
    return Imperative.Function.of("f", ImmutableList.of("a"), ImmutableList.copyOf(instructions));
  }

  @Test
  public void validFunction() {
    Imperative.Function function =
        function(
            Imperative.CondJump.of(var("a"), "yes", "no"),
            Imperative.Label.of("yes"),
            Imperative.Assign.of("t0", Imperative.IntLiteral.of(1)),
            Imperative.Jump.of("done"),
            Imperative.Label.of("no"),
            Imperative.Assign.of("t0", Imperative.BoolLiteral.of(false)),
            Imperative.Label.of("done"),
            Imperative.Return.of(var("t0")));

    assertThat(InstructionValidator.validate(function)).isEmpty();
  }

  @Test
  public void readBeforeAssignment() {
    Imperative.Function function =
        function(
            Imperative.BinaryOp.of("t0", Imperative.Opcode.ADD, var("a"), var("t1")),
            Imperative.Assign.of("t1", Imperative.IntLiteral.of(1)),
            Imperative.Return.of(var("t0")));

    assertThat(InstructionValidator.validate(function))
        .containsExactly("f: instruction 0 reads 't1' before it is assigned");
  }

  @Test
  public void temporaryAssignedOnOnlyOneBranch() {
    Imperative.Function function =
        function(
            Imperative.CondJump.of(var("a"), "yes", "no"),
            Imperative.Label.of("yes"),
            Imperative.Assign.of("t0", Imperative.IntLiteral.of(1)),
            Imperative.Jump.of("done"),
            Imperative.Label.of("no"),
            Imperative.Assign.of("t1", var("t0")),
            Imperative.Label.of("done"),
            Imperative.Return.of(var("t0")));

    assertThat(InstructionValidator.validate(function))
        .containsExactly(
            "f: instruction 5 reads 't0' before it is assigned",
            "f: instruction 7 reads 't0' before it is assigned")
        .inOrder();
  }

  @Test
  public void assignmentBeforeBranchReachesBothArms() {
    Imperative.Function function =
        function(
            Imperative.Assign.of("t1", Imperative.IntLiteral.of(2)),
            Imperative.CondJump.of(var("a"), "yes", "no"),
            Imperative.Label.of("yes"),
            Imperative.BinaryOp.of("t0", Imperative.Opcode.MUL, var("t1"), var("t1")),
            Imperative.Jump.of("done"),
            Imperative.Label.of("no"),
            Imperative.Assign.of("t0", var("t1")),
            Imperative.Label.of("done"),
            Imperative.Return.of(var("t0")));

    assertThat(InstructionValidator.validate(function)).isEmpty();
  }

  @Test
  public void userNamesAreNotChecked() {
    // Free names, let-bound names and temporary-looking parameters belong to the program.
    Imperative.Function function =
        Imperative.Function.of(
            "f",
            ImmutableList.of("t1"),
            ImmutableList.of(
                Imperative.Assign.of("t0", var("y")),
                Imperative.BinaryOp.of("t0", Imperative.Opcode.ADD, var("x"), var("t9")),
                Imperative.Assign.of("x", var("t0")),
                Imperative.Assign.of("t1", var("t1")),
                Imperative.Return.of(var("t0"))));

    assertThat(InstructionValidator.validate(function)).isEmpty();
  }

  @Test
  public void destinationIsAssignedAfterItsOperandsAreRead() {
    Imperative.Function function =
        function(Imperative.Assign.of("t0", var("t0")), Imperative.Return.of(var("t0")));

    assertThat(InstructionValidator.validate(function))
        .containsExactly("f: instruction 0 reads 't0' before it is assigned");
  }

  @Test
  public void callArgumentsAndDestination() {
    Imperative.Function function =
        function(
            Imperative.Call.of(Optional.empty(), "log", ImmutableList.of(var("a"))),
            Imperative.Call.of(Optional.of("t0"), "g", ImmutableList.of(var("t1"))),
            Imperative.Call.of(Optional.of("t1"), "h", ImmutableList.of(var("t0"))),
            Imperative.Return.of(var("t1")));

    assertThat(InstructionValidator.validate(function))
        .containsExactly("f: instruction 1 reads 't1' before it is assigned");
  }

  @Test
  public void duplicateLabel() {
    Imperative.Function function =
        function(
            Imperative.Label.of("top"),
            Imperative.Label.of("top"),
            Imperative.Return.of(var("a")));

    assertThat(InstructionValidator.validate(function))
        .containsExactly("f: label 'top' is defined more than once");
  }

  @Test
  public void undefinedJumpTargets() {
    Imperative.Function function =
        function(
            Imperative.Jump.of("nowhere"),
            Imperative.CondJump.of(var("a"), "here", "there"),
            Imperative.Label.of("here"),
            Imperative.Return.of(var("a")));

    assertThat(InstructionValidator.validate(function))
        .containsExactly(
            "f: jump to undefined label 'nowhere'", "f: jump to undefined label 'there'")
        .inOrder();
  }

  @Test
  public void labelsMayFollowTheirJumps() {
    Imperative.Function function =
        function(
            Imperative.Jump.of("end"), Imperative.Label.of("end"), Imperative.Return.of(var("a")));

    assertThat(InstructionValidator.validate(function)).isEmpty();
  }

  @Test
  public void verifyReportsEveryFunction() {
    Imperative.Program program =
        Imperative.Program.of(
            ImmutableList.of(
                Imperative.Function.of(
                    "ok", ImmutableList.of("x"), ImmutableList.of(Imperative.Return.of(var("x")))),
                Imperative.Function.of(
                    "bad",
                    ImmutableList.of(),
                    ImmutableList.of(
                        Imperative.Return.of(var("t0")),
                        Imperative.Assign.of("t0", Imperative.IntLiteral.of(0))))));

    VerifyException ex =
        assertThrows(VerifyException.class, () -> InstructionValidator.verify(program));

    assertThat(ex).hasMessageThat().contains("bad: instruction 0 reads 't0' before it is assigned");
    assertThat(ex).hasMessageThat().doesNotContain("ok:");
  }

  @Test
  public void verifyAcceptsLoweredOutput() throws CompilerException {
    Imperative.Program program =
        new Compiler(Compiler.Options.builder().setValidateOutput(false).build())
            .compile("fn max(a: Int, b: Int) -> Int = if a > b then a else b");

    InstructionValidator.verify(program);
    assertThat(InstructionValidator.validate(program)).isEmpty();
  }
}
