package squawk;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Checks lowered functions against the imperative IR invariants: labels are defined once, jump
 * targets exist, and every compiler temporary is assigned on every forward path before it is read.
 *
 * <p>Assignments are tracked per path: a jump carries the names assigned so far to its target
 * label, and a label only keeps the names assigned on every edge reaching it. Jumps to a label
 * that was already passed are ignored.
 *
 * <p>User-level names (parameters, let-bound names and names the program never binds) are not
 * checked, since the language has no name resolution. A temporary is a {@code t<n>} name that the
 * function assigns and that is not one of its parameters.
 *
 * <p>A violation means the lowering itself is broken; it is never a user error.
 */
public class InstructionValidator extends VoidDefaultImperativeVisitor {

  private static final Pattern TEMPORARY = Pattern.compile("t[0-9]+");

  private final String functionName;
  private final ImmutableSet<String> temporaries;
  private final Map<String, Set<String>> pendingAtLabel = new HashMap<>();
  private final Set<String> labels = new HashSet<>();
  private final Set<String> jumpTargets = new LinkedHashSet<>();
  private final List<String> errors = new ArrayList<>();
  private Set<String> assigned = new HashSet<>();
  private boolean reachable = true;
  private int index = 0;

  private InstructionValidator(Imperative.Function function) {
    this.functionName = function.name();
    this.temporaries = temporaries(function);
  }

  public static ImmutableList<String> validate(Imperative.Function function) {
    InstructionValidator validator = new InstructionValidator(function);
    for (Imperative.Instruction instruction : function.instructions()) {
      instruction.accept(validator, null);
      validator.index++;
    }

    for (String target : validator.jumpTargets) {
      if (!validator.labels.contains(target)) {
        validator.logError(String.format("jump to undefined label '%s'", target));
      }
    }
    return ImmutableList.copyOf(validator.errors);
  }

  public static ImmutableList<String> validate(Imperative.Program program) {
    return program
        .functions()
        .stream()
        .flatMap(f -> validate(f).stream())
        .collect(ImmutableList.toImmutableList());
  }

  /** Fails with a {@link com.google.common.base.VerifyException} if the program is malformed. */
  public static void verify(Imperative.Program program) {
    ImmutableList<String> errors = validate(program);
    Verify.verify(
        errors.isEmpty(),
        "lowering produced invalid imperative IR:\n%s",
        errors.stream().collect(Collectors.joining("\n")));
  }

  private static ImmutableSet<String> temporaries(Imperative.Function function) {
    DestinationCollector collector = new DestinationCollector();
    function.instructions().forEach(i -> i.accept(collector, null));
    return collector
        .destinations
        .stream()
        .filter(name -> TEMPORARY.matcher(name).matches())
        .filter(name -> !function.params().contains(name))
        .collect(ImmutableSet.toImmutableSet());
  }

  private void logError(String msg) {
    errors.add(functionName + ": " + msg);
  }

  // Merges the current path into the entry state of a later label.
  private void flowTo(String target) {
    jumpTargets.add(target);
    if (!reachable || labels.contains(target)) {
      return;
    }
    pendingAtLabel.merge(
        target,
        new HashSet<>(assigned),
        (pending, incoming) -> {
          pending.retainAll(incoming);
          return pending;
        });
  }

  @Override
  public void visitImpl(Imperative.Variable variable) {
    if (temporaries.contains(variable.name()) && !assigned.contains(variable.name())) {
      logError(
          String.format(
              "instruction %d reads '%s' before it is assigned", index, variable.name()));
    }
  }

  @Override
  public void visitImpl(Imperative.Assign assign) {
    assign.visitChildren(this, null);
    assigned.add(assign.dest());
  }

  @Override
  public void visitImpl(Imperative.BinaryOp binaryOp) {
    binaryOp.visitChildren(this, null);
    assigned.add(binaryOp.dest());
  }

  @Override
  public void visitImpl(Imperative.Call call) {
    call.visitChildren(this, null);
    call.dest().ifPresent(assigned::add);
  }

  @Override
  public void visitImpl(Imperative.Label label) {
    if (!labels.add(label.name())) {
      logError(String.format("label '%s' is defined more than once", label.name()));
    }

    Set<String> pending = pendingAtLabel.remove(label.name());
    if (pending != null) {
      if (reachable) {
        pending.retainAll(assigned);
      }
      assigned = pending;
    } else if (!reachable) {
      // Nothing reaches this label.
      assigned = new HashSet<>();
    }
    reachable = true;
  }

  @Override
  public void visitImpl(Imperative.Jump jump) {
    flowTo(jump.target());
    reachable = false;
  }

  @Override
  public void visitImpl(Imperative.CondJump condJump) {
    condJump.visitChildren(this, null);
    flowTo(condJump.trueTarget());
    flowTo(condJump.falseTarget());
    reachable = false;
  }

  @Override
  public void visitImpl(Imperative.Return ret) {
    ret.visitChildren(this, null);
    reachable = false;
  }

  private static final class DestinationCollector extends VoidDefaultImperativeVisitor {
    private final Set<String> destinations = new HashSet<>();

    @Override
    public void visitImpl(Imperative.Assign assign) {
      destinations.add(assign.dest());
    }

    @Override
    public void visitImpl(Imperative.BinaryOp binaryOp) {
      destinations.add(binaryOp.dest());
    }

    @Override
    public void visitImpl(Imperative.Call call) {
      call.dest().ifPresent(destinations::add);
    }
  }
}
