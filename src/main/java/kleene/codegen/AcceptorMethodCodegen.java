package kleene.codegen;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import kleene.graph.Automaton;
import kleene.graph.Edge;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Emits the body of {@link Acceptor#accepts} for a total DFA.
 *
 * <p>Every state gets a block of code: at the end of the input it returns
 * whether the state is terminal, otherwise it reads the next character and
 * branches to the block of the successor state. Characters with no
 * transition jump to a shared rejecting block.
 */
final class AcceptorMethodCodegen extends BytecodeHelpers {

  // Local variable slots
  private static final int INPUT_VAR = 1;
  private static final int OFFSET_VAR = 2;
  private static final int LENGTH_VAR = 3;

  private final Automaton dfa;
  private final Map<Integer, Label> stateLabels = new HashMap<>();
  private final Label rejectLabel = new Label();

  AcceptorMethodCodegen(MethodVisitor mv, Automaton dfa) {
    super(mv);
    this.dfa = dfa;
    for (int state : dfa.nodes()) {
      stateLabels.put(state, new Label());
    }
  }

  void visitAcceptsMethod() {
    mv.visitCode();

    // int offset = 0; int length = input.length();
    visitConstantInt(0);
    mv.visitVarInsn(Opcodes.ISTORE, OFFSET_VAR);
    mv.visitVarInsn(Opcodes.ALOAD, INPUT_VAR);
    Method.LENGTH_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
    mv.visitVarInsn(Opcodes.ISTORE, LENGTH_VAR);
    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.get(dfa.start()));

    final List<Integer> states = dfa.nodes();
    for (int state : states) {
      visitState(state);
    }

    mv.visitLabel(rejectLabel);
    visitConstantBoolean(false);
    mv.visitInsn(Opcodes.IRETURN);

    mv.visitMaxs(0, 0);
    mv.visitEnd();
  }

  private void visitState(int state) {
    final Label readLabel = new Label();
    mv.visitLabel(stateLabels.get(state));

    // if (offset >= length) return terminal;
    mv.visitVarInsn(Opcodes.ILOAD, OFFSET_VAR);
    mv.visitVarInsn(Opcodes.ILOAD, LENGTH_VAR);
    mv.visitJumpInsn(Opcodes.IF_ICMPLT, readLabel);
    visitConstantBoolean(dfa.isTerminal(state));
    mv.visitInsn(Opcodes.IRETURN);

    // char c = input.charAt(offset++);
    mv.visitLabel(readLabel);
    mv.visitVarInsn(Opcodes.ALOAD, INPUT_VAR);
    mv.visitVarInsn(Opcodes.ILOAD, OFFSET_VAR);
    Method.CHARAT_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
    mv.visitIincInsn(OFFSET_VAR, 1);

    final TreeMap<Character, Integer> transitions = new TreeMap<>();
    for (Edge edge : dfa.outgoing(state)) {
      transitions.put(edge.symbol(), edge.target());
    }
    final int[] values = new int[transitions.size()];
    final Label[] labels = new Label[transitions.size()];
    int i = 0;
    for (var transition : transitions.entrySet()) {
      values[i] = transition.getKey();
      labels[i] = stateLabels.get(transition.getValue());
      i++;
    }
    visitLookupBranch(rejectLabel, values, labels);
  }
}
