package kleene.codegen;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Superclass containing utility methods for emitting compact bytecode.
 *
 * <p>Method bodies are limited in length by the fact the code array must
 * have length fitting in an unsigned 16-bit number, and a DFA with many states
 * turns into one long method. Where there is an equivalent but shorter
 * encoding, these helpers emit it.
 */
class BytecodeHelpers {

  /**
   * Method visitor into which code will be emitted.
   */
  protected final MethodVisitor mv;

  BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  /**
   * Branch on the {@code int} at the top of the stack.
   *
   * <p>Equivalent to {@code mv.visitLookupSwitchInsn(dflt, values, labels)},
   * but uses a comparison for a single value and a {@code tableswitch} when
   * the values are contiguous.
   *
   * @param dflt label to jump to if nothing else matches
   * @param values test values in the switch (sorted in ascending order)
   * @param labels labels to jump to if the scrutinee is in the test values
   */
  protected void visitLookupBranch(Label dflt, int[] values, Label[] labels) {
    if (values.length == 0) {
      mv.visitInsn(Opcodes.POP);
      mv.visitJumpInsn(Opcodes.GOTO, dflt);
    } else if (values.length == 1) {
      if (values[0] == 0) {
        mv.visitJumpInsn(Opcodes.IFEQ, labels[0]);
      } else {
        visitConstantInt(values[0]);
        mv.visitJumpInsn(Opcodes.IF_ICMPEQ, labels[0]);
      }
      mv.visitJumpInsn(Opcodes.GOTO, dflt);
    } else if (values[values.length - 1] - values[0] == values.length - 1) {
      mv.visitTableSwitchInsn(values[0], values[values.length - 1], dflt, labels);
    } else {
      mv.visitLookupSwitchInsn(dflt, values, labels);
    }
  }

  /**
   * Push an integer constant onto the stack, using the shortest instruction.
   *
   * @param constant integer constant
   */
  protected void visitConstantInt(int constant) {
    if (-1 <= constant && constant <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + constant);
    } else if (Byte.MIN_VALUE <= constant && constant <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }

  /**
   * Push a boolean constant onto the stack.
   */
  protected void visitConstantBoolean(boolean constant) {
    mv.visitInsn(constant ? Opcodes.ICONST_1 : Opcodes.ICONST_0);
  }
}
