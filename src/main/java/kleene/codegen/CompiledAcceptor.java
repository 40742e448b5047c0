package kleene.codegen;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;

import kleene.graph.Automaton;
import kleene.graph.Determinizer;

import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles automata into JVM classes implementing {@link Acceptor}.
 *
 * <p>The automaton is completed into a total DFA, whose states become basic
 * blocks in a single method. The generated class is loaded as a hidden class
 * next to this one.
 */
public final class CompiledAcceptor {

  private static final Logger log = LoggerFactory.getLogger(CompiledAcceptor.class);

  private static final String CLASS_NAME = "kleene/codegen/Acceptor$Compiled";

  private CompiledAcceptor() {
  }

  /**
   * Compile an automaton.
   *
   * @param automaton automaton whose language the acceptor recognizes
   * @return acceptor backed by generated bytecode
   * @throws IllegalStateException if the class cannot be generated or loaded
   */
  public static Acceptor compile(Automaton automaton) {
    final Automaton dfa = automaton.isTotal() ? automaton : Determinizer.complete(automaton);
    try {
      final byte[] classBytes = generateClass(dfa).toByteArray();
      log.debug("Generated {} bytes of bytecode for {} states", classBytes.length, dfa.size());

      // Load the class and get a handle on the constructor
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
      return (Acceptor) constructor.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to construct acceptor", error);
    }
  }

  /**
   * Code generator for the acceptor class.
   *
   * @param dfa total DFA
   * @return class writer for a class implementing `Acceptor`
   */
  static ClassWriter generateClass(Automaton dfa) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      CLASS_NAME,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.ACCEPTOR_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `accepts` method
    {
      final var mv = Method.ACCEPTS_M.newMethod(cw, Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL);
      new AcceptorMethodCodegen(mv, dfa).visitAcceptsMethod();
    }

    cw.visitEnd();
    return cw;
  }
}
