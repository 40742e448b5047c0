package kleene.graph;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Immutable set of input symbols.
 *
 * Symbols are single {@code char} values, stored sorted and distinct so that
 * two alphabets with the same symbols are equal no matter how they were
 * spelled out.
 */
public final class Alphabet implements Iterable<Character> {

  public static final Alphabet EMPTY = new Alphabet(new char[0]);

  // Sorted and distinct symbols
  private final char[] symbols;

  private Alphabet(char[] symbols) {
    this.symbols = symbols;
  }

  public static Alphabet of(CharSequence symbols) {
    final char[] sorted = symbols
      .chars()
      .distinct()
      .sorted()
      .mapToObj(c -> String.valueOf((char) c))
      .collect(Collectors.joining())
      .toCharArray();
    return new Alphabet(sorted);
  }

  public int size() {
    return symbols.length;
  }

  public boolean isEmpty() {
    return symbols.length == 0;
  }

  /**
   * Symbol at a position in the (sorted) alphabet.
   *
   * @param index position between {@code 0} and {@code size() - 1}
   * @return symbol at that position
   */
  public char symbol(int index) {
    return symbols[index];
  }

  /**
   * Position of a symbol in the sorted alphabet.
   *
   * @param symbol symbol to look up
   * @return position of the symbol, or a negative number if it is absent
   */
  public int indexOf(char symbol) {
    final int index = Arrays.binarySearch(symbols, symbol);
    return index < 0 ? -1 : index;
  }

  public boolean contains(char symbol) {
    return indexOf(symbol) >= 0;
  }

  /**
   * Check that every symbol of a label belongs to the alphabet.
   *
   * @param label edge label or word
   * @return whether all symbols are in the alphabet
   */
  public boolean containsAll(CharSequence label) {
    return label.chars().allMatch(c -> contains((char) c));
  }

  public boolean containsAll(Alphabet other) {
    for (char symbol : other.symbols) {
      if (!contains(symbol)) {
        return false;
      }
    }
    return true;
  }

  public Alphabet union(Alphabet other) {
    return Alphabet.of(toString() + other);
  }

  public IntStream stream() {
    return IntStream.range(0, symbols.length).map(i -> symbols[i]);
  }

  @Override
  public Iterator<Character> iterator() {
    return new Iterator<Character>() {
      int next = 0;

      @Override
      public boolean hasNext() {
        return next < symbols.length;
      }

      @Override
      public Character next() {
        if (next >= symbols.length) {
          throw new NoSuchElementException();
        }
        return symbols[next++];
      }
    };
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(symbols);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof Alphabet other) {
      return Arrays.equals(symbols, other.symbols);
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    return new String(symbols);
  }
}
