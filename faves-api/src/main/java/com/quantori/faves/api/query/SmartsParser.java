package com.quantori.faves.api.query;

import com.quantori.faves.api.StructureParseException;
import com.quantori.faves.api.model.BondOrder;
import com.quantori.faves.api.model.PeriodicTable;
import com.quantori.faves.api.query.QueryMolecule.QueryBond;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.apache.commons.lang3.CharUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads the SMARTS subset used by scaffold patterns into a {@link QueryMolecule}.
 *
 * <p>Atom primitives: {@code * a A #n}, element symbols, {@code H D X R r x}, charges and isotopes.
 * Bond primitives: {@code - = # $ : ~ @}. Operators in decreasing precedence: {@code !}, {@code &}
 * (or juxtaposition), {@code ,} and {@code ;}. Recursive SMARTS and stereo are not supported;
 * chirality marks are accepted and ignored.
 */
public final class SmartsParser {
  private static final String BOND_CHARS = "-=#$:~@!&,;/\\";
  private static final int MAX_NUMBER_LENGTH = 9;

  private final String input;
  private int pos;
  private final List<AtomExpression> atoms = new ArrayList<>();
  private final List<QueryBond> bonds = new ArrayList<>();
  private final Set<Long> bonded = new HashSet<>();
  private final Deque<Integer> branches = new ArrayDeque<>();
  private final Map<Integer, int[]> openRings = new HashMap<>();
  private final Map<Integer, BondExpression> openRingBonds = new HashMap<>();
  private int previous = -1;
  private BondExpression pendingBond;
  private int pendingPosition = -1;

  private SmartsParser(String input) {
    this.input = input;
  }

  /**
   * Parses a SMARTS pattern.
   *
   * @param smarts pattern text
   * @return query graph
   * @throws StructureParseException when the pattern is malformed
   */
  public static QueryMolecule parse(String smarts) {
    if (StringUtils.isBlank(smarts)) {
      throw new StructureParseException("Pattern is empty");
    }
    return new SmartsParser(smarts.strip()).read();
  }

  private QueryMolecule read() {
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (c == '(') {
        if (previous < 0 || pendingPosition >= 0) {
          throw new StructureParseException("Branch does not follow an atom", pos);
        }
        branches.push(previous);
        pos++;
      } else if (c == ')') {
        if (branches.isEmpty()) {
          throw new StructureParseException("Unbalanced parentheses", pos);
        }
        if (pendingPosition >= 0) {
          throw new StructureParseException("Dangling bond", pendingPosition);
        }
        previous = branches.pop();
        pos++;
      } else if (c == '.') {
        if (previous < 0 || pendingPosition >= 0) {
          throw new StructureParseException("Unexpected fragment separator", pos);
        }
        previous = -1;
        pos++;
      } else if (BOND_CHARS.indexOf(c) >= 0) {
        if (previous < 0 || pendingPosition >= 0) {
          throw new StructureParseException("Unexpected bond", pos);
        }
        pendingPosition = pos;
        pendingBond = readBondExpression();
      } else if (c == '%' || CharUtils.isAsciiNumeric(c)) {
        readRingBond();
      } else if (c == '[') {
        addAtom(readBracket());
      } else {
        addAtom(readBareAtom());
      }
    }
    if (pendingPosition >= 0) {
      throw new StructureParseException("Dangling bond", pendingPosition);
    }
    if (!branches.isEmpty()) {
      throw new StructureParseException("Unbalanced parentheses", input.length());
    }
    if (!openRings.isEmpty()) {
      throw new StructureParseException(
          "Unclosed ring bond", openRings.values().iterator().next()[1]);
    }
    if (atoms.isEmpty()) {
      throw new StructureParseException("Pattern contains no atoms");
    }
    return new QueryMolecule(atoms, bonds);
  }

  private void addAtom(AtomExpression atom) {
    int index = atoms.size();
    atoms.add(atom);
    if (previous >= 0) {
      addBond(previous, index, pendingBond, pendingPosition);
    }
    previous = index;
    pendingBond = null;
    pendingPosition = -1;
  }

  private void addBond(int begin, int end, BondExpression expression, int position) {
    long key = begin < end ? ((long) begin << 32) | end : ((long) end << 32) | begin;
    if (!bonded.add(key)) {
      throw new StructureParseException("Duplicate bond between the same atoms", position);
    }
    bonds.add(
        new QueryBond(
            begin, end, expression == null ? new BondExpression.SingleOrAromatic() : expression));
  }

  private void readRingBond() {
    int start = pos;
    if (previous < 0) {
      throw new StructureParseException("Ring bond does not follow an atom", start);
    }
    int number;
    if (input.charAt(pos) == '%') {
      if (pos + 2 >= input.length()
          || !CharUtils.isAsciiNumeric(input.charAt(pos + 1))
          || !CharUtils.isAsciiNumeric(input.charAt(pos + 2))) {
        throw new StructureParseException("Invalid ring bond number", start);
      }
      number = Integer.parseInt(input.substring(pos + 1, pos + 3));
      pos += 3;
    } else {
      number = input.charAt(pos++) - '0';
    }
    int[] opening = openRings.remove(number);
    if (opening == null) {
      openRings.put(number, new int[] {previous, start});
      if (pendingBond != null) {
        openRingBonds.put(number, pendingBond);
      }
    } else {
      if (opening[0] == previous) {
        throw new StructureParseException("Ring bond to the same atom", start);
      }
      BondExpression opened = openRingBonds.remove(number);
      BondExpression expression = pendingBond;
      if (opened != null) {
        expression =
            expression == null ? opened : new BondExpression.And(List.of(opened, expression));
      }
      addBond(opening[0], previous, expression, start);
    }
    pendingBond = null;
    pendingPosition = -1;
  }

  private AtomExpression readBareAtom() {
    int start = pos;
    char c = input.charAt(pos);
    switch (c) {
      case '*' -> {
        pos++;
        return new AtomExpression.Any();
      }
      case 'a', 'A' -> {
        pos++;
        return new AtomExpression.Aromatic(c == 'a');
      }
      default -> {
        // fall through to element symbols
      }
    }
    String symbol;
    if ((c == 'C' && peek(1) == 'l') || (c == 'B' && peek(1) == 'r')) {
      symbol = input.substring(pos, pos + 2);
    } else {
      symbol = String.valueOf(c);
    }
    boolean aromatic = Character.isLowerCase(c);
    int number = PeriodicTable.atomicNumber(aromatic ? StringUtils.capitalize(symbol) : symbol);
    if (number <= 0 || !PeriodicTable.isOrganicSubset(number)
        || (aromatic && !PeriodicTable.canBeAromatic(number))) {
      throw new StructureParseException("Invalid atom symbol '" + c + "'", start);
    }
    pos += symbol.length();
    return new AtomExpression.Element(number, aromatic);
  }

  private AtomExpression readBracket() {
    int start = pos++;
    AtomExpression expression = parseLowAnd(this::readAtomPrimitive);
    if (peek(0) != ']') {
      throw new StructureParseException("Unclosed or invalid bracket atom", start);
    }
    pos++;
    return expression;
  }

  private BondExpression readBondExpression() {
    int start = pos;
    BondExpression expression = parseBondLowAnd();
    if (pos == start) {
      throw new StructureParseException("Invalid bond", start);
    }
    return expression;
  }

  // atom expressions: ';' < ',' < '&'/implicit < '!'

  private AtomExpression parseLowAnd(Function<Integer, AtomExpression> primitive) {
    List<AtomExpression> operands = new ArrayList<>();
    operands.add(parseOr(primitive));
    while (peek(0) == ';') {
      pos++;
      operands.add(parseOr(primitive));
    }
    return operands.size() == 1 ? operands.get(0) : new AtomExpression.And(operands);
  }

  private AtomExpression parseOr(Function<Integer, AtomExpression> primitive) {
    List<AtomExpression> operands = new ArrayList<>();
    operands.add(parseHighAnd(primitive));
    while (peek(0) == ',') {
      pos++;
      operands.add(parseHighAnd(primitive));
    }
    return operands.size() == 1 ? operands.get(0) : new AtomExpression.Or(operands);
  }

  private AtomExpression parseHighAnd(Function<Integer, AtomExpression> primitive) {
    List<AtomExpression> operands = new ArrayList<>();
    operands.add(parseNot(primitive));
    while (true) {
      char c = peek(0);
      if (c == '&') {
        pos++;
      } else if (c == ']' || c == ',' || c == ';' || c == '\0') {
        break;
      }
      operands.add(parseNot(primitive));
    }
    return operands.size() == 1 ? operands.get(0) : new AtomExpression.And(operands);
  }

  private AtomExpression parseNot(Function<Integer, AtomExpression> primitive) {
    if (peek(0) == '!') {
      pos++;
      return new AtomExpression.Not(parseNot(primitive));
    }
    return primitive.apply(pos);
  }

  private AtomExpression readAtomPrimitive(int start) {
    char c = peek(0);
    if (CharUtils.isAsciiNumeric(c)) {
      return new AtomExpression.Isotope(readNumber(0));
    }
    switch (c) {
      case '*' -> {
        pos++;
        return new AtomExpression.Any();
      }
      case 'a', 'A' -> {
        pos++;
        return new AtomExpression.Aromatic(c == 'a');
      }
      case '#' -> {
        pos++;
        if (!CharUtils.isAsciiNumeric(peek(0))) {
          throw new StructureParseException("Missing atomic number", start);
        }
        return new AtomExpression.Element(readNumber(0), null);
      }
      case 'H' -> {
        pos++;
        return new AtomExpression.HydrogenCount(readNumber(1));
      }
      case 'D' -> {
        pos++;
        return new AtomExpression.Degree(readNumber(1));
      }
      case 'X' -> {
        pos++;
        return new AtomExpression.Connectivity(readNumber(1));
      }
      case 'R' -> {
        pos++;
        return new AtomExpression.RingMembership(readNumber(-1));
      }
      case 'r' -> {
        pos++;
        int size = readNumber(-1);
        return size == 0 ? new AtomExpression.Not(new AtomExpression.RingSize(-1))
            : new AtomExpression.RingSize(size);
      }
      case 'x' -> {
        pos++;
        int count = readNumber(-1);
        return count < 0
            ? new AtomExpression.Not(new AtomExpression.RingConnectivity(0))
            : new AtomExpression.RingConnectivity(count);
      }
      case '+', '-' -> {
        return new AtomExpression.Charge(readCharge());
      }
      case '@' -> {
        while (peek(0) == '@') {
          pos++;
        }
        return new AtomExpression.Any();
      }
      default -> {
        return readElement(start);
      }
    }
  }

  private AtomExpression readElement(int start) {
    char c = peek(0);
    if (!Character.isLetter(c)) {
      throw new StructureParseException("Unexpected character '" + c + "'", start);
    }
    if (Character.isLowerCase(c)) {
      String two = pos + 1 < input.length() ? input.substring(pos, pos + 2) : "";
      if (two.equals("se") || two.equals("as") || two.equals("te")) {
        pos += 2;
        return new AtomExpression.Element(
            PeriodicTable.atomicNumber(StringUtils.capitalize(two)), true);
      }
      int number = PeriodicTable.atomicNumber(String.valueOf(Character.toUpperCase(c)));
      if (number < 0 || !PeriodicTable.canBeAromatic(number)) {
        throw new StructureParseException("Invalid aromatic symbol '" + c + "'", start);
      }
      pos++;
      return new AtomExpression.Element(number, true);
    }
    if (Character.isLowerCase(peek(1))) {
      int number = PeriodicTable.atomicNumber(input.substring(pos, pos + 2));
      if (number > 0) {
        pos += 2;
        return new AtomExpression.Element(number, false);
      }
    }
    int number = PeriodicTable.atomicNumber(String.valueOf(c));
    if (number <= 0) {
      throw new StructureParseException("Invalid atom symbol '" + c + "'", start);
    }
    pos++;
    return new AtomExpression.Element(number, false);
  }

  // bond expressions use the same precedence as atom expressions

  private BondExpression parseBondLowAnd() {
    List<BondExpression> operands = new ArrayList<>();
    operands.add(parseBondOr());
    while (peek(0) == ';') {
      pos++;
      operands.add(parseBondOr());
    }
    return operands.size() == 1 ? operands.get(0) : new BondExpression.And(operands);
  }

  private BondExpression parseBondOr() {
    List<BondExpression> operands = new ArrayList<>();
    operands.add(parseBondHighAnd());
    while (peek(0) == ',') {
      pos++;
      operands.add(parseBondHighAnd());
    }
    return operands.size() == 1 ? operands.get(0) : new BondExpression.Or(operands);
  }

  private BondExpression parseBondHighAnd() {
    List<BondExpression> operands = new ArrayList<>();
    operands.add(parseBondNot());
    while (true) {
      char c = peek(0);
      if (c == '&') {
        pos++;
      } else if (c == '\0' || "-=#$:~@!/\\".indexOf(c) < 0) {
        break;
      }
      operands.add(parseBondNot());
    }
    return operands.size() == 1 ? operands.get(0) : new BondExpression.And(operands);
  }

  private BondExpression parseBondNot() {
    if (peek(0) == '!') {
      pos++;
      return new BondExpression.Not(parseBondNot());
    }
    char c = peek(0);
    int start = pos++;
    return switch (c) {
      case '-', '/', '\\' -> new BondExpression.Order(BondOrder.SINGLE);
      case '=' -> new BondExpression.Order(BondOrder.DOUBLE);
      case '#' -> new BondExpression.Order(BondOrder.TRIPLE);
      case '$' -> new BondExpression.Order(BondOrder.QUADRUPLE);
      case ':' -> new BondExpression.Order(BondOrder.AROMATIC);
      case '~' -> new BondExpression.Any();
      case '@' -> new BondExpression.Ring();
      default -> throw new StructureParseException("Invalid bond primitive", start);
    };
  }

  private int readCharge() {
    char sign = peek(0);
    pos++;
    int magnitude = 1;
    if (CharUtils.isAsciiNumeric(peek(0))) {
      magnitude = readNumber(1);
    } else {
      while (peek(0) == sign) {
        magnitude++;
        pos++;
      }
    }
    return sign == '+' ? magnitude : -magnitude;
  }

  private int readNumber(int defaultValue) {
    int start = pos;
    while (CharUtils.isAsciiNumeric(peek(0))) {
      pos++;
    }
    if (pos == start) {
      return defaultValue;
    }
    if (pos - start > MAX_NUMBER_LENGTH) {
      throw new StructureParseException("Number out of range", start);
    }
    return Integer.parseInt(input.substring(start, pos));
  }

  private char peek(int offset) {
    int index = pos + offset;
    return index < input.length() ? input.charAt(index) : '\0';
  }
}
