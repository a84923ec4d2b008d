package com.quantori.faves.api.smiles;

import com.quantori.faves.api.StructureParseException;
import com.quantori.faves.api.model.Atom;
import com.quantori.faves.api.model.Bond;
import com.quantori.faves.api.model.BondOrder;
import com.quantori.faves.api.model.BondStereo;
import com.quantori.faves.api.model.Chirality;
import com.quantori.faves.api.model.Hydrogens;
import com.quantori.faves.api.model.Molecule;
import com.quantori.faves.api.model.PeriodicTable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.CharUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads SMILES line notation into a {@link Molecule}. Hydrogen counts of unbracketed atoms are
 * resolved from standard valences; aromaticity is taken as written.
 */
public final class SmilesParser {
  private static final int MAX_CHARGE = 15;
  private static final int MAX_NUMBER_LENGTH = 9;
  private static final int RING_SLOT = Integer.MIN_VALUE;

  private final String input;
  private int pos;
  private final List<AtomDraft> atoms = new ArrayList<>();
  private final List<BondDraft> bonds = new ArrayList<>();
  private final Set<Long> bonded = new HashSet<>();
  private final Deque<Integer> branches = new ArrayDeque<>();
  private final Map<Integer, RingOpening> openRings = new HashMap<>();
  private int previous = -1;
  private BondOrder pendingOrder;
  private BondStereo pendingStereo = BondStereo.NONE;
  private int pendingPosition = -1;

  private SmilesParser(String input) {
    this.input = input;
  }

  /**
   * Parses a SMILES string.
   *
   * @param smiles structure text
   * @return the molecular graph
   * @throws StructureParseException when the text is not valid SMILES or describes no atoms
   */
  public static Molecule parse(String smiles) {
    if (StringUtils.isBlank(smiles)) {
      throw new StructureParseException("Structure is empty");
    }
    return new SmilesParser(smiles.strip()).read();
  }

  private Molecule read() {
    while (pos < input.length()) {
      char c = input.charAt(pos);
      switch (c) {
        case '(' -> openBranch();
        case ')' -> closeBranch();
        case '-', '=', '#', '$', ':', '/', '\\' -> readBond(c);
        case '.' -> readDot();
        case '%', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> readRingBond();
        case '[' -> addAtom(readBracketAtom());
        default -> addAtom(readOrganicAtom());
      }
    }
    if (pendingPosition >= 0) {
      throw new StructureParseException("Dangling bond", pendingPosition);
    }
    if (!branches.isEmpty()) {
      throw new StructureParseException("Unbalanced parentheses", input.length());
    }
    if (!openRings.isEmpty()) {
      RingOpening ring = openRings.values().iterator().next();
      throw new StructureParseException("Unclosed ring bond", ring.position);
    }
    if (atoms.isEmpty()) {
      throw new StructureParseException("Structure contains no atoms");
    }
    return build();
  }

  private void openBranch() {
    if (previous < 0 || pendingPosition >= 0) {
      throw new StructureParseException("Branch does not follow an atom", pos);
    }
    branches.push(previous);
    pos++;
  }

  private void closeBranch() {
    if (branches.isEmpty()) {
      throw new StructureParseException("Unbalanced parentheses", pos);
    }
    if (pendingPosition >= 0) {
      throw new StructureParseException("Dangling bond", pendingPosition);
    }
    previous = branches.pop();
    pos++;
  }

  private void readBond(char c) {
    if (previous < 0 || pendingPosition >= 0) {
      throw new StructureParseException("Unexpected bond symbol", pos);
    }
    pendingOrder =
        switch (c) {
          case '=' -> BondOrder.DOUBLE;
          case '#' -> BondOrder.TRIPLE;
          case '$' -> BondOrder.QUADRUPLE;
          case ':' -> BondOrder.AROMATIC;
          default -> BondOrder.SINGLE;
        };
    pendingStereo = c == '/' ? BondStereo.UP : c == '\\' ? BondStereo.DOWN : BondStereo.NONE;
    pendingPosition = pos++;
  }

  private void readDot() {
    if (previous < 0 || pendingPosition >= 0) {
      throw new StructureParseException("Unexpected fragment separator", pos);
    }
    previous = -1;
    pos++;
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
    RingOpening opening = openRings.remove(number);
    if (opening == null) {
      AtomDraft atom = atoms.get(previous);
      openRings.put(
          number,
          new RingOpening(previous, pendingOrder, pendingStereo, atom.order.size(), start));
      atom.order.add(RING_SLOT);
    } else {
      if (opening.atom == previous) {
        throw new StructureParseException("Ring bond to the same atom", start);
      }
      BondOrder order = opening.order;
      if (pendingOrder != null) {
        if (order != null && order != pendingOrder) {
          throw new StructureParseException("Conflicting ring bond orders", start);
        }
        order = pendingOrder;
      }
      BondStereo stereo = pendingStereo != BondStereo.NONE ? pendingStereo : opening.stereo;
      addBond(opening.atom, previous, order, stereo, start);
      atoms.get(opening.atom).order.set(opening.slot, previous);
      atoms.get(previous).order.add(opening.atom);
    }
    clearPending();
  }

  private AtomDraft readOrganicAtom() {
    int start = pos;
    char c = input.charAt(pos);
    AtomDraft atom = new AtomDraft(start);
    if (c == '*') {
      pos++;
      atom.atomicNumber = 0;
      return atom;
    }
    String symbol;
    if ((c == 'C' && peek(1) == 'l') || (c == 'B' && peek(1) == 'r')) {
      symbol = input.substring(pos, pos + 2);
      pos += 2;
    } else {
      symbol = String.valueOf(c);
      pos++;
    }
    if (Character.isLowerCase(symbol.charAt(0))) {
      atom.aromatic = true;
      symbol = StringUtils.capitalize(symbol);
    }
    int number = PeriodicTable.atomicNumber(symbol);
    if (number < 0 || !PeriodicTable.isOrganicSubset(number)
        || (atom.aromatic && !PeriodicTable.canBeAromatic(number))) {
      throw new StructureParseException("Invalid atom symbol '" + c + "'", start);
    }
    atom.atomicNumber = number;
    return atom;
  }

  private AtomDraft readBracketAtom() {
    int start = pos++;
    AtomDraft atom = new AtomDraft(start);
    atom.bracket = true;
    atom.isotope = readNumber(0);
    readBracketSymbol(atom);
    if (peek(0) == '@') {
      pos++;
      atom.chirality = Chirality.ANTICLOCKWISE;
      if (peek(0) == '@') {
        pos++;
        atom.chirality = Chirality.CLOCKWISE;
      }
    }
    atom.hydrogens = 0;
    if (peek(0) == 'H') {
      pos++;
      atom.hydrogens = CharUtils.isAsciiNumeric(peek(0)) ? input.charAt(pos++) - '0' : 1;
    }
    atom.charge = readCharge();
    if (peek(0) == ':') {
      pos++;
      if (!CharUtils.isAsciiNumeric(peek(0))) {
        throw new StructureParseException("Invalid atom class", pos);
      }
      readNumber(0);
    }
    if (peek(0) != ']') {
      throw new StructureParseException("Unclosed or invalid bracket atom", start);
    }
    pos++;
    return atom;
  }

  private void readBracketSymbol(AtomDraft atom) {
    char c = peek(0);
    if (c == '*') {
      pos++;
      atom.atomicNumber = 0;
      return;
    }
    if (!Character.isLetter(c)) {
      throw new StructureParseException("Missing element symbol", pos);
    }
    if (Character.isLowerCase(c)) {
      atom.aromatic = true;
      String two = pos + 1 < input.length() ? input.substring(pos, pos + 2) : "";
      if (two.equals("se") || two.equals("as") || two.equals("te")) {
        atom.atomicNumber = PeriodicTable.atomicNumber(StringUtils.capitalize(two));
        pos += 2;
        return;
      }
      int number = PeriodicTable.atomicNumber(String.valueOf(Character.toUpperCase(c)));
      if (number < 0 || !PeriodicTable.canBeAromatic(number)) {
        throw new StructureParseException("Invalid aromatic symbol '" + c + "'", pos);
      }
      atom.atomicNumber = number;
      pos++;
      return;
    }
    if (Character.isLowerCase(peek(1))) {
      int number = PeriodicTable.atomicNumber(input.substring(pos, pos + 2));
      if (number > 0) {
        atom.atomicNumber = number;
        pos += 2;
        return;
      }
    }
    int number = PeriodicTable.atomicNumber(String.valueOf(c));
    if (number <= 0) {
      throw new StructureParseException("Invalid atom symbol '" + c + "'", pos);
    }
    atom.atomicNumber = number;
    pos++;
  }

  private int readCharge() {
    char sign = peek(0);
    if (sign != '+' && sign != '-') {
      return 0;
    }
    int start = pos++;
    int magnitude = 1;
    if (CharUtils.isAsciiNumeric(peek(0))) {
      magnitude = readNumber(0);
    } else {
      while (peek(0) == sign) {
        magnitude++;
        pos++;
      }
    }
    if (magnitude > MAX_CHARGE) {
      throw new StructureParseException("Charge out of range", start);
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

  private void addAtom(AtomDraft atom) {
    int index = atoms.size();
    atoms.add(atom);
    if (previous >= 0) {
      addBond(previous, index, pendingOrder, pendingStereo, pendingPosition);
      atoms.get(previous).order.add(index);
      atom.order.add(previous);
    }
    atom.implicitSlot = atom.order.size();
    if (atom.bracket && atom.hydrogens > 0) {
      atom.order.add(-1);
    }
    previous = index;
    clearPending();
  }

  private void addBond(int begin, int end, BondOrder order, BondStereo stereo, int position) {
    long key = begin < end ? ((long) begin << 32) | end : ((long) end << 32) | begin;
    if (!bonded.add(key)) {
      throw new StructureParseException("Duplicate bond between the same atoms", position);
    }
    bonds.add(new BondDraft(begin, end, order, stereo));
  }

  private void clearPending() {
    pendingOrder = null;
    pendingStereo = BondStereo.NONE;
    pendingPosition = -1;
  }

  private Molecule build() {
    List<Bond> resolved = new ArrayList<>(bonds.size());
    for (BondDraft draft : bonds) {
      BondOrder order = draft.order;
      if (order == null) {
        order =
            atoms.get(draft.begin).aromatic && atoms.get(draft.end).aromatic
                ? BondOrder.AROMATIC
                : BondOrder.SINGLE;
      }
      resolved.add(
          Bond.builder()
              .begin(draft.begin)
              .end(draft.end)
              .order(order)
              .stereo(draft.stereo)
              .build());
    }
    List<Atom> skeleton = new ArrayList<>(atoms.size());
    for (AtomDraft draft : atoms) {
      skeleton.add(Atom.builder().atomicNumber(draft.atomicNumber).build());
    }
    Molecule rings = new Molecule(skeleton, resolved);
    for (int b = 0; b < resolved.size(); b++) {
      if (bonds.get(b).order == null
          && resolved.get(b).getOrder() == BondOrder.AROMATIC
          && !rings.isRingBond(b)) {
        resolved.set(b, resolved.get(b).toBuilder().order(BondOrder.SINGLE).build());
      }
    }
    List<Atom> result = new ArrayList<>(atoms.size());
    for (int i = 0; i < atoms.size(); i++) {
      AtomDraft draft = atoms.get(i);
      if (draft.aromatic && !rings.isRingAtom(i)) {
        throw new StructureParseException("Aromatic atom outside of a ring", draft.position);
      }
      int valence = 0;
      for (int b : rings.incidentBonds(i)) {
        valence += resolved.get(b).getOrder().getValence();
      }
      result.add(toAtom(draft, valence));
    }
    return new Molecule(result, resolved);
  }

  private Atom toAtom(AtomDraft draft, int valence) {
    int hydrogens = draft.hydrogens;
    if (!draft.bracket) {
      hydrogens = draft.atomicNumber == 0
          ? 0
          : Hydrogens.implicitCount(draft.atomicNumber, draft.aromatic, valence);
      if (hydrogens < 0) {
        throw new StructureParseException("Valence exceeded", draft.position);
      }
    } else if (draft.charge == 0 && !draft.aromatic) {
      int[] valences = PeriodicTable.standardValences(draft.atomicNumber);
      if (valences.length > 0 && valence + hydrogens > valences[valences.length - 1]) {
        throw new StructureParseException("Valence exceeded", draft.position);
      }
    }
    Atom.AtomBuilder builder =
        Atom.builder()
            .atomicNumber(draft.atomicNumber)
            .charge(draft.charge)
            .isotope(draft.isotope)
            .hydrogenCount(hydrogens)
            .aromatic(draft.aromatic)
            .chirality(draft.chirality);
    if (draft.chirality != Chirality.NONE) {
      List<Integer> neighbors = new ArrayList<>(draft.order);
      if (neighbors.size() == 3 && !neighbors.contains(-1)) {
        // lone pair sits where an implicit hydrogen would be written
        neighbors.add(draft.implicitSlot, -1);
      }
      builder.stereoNeighbors(List.copyOf(neighbors));
    }
    return builder.build();
  }

  private static final class AtomDraft {
    final int position;
    final List<Integer> order = new ArrayList<>(4);
    int atomicNumber;
    int charge;
    int isotope;
    int hydrogens = -1;
    int implicitSlot;
    boolean aromatic;
    boolean bracket;
    Chirality chirality = Chirality.NONE;

    AtomDraft(int position) {
      this.position = position;
    }
  }

  private record BondDraft(int begin, int end, BondOrder order, BondStereo stereo) {}

  private record RingOpening(
      int atom, BondOrder order, BondStereo stereo, int slot, int position) {}
}
