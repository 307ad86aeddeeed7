package NFAReduce;

import NFAReduce.Model.LabeledNFA;
import NFAReduce.Model.ReducibleNFA;
import NFAReduce.Model.StateLabels;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.serialization.ba.BAWriter;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class BAFormat {
    /*
    BA files: an optional initial state line, "symbol,[p]->[q]" transitions, then the accepting states.
    Without an initial state line, the source of the first transition is initial.
    Without accepting state lines, every state accepts.
    Reading keeps the state names (frequency files refer to them); writing is done by Automatalib's BAWriter.
     */
    private static final String LABEL = "\\[?([^\\[\\],\\s]+)]?";
    private static final Pattern TRANSITION = Pattern.compile("(.+),\\s*" + LABEL + "\\s*->\\s*" + LABEL);
    private static final Pattern STATE = Pattern.compile(LABEL);

    public static LabeledNFA read(BufferedReader reader) throws IOException {
        final List<String[]> transitions = new ArrayList<>();
        final List<String> accepting = new ArrayList<>();
        String initial = null;
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            Matcher m = TRANSITION.matcher(line);
            if (m.matches()) {
                transitions.add(new String[]{m.group(1).trim(), m.group(2), m.group(3)});
                continue;
            }
            m = STATE.matcher(line);
            if (!m.matches()) {
                throw new IllegalArgumentException("invalid BA syntax at line " + lineNo + ": " + line);
            }
            if (!transitions.isEmpty()) {
                accepting.add(m.group(1));
            } else if (initial == null) {
                initial = m.group(1);
            } else {
                throw new IllegalArgumentException("expected exactly one initial state, found another at line " + lineNo);
            }
        }
        if (initial == null) {
            if (transitions.isEmpty()) {
                throw new IllegalArgumentException("no states in BA input");
            }
            initial = transitions.get(0)[1];
        }

        final SortedSet<String> symbols = new TreeSet<>();
        for (String[] t : transitions) {
            symbols.add(t[0]);
        }
        final Object2IntMap<String> symbolValue = symbolValues(symbols);
        int alphSize = 1;
        for (int v : symbolValue.values()) {
            alphSize = Math.max(alphSize, v + 1);
        }

        final ReducibleNFA<Integer> nfa = new ReducibleNFA<>(Alphabets.integers(0, alphSize - 1));
        final StateLabels labels = new StateLabels();
        nfa.setInitial(state(nfa, labels, initial));
        for (String[] t : transitions) {
            final int src = state(nfa, labels, t[1]);
            final int tgt = state(nfa, labels, t[2]);
            nfa.addTransition(src, symbolValue.getInt(t[0]), tgt);
        }
        for (String f : accepting) {
            nfa.setFinal(state(nfa, labels, f), true);
        }
        if (accepting.isEmpty()) {
            for (int s : nfa.getStates()) {
                nfa.setFinal(s, true);
            }
        }
        return new LabeledNFA(nfa, labels);
    }

    public static LabeledNFA read(InputStream is) throws IOException {
        return read(new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8)));
    }

    private static int state(ReducibleNFA<Integer> nfa, StateLabels labels, String label) {
        int s = labels.state(label);
        if (s == ReducibleNFA.NO_STATE) {
            s = nfa.addState(false);
            labels.put(label, s);
        }
        return s;
    }

    /**
     * Numeric symbols keep their value; otherwise (or if two symbols share a value) symbols are numbered in order.
     */
    private static Object2IntMap<String> symbolValues(SortedSet<String> symbols) {
        final Object2IntMap<String> values = new Object2IntOpenHashMap<>();
        final IntSet seen = new IntOpenHashSet();
        boolean numeric = true;
        for (String symbol : symbols) {
            try {
                final int v = Integer.parseInt(symbol);
                if (v < 0 || !seen.add(v)) {
                    numeric = false;
                    break;
                }
                values.put(symbol, v);
            } catch (NumberFormatException ex) {
                numeric = false;
                break;
            }
        }
        if (!numeric) {
            values.clear();
            int index = 0;
            for (String symbol : symbols) {
                values.put(symbol, index++);
            }
        }
        return values;
    }

    /**
     * Copy into a CompactNFA, numbering the states 0..n-1 in ascending order.
     */
    public static <I> CompactNFA<I> toCompactNFA(ReducibleNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final CompactNFA<I> out = new CompactNFA<>(alphabet, nfa.size());
        final Int2IntMap renumber = new Int2IntOpenHashMap();
        for (int s : nfa.getStates()) {
            renumber.put(s, (int) out.addState(nfa.isFinal(s)));
        }
        out.setInitial(renumber.get(nfa.getInitialState()), true);
        for (int s : nfa.getStates()) {
            for (I a : alphabet) {
                for (int t : nfa.getTransitions(s, a)) {
                    out.addTransition(renumber.get(s), a, renumber.get(t));
                }
            }
        }
        return out;
    }

    public static <I> void writeBA(OutputStream os, ReducibleNFA<I> nfa) throws IOException {
        final CompactNFA<I> out = toCompactNFA(nfa);
        final BAWriter<I> baWriter = new BAWriter<>();
        baWriter.writeModel(os, out, out.getInputAlphabet());
    }

    static LabeledNFA getBAFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is);
        } catch (IOException ex) {
            throw new UncheckedIOException("error loading NFA '" + filePath + "'", ex);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("error loading NFA '" + filePath + "': " + ex.getMessage(), ex);
        }
    }

    static <I> void writeBAFile(String filePath, ReducibleNFA<I> nfa) {
        try (OutputStream os = new FileOutputStream(filePath)) {
            writeBA(os, nfa);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write NFA '" + filePath + "'", e);
        }
    }
}
