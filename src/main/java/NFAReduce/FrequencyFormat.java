package NFAReduce;

import NFAReduce.Model.ReducibleNFA;
import NFAReduce.Model.StateFrequencies;
import NFAReduce.Model.StateLabels;
import it.unimi.dsi.fastutil.ints.Int2LongMap;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Precomputed packet frequencies: one "state count" pair per line, '#' starts a comment.
 * States are named as in the automaton file.
 */
public class FrequencyFormat {
    public static StateFrequencies read(BufferedReader reader, ReducibleNFA<?> nfa, StateLabels labels) throws IOException {
        final StateFrequencies freq = new StateFrequencies();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            final int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            final String[] fields = line.split("\\s+");
            final long count;
            try {
                if (fields.length != 2) {
                    throw new NumberFormatException("expected 2 fields, found " + fields.length);
                }
                count = Long.parseLong(fields[1]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("invalid state labels syntax at line " + lineNo + ": " + ex.getMessage(), ex);
            }
            final int state = labels.state(fields[0]);
            if (state == ReducibleNFA.NO_STATE || !nfa.isState(state)) {
                throw new IllegalArgumentException("invalid NFA state at line " + lineNo + ": " + fields[0]);
            }
            freq.put(state, count);
        }
        return freq;
    }

    public static StateFrequencies read(Path path, ReducibleNFA<?> nfa, StateLabels labels) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, nfa, labels);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read state frequencies '" + path + "'", e);
        }
    }

    public static void write(Writer writer, StateFrequencies freq, StateLabels labels) throws IOException {
        for (Int2LongMap.Entry e : freq.asMap().int2LongEntrySet()) {
            writer.write(labels.label(e.getIntKey()) + " " + e.getLongValue() + "\n");
        }
    }

    public static void write(Path path, StateFrequencies freq, StateLabels labels) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer, freq, labels);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write state frequencies '" + path + "'", e);
        }
    }
}
