package NFAReduce;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.word.Word;
import net.automatalib.word.WordBuilder;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Traffic samples: one word per line, each symbol given by its index in the alphabet, whitespace separated.
 * Blank lines are empty words; lines starting with '#' are skipped.
 */
public class TraceFormat {
    public static <I> List<Word<I>> read(BufferedReader reader, Alphabet<I> alphabet) throws IOException {
        final List<Word<I>> words = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.startsWith("#")) {
                continue;
            }
            final WordBuilder<I> wb = new WordBuilder<>();
            if (!line.isEmpty()) {
                for (String token : line.split("\\s+")) {
                    final int index;
                    try {
                        index = Integer.parseInt(token);
                    } catch (NumberFormatException ex) {
                        throw new IllegalArgumentException("invalid symbol '" + token + "' at line " + lineNo, ex);
                    }
                    if (index < 0 || index >= alphabet.size()) {
                        throw new IllegalArgumentException("symbol " + index + " at line " + lineNo
                            + " is outside the alphabet of size " + alphabet.size());
                    }
                    wb.append(alphabet.getSymbol(index));
                }
            }
            words.add(wb.toWord());
        }
        return words;
    }

    public static <I> List<Word<I>> read(Path path, Alphabet<I> alphabet) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, alphabet);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read traces '" + path + "'", e);
        }
    }
}
