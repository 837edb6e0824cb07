package ai.docsite.latex.inline;

import ai.docsite.latex.ast.Emphasis;
import ai.docsite.latex.ast.Inline;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Pairs {@code *} and {@code _} delimiter runs into emphasis nodes. Closers are matched against the nearest
 * compatible opener, so innermost pairs resolve first; a run of two or more on both sides produces strong emphasis.
 */
final class EmphasisResolver {

    private sealed interface Token permits Chars, Delimiter, Atom {
    }

    private record Chars(String value) implements Token {
    }

    private record Atom(Inline inline) implements Token {
    }

    private static final class Delimiter implements Token {
        private final char symbol;
        private int count;
        private final boolean canOpen;
        private final boolean canClose;

        private Delimiter(char symbol, int count, boolean canOpen, boolean canClose) {
            this.symbol = symbol;
            this.count = count;
            this.canOpen = canOpen;
            this.canClose = canClose;
        }
    }

    private final Function<String, List<Inline>> textRules;

    EmphasisResolver(Function<String, List<Inline>> textRules) {
        this.textRules = textRules;
    }

    /**
     * @param text  flattened run; positions listed in {@code atoms} stand for already resolved nodes
     * @param atoms resolved nodes keyed by their position in {@code text}
     */
    List<Inline> resolve(String text, Map<Integer, Inline> atoms) {
        List<Token> tokens = tokenize(text, atoms);
        List<Integer> openers = new ArrayList<>();
        for (int index = 0; index < tokens.size(); index++) {
            if (!(tokens.get(index) instanceof Delimiter closer)) {
                continue;
            }
            if (closer.canClose) {
                index = closeAgainstOpeners(tokens, openers, index, closer);
            }
            if (closer.count > 0 && closer.canOpen) {
                openers.add(index);
            }
        }
        return finish(tokens);
    }

    private int closeAgainstOpeners(List<Token> tokens, List<Integer> openers, int closerIndex, Delimiter closer) {
        int index = closerIndex;
        while (closer.count > 0) {
            int stackPosition = nearestOpener(tokens, openers, closer.symbol);
            if (stackPosition < 0) {
                break;
            }
            int openerIndex = openers.get(stackPosition);
            Delimiter opener = (Delimiter) tokens.get(openerIndex);
            int used = opener.count >= 2 && closer.count >= 2 ? 2 : 1;
            while (openers.size() > stackPosition + 1) {
                openers.remove(openers.size() - 1);
            }
            List<Token> between = tokens.subList(openerIndex + 1, index);
            List<Inline> children = finish(between);
            between.clear();
            tokens.add(openerIndex + 1, new Atom(new Emphasis(used == 2, children)));
            index = openerIndex + 2;
            opener.count -= used;
            closer.count -= used;
            if (opener.count == 0) {
                openers.remove(stackPosition);
            }
        }
        return index;
    }

    private static int nearestOpener(List<Token> tokens, List<Integer> openers, char symbol) {
        for (int i = openers.size() - 1; i >= 0; i--) {
            Delimiter candidate = (Delimiter) tokens.get(openers.get(i));
            if (candidate.symbol == symbol && candidate.count > 0) {
                return i;
            }
        }
        return -1;
    }

    private List<Inline> finish(List<Token> tokens) {
        List<Inline> result = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (Token token : tokens) {
            if (token instanceof Chars chars) {
                pending.append(chars.value());
            } else if (token instanceof Delimiter delimiter) {
                pending.append(String.valueOf(delimiter.symbol).repeat(delimiter.count));
            } else if (token instanceof Atom atom) {
                flush(pending, result);
                result.add(atom.inline());
            }
        }
        flush(pending, result);
        return result;
    }

    private void flush(StringBuilder pending, List<Inline> result) {
        if (pending.length() > 0) {
            result.addAll(textRules.apply(pending.toString()));
            pending.setLength(0);
        }
    }

    private static List<Token> tokenize(String text, Map<Integer, Inline> atoms) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder chars = new StringBuilder();
        int index = 0;
        while (index < text.length()) {
            Inline atom = atoms.get(index);
            if (atom != null) {
                flushChars(chars, tokens);
                tokens.add(new Atom(atom));
                index++;
                continue;
            }
            char ch = text.charAt(index);
            if (ch == '\\' && index + 1 < text.length() && isDelimiter(text.charAt(index + 1))
                    && !atoms.containsKey(index + 1)) {
                chars.append(ch).append(text.charAt(index + 1));
                index += 2;
                continue;
            }
            if (!isDelimiter(ch)) {
                chars.append(ch);
                index++;
                continue;
            }
            int end = index;
            while (end < text.length() && text.charAt(end) == ch && !atoms.containsKey(end)) {
                end++;
            }
            int before = index == 0 ? ' ' : classOf(text, index - 1, atoms);
            int after = end == text.length() ? ' ' : classOf(text, end, atoms);
            boolean canOpen = !Character.isWhitespace(after);
            boolean canClose = !Character.isWhitespace(before);
            if (ch == '_') {
                canOpen = canOpen && !Character.isLetterOrDigit(before);
                canClose = canClose && !Character.isLetterOrDigit(after);
            }
            if (canOpen || canClose) {
                flushChars(chars, tokens);
                tokens.add(new Delimiter(ch, end - index, canOpen, canClose));
            } else {
                chars.append(text, index, end);
            }
            index = end;
        }
        flushChars(chars, tokens);
        return tokens;
    }

    // resolved nodes count as punctuation when deciding whether a delimiter can open or close
    private static int classOf(String text, int index, Map<Integer, Inline> atoms) {
        return atoms.containsKey(index) ? '.' : text.charAt(index);
    }

    private static boolean isDelimiter(char ch) {
        return ch == '*' || ch == '_';
    }

    private static void flushChars(StringBuilder chars, List<Token> tokens) {
        if (chars.length() > 0) {
            tokens.add(new Chars(chars.toString()));
            chars.setLength(0);
        }
    }
}
