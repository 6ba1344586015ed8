package com.example.cuneiform.pipeline.cdl;

import com.example.cuneiform.pipeline.SpecialToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Flattens an annotation tree into its reading-order text tokens and the languages it uses.
 */
public final class TreeWalker {

    private static final Pattern SPACES_AROUND_NEWLINE = Pattern.compile(" *\n *");
    private static final Pattern NEWLINES = Pattern.compile("\n+");
    private static final Pattern SPACES = Pattern.compile(" +");
    private static final Pattern SURFACE_SPLIT = Pattern.compile(Pattern.quote(SpecialToken.SURFACE.placeholder()));

    /**
     * Walks the nodes depth-first, left to right.
     */
    public WalkResult walk(List<CdlNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        List<String> tokens = new ArrayList<>();
        Set<String> languages = new TreeSet<>();
        collect(nodes, tokens, languages);
        return new WalkResult(tokens, languages);
    }

    /**
     * Produces the raw transliteration of a record: the walked tokens joined with spaces, split into
     * surfaces, with surfaces lacking any text dropped and whitespace runs collapsed.
     */
    public String transliteration(List<CdlNode> nodes) {
        return transliteration(walk(nodes));
    }

    public String transliteration(WalkResult walk) {
        return assemble(walk.tokens());
    }

    static String assemble(List<String> tokens) {
        String joined = String.join(" ", tokens);

        List<String> surfaces = new ArrayList<>();
        for (String surface : SURFACE_SPLIT.split(joined, -1)) {
            String trimmed = surface.strip();
            if (!SpecialToken.withoutPlaceholders(trimmed).isEmpty()) {
                surfaces.add(trimmed);
            }
        }

        String text = "";
        if (!surfaces.isEmpty()) {
            String separator = "\n" + SpecialToken.SURFACE.placeholder() + "\n";
            text = SpecialToken.SURFACE.placeholder() + "\n" + String.join(separator, surfaces);
        }
        text = SPACES_AROUND_NEWLINE.matcher(text).replaceAll("\n");
        text = NEWLINES.matcher(text).replaceAll("\n");
        text = SPACES.matcher(text).replaceAll(" ");
        return text.strip();
    }

    /**
     * Text contributed by a single non-chunk node, if any.
     */
    public static Optional<String> textOf(CdlNode node) {
        switch (node.kind()) {
            case DISCONTINUITY:
                return ((Discontinuity) node).toText();
            case LEMMA:
                Lemma lemma = (Lemma) node;
                String ideal = BracketRepair.idealSequence(lemma.form().graphemes());
                String text = BracketRepair.repair(lemma.literalText(), ideal);
                return text.isEmpty() ? Optional.empty() : Optional.of(text);
            default:
                return Optional.empty();
        }
    }

    private void collect(List<CdlNode> nodes, List<String> tokens, Set<String> languages) {
        for (CdlNode node : nodes) {
            switch (node.kind()) {
                case CHUNK:
                    collect(((Chunk) node).children(), tokens, languages);
                    break;
                case LEMMA:
                    textOf(node).ifPresent(tokens::add);
                    String language = ((Lemma) node).language();
                    if (!language.isEmpty()) {
                        languages.add(language);
                    }
                    break;
                case DISCONTINUITY:
                    textOf(node).ifPresent(tokens::add);
                    break;
                case LINK_GROUP:
                case LINKBASE:
                    break;
                default:
                    throw new CdlFormatException("Unsupported node type: " + node.kind());
            }
        }
    }

    /**
     * Ordered tokens and the sorted set of language codes seen on lemmas.
     */
    public record WalkResult(List<String> tokens, Set<String> languages) {

        public WalkResult {
            tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
            languages = Collections.unmodifiableSet(new TreeSet<>(languages));
        }

        public String languageList() {
            return String.join(", ", languages);
        }
    }
}
