package com.example.cuneiform.pipeline.cdl;

import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TreeWalkerTest {

    private final TreeWalker walker = new TreeWalker();

    @Test
    void walksDocumentInOrder() throws Exception {
        List<CdlNode> nodes = new CdlParser().parseFile(resource("/corpus/P000001.json"));

        TreeWalker.WalkResult result = walker.walk(nodes);

        assertEquals(List.of("#SURFACE#", "\n", "lugal-la-ka", "[x]", "\n", "2(diš)", "udu",
                "#SURFACE#", "\n#MISSING#\n"), result.tokens());
        assertEquals("sux", result.languageList());
        assertEquals("#SURFACE#\nlugal-la-ka [x]\n2(diš) udu", walker.transliteration(result));
    }

    @Test
    void languagesAreSortedAndJoined() throws Exception {
        List<CdlNode> nodes = new CdlParser().parseFile(resource("/corpus/P000005.json"));

        assertEquals("qpn, sux", walker.walk(nodes).languageList());
    }

    @Test
    void emptySurfacesAreDropped() {
        String text = TreeWalker.assemble(List.of("#SURFACE#", "\n#MISSING#\n", "#SURFACE#", "\n", "a",
                "b", "#SURFACE#", "\n#RULING#\n"));

        assertEquals("#SURFACE#\na b", text);
    }

    @Test
    void surfacesAreSeparatedByMarkers() {
        String text = TreeWalker.assemble(List.of("#SURFACE#", "\n", "a", "\n", "\n", "#SURFACE#", "b  c"));

        assertEquals("#SURFACE#\na\n#SURFACE#\nb c", text);
    }

    @Test
    void noSurfaceMeansNoText() {
        assertEquals("", TreeWalker.assemble(List.of()));
        assertEquals("", TreeWalker.assemble(List.of("#SURFACE#", "\n#BLANK_SPACE#\n")));
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(TreeWalkerTest.class.getResource(name).toURI());
    }
}
