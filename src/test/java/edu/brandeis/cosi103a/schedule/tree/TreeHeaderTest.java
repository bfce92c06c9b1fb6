package edu.brandeis.cosi103a.schedule.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TreeHeaderTest {

    @Test
    void parse_acceptsPaddedAndPartialHeaders() throws Exception {
        assertEquals(new TreeHeader(8, 3, 120, false), TreeHeader.parse("# teams=8 weeks=3 count=120          "));
        assertEquals(new TreeHeader(8, 3, 7, true), TreeHeader.parse("# teams=8 weeks=3 count=7 (partial)"));
    }

    @Test
    void format_keepsFixedWidthWhateverTheCount() {
        TreeHeader small = new TreeHeader(8, 3, 0, true);
        TreeHeader large = small.withCount(9_999_999_999L, false);
        assertEquals(small.format().length(), large.format().length());
    }

    @Test
    void parse_rejectsGarbage() {
        assertThrows(TreeFormatException.class, () -> TreeHeader.parse("# teams=eight weeks=3 count=0"));
        assertThrows(TreeFormatException.class, () -> TreeHeader.parse(null));
    }
}
