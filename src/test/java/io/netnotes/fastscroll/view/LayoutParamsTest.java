package io.netnotes.fastscroll.view;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class LayoutParamsTest {

    @Test
    public void testParseSize() {
        assertEquals(LayoutParams.MATCH_PARENT, LayoutParams.parseSize("match_parent", 1f, 1f));
        assertEquals(LayoutParams.MATCH_PARENT, LayoutParams.parseSize("fill_parent", 1f, 1f));
        assertEquals(LayoutParams.WRAP_CONTENT, LayoutParams.parseSize(" WRAP_CONTENT ", 1f, 1f));
        assertEquals(120, LayoutParams.parseSize("120px", 2f, 2f));
        assertEquals(120, LayoutParams.parseSize("120", 2f, 2f));
        assertEquals(0, LayoutParams.parseSize("0", 1f, 1f));
    }

    @Test
    public void testParseScaledSizes() {
        assertEquals(640, LayoutParams.parseSize("320dp", 2f, 2.5f));
        assertEquals(50, LayoutParams.parseSize("20sp", 2f, 2.5f));
        assertEquals(320, LayoutParams.parseSize("320DP", 1f, 1f));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseGarbage() {
        LayoutParams.parseSize("tall", 1f, 1f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseNegativeDp() {
        LayoutParams.parseSize("-10dp", 1f, 1f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeSizeRejected() {
        new LayoutParams(-3, LayoutParams.MATCH_PARENT);
    }

    @Test
    public void testEquality() {
        assertEquals(new LayoutParams(LayoutParams.MATCH_PARENT, 40), new LayoutParams(-1, 40));
        assertEquals(new LayoutParams(1, 2).hashCode(), new LayoutParams(1, 2).hashCode());
        assertNotEquals(new LayoutParams(1, 2), new LayoutParams(2, 1));
        assertEquals("LayoutParams[match_parent x wrap_content]",
            new LayoutParams(LayoutParams.MATCH_PARENT, LayoutParams.WRAP_CONTENT).toString());
    }
}
