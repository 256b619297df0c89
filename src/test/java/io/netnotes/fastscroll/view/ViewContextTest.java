package io.netnotes.fastscroll.view;

import org.junit.Test;

import io.netnotes.fastscroll.scroller.BubbleSize;
import javafx.scene.paint.Color;

import static org.junit.Assert.*;

public class ViewContextTest {

    @Test
    public void testDefaultThemeFromClasspath() {
        ViewContext context = new ViewContext();
        assertEquals(FeatureLevel.CURRENT, context.getFeatureLevel());
        assertEquals(1f, context.getDensity(), 0f);
        assertEquals("FastScroll", context.getTheme().getBaseStyleName());
        assertNotNull(context.getTheme().getStyle("FastScroll.Small"));
        assertNull(context.getTheme().getStyle("FastScroll.Missing"));
    }

    @Test
    public void testLegacyTheme() {
        ViewContext context = new ViewContext(Theme.load("/legacy-theme.json"));
        assertEquals(19, context.getFeatureLevel());
        assertEquals(2f, context.getDensity(), 0f);
        assertEquals(2.5f, context.getScaledDensity(), 0f);
        assertFalse(FeatureLevel.supportsNestedScrolling(context.getFeatureLevel()));
    }

    @Test
    public void testFeatureLevelOverride() {
        ViewContext context = new ViewContext(Theme.load(), 16);
        assertEquals(16, context.getFeatureLevel());
    }

    @Test
    public void testMissingThemeFallsBackToDefaults() {
        Theme theme = Theme.load("/no-such-theme.json");
        assertEquals(FeatureLevel.CURRENT, theme.getFeatureLevel());
        assertEquals(1f, theme.getDensity(), 0f);
        assertNull(theme.getBaseStyle());
    }

    @Test
    public void testResolutionPrecedence() {
        ViewContext context = new ViewContext(Theme.load("/legacy-theme.json"));

        ResolvedStyle baseOnly = context.obtainStyledAttributes(null, null);
        assertEquals(Color.web("#00ff00"), baseOnly.getColor(StyleAttr.HANDLE_COLOR, Color.BLACK));

        ResolvedStyle named = context.obtainStyledAttributes(null, "Legacy.Red");
        assertEquals(Color.web("#ff0000"), named.getColor(StyleAttr.HANDLE_COLOR, Color.BLACK));
        assertFalse(named.getBoolean(StyleAttr.HIDE_SCROLLBAR, true));

        StyleAttributes attrs = StyleAttributes.builder().set(StyleAttr.HANDLE_COLOR, "#0000ff").build();
        ResolvedStyle declared = context.obtainStyledAttributes(attrs, "Legacy.Red");
        assertEquals(Color.web("#0000ff"), declared.getColor(StyleAttr.HANDLE_COLOR, Color.BLACK));
        assertEquals(18, declared.getInt(StyleAttr.BUBBLE_TEXT_SIZE, 0));

        assertEquals(Color.BLACK, declared.getColor(StyleAttr.TRACK_COLOR, Color.BLACK));
        assertFalse(declared.has(StyleAttr.TRACK_COLOR));
    }

    @Test
    public void testUnknownNamedStyleSkipped() {
        ViewContext context = new ViewContext(Theme.load("/legacy-theme.json"));
        ResolvedStyle style = context.obtainStyledAttributes(StyleAttributes.EMPTY, "Legacy.Blue");
        assertEquals(Color.web("#00ff00"), style.getColor(StyleAttr.HANDLE_COLOR, Color.BLACK));
    }

    @Test
    public void testDimensions() {
        ViewContext context = new ViewContext(Theme.load("/legacy-theme.json"));
        StyleAttributes attrs = StyleAttributes.builder()
            .set("a", "10px")
            .set("b", "10dp")
            .set("c", "10sp")
            .set("d", 10)
            .set("e", "ten")
            .build();
        ResolvedStyle style = context.obtainStyledAttributes(attrs, null);

        assertEquals(10, style.getDimensionPx("a", -1));
        assertEquals(20, style.getDimensionPx("b", -1));
        assertEquals(25, style.getDimensionPx("c", -1));
        assertEquals(20, style.getDimensionPx("d", -1));
        assertEquals(-1, style.getDimensionPx("e", -1));
        assertEquals(-1, style.getDimensionPx("missing", -1));
    }

    @Test
    public void testBadValuesFallBack() {
        StyleAttributes attrs = StyleAttributes.fromJson(
            "{\"handleColor\": \"not-a-color\", \"bubbleSize\": \"huge\", \"bubbleTextSize\": \"big\"}");
        ResolvedStyle style = new ViewContext().obtainStyledAttributes(attrs, null);

        assertEquals(Color.RED, style.getColor(StyleAttr.HANDLE_COLOR, Color.RED));
        assertEquals(BubbleSize.SMALL, style.getEnum(StyleAttr.BUBBLE_SIZE, BubbleSize.class, BubbleSize.SMALL));
        assertEquals(7, style.getInt(StyleAttr.BUBBLE_TEXT_SIZE, 7));
    }

    @Test
    public void testMalformedAttributeJsonIgnored() {
        StyleAttributes attrs = StyleAttributes.fromJson("{\"handleColor\": ");
        assertTrue(attrs.isEmpty());

        ResolvedStyle style = new ViewContext().obtainStyledAttributes(attrs, null);
        assertEquals(Color.web("#9e9e9e"), style.getColor(StyleAttr.HANDLE_COLOR, Color.BLACK));
    }

    @Test
    public void testEnumIgnoresCase() {
        StyleAttributes attrs = StyleAttributes.builder().set(StyleAttr.BUBBLE_SIZE, "small").build();
        ResolvedStyle style = new ViewContext().obtainStyledAttributes(attrs, null);
        assertEquals(BubbleSize.SMALL, style.getEnum(StyleAttr.BUBBLE_SIZE, BubbleSize.class, BubbleSize.NORMAL));
    }

    @Test
    public void testAttributeBag() {
        StyleAttributes attrs = StyleAttributes.builder()
            .set(StyleAttr.ID, "list")
            .set(StyleAttr.SHOW_TRACK, true)
            .build();
        assertTrue(attrs.has(StyleAttr.ID));
        assertEquals("list", attrs.getString(StyleAttr.ID));
        assertFalse(attrs.isEmpty());
        assertTrue(StyleAttributes.EMPTY.isEmpty());
        assertEquals(attrs.toJson(), StyleAttributes.fromJson(attrs.toJson()).toJson());
        assertTrue(StyleAttributes.fromJson((String) null).isEmpty());
    }
}
