package io.netnotes.fastscroll.view;

/**
 * Attribute names understood by the fast scroll widgets.
 */
public final class StyleAttr {
    // view
    public static final String ID                 = "id";
    public static final String LAYOUT_WIDTH       = "layout_width";
    public static final String LAYOUT_HEIGHT      = "layout_height";
    public static final String ENABLED            = "enabled";

    // list
    public static final String ITEM_HEIGHT        = "itemHeight";

    // fast scroller
    public static final String BUBBLE_COLOR       = "bubbleColor";
    public static final String BUBBLE_SIZE        = "bubbleSize";
    public static final String BUBBLE_TEXT_COLOR  = "bubbleTextColor";
    public static final String BUBBLE_TEXT_SIZE   = "bubbleTextSize";
    public static final String HANDLE_COLOR       = "handleColor";
    public static final String HANDLE_HEIGHT      = "handleHeight";
    public static final String TRACK_COLOR        = "trackColor";
    public static final String HIDE_SCROLLBAR     = "hideScrollbar";
    public static final String SHOW_BUBBLE        = "showBubble";
    public static final String SHOW_BUBBLE_ALWAYS = "showBubbleAlways";
    public static final String SHOW_TRACK         = "showTrack";

    private StyleAttr() {}
}
