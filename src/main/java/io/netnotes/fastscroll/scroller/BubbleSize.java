package io.netnotes.fastscroll.scroller;

/**
 * Size presets for the section bubble.
 */
public enum BubbleSize {
    NORMAL(88, 32),
    SMALL(56, 20);

    private final int diameterDp;
    private final int defaultTextSizeSp;

    private BubbleSize(int diameterDp, int defaultTextSizeSp) {
        this.diameterDp = diameterDp;
        this.defaultTextSizeSp = defaultTextSizeSp;
    }

    public int getDiameterDp() {
        return diameterDp;
    }

    public int getDefaultTextSizeSp() {
        return defaultTextSizeSp;
    }
}
