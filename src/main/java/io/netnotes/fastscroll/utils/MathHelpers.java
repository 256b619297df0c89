package io.netnotes.fastscroll.utils;

public class MathHelpers {

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }

    /**
     * Scaled-pixel to pixel conversion, rounded to the nearest whole pixel
     */
    public static int spToPx(int sp, float scaledDensity) {
        return Math.round(sp * scaledDensity);
    }

    public static int dpToPx(int dp, float density) {
        return Math.round(dp * density);
    }
}
