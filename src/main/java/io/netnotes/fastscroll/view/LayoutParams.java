package io.netnotes.fastscroll.view;

import java.util.Objects;

import io.netnotes.fastscroll.utils.MathHelpers;

public class LayoutParams {
    public static final int MATCH_PARENT = -1;
    public static final int WRAP_CONTENT = -2;

    private final int width;
    private final int height;

    public LayoutParams(int width, int height) {
        this.width = checkSize(width, "width");
        this.height = checkSize(height, "height");
    }

    private static int checkSize(int size, String name) {
        if (size < WRAP_CONTENT) {
            throw new IllegalArgumentException("Invalid layout " + name + ": " + size);
        }
        return size;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    /**
     * Parses a layout dimension: "match_parent", "wrap_content", or a size in
     * "dp", "sp" or "px". A bare number is pixels.
     *
     * @throws IllegalArgumentException if the value is not a dimension
     */
    public static int parseSize(String value, float density, float scaledDensity) {
        if (value == null) {
            throw new IllegalArgumentException("Layout size is null");
        }
        String size = value.trim().toLowerCase();
        switch (size) {
            case "match_parent":
            case "fill_parent":
                return MATCH_PARENT;
            case "wrap_content":
                return WRAP_CONTENT;
            default:
                try {
                    if (size.endsWith("dp")) {
                        return checkSize(MathHelpers.dpToPx(parseNumber(size), density), "size");
                    } else if (size.endsWith("sp")) {
                        return checkSize(MathHelpers.spToPx(parseNumber(size), scaledDensity), "size");
                    } else if (size.endsWith("px")) {
                        return checkSize(parseNumber(size), "size");
                    }
                    return checkSize(Integer.parseInt(size), "size");
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid layout size: " + value, e);
                }
        }
    }

    private static int parseNumber(String withUnit) {
        return Integer.parseInt(withUnit.substring(0, withUnit.length() - 2).trim());
    }

    private static String sizeToString(int size) {
        return size == MATCH_PARENT ? "match_parent" : size == WRAP_CONTENT ? "wrap_content" : size + "px";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LayoutParams)) return false;
        LayoutParams other = (LayoutParams) obj;
        return width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height);
    }

    @Override
    public String toString() {
        return "LayoutParams[" + sizeToString(width) + " x " + sizeToString(height) + "]";
    }
}
