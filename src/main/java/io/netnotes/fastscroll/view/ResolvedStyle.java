package io.netnotes.fastscroll.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonElement;

import io.netnotes.fastscroll.utils.LoggingHelpers.Log;
import io.netnotes.fastscroll.utils.MathHelpers;
import javafx.scene.paint.Color;

/**
 * Typed attribute lookups over a chain of style layers.
 *
 * Lookup order: declared attributes, then the named default style, then
 * the theme's base style, then the caller's default. Values that fail to
 * parse are logged and skipped.
 */
public final class ResolvedStyle {
    private final List<StyleAttributes> layers;
    private final float density;
    private final float scaledDensity;

    ResolvedStyle(List<StyleAttributes> layers, float density, float scaledDensity) {
        this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
        this.density = density;
        this.scaledDensity = scaledDensity;
    }

    public boolean has(String attr) {
        return find(attr) != null;
    }

    private JsonElement find(String attr) {
        for (StyleAttributes layer : layers) {
            if (layer.has(attr)) {
                return layer.get(attr);
            }
        }
        return null;
    }

    public String getString(String attr, String defaultValue) {
        JsonElement element = find(attr);
        return element != null && element.isJsonPrimitive() ? element.getAsString() : defaultValue;
    }

    public boolean getBoolean(String attr, boolean defaultValue) {
        JsonElement element = find(attr);
        return element != null && element.isJsonPrimitive() ? element.getAsBoolean() : defaultValue;
    }

    public int getInt(String attr, int defaultValue) {
        JsonElement element = find(attr);
        if (element == null || !element.isJsonPrimitive()) {
            return defaultValue;
        }
        try {
            return element.getAsInt();
        } catch (NumberFormatException e) {
            Log.logError("[ResolvedStyle] " + attr, e);
            return defaultValue;
        }
    }

    /**
     * Dimension in pixels. Plain numbers and "dp" values are scaled by
     * density, "sp" by scaled density, "px" values are taken as is.
     */
    public int getDimensionPx(String attr, int defaultValue) {
        String value = getString(attr, null);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim().toLowerCase();
        try {
            if (trimmed.endsWith("px")) {
                return Integer.parseInt(trimmed.substring(0, trimmed.length() - 2));
            } else if (trimmed.endsWith("sp")) {
                return MathHelpers.spToPx(Integer.parseInt(trimmed.substring(0, trimmed.length() - 2)), scaledDensity);
            } else if (trimmed.endsWith("dp")) {
                return MathHelpers.dpToPx(Integer.parseInt(trimmed.substring(0, trimmed.length() - 2)), density);
            }
            return MathHelpers.dpToPx(Integer.parseInt(trimmed), density);
        } catch (NumberFormatException e) {
            Log.logError("[ResolvedStyle] " + attr + "=" + value, e);
            return defaultValue;
        }
    }

    public Color getColor(String attr, Color defaultValue) {
        String value = getString(attr, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Color.web(value);
        } catch (IllegalArgumentException e) {
            Log.logError("[ResolvedStyle] " + attr + "=" + value, e);
            return defaultValue;
        }
    }

    public <E extends Enum<E>> E getEnum(String attr, Class<E> type, E defaultValue) {
        String value = getString(attr, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            Log.logError("[ResolvedStyle] " + attr + "=" + value, e);
            return defaultValue;
        }
    }
}
