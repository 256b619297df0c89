package io.netnotes.fastscroll.view;

import com.google.gson.JsonObject;

import io.netnotes.fastscroll.utils.JsonHelpers;
import io.netnotes.fastscroll.utils.LoggingHelpers.Log;

/**
 * Theme - platform-wide defaults loaded from JSON
 *
 * <pre>
 * {
 *   "featureLevel": 34,
 *   "density": 1.0,
 *   "scaledDensity": 1.0,
 *   "logLevel": "GENERAL",
 *   "baseStyle": "FastScroll",
 *   "styles": { "FastScroll": { "handleColor": "#9e9e9e" }, ... }
 * }
 * </pre>
 */
public final class Theme {
    public static final String DEFAULT_RESOURCE = "/fastscroll-theme.json";

    public static final String FEATURE_LEVEL  = "featureLevel";
    public static final String DENSITY        = "density";
    public static final String SCALED_DENSITY = "scaledDensity";
    public static final String LOG_LEVEL      = "logLevel";
    public static final String BASE_STYLE     = "baseStyle";
    public static final String STYLES         = "styles";

    private final JsonObject json;

    private Theme(JsonObject json) {
        this.json = json;
    }

    public static Theme fromJson(JsonObject json) {
        return new Theme(json != null ? json.deepCopy() : new JsonObject());
    }

    public static Theme load() {
        return load(DEFAULT_RESOURCE);
    }

    public static Theme load(String resourceName) {
        JsonObject json = JsonHelpers.readResource(Theme.class, resourceName);
        if (json == null) {
            Log.logError("[Theme] " + resourceName + " not found, using built-in defaults");
        } else {
            Log.logJson("Theme " + resourceName, json);
        }
        return fromJson(json);
    }

    public int getFeatureLevel() {
        return JsonHelpers.getInt(json, FEATURE_LEVEL, FeatureLevel.CURRENT);
    }

    public float getDensity() {
        return JsonHelpers.getFloat(json, DENSITY, 1f);
    }

    public float getScaledDensity() {
        return JsonHelpers.getFloat(json, SCALED_DENSITY, getDensity());
    }

    public String getLogLevel() {
        return JsonHelpers.getString(json, LOG_LEVEL, null);
    }

    public String getBaseStyleName() {
        return JsonHelpers.getString(json, BASE_STYLE, null);
    }

    /**
     * @return the named style, or null if the theme does not define it
     */
    public StyleAttributes getStyle(String name) {
        if (name == null) {
            return null;
        }
        JsonObject style = JsonHelpers.getJsonObject(JsonHelpers.getJsonObject(json, STYLES), name);
        return style != null ? StyleAttributes.fromJson(style) : null;
    }

    public StyleAttributes getBaseStyle() {
        return getStyle(getBaseStyleName());
    }
}
