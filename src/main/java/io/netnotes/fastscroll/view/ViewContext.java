package io.netnotes.fastscroll.view;

import java.util.ArrayList;
import java.util.List;

import io.netnotes.fastscroll.utils.LoggingHelpers.Log;
import io.netnotes.fastscroll.utils.LoggingHelpers.LogLevel;

/**
 * The platform handle every view is created with: feature level, display
 * density and the theme that supplies default styles.
 */
public class ViewContext {
    private final Theme theme;
    private final int featureLevel;

    public ViewContext() {
        this(Theme.load());
    }

    public ViewContext(Theme theme) {
        this(theme, theme.getFeatureLevel());
    }

    public ViewContext(Theme theme, int featureLevel) {
        this.theme = theme;
        this.featureLevel = featureLevel;

        String logLevel = theme.getLogLevel();
        if (logLevel != null) {
            Log.setLogLevel(LogLevel.fromName(logLevel, LogLevel.ALL));
        }
    }

    public Theme getTheme() {
        return theme;
    }

    public int getFeatureLevel() {
        return featureLevel;
    }

    public float getDensity() {
        return theme.getDensity();
    }

    public float getScaledDensity() {
        return theme.getScaledDensity();
    }

    /**
     * Resolves declared attributes against the named default style and the
     * theme's base style. Both arguments may be null.
     */
    public ResolvedStyle obtainStyledAttributes(StyleAttributes attrs, String defStyle) {
        List<StyleAttributes> layers = new ArrayList<>(3);
        if (attrs != null) {
            layers.add(attrs);
        }
        if (defStyle != null) {
            StyleAttributes named = theme.getStyle(defStyle);
            if (named != null) {
                layers.add(named);
            } else {
                Log.logError("[ViewContext] unknown style: " + defStyle);
            }
        }
        StyleAttributes base = theme.getBaseStyle();
        if (base != null) {
            layers.add(base);
        }
        return new ResolvedStyle(layers, getDensity(), getScaledDensity());
    }
}
