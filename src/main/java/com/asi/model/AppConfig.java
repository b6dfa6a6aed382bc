package com.asi.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_BATCH_THREADS = "batch_threads";
    private static final String KEY_PREVIEW_FRAME = "preview_frame";
    private static final String KEY_PREVIEW_OPACITY = "preview_opacity";

    public static int getBatchThreads() { return prefs.getInt(KEY_BATCH_THREADS, 4); }
    public static void setBatchThreads(int v) { prefs.putInt(KEY_BATCH_THREADS, v); }

    // Frame que se muestra en la preview (se recorta al último si el stack es más corto)
    public static int getPreviewFrame() { return prefs.getInt(KEY_PREVIEW_FRAME, 0); }
    public static void setPreviewFrame(int v) { prefs.putInt(KEY_PREVIEW_FRAME, v); }

    public static double getPreviewOpacity() { return prefs.getDouble(KEY_PREVIEW_OPACITY, 0.4); }
    public static void setPreviewOpacity(double v) { prefs.putDouble(KEY_PREVIEW_OPACITY, v); }
}
