package com.astro.stamps.model;

import java.util.prefs.Preferences;

public class FixtureConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(FixtureConfig.class);

    private static final String KEY_DATA_DIR = "data_dir";
    private static final String KEY_STAMP_ID = "stamp_id";
    private static final String KEY_PATCH_RADIUS = "n_body_patch_radius";
    private static final String KEY_CANVAS_H = "n_body_canvas_h";
    private static final String KEY_CANVAS_W = "n_body_canvas_w";

    // Directory holding stamp-<band>-<id>.fits and cat-<id>.fits
    public static String getDataDir() { return prefs.get(KEY_DATA_DIR, "src/test/data"); }
    public static void setDataDir(String v) { prefs.put(KEY_DATA_DIR, v); }

    public static String getStampId() { return prefs.get(KEY_STAMP_ID, "164.4311-39.0359_2kpsf"); }
    public static void setStampId(String v) { prefs.put(KEY_STAMP_ID, v); }

    public static double getNBodyPatchRadius() { return prefs.getDouble(KEY_PATCH_RADIUS, 20.0); }
    public static void setNBodyPatchRadius(double v) { prefs.putDouble(KEY_PATCH_RADIUS, v); }

    public static int getNBodyCanvasHeight() { return prefs.getInt(KEY_CANVAS_H, 900); }
    public static void setNBodyCanvasHeight(int v) { prefs.putInt(KEY_CANVAS_H, v); }

    public static int getNBodyCanvasWidth() { return prefs.getInt(KEY_CANVAS_W, 1000); }
    public static void setNBodyCanvasWidth(int v) { prefs.putInt(KEY_CANVAS_W, v); }
}
