package com.faultline.core.classification;

import java.util.regex.Pattern;

/**
 * Derives a platform name from a user agent string.
 *
 * @since 1.0.0
 */
public final class PlatformDetector {

    public static final String IOS = "iOS";
    public static final String ANDROID = "Android";
    public static final String MOBILE = "Mobile";
    public static final String API = "API";

    private static final Pattern APPLE_DEVICE = Pattern.compile("iPhone|iPad|iPod", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANDROID_DEVICE = Pattern.compile("Android", Pattern.CASE_INSENSITIVE);

    private PlatformDetector() {
    }

    /**
     * @param userAgent raw user agent, may be {@code null}
     * @return one of {@code iOS}, {@code Android}, {@code Mobile} or {@code API}
     */
    public static String detect(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return API;
        }
        if (APPLE_DEVICE.matcher(userAgent).find()) {
            return IOS;
        }
        if (ANDROID_DEVICE.matcher(userAgent).find()) {
            return ANDROID;
        }
        if (userAgent.contains("Expo")) {
            // Expo clients only name the OS, not the device
            if (userAgent.contains("iOS")) {
                return IOS;
            }
            return userAgent.contains("Android") ? ANDROID : MOBILE;
        }
        return API;
    }

    /**
     * Use the explicit platform when present, otherwise detect it.
     */
    public static String resolve(String platform, String userAgent) {
        return platform != null && !platform.isBlank() ? platform : detect(userAgent);
    }
}
