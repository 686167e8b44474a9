package com.edge.fieldline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库（openpnp 打包的各平台 native 库）
 * <p>
 * 可重复调用，只在第一次真正加载
 */
public final class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    private NativeLibraryLoader() {
    }

    /**
     * 预加载 OpenCV native 库
     * 必须在任何使用 Mat / Imgproc 的代码之前调用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        try {
            nu.pattern.OpenCV.loadShared();
            logger.info("OpenCV loaded successfully via openpnp (shared)");
        } catch (Exception | UnsatisfiedLinkError e) {
            // 新版 JDK 上 loadShared 可能不可用，退回到本地临时目录加载
            logger.warn("Failed to load OpenCV via openpnp shared loader: {}", e.getMessage());
            loadLocally();
        }
        loaded = true;
    }

    private static void loadLocally() {
        try {
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV loaded successfully via openpnp (local)");
        } catch (Exception | UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library", e);
            throw new IllegalStateException("OpenCV native library not found", e);
        }
    }
}
