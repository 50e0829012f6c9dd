package com.bayesai.server.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

public class ConfigPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigPathResolver.class);

    public static final String CONFIG_PROPERTY = "bn.config";
    public static final String DATA_DIR_PROPERTY = "bn.data.dir";
    public static final String DEFAULT_CONFIG_RESOURCE = "/bn_config.json";
    public static final String DB_FILE_NAME = "bn_query_cache.db";

    /**
     * Opens the service config: the file named by {@code bn.config} if set,
     * otherwise {@code bn_config.json} from the classpath. Returns null when
     * neither exists.
     */
    public static InputStream openConfig() throws IOException {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override != null && !override.isEmpty()) {
            File file = new File(override);
            if (file.isFile()) {
                logger.info("Using inference config from {}", file.getAbsolutePath());
                return new FileInputStream(file);
            }
            logger.warn("Config file {} not found, falling back to classpath {}", override,
                    DEFAULT_CONFIG_RESOURCE);
        }
        return ConfigPathResolver.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE);
    }

    /**
     * Opens a network definition: a classpath resource when it starts with
     * {@code /} and exists there, otherwise a file path.
     */
    public static InputStream openResource(String location) throws IOException {
        if (location.startsWith("/")) {
            InputStream is = ConfigPathResolver.class.getResourceAsStream(location);
            if (is != null) {
                return is;
            }
        }
        File file = new File(location);
        if (!file.isFile()) {
            throw new IOException("Network definition not found: " + location);
        }
        return new FileInputStream(file);
    }

    public static String resolveDataDirectory(String configured) {
        // 1. System property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Config file
        if (configured != null && !configured.isEmpty()) {
            return configured;
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath(String configured) {
        return resolveDataDirectory(configured) + File.separator + DB_FILE_NAME;
    }
}
