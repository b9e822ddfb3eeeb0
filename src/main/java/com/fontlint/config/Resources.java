package com.fontlint.config;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

/**
 * Resolves configuration paths. A {@code classpath:} prefix selects a classpath resource,
 * anything else is a file system path.
 */
public final class Resources {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private Resources() {
    }

    public static Resource get(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }
}
