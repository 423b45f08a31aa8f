package com.zzf.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

import java.nio.file.Files;
import java.nio.file.Path;

@EnableAsync
@SpringBootApplication
public class RelayApplication {
    private static final Logger logger = LoggerFactory.getLogger(RelayApplication.class);

    public static void main(String[] args) {
        guardWorkDir();
        SpringApplication.run(RelayApplication.class, args);
    }

    private static void guardWorkDir() {
        String configured = System.getenv("WORK_DIR");
        if (configured == null || configured.isBlank()) {
            return;
        }
        try {
            Path dir = Path.of(configured.trim());
            if (!Files.isDirectory(dir)) {
                logger.error("relay.workdir.invalid path={}", dir);
                throw new IllegalStateException("WORK_DIR does not point to a directory: " + dir);
            }
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            logger.warn("relay.workdir.check.failed err={}", e.toString());
        }
    }
}
