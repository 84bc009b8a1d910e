package com.sketchsync.service;

import com.sketchsync.config.SketchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.UUID;

// Actor id is generated once and persisted to a local properties file
@Slf4j
@Service
public class IdentityService {
    static final String ACTOR_ID_KEY = "sketchsync.actorId";

    private final Path identityFile;
    private final String actorId;

    @Autowired
    public IdentityService(SketchProperties properties) {
        this(properties.getIdentity().getFile());
    }

    IdentityService(Path identityFile) {
        this.identityFile = identityFile;
        this.actorId = loadOrCreate();
    }

    public String getActorId() {
        return actorId;
    }

    private String loadOrCreate() {
        String existing = load();
        if (existing != null) {
            log.info("Using existing actor id {}", existing);
            return existing;
        }

        String generated = UUID.randomUUID().toString();
        store(generated);
        log.info("Generated new actor id {}", generated);
        return generated;
    }

    private String load() {
        if (!Files.isRegularFile(identityFile)) {
            return null;
        }

        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(identityFile)) {
            properties.load(in);
        } catch (IOException e) {
            log.warn("Could not read identity file {}: {}", identityFile, e.getMessage());
            return null;
        }

        String value = properties.getProperty(ACTOR_ID_KEY);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private void store(String id) {
        Properties properties = new Properties();
        properties.setProperty(ACTOR_ID_KEY, id);
        try {
            Path parent = identityFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(identityFile)) {
                properties.store(out, "SketchSync replica identity");
            }
        } catch (IOException e) {
            // Still usable for this process, just not stable across restarts
            log.warn("Could not persist actor id to {}: {}", identityFile, e.getMessage());
        }
    }
}
