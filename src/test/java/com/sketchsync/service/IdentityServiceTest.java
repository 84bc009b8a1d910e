package com.sketchsync.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class IdentityServiceTest {
    @TempDir
    Path tempDir;

    @Test
    public void testGeneratesAndPersistsActorId() {
        Path file = tempDir.resolve("nested").resolve("identity.properties");

        String actorId = new IdentityService(file).getActorId();

        assertNotNull(actorId);
        assertFalse(actorId.isBlank());
        assertTrue(Files.isRegularFile(file));
    }

    @Test
    public void testSameIdAcrossRestarts() {
        Path file = tempDir.resolve("identity.properties");

        String first = new IdentityService(file).getActorId();
        String second = new IdentityService(file).getActorId();

        assertEquals(first, second);
    }

    @Test
    public void testReadsExistingId() throws Exception {
        Path file = tempDir.resolve("identity.properties");
        Properties properties = new Properties();
        properties.setProperty(IdentityService.ACTOR_ID_KEY, "existing-actor");
        try (OutputStream out = Files.newOutputStream(file)) {
            properties.store(out, null);
        }

        assertEquals("existing-actor", new IdentityService(file).getActorId());
    }

    @Test
    public void testBlankIdIsReplaced() throws Exception {
        Path file = tempDir.resolve("identity.properties");
        Files.writeString(file, IdentityService.ACTOR_ID_KEY + "=\n");

        String actorId = new IdentityService(file).getActorId();

        assertFalse(actorId.isBlank());
    }

    @Test
    public void testUnwritableLocationStillYieldsId() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        IdentityService service = new IdentityService(blocker.resolve("identity.properties"));

        assertNotNull(service.getActorId());
    }

    @Test
    public void testDifferentDevicesGetDifferentIds() {
        String first = new IdentityService(tempDir.resolve("a.properties")).getActorId();
        String second = new IdentityService(tempDir.resolve("b.properties")).getActorId();

        assertNotEquals(first, second);
    }
}
