package com.sessionhub.test.observer;

import com.sessionhub.observer.store.JsonFileObserverSessionCache;
import com.sessionhub.observer.store.ObservedSession;
import com.sessionhub.types.enums.SessionStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

public class JsonFileObserverSessionCacheTest {

    @TempDir
    Path tempDir;

    @Test
    public void shouldLoadWhatWasSaved() {
        JsonFileObserverSessionCache cache = new JsonFileObserverSessionCache(tempDir.resolve("cache/sessions.json"));
        ObservedSession session = ObservedSession.builder()
                .sessionId("session_1")
                .status(SessionStatusEnum.READY)
                .phoneNumber("100")
                .lastActiveAt(LocalDateTime.of(2024, 5, 1, 10, 0))
                .build();

        cache.save(List.of(session));

        Assertions.assertEquals(List.of(session), cache.load());
    }

    @Test
    public void shouldReturnEmptyWhenFileMissing() {
        JsonFileObserverSessionCache cache = new JsonFileObserverSessionCache(tempDir.resolve("missing.json"));

        Assertions.assertTrue(cache.load().isEmpty());
    }

    @Test
    public void shouldReturnEmptyWhenFileCorrupt() throws Exception {
        Path file = tempDir.resolve("sessions.json");
        Files.write(file, "{not-json".getBytes(StandardCharsets.UTF_8));

        Assertions.assertTrue(new JsonFileObserverSessionCache(file).load().isEmpty());
    }
}
