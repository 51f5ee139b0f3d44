package com.sessionhub.observer.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JSON 文件缓存。写入先落临时文件再原子替换，读写失败只记日志。
 */
@Slf4j
public class JsonFileObserverSessionCache implements ObserverSessionCache {

    private static final TypeReference<List<ObservedSession>> LIST_REF = new TypeReference<List<ObservedSession>>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileObserverSessionCache(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Override
    public List<ObservedSession> load() {
        if (!Files.isRegularFile(file)) {
            return Collections.emptyList();
        }
        try {
            List<ObservedSession> sessions = objectMapper.readValue(file.toFile(), LIST_REF);
            return sessions == null ? Collections.emptyList() : sessions;
        } catch (IOException ex) {
            log.warn("Load observer session cache failed. file={}, error={}", file, ex.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public void save(List<ObservedSession> sessions) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), sessions == null ? new ArrayList<>() : sessions);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            log.warn("Save observer session cache failed. file={}, error={}", file, ex.getMessage());
        }
    }
}
