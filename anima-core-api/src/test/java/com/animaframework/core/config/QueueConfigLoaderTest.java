package com.animaframework.core.config;

import java.nio.file.Files;
import java.nio.file.Path;

import com.animaframework.core.property.OverflowPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class QueueConfigLoaderTest {

    @Test
    void loadsSnakeCaseJson() throws JsonProcessingException {
        QueueConfig config = QueueConfigLoader.fromJson("""
                {
                  "name": "ui",
                  "command_batch_size": 16,
                  "subscriber_buffer_capacity": 4,
                  "overflow_policy": "DROP_LATEST",
                  "unknown_key": true
                }
                """);
        assertEquals("ui", config.getName());
        assertEquals(16, config.getCommandBatchSize());
        assertEquals(4, config.getSubscriberBufferCapacity());
        assertEquals(OverflowPolicy.DROP_LATEST, config.getOverflowPolicy());
        // 未给出的字段保持默认值
        assertEquals(3_000, config.getShutdownTimeoutMs());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> QueueConfigLoader.fromJson("{\"command_batch_size\": 0}"));
        assertThrows(IllegalArgumentException.class,
                () -> QueueConfigLoader.fromJson("{\"name\": \" \"}"));
        assertThrows(JsonProcessingException.class, () -> QueueConfigLoader.fromJson("{not json"));
    }

    @Test
    void loadDefaultReadsClasspathResource() {
        QueueConfig config = QueueConfigLoader.loadDefault();
        assertEquals("anima-test", config.getName());
        assertEquals(16, config.getSubscriberBufferCapacity());
        assertEquals(OverflowPolicy.DROP_OLDEST, config.getOverflowPolicy());
    }

    @Test
    void roundTripsThroughFile(@TempDir Path dir) throws Exception {
        QueueConfig original = QueueConfig.defaults().setName("disk").setCommandBatchSize(8);
        Path file = dir.resolve("queue.json");
        Files.writeString(file, QueueConfigLoader.toJson(original));

        assertEquals(original, QueueConfigLoader.fromFile(file));
    }
}
