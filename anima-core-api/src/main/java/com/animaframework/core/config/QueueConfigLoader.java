package com.animaframework.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

/**
 * 从 JSON 加载 {@link QueueConfig}。
 */
@Slf4j
public final class QueueConfigLoader {

    /**
     * classpath 上的默认配置文件名
     */
    public static final String DEFAULT_RESOURCE = "anima-queue.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    private QueueConfigLoader() {
    }

    /**
     * 从JSON字符串加载队列配置。
     *
     * @param json JSON格式的配置字符串
     * @return 校验后的配置
     * @throws JsonProcessingException 如果JSON解析失败
     */
    public static QueueConfig fromJson(String json) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(json, QueueConfig.class).validate();
    }

    public static QueueConfig fromFile(Path path) throws IOException {
        QueueConfig config = fromJson(Files.readString(path));
        log.info("从 {} 加载队列配置: {}", path, config);
        return config;
    }

    /**
     * 从 classpath 的 {@value #DEFAULT_RESOURCE} 加载配置，不存在或解析失败时使用默认值。
     */
    public static QueueConfig loadDefault() {
        ClassLoader loader = QueueConfigLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("classpath 上没有 {}，使用默认配置。", DEFAULT_RESOURCE);
                return QueueConfig.defaults();
            }
            QueueConfig config = OBJECT_MAPPER.readValue(in, QueueConfig.class).validate();
            log.info("从 classpath 加载队列配置: {}", config);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("加载 {} 失败，使用默认配置: {}", DEFAULT_RESOURCE, e.getMessage());
            return QueueConfig.defaults();
        }
    }

    public static String toJson(QueueConfig config) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(config);
    }
}
