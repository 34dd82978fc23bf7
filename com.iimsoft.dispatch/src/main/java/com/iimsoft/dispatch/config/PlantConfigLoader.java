package com.iimsoft.dispatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 工厂配置加载器。
 *
 * 配置来源（优先级从高到低）：
 * 1) JVM 参数：-Dplant.config=JSON 或 JSON 文件路径
 * 2) classpath 下的 plant-config.json
 * 3) 默认：{@link PlantConfig#defaultPlant()}
 *
 * 请求里自带的 plant 配置优先于这里，见 DispatchRequestMapper。
 */
public class PlantConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlantConfigLoader.class);

    /** JVM 参数 key */
    public static final String PLANT_CONFIG_PROPERTY = "plant.config";

    /** classpath 资源名 */
    public static final String PLANT_CONFIG_RESOURCE = "plant-config.json";

    private final ObjectMapper mapper;
    private final String resourceName;

    public PlantConfigLoader() {
        this(new ObjectMapper(), PLANT_CONFIG_RESOURCE);
    }

    public PlantConfigLoader(ObjectMapper mapper, String resourceName) {
        this.mapper = mapper;
        this.resourceName = resourceName;
    }

    public PlantConfig load() {
        String property = System.getProperty(PLANT_CONFIG_PROPERTY);
        if (property != null && !property.isBlank()) {
            PlantConfig fromProperty = readProperty(property.trim());
            if (fromProperty != null) {
                return fromProperty;
            }
        }

        PlantConfig fromClasspath = readClasspath();
        if (fromClasspath != null) {
            return fromClasspath;
        }

        LOGGER.debug("No plant configuration supplied, using built-in defaults");
        return PlantConfig.defaultPlant();
    }

    private PlantConfig readProperty(String value) {
        try {
            if (value.startsWith("{")) {
                return mapper.readValue(value, PlantConfig.class);
            }
            Path path = Path.of(value);
            if (!Files.exists(path) || Files.isDirectory(path)) {
                LOGGER.warn("Plant configuration file not found: {}, falling back", path.toAbsolutePath());
                return null;
            }
            LOGGER.info("Loading plant configuration from {}", path.toAbsolutePath());
            return mapper.readValue(path.toFile(), PlantConfig.class);
        } catch (Exception e) {
            // 配置错误回退，避免程序直接挂
            LOGGER.warn("Invalid -D{} value, falling back: {}", PLANT_CONFIG_PROPERTY, e.getMessage());
            return null;
        }
    }

    private PlantConfig readClasspath() {
        ClassLoader classLoader = PlantConfigLoader.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resourceName)) {
            if (in == null) {
                return null;
            }
            LOGGER.info("Loading plant configuration from classpath resource {}", resourceName);
            return mapper.readValue(in, PlantConfig.class);
        } catch (Exception e) {
            LOGGER.warn("Invalid classpath resource {}, falling back: {}", resourceName, e.getMessage());
            return null;
        }
    }
}
