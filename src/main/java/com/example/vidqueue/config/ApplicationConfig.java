package com.example.vidqueue.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "app.download")
public class ApplicationConfig {
    private String directory = "./downloads";
    private int maxConcurrentDownloads = 3;
    private boolean clearHistoryOnStartup = false;

    private String proxy;
    private String browserForCookies = "none";
    private String cookiesPath;
    private String configPath;

    private boolean shareWatermark = false;
    private String oneClickQuality = "auto";

    private boolean embedSubs = false;
    private boolean embedThumbnail = false;
    private boolean embedMetadata = true;
    private boolean embedChapters = true;

    private List<String> extraArgs = new ArrayList<>();

    private String dataDirectory = "./data";
    private String settingsFile = "vidqueue-settings.cfg";
    private String brandingMarker = "Vidqueue";

    @Bean(name = "downloadExecutor")
    public ThreadPoolTaskExecutor downloadExecutor() {
        // Без очереди: каждая активная задача сразу получает поток, лимит держит DownloadQueue
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("Download-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "prefetchExecutor")
    public ThreadPoolTaskExecutor prefetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("Prefetch-");
        executor.initialize();
        return executor;
    }

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("Vidqueue-timer-");
        scheduler.initialize();
        return scheduler;
    }

    @PostConstruct
    public void init() {
        loadConfig();
    }

    public void setDirectory(String directory) {
        this.directory = directory.replace("/", File.separator)
                .replace("\\", File.separator);
    }

    // Загрузка пользовательских настроек из файла
    public void loadConfig() {
        Properties props = new Properties();
        try (FileInputStream input = new FileInputStream(settingsFile)) {
            props.load(input);
            applyProperties(props);
            log.info("Configuration loaded from {}", settingsFile);
        } catch (IOException e) {
            // Файл не существует, используем значения по умолчанию
            saveConfig();
        }
    }

    // Сохранение конфигурации в файл
    public void saveConfig() {
        try (FileOutputStream output = new FileOutputStream(settingsFile)) {
            toProperties().store(output, "Vidqueue Configuration");
            log.info("Configuration saved successfully");
        } catch (IOException e) {
            throw new RuntimeException("Failed to save configuration", e);
        }
    }

    // Обновление конкретной настройки
    public void updateConfig(String key, String value) {
        Properties props = toProperties();
        props.setProperty(key, value);
        applyProperties(props);

        try (FileOutputStream output = new FileOutputStream(settingsFile)) {
            props.store(output, "Vidqueue Configuration");
        } catch (IOException e) {
            throw new RuntimeException("Failed to update configuration", e);
        }
        log.info("Configuration key '{}' updated", key);
    }

    private void applyProperties(Properties props) {
        setDirectory(props.getProperty("directory", directory));
        this.maxConcurrentDownloads = Math.max(1, Integer.parseInt(
                props.getProperty("maxConcurrentDownloads", String.valueOf(maxConcurrentDownloads)).trim()));
        this.clearHistoryOnStartup = Boolean.parseBoolean(
                props.getProperty("clearHistoryOnStartup", String.valueOf(clearHistoryOnStartup)));
        this.proxy = emptyToNull(props.getProperty("proxy", nullToEmpty(proxy)));
        this.browserForCookies = props.getProperty("browserForCookies", browserForCookies);
        this.cookiesPath = emptyToNull(props.getProperty("cookiesPath", nullToEmpty(cookiesPath)));
        this.configPath = emptyToNull(props.getProperty("configPath", nullToEmpty(configPath)));
        this.shareWatermark = Boolean.parseBoolean(
                props.getProperty("shareWatermark", String.valueOf(shareWatermark)));
        this.oneClickQuality = props.getProperty("oneClickQuality", oneClickQuality);
        this.embedSubs = Boolean.parseBoolean(props.getProperty("embedSubs", String.valueOf(embedSubs)));
        this.embedThumbnail = Boolean.parseBoolean(
                props.getProperty("embedThumbnail", String.valueOf(embedThumbnail)));
        this.embedMetadata = Boolean.parseBoolean(
                props.getProperty("embedMetadata", String.valueOf(embedMetadata)));
        this.embedChapters = Boolean.parseBoolean(
                props.getProperty("embedChapters", String.valueOf(embedChapters)));
        String extra = props.getProperty("extraArgs");
        if (extra != null) {
            this.extraArgs = Arrays.stream(extra.trim().split("\\s+"))
                    .filter(arg -> !arg.isEmpty())
                    .collect(Collectors.toList());
        }
    }

    private Properties toProperties() {
        Properties props = new Properties();
        props.setProperty("directory", directory);
        props.setProperty("maxConcurrentDownloads", String.valueOf(maxConcurrentDownloads));
        props.setProperty("clearHistoryOnStartup", String.valueOf(clearHistoryOnStartup));
        props.setProperty("proxy", nullToEmpty(proxy));
        props.setProperty("browserForCookies", nullToEmpty(browserForCookies));
        props.setProperty("cookiesPath", nullToEmpty(cookiesPath));
        props.setProperty("configPath", nullToEmpty(configPath));
        props.setProperty("shareWatermark", String.valueOf(shareWatermark));
        props.setProperty("oneClickQuality", nullToEmpty(oneClickQuality));
        props.setProperty("embedSubs", String.valueOf(embedSubs));
        props.setProperty("embedThumbnail", String.valueOf(embedThumbnail));
        props.setProperty("embedMetadata", String.valueOf(embedMetadata));
        props.setProperty("embedChapters", String.valueOf(embedChapters));
        props.setProperty("extraArgs", String.join(" ", extraArgs));
        return props;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
