package com.shelf.assistant.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Web MVC 配置
 * <p>
 * 语音文件映射：/api/speech/** -> audio.output-dir，穿戴设备按文件名拉取播放
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private YamlConfig config;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Paths.get(config.getAudio().getOutputDir()).toAbsolutePath().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler("/api/speech/**")
                .addResourceLocations(location);
    }
}
