package com.shelf.assistant;

import com.shelf.assistant.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ShelfAssistantApplication {

    public static void main(String[] args) {
        // OpenCV 必须在 Spring 创建照片预处理组件之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(ShelfAssistantApplication.class, args);
    }
}
