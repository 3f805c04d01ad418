package com.shelf.assistant.core.photo;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public interface PhotoSource extends AutoCloseable {
    /**
     * 打开照片来源
     * @throws SourceUnavailableException 来源不存在或无法监听
     */
    void open() throws SourceUnavailableException;

    /**
     * 等待新到达的照片
     * @param timeout 最长等待时间
     * @return 按创建顺序排列的新文件，超时返回空列表
     * @throws SourceUnavailableException 来源在监听过程中丢失
     */
    List<Path> poll(Duration timeout) throws SourceUnavailableException, InterruptedException;

    /**
     * 关闭照片来源
     */
    @Override
    void close();

    /**
     * 来源描述，用于日志
     */
    String describe();
}
