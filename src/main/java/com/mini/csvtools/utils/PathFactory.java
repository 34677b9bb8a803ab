package com.mini.csvtools.utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * 路径工厂类
 * 负责生成临时文件的标准路径
 *
 * 目录结构：
 * {tempRoot}/
 * └── csvtools-{kind}-{runId}/
 *     ├── segment-000000.jsonl
 *     └── segment-000001.jsonl
 */
public class PathFactory {
    private final Path tempRoot;

    public PathFactory(Path tempRoot) {
        this.tempRoot = tempRoot;
    }

    /**
     * 使用系统临时目录
     */
    public static PathFactory systemTemp() {
        return new PathFactory(Paths.get(System.getProperty("java.io.tmpdir")));
    }

    public Path getTempRoot() {
        return tempRoot;
    }

    /**
     * 获取某次运行的私有目录路径
     */
    public Path getRunPath(String kind, String runId) {
        return tempRoot.resolve("csvtools-" + kind + "-" + runId);
    }

    /**
     * 创建某次运行的私有目录，目录已存在时报错以避免两次运行共用
     */
    public Path createRunDirectory(String kind, String runId) throws IOException {
        Files.createDirectories(tempRoot);
        return Files.createDirectory(getRunPath(kind, runId));
    }

    /**
     * 获取段文件路径
     */
    public Path getSegmentPath(Path runDirectory, long segmentId) {
        return runDirectory.resolve(String.format("segment-%06d.jsonl", segmentId));
    }

    /**
     * 递归删除目录
     */
    public static void deleteDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            Path[] ordered = paths.sorted(Comparator.reverseOrder()).toArray(Path[]::new);
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        }
    }
}
