package com.mini.csvtools.merge;

import com.google.common.collect.ImmutableList;
import com.mini.csvtools.utils.AlphanumericComparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 合并输入收集器
 * 接受文件和目录：目录中以 .csv 结尾的文件按文件名自然顺序加入，重复的路径只保留第一次
 */
public class InputStager {
    private static final Logger logger = LoggerFactory.getLogger(InputStager.class);

    private static final String CSV_SUFFIX = ".csv";

    private final Set<Path> inputs = new LinkedHashSet<>();

    /**
     * 加入一个文件或目录
     *
     * @throws NoSuchFileException 路径不存在
     */
    public InputStager add(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "merge input does not exist");
        }
        if (Files.isDirectory(path)) {
            List<Path> entries = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(path)) {
                for (Path entry : stream) {
                    String name = entry.getFileName().toString();
                    if (Files.isRegularFile(entry) && name.toLowerCase(Locale.ROOT).endsWith(CSV_SUFFIX)) {
                        entries.add(entry);
                    }
                }
            }
            entries.sort((a, b) -> AlphanumericComparator.INSTANCE.compare(
                    a.getFileName().toString(), b.getFileName().toString()));
            logger.debug("Staged {} csv files from directory {}", entries.size(), path);
            for (Path entry : entries) {
                addFile(entry);
            }
        } else {
            addFile(path);
        }
        return this;
    }

    public InputStager addAll(Collection<Path> paths) throws IOException {
        for (Path path : paths) {
            add(path);
        }
        return this;
    }

    private void addFile(Path file) {
        if (!inputs.add(file.toAbsolutePath().normalize())) {
            logger.debug("Skipping duplicate input {}", file);
        }
    }

    public List<Path> getInputs() {
        return ImmutableList.copyOf(inputs);
    }

    public int size() {
        return inputs.size();
    }

    /**
     * 一次性收集多个路径
     */
    public static List<Path> stage(Path... paths) throws IOException {
        InputStager stager = new InputStager();
        for (Path path : paths) {
            stager.add(path);
        }
        return stager.getInputs();
    }
}
