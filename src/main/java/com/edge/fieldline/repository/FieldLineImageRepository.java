package com.edge.fieldline.repository;

import com.edge.fieldline.config.FieldlineProperties;
import com.edge.fieldline.model.FieldLineImageArchive;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 磁力线图像存档仓库
 * 存档文件: &lt;output.directory&gt;/fl_images_&lt;shot&gt;_&lt;time&gt;.json
 */
@Repository
public class FieldLineImageRepository {
    private static final Logger logger = LoggerFactory.getLogger(FieldLineImageRepository.class);
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final Gson gson = new GsonBuilder()
            .registerTypeAdapter(LocalDateTime.class, (JsonSerializer<LocalDateTime>) (src, type, context) ->
                    new JsonPrimitive(src.format(ISO_FORMATTER)))
            .registerTypeAdapter(LocalDateTime.class, (JsonDeserializer<LocalDateTime>) (json, type, context) ->
                    LocalDateTime.parse(json.getAsString(), ISO_FORMATTER))
            .serializeSpecialFloatingPointValues()
            .create();

    @Autowired
    private FieldlineProperties properties;

    public FieldLineImageRepository() {
    }

    public FieldLineImageRepository(FieldlineProperties properties) {
        this.properties = properties;
    }

    /**
     * 写入存档；先写临时文件再替换，避免留下不完整的文件
     *
     * @return 存档文件路径
     */
    public Path save(FieldLineImageArchive archive) throws IOException {
        Path dir = getDirectory();
        Files.createDirectories(dir);
        Path target = dir.resolve(fileName(archive.getShot(), archive.getTime()));
        Path tmp = dir.resolve(target.getFileName() + ".tmp");

        try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            gson.toJson(archive, writer);
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Field line archive saved: {} ({} images)", target,
            archive.getImages() == null ? 0 : archive.getImages().length);
        return target;
    }

    public FieldLineImageArchive load(long shot, double time) throws IOException {
        Path file = getDirectory().resolve(fileName(shot, time));
        if (!Files.exists(file)) {
            throw new FileNotFoundException("Field line archive not found: " + file);
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            FieldLineImageArchive archive = gson.fromJson(reader, FieldLineImageArchive.class);
            logger.info("Field line archive loaded: {}", file);
            return archive;
        }
    }

    public boolean exists(long shot, double time) {
        return Files.exists(getDirectory().resolve(fileName(shot, time)));
    }

    public Path getDirectory() {
        return Paths.get(properties.getOutput().getDirectory());
    }

    public static String fileName(long shot, double time) {
        return "fl_images_" + shot + "_" + time + ".json";
    }
}
