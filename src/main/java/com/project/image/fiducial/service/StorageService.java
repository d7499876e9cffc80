package com.project.image.fiducial.service;

import com.project.image.fiducial.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter UPLOAD_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final DateTimeFormatter REPORT_STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Path rootDir;
    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }
    public record StoredFile(Path path, String filename, String relativeWebPath) {}
    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String safeBase = original.replaceAll("[^a-zA-Z0-9._-]", "_");
        String filename = UPLOAD_STAMP.format(LocalDateTime.now()) + "_" + safeBase;
        Path target = rootDir.resolve(filename);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }
    public StoredFile storeResultImage(byte[] pngBytes, String suffix) {
        String filename = UPLOAD_STAMP.format(LocalDateTime.now()) + "_" + suffix + ".png";
        Path target = rootDir.resolve(filename);
        try {
            Files.write(target, pngBytes);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store result image", e);
        }
    }

    /**
     * Prefix for result files written next to an input image: {@code <name without extension>_<yyyyMMddHHmmss>_}.
     */
    public static String reportPrefix(Path input, LocalDateTime when) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return base + "_" + REPORT_STAMP.format(when) + "_";
    }

    public Path writeBeside(Path input, String prefix, String name, byte[] pngBytes) {
        Path dir = input.toAbsolutePath().getParent();
        Path target = dir.resolve(prefix + name + ".png");
        try {
            Files.write(target, pngBytes);
            log.debug("Wrote {}", target);
            return target;
        } catch (IOException e) {
            throw new StorageException("Failed to write " + target, e);
        }
    }
}
