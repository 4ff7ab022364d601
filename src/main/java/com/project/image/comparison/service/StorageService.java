package com.project.image.comparison.service;

import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.exceptions.ImageInputException;
import com.project.image.comparison.exceptions.StorageException;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * File access for a comparison: decoding the two inputs, keeping web uploads
 * and writing the generated artifacts.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private final Path uploadDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String uploadDir) {
        OpenCVSupport.ensureLoaded();
        this.uploadDir = Paths.get(uploadDir).toAbsolutePath().normalize();
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    /** Decodes an input image as 3-channel BGR. */
    public Image loadImage(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ImageInputException("Image not found: " + path);
        }
        Mat decoded = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_COLOR);
        if (decoded.empty()) {
            throw new ImageInputException("Cannot decode image: " + path);
        }
        log.debug("Loaded {} ({}x{})", path, decoded.cols(), decoded.rows());
        return Image.of(decoded);
    }

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
        String timestamp = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").format(LocalDateTime.now());
        String filename = timestamp + "_" + safeBase;
        Path target = uploadDir.resolve(filename);
        try {
            Files.createDirectories(uploadDir);
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    public Path prepareDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
            return dir;
        } catch (IOException e) {
            throw new StorageException("Cannot create output directory: " + dir, e);
        }
    }

    public Path writeImage(Path dir, String filename, Mat image) {
        Path target = dir.resolve(filename);
        boolean written;
        try {
            written = Imgcodecs.imwrite(target.toString(), image);
        } catch (CvException e) {
            throw new StorageException("Failed to write " + target, e);
        }
        if (!written) {
            throw new StorageException("Failed to write " + target);
        }
        log.debug("Wrote {}", target);
        return target;
    }

    public Path writeText(Path dir, String filename, String content, boolean append) {
        Path target = dir.resolve(filename);
        try {
            if (append) {
                Files.writeString(target, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(target, content, StandardCharsets.UTF_8);
            }
            return target;
        } catch (IOException e) {
            throw new StorageException("Failed to write " + target, e);
        }
    }
}
