package com.crypto.rebalance.calibration;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Reads profiles from {@code <dir>/<name>.json}, falling back to the bundled
 * {@code classpath:calibration-profiles/<name>.json}.
 * Nothing is cached: every run loads its profile afresh.
 */
@Component
@Slf4j
public class JsonCalibrationProfileStore implements CalibrationProfileStore {

    static final String CLASSPATH_DIR = "calibration-profiles/";
    private static final String EXTENSION = ".json";

    private final ObjectMapper objectMapper;
    private final Path profilesDir;

    public JsonCalibrationProfileStore(ObjectMapper objectMapper,
                                       @Value("${calibration.profiles.dir:calibration_profiles}") String profilesDir) {
        this.objectMapper = objectMapper;
        this.profilesDir = Paths.get(profilesDir);
    }

    @Override
    public Optional<CalibrationProfile> loadProfile(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("..")) {
            return Optional.empty();
        }

        Path file = profilesDir.resolve(name + EXTENSION);
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                return Optional.of(objectMapper.readValue(in, CalibrationProfile.class));
            } catch (IOException e) {
                log.warn("Could not read calibration profile {}: {}", file, e.getMessage());
                return Optional.empty();
            }
        }

        ClassPathResource resource = new ClassPathResource(CLASSPATH_DIR + name + EXTENSION);
        if (resource.exists()) {
            try (InputStream in = resource.getInputStream()) {
                return Optional.of(objectMapper.readValue(in, CalibrationProfile.class));
            } catch (IOException e) {
                log.warn("Could not read bundled calibration profile {}: {}", name, e.getMessage());
                return Optional.empty();
            }
        }

        log.debug("Calibration profile {} not found in {} or classpath", name, profilesDir);
        return Optional.empty();
    }

    @Override
    public List<String> listProfiles() {
        TreeSet<String> names = new TreeSet<>();

        if (Files.isDirectory(profilesDir)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(profilesDir, "*" + EXTENSION)) {
                for (Path path : stream) {
                    names.add(stripExtension(path.getFileName().toString()));
                }
            } catch (IOException e) {
                log.warn("Could not list calibration profiles in {}: {}", profilesDir, e.getMessage());
            }
        }

        try {
            Resource[] resources = new PathMatchingResourcePatternResolver()
                    .getResources("classpath*:" + CLASSPATH_DIR + "*" + EXTENSION);
            for (Resource resource : resources) {
                if (resource.getFilename() != null) {
                    names.add(stripExtension(resource.getFilename()));
                }
            }
        } catch (IOException e) {
            log.warn("Could not list bundled calibration profiles: {}", e.getMessage());
        }

        List<String> usable = new ArrayList<>();
        for (String name : names) {
            loadProfile(name)
                    .filter(profile -> !profile.hasInsufficientData())
                    .ifPresent(profile -> usable.add(name));
        }
        return usable;
    }

    private static String stripExtension(String fileName) {
        return fileName.substring(0, fileName.length() - EXTENSION.length());
    }
}
