package com.example.filematcher;

import com.example.filematcher.model.Action;
import com.example.filematcher.model.HashAlgorithm;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public class ConfigLoader {
    private static final Action DEFAULT_ACTION = Action.COMPARE;
    private static final HashAlgorithm DEFAULT_HASH_ALGORITHM = HashAlgorithm.MD5;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public MatcherConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        return fromRaw(raw);
    }

    MatcherConfig fromRaw(RawConfig raw) {
        if (isBlank(raw.dir1) || isBlank(raw.dir2)) {
            throw new IllegalArgumentException("Config must include both dir1 (master) and dir2.");
        }

        Action action = isBlank(raw.action) ? DEFAULT_ACTION : Action.parse(raw.action);
        HashAlgorithm hashAlgorithm = isBlank(raw.hashAlgorithm) ? DEFAULT_HASH_ALGORITHM : HashAlgorithm.parse(raw.hashAlgorithm);
        boolean execute = raw.execute != null && raw.execute;
        boolean assumeYes = raw.assumeYes != null && raw.assumeYes;
        boolean fallbackSymlink = raw.fallbackSymlink != null && raw.fallbackSymlink;
        boolean fastMode = raw.fastMode != null && raw.fastMode;
        boolean differentNamesOnly = raw.differentNamesOnly != null && raw.differentNamesOnly;
        Optional<Path> auditLog = optionalPath(raw.auditLog);
        Optional<Path> targetDirectory = optionalPath(raw.targetDirectory);
        Optional<Path> reportFile = optionalPath(raw.reportFile);

        if (execute && action == Action.COMPARE) {
            throw new IllegalArgumentException("compare action doesn't modify files - remove execute.");
        }
        if (auditLog.isPresent() && !execute) {
            throw new IllegalArgumentException("auditLog requires execute.");
        }
        if (fallbackSymlink && action != Action.HARDLINK) {
            throw new IllegalArgumentException("fallbackSymlink only applies to the hardlink action.");
        }
        if (targetDirectory.isPresent() && !action.createsLink()) {
            throw new IllegalArgumentException("targetDirectory only applies to the hardlink and symlink actions.");
        }

        return new MatcherConfig(
                Path.of(raw.dir1),
                Path.of(raw.dir2),
                action,
                execute,
                assumeYes,
                fallbackSymlink,
                hashAlgorithm,
                fastMode,
                auditLog,
                targetDirectory,
                differentNamesOnly,
                reportFile
        );
    }

    private Optional<Path> optionalPath(String value) {
        return Optional.ofNullable(value).filter(candidate -> !candidate.isBlank()).map(Path::of);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static class RawConfig {
        public String dir1;
        public String dir2;
        public String action;
        public Boolean execute;
        public Boolean assumeYes;
        public Boolean fallbackSymlink;
        public String hashAlgorithm;
        public Boolean fastMode;
        public String auditLog;
        public String targetDirectory;
        public Boolean differentNamesOnly;
        public String reportFile;
    }
}
