package com.czesl.vert.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups {@code <base>.w.xml}, {@code <base>.a.xml} and {@code <base>.b.xml} files into document sets.
 * The base name is the file name up to its first dot. Sets are returned sorted by base name.
 */
public final class MetaFiles {
    private static final String XML_SUFFIX = ".xml";

    private MetaFiles() {}

    public static List<MetaFile> fromDirectory(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + XML_SUFFIX)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        }
        return group(files);
    }

    public static List<MetaFile> fromFiles(List<Path> files) throws IOException {
        Set<Path> unique = new LinkedHashSet<>();
        for (Path file : files) {
            if (file.getFileName().toString().endsWith(XML_SUFFIX)) {
                unique.add(file.toAbsolutePath().normalize());
            }
        }
        return group(new ArrayList<>(unique));
    }

    public static MetaXml read(MetaFile metaFile) throws IOException {
        return new MetaXml(
                metaFile.getName(),
                Files.readString(metaFile.getWFile(), StandardCharsets.UTF_8),
                Files.readString(metaFile.getAFile(), StandardCharsets.UTF_8),
                Files.readString(metaFile.getBFile(), StandardCharsets.UTF_8));
    }

    static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot >= 0 ? fileName.substring(0, dot) : fileName;
    }

    private static List<MetaFile> group(List<Path> files) throws NoSuchFileException {
        Map<String, Map<String, Path>> baseNameToPaths = new TreeMap<>();
        for (Path file : files) {
            baseNameToPaths
                    .computeIfAbsent(baseName(file), key -> new TreeMap<>())
                    .put(file.getFileName().toString(), file);
        }
        List<MetaFile> metaFiles = new ArrayList<>(baseNameToPaths.size());
        for (Map.Entry<String, Map<String, Path>> entry : baseNameToPaths.entrySet()) {
            String baseName = entry.getKey();
            Map<String, Path> nameToPath = entry.getValue();
            metaFiles.add(
                    new MetaFile(
                            baseName,
                            require(nameToPath, baseName + ".w" + XML_SUFFIX),
                            require(nameToPath, baseName + ".a" + XML_SUFFIX),
                            require(nameToPath, baseName + ".b" + XML_SUFFIX)));
        }
        return metaFiles;
    }

    private static Path require(Map<String, Path> nameToPath, String fileName) throws NoSuchFileException {
        Path path = nameToPath.get(fileName);
        if (path == null) {
            throw new NoSuchFileException(fileName, null, "File " + fileName + " expected but not found");
        }
        return path;
    }
}
