package com.czesl.vert.io;

import java.nio.file.Path;
import java.util.Objects;

/** The three layer files belonging to one annotated document set. */
public final class MetaFile {
    private final String name;
    private final Path wFile;
    private final Path aFile;
    private final Path bFile;

    public MetaFile(String name, Path wFile, Path aFile, Path bFile) {
        this.name = Objects.requireNonNull(name, "name");
        this.wFile = Objects.requireNonNull(wFile, "wFile");
        this.aFile = Objects.requireNonNull(aFile, "aFile");
        this.bFile = Objects.requireNonNull(bFile, "bFile");
    }

    public String getName() {
        return name;
    }

    public Path getWFile() {
        return wFile;
    }

    public Path getAFile() {
        return aFile;
    }

    public Path getBFile() {
        return bFile;
    }

    @Override
    public String toString() {
        return "MetaFile(" + name + ")";
    }
}
