package com.czesl.vert.tools;

import com.czesl.vert.convert.ConversionException;
import com.czesl.vert.convert.VertConverter;
import com.czesl.vert.diagnostics.Diagnostics;
import com.czesl.vert.io.MetaFile;
import com.czesl.vert.io.MetaFiles;
import com.czesl.vert.io.MetaXml;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts document sets one after another. A set that fails to load, parse or convert is reported
 * and left out of the output; the remaining sets are still converted.
 */
public final class BatchConverter {
    private static final Logger LOGGER = Logger.getLogger(BatchConverter.class.getName());

    private final VertConverter converter;

    public BatchConverter(VertConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter");
    }

    /**
     * @throws IOException when writing to {@code out} fails; read failures only skip the set
     */
    public BatchResult run(List<MetaFile> metaFiles, Appendable out) throws IOException {
        Diagnostics diagnostics = new Diagnostics();
        List<String> converted = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (MetaFile metaFile : metaFiles) {
            MetaXml metaXml;
            try {
                metaXml = MetaFiles.read(metaFile);
            } catch (IOException ex) {
                skip(metaFile.getName(), ex, diagnostics, failed);
                continue;
            }
            convertOne(metaXml, out, diagnostics, converted, failed);
        }
        return new BatchResult(converted, failed, diagnostics.getMessages());
    }

    /** Same as {@link #run(List, Appendable)} for document sets already read into memory. */
    public BatchResult runXml(List<MetaXml> sets, Appendable out) throws IOException {
        Diagnostics diagnostics = new Diagnostics();
        List<String> converted = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (MetaXml metaXml : sets) {
            convertOne(metaXml, out, diagnostics, converted, failed);
        }
        return new BatchResult(converted, failed, diagnostics.getMessages());
    }

    private void convertOne(
            MetaXml metaXml,
            Appendable out,
            Diagnostics diagnostics,
            List<String> converted,
            List<String> failed)
            throws IOException {
        String text;
        try {
            text = converter.convert(metaXml.parse(), diagnostics);
        } catch (ConversionException | RuntimeException ex) {
            skip(metaXml.getName(), ex, diagnostics, failed);
            return;
        }
        out.append(text);
        converted.add(metaXml.getName());
    }

    private static void skip(String name, Exception ex, Diagnostics diagnostics, List<String> failed) {
        diagnostics.error(name, "Skipping document set: " + ex.getMessage());
        LOGGER.log(Level.WARNING, "Failed to convert document set " + name, ex);
        failed.add(name);
    }
}
