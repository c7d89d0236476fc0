package com.czesl.vert.io;

import com.czesl.vert.convert.ConversionException;
import com.czesl.vert.convert.LayerTrees;
import java.util.Objects;

/** Contents of the three layer files of one document set. */
public final class MetaXml {
    private final String name;
    private final String wXml;
    private final String aXml;
    private final String bXml;

    public MetaXml(String name, String wXml, String aXml, String bXml) {
        this.name = Objects.requireNonNull(name, "name");
        this.wXml = Objects.requireNonNull(wXml, "wXml");
        this.aXml = Objects.requireNonNull(aXml, "aXml");
        this.bXml = Objects.requireNonNull(bXml, "bXml");
    }

    public String getName() {
        return name;
    }

    public String getWXml() {
        return wXml;
    }

    public String getAXml() {
        return aXml;
    }

    public String getBXml() {
        return bXml;
    }

    public LayerTrees parse() throws ConversionException {
        return LayerTrees.parse(name, wXml, aXml, bXml);
    }
}
