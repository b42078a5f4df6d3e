package com.example.realm.content;

import com.example.realm.error.FatalStartupException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

public class ContentLoader {
    private static final Logger log = LoggerFactory.getLogger(ContentLoader.class);

    private final ObjectMapper om;
    private final ClassLoader classLoader;

    public ContentLoader(ObjectMapper om) {
        this(om, ContentLoader.class.getClassLoader());
    }

    public ContentLoader(ObjectMapper om, ClassLoader classLoader) {
        this.om = om;
        this.classLoader = classLoader;
    }

    public ContentCatalog load(String location, int goldItemId) {
        String base = location.endsWith("/") ? location : location + "/";
        ContentCatalog catalog = new ContentCatalog(
                read(base + "maps.json", new TypeReference<List<MapDefinition>>() {}),
                read(base + "npcs.json", new TypeReference<List<NpcTemplate>>() {}),
                read(base + "items.json", new TypeReference<List<ItemTemplate>>() {}),
                read(base + "spells.json", new TypeReference<List<SpellTemplate>>() {}));
        catalog.validate(goldItemId);
        log.info("Loaded content from {}: {} maps, {} npc templates", base, catalog.maps().size(), catalog.npcs().size());
        return catalog;
    }

    private <T> List<T> read(String path, TypeReference<List<T>> type) {
        try (InputStream in = classLoader.getResourceAsStream(path)) {
            if (in == null) throw new FatalStartupException("content file not found: " + path);
            List<T> values = om.readValue(in, type);
            if (values == null) throw new FatalStartupException("content file is empty: " + path);
            return values;
        } catch (IOException e) {
            throw new FatalStartupException("content file is corrupt: " + path, e);
        }
    }
}
