package org.calista.arasaka.blueprint.kits;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only lookup of industry kits by id.
 *
 * Resource format: {@code {"kits": [ {IndustryKit}, ... ]}}. Later duplicates of an id are ignored.
 */
public final class IndustryKitCatalog {

    private static final Logger log = LogManager.getLogger(IndustryKitCatalog.class);

    public static final String DEFAULT_RESOURCE = "kits/industry-kits.json";

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class CatalogFile {
        public List<IndustryKit> kits = new ArrayList<>();
    }

    private final Map<String, IndustryKit> kits;

    public IndustryKitCatalog(List<IndustryKit> kits) {
        Objects.requireNonNull(kits, "kits");
        LinkedHashMap<String, IndustryKit> m = new LinkedHashMap<>();
        for (IndustryKit k : kits) {
            if (k == null) continue;
            k.validate();
            if (m.putIfAbsent(k.id, k) != null) {
                log.warn("duplicate industry kit id={} ignored", k.id);
            }
        }
        this.kits = Collections.unmodifiableMap(m);
    }

    public static IndustryKitCatalog empty() {
        return new IndustryKitCatalog(List.of());
    }

    /**
     * Loads the catalog from the classpath.
     *
     * @throws UncheckedIOException  if the resource cannot be read
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static IndustryKitCatalog fromClasspath(String resource, ObjectMapper mapper) {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(mapper, "mapper");

        ClassLoader cl = IndustryKitCatalog.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("industry kit catalog not found: " + resource);

            CatalogFile file = mapper.readValue(in, CatalogFile.class);
            if (file == null || file.kits == null) {
                throw new IllegalStateException("industry kit catalog has no kits: " + resource);
            }
            IndustryKitCatalog out = new IndustryKitCatalog(file.kits);
            log.info("industry kits loaded resource={} count={}", resource, out.size());
            return out;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("malformed industry kit catalog " + resource + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read industry kit catalog " + resource, e);
        }
    }

    public Optional<IndustryKit> find(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(kits.get(id));
    }

    public List<String> ids() {
        return List.copyOf(kits.keySet());
    }

    public int size() {
        return kits.size();
    }
}
