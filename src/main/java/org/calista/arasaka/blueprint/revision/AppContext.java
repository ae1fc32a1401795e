package org.calista.arasaka.blueprint.revision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only description of a live application: its pages, entities and workflows.
 * Applying revision changes produces a new instance; this one is never modified.
 */
public final class AppContext {

    public final String appId;
    public final String appName;
    public final List<Page> pages;
    public final List<Entity> entities;
    public final List<Workflow> workflows;
    public final String currentPageId;

    public AppContext(String appId,
                      String appName,
                      List<Page> pages,
                      List<Entity> entities,
                      List<Workflow> workflows,
                      String currentPageId) {
        this.appId = Objects.requireNonNull(appId, "appId");
        this.appName = appName == null ? appId : appName;
        this.pages = pages == null ? List.of() : List.copyOf(pages);
        this.entities = entities == null ? List.of() : List.copyOf(entities);
        this.workflows = workflows == null ? List.of() : List.copyOf(workflows);
        this.currentPageId = currentPageId;
    }

    public AppContext withPages(List<Page> pages) {
        return new AppContext(appId, appName, pages, entities, workflows, currentPageId);
    }

    public AppContext withEntities(List<Entity> entities) {
        return new AppContext(appId, appName, pages, entities, workflows, currentPageId);
    }

    public AppContext withWorkflows(List<Workflow> workflows) {
        return new AppContext(appId, appName, pages, entities, workflows, currentPageId);
    }

    public Page page(String id) {
        for (Page p : pages) {
            if (p.id.equals(id)) return p;
        }
        return null;
    }

    public Entity entity(String id) {
        for (Entity e : entities) {
            if (e.id().equals(id)) return e;
        }
        return null;
    }

    public Workflow workflow(String id) {
        for (Workflow w : workflows) {
            if (w.id().equals(id)) return w;
        }
        return null;
    }

    // -------------------- Page --------------------

    /**
     * Page with open-ended attributes (route, order, showInSidebar, ...).
     */
    public static final class Page {
        public final String id;
        public final String name;
        public final String type;
        public final Map<String, Object> attributes;

        public Page(String id, String name, String type, Map<String, Object> attributes) {
            this.id = Objects.requireNonNull(id, "id");
            this.name = name == null ? id : name;
            this.type = type == null ? "custom" : type;
            this.attributes = attributes == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public Page(String id, String name) {
            this(id, name, null, null);
        }

        public static Page fromMap(Map<String, Object> m) {
            Map<String, Object> rest = new LinkedHashMap<>(m);
            Object id = rest.remove("id");
            Object name = rest.remove("name");
            Object type = rest.remove("type");
            return new Page(String.valueOf(id), name == null ? null : String.valueOf(name),
                    type == null ? null : String.valueOf(type), rest);
        }

        /**
         * Shallow merge: keys of {@code patch} replace this page's values.
         */
        public Page merge(Map<String, Object> patch) {
            Map<String, Object> m = toMap();
            if (patch != null) m.putAll(patch);
            return fromMap(m);
        }

        public Object attribute(String key) {
            return attributes.get(key);
        }

        public Map<String, Object> toMap() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", id);
            m.put("name", name);
            m.put("type", type);
            m.putAll(attributes);
            return m;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Page p)) return false;
            return id.equals(p.id) && name.equals(p.name) && type.equals(p.type) && attributes.equals(p.attributes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, name, type, attributes);
        }

        @Override
        public String toString() {
            return "Page{" + id + ", " + name + "}";
        }
    }

    // -------------------- Entity / Workflow --------------------

    public record Entity(String id, String name, List<String> fields) {
        public Entity {
            Objects.requireNonNull(id, "id");
            name = name == null ? id : name;
            fields = fields == null ? List.of() : List.copyOf(fields);
        }

        public static Entity fromMap(Map<String, Object> m) {
            Object id = m.get("id");
            Object name = m.get("name");
            return new Entity(String.valueOf(id), name == null ? null : String.valueOf(name), List.of());
        }
    }

    public record Workflow(String id, String name) {
        public Workflow {
            Objects.requireNonNull(id, "id");
            name = name == null ? id : name;
        }

        public static Workflow fromMap(Map<String, Object> m) {
            Object id = m.get("id");
            Object name = m.get("name");
            return new Workflow(String.valueOf(id), name == null ? null : String.valueOf(name));
        }
    }
}
