package org.calista.arasaka.blueprint.kits;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog entry describing the defaults of one business vertical.
 * Plain Jackson POJO; {@link #validate()} normalizes missing lists to empty and makes all lists
 * unmodifiable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IndustryKit {

    public String id;
    public String name;
    public List<KitEntity> entities = new ArrayList<>();
    /** Workflow ids suggested for the vertical. */
    public List<String> workflows = new ArrayList<>();
    public List<SuggestedIntegration> suggestedIntegrations = new ArrayList<>();
    /** Optional. */
    public FeatureBundle featureBundle;

    // -------------------- Parts --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class KitEntity {
        public String id;
        public String name;
        public String pluralName;

        public KitEntity() {}

        public KitEntity(String id, String name, String pluralName) {
            this.id = id;
            this.name = name;
            this.pluralName = pluralName;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SuggestedIntegration {
        public String id;
        public String name;
        public String purpose;

        public SuggestedIntegration() {}

        public SuggestedIntegration(String id, String name, String purpose) {
            this.id = id;
            this.name = name;
            this.purpose = purpose;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FeatureBundle {
        public List<String> core = new ArrayList<>();
        public List<String> recommended = new ArrayList<>();
        public List<String> optional = new ArrayList<>();
    }

    // -------------------- Validation --------------------

    /**
     * @throws IllegalStateException when the kit has no id
     */
    public IndustryKit validate() {
        if (id == null || id.isBlank()) throw new IllegalStateException("industry kit without id");
        if (name == null || name.isBlank()) name = id;
        if (entities == null) entities = new ArrayList<>();
        if (workflows == null) workflows = new ArrayList<>();
        if (suggestedIntegrations == null) suggestedIntegrations = new ArrayList<>();
        if (featureBundle != null) {
            if (featureBundle.core == null) featureBundle.core = new ArrayList<>();
            if (featureBundle.recommended == null) featureBundle.recommended = new ArrayList<>();
            if (featureBundle.optional == null) featureBundle.optional = new ArrayList<>();
        }
        List<KitEntity> kept = new ArrayList<>(entities.size());
        for (KitEntity e : entities) {
            if (e == null || e.id == null || e.name == null) continue;
            if (e.pluralName == null) e.pluralName = e.name + "s";
            kept.add(e);
        }

        entities = List.copyOf(kept);
        workflows = frozen(workflows);
        suggestedIntegrations = frozen(suggestedIntegrations);
        if (featureBundle != null) {
            featureBundle.core = frozen(featureBundle.core);
            featureBundle.recommended = frozen(featureBundle.recommended);
            featureBundle.optional = frozen(featureBundle.optional);
        }
        return this;
    }

    private static <T> List<T> frozen(List<T> in) {
        List<T> out = new ArrayList<>(in.size());
        for (T t : in) {
            if (t != null) out.add(t);
        }
        return List.copyOf(out);
    }

    public List<String> entityNames() {
        List<String> out = new ArrayList<>(entities.size());
        for (KitEntity e : entities) out.add(e.name);
        return out;
    }

    public List<String> recommendedFeatures() {
        return featureBundle == null ? List.of() : featureBundle.recommended;
    }

    @Override
    public String toString() {
        return "IndustryKit{" + id + "}";
    }
}
