package buildinghealth.domain.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;

/**
 * Lista ordenada de nombres de características que consume un modelo.
 * Dos esquemas son compatibles solo si coinciden en nombres, orden y longitud.
 */
public record FeatureSchema(List<String> names) {

    public FeatureSchema {
        Objects.requireNonNull(names, "names");
        names = List.copyOf(names);
    }

    @JsonCreator
    public static FeatureSchema of(List<String> names) {
        return new FeatureSchema(names);
    }

    public static FeatureSchema of(String... names) {
        return new FeatureSchema(List.of(names));
    }

    @JsonValue
    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public boolean isCompatibleWith(FeatureSchema other) {
        return other != null && names.equals(other.names);
    }
}
