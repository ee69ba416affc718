package buildinghealth.domain.feature;

import buildinghealth.domain.exception.SchemaMismatchException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Vector numérico de longitud fija derivado de una o varias muestras.
 * <p>
 * Guarda una copia defensiva de los valores; el esquema viaja con el vector para que el
 * motor pueda validarlo contra el modelo activo antes de puntuar.
 */
public final class FeatureVector {

    private final FeatureSchema schema;
    private final double[] values;

    public FeatureVector(FeatureSchema schema, double[] values) {
        this.schema = Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(values, "values");
        if (values.length != schema.size()) {
            throw new SchemaMismatchException(String.format(
                    "Feature vector has %d values but its schema declares %d features %s",
                    values.length, schema.size(), schema.names()));
        }
        this.values = values.clone();
    }

    public FeatureSchema schema() {
        return schema;
    }

    public int length() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector that)) return false;
        return schema.equals(that.schema) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * schema.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + schema.names() + "=" + Arrays.toString(values);
    }
}
