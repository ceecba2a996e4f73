package ch.realestate.backend.query;

import com.mongodb.client.model.Filters;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.bson.Document;
import org.bson.conversions.Bson;

/**
 * Inclusive numeric range on one field. Either bound may be open (null), never both.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RangeMatch implements Constraint {

    private final String field;
    private final Number min;
    private final Number max;

    private RangeMatch(String field, Number min, Number max) {
        if (min == null && max == null) {
            throw new IllegalArgumentException("Range on '" + field + "' needs at least one bound");
        }
        this.field = field;
        this.min = min;
        this.max = max;
    }

    public static RangeMatch between(String field, Number min, Number max) {
        return new RangeMatch(field, min, max);
    }

    public static RangeMatch atLeast(String field, Number min) {
        return new RangeMatch(field, min, null);
    }

    @Override
    public Bson toBson() {
        if (max == null) {
            return Filters.gte(field, min);
        }
        if (min == null) {
            return Filters.lte(field, max);
        }
        // single operator document on the field: {field: {$gte: min, $lte: max}}
        return new Document(field, new Document("$gte", min).append("$lte", max));
    }

    @Override
    public boolean matches(Document document) {
        Object candidate = document.get(field);
        if (!(candidate instanceof Number)) {
            return false;
        }
        double actual = ((Number) candidate).doubleValue();
        if (min != null && actual < min.doubleValue()) {
            return false;
        }
        return max == null || actual <= max.doubleValue();
    }
}
