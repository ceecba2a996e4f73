package ch.realestate.backend.query;

import com.mongodb.client.model.Filters;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.Objects;

@Getter
@ToString
@EqualsAndHashCode
public final class EqualsMatch implements Constraint {

    private final String field;
    private final Object value;

    public EqualsMatch(String field, Object value) {
        this.field = field;
        this.value = value;
    }

    @Override
    public Bson toBson() {
        return Filters.eq(field, value);
    }

    @Override
    public boolean matches(Document document) {
        return document.containsKey(field) && Objects.equals(document.get(field), value);
    }
}
