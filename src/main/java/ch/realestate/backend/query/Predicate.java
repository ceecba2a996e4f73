package ch.realestate.backend.query;

import com.mongodb.client.model.Filters;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AND of per-field constraints selecting documents in a collection. A predicate without constraints selects every
 * document.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Predicate {

    private static final Predicate ALWAYS = new Predicate(List.of());

    private final List<Constraint> constraints;

    private Predicate(List<Constraint> constraints) {
        this.constraints = List.copyOf(constraints);
    }

    public static Predicate always() {
        return ALWAYS;
    }

    public static Predicate allOf(List<Constraint> constraints) {
        return constraints.isEmpty() ? ALWAYS : new Predicate(constraints);
    }

    public static Predicate of(Constraint... constraints) {
        return allOf(List.of(constraints));
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    /**
     * Renders the predicate as a MongoDB query filter. The empty predicate renders as {@code {}}.
     */
    public Bson toBson() {
        if (constraints.isEmpty()) {
            return new Document();
        }
        if (constraints.size() == 1) {
            return constraints.get(0).toBson();
        }
        return Filters.and(constraints.stream().map(Constraint::toBson).collect(Collectors.toList()));
    }

    public boolean matches(Document document) {
        return constraints.stream().allMatch(constraint -> constraint.matches(document));
    }
}
