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
 * OR-group: satisfied when at least one member constraint is.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AnyOf implements Constraint {

    private final List<Constraint> members;

    public AnyOf(List<Constraint> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("An OR-group needs at least one member");
        }
        this.members = List.copyOf(members);
    }

    @Override
    public Bson toBson() {
        return Filters.or(members.stream().map(Constraint::toBson).collect(Collectors.toList()));
    }

    @Override
    public boolean matches(Document document) {
        return members.stream().anyMatch(member -> member.matches(document));
    }
}
