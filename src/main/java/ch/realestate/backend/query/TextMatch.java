package ch.realestate.backend.query;

import com.mongodb.client.model.Filters;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive string match on one field. The value is taken literally, never as a pattern.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TextMatch implements Constraint {

    public enum Mode {
        CONTAINS,
        EQUALS
    }

    private final String field;
    private final String value;
    private final Mode mode;

    private TextMatch(String field, String value, Mode mode) {
        this.field = field;
        this.value = value;
        this.mode = mode;
    }

    public static TextMatch contains(String field, String value) {
        return new TextMatch(field, value, Mode.CONTAINS);
    }

    public static TextMatch equalsIgnoreCase(String field, String value) {
        return new TextMatch(field, value, Mode.EQUALS);
    }

    @Override
    public Bson toBson() {
        String quoted = Pattern.quote(value);
        String regex = mode == Mode.EQUALS ? "^" + quoted + "$" : quoted;
        return Filters.regex(field, regex, "i");
    }

    @Override
    public boolean matches(Document document) {
        Object candidate = document.get(field);
        if (!(candidate instanceof String)) {
            return false;
        }
        String actual = ((String) candidate).toLowerCase(Locale.ROOT);
        String expected = value.toLowerCase(Locale.ROOT);
        return mode == Mode.EQUALS ? actual.equals(expected) : actual.contains(expected);
    }
}
