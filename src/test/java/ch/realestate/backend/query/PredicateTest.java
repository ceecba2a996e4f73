package ch.realestate.backend.query;

import com.mongodb.MongoClientSettings;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonRegularExpression;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PredicateTest {

    @Test
    void singleConstraintRendersWithoutAndWrapper() {
        BsonDocument rendered = render(Predicate.of(new EqualsMatch("featured", true)).toBson());

        assertThat(rendered).isEqualTo(new BsonDocument("featured", BsonBoolean.TRUE));
    }

    @Test
    void severalConstraintsRenderAsAnd() {
        Predicate predicate = Predicate.of(
                new EqualsMatch("featured", true),
                RangeMatch.atLeast("bedrooms", 2));

        BsonDocument rendered = render(predicate.toBson());

        assertThat(rendered.getArray("$and")).hasSize(2);
    }

    @Test
    void closedRangeRendersAsOneFieldCondition() {
        BsonDocument rendered = render(RangeMatch.between("price", 200000d, 400000d).toBson());

        BsonDocument price = rendered.getDocument("price");
        assertThat(price.getNumber("$gte").doubleValue()).isEqualTo(200000d);
        assertThat(price.getNumber("$lte").doubleValue()).isEqualTo(400000d);
    }

    @Test
    void rangeNeedsABound() {
        assertThatThrownBy(() -> RangeMatch.between("price", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void textMatchQuotesItsValue() {
        BsonRegularExpression contains = render(TextMatch.contains("city", "a.b").toBson())
                .getRegularExpression("city");
        BsonRegularExpression exact = render(TextMatch.equalsIgnoreCase("property_type", "Condo").toBson())
                .getRegularExpression("property_type");

        assertThat(contains.getPattern()).isEqualTo("\\Qa.b\\E");
        assertThat(contains.getOptions()).isEqualTo("i");
        assertThat(exact.getPattern()).isEqualTo("^\\QCondo\\E$");
    }

    @Test
    void textMatchIgnoresNonStringValues() {
        assertThat(TextMatch.contains("city", "1").matches(new Document("city", 1))).isFalse();
        assertThat(TextMatch.contains("city", "1").matches(new Document())).isFalse();
    }

    @Test
    void orGroupRendersEveryMember() {
        AnyOf anyOf = new AnyOf(List.of(TextMatch.contains("title", "x"), TextMatch.contains("state", "x")));

        assertThat(render(anyOf.toBson()).getArray("$or")).hasSize(2);
        assertThat(anyOf.matches(new Document("state", "XY"))).isTrue();
        assertThat(anyOf.matches(new Document("title", "none"))).isFalse();
    }

    @Test
    void missingFieldDoesNotSatisfyEquality() {
        assertThat(new EqualsMatch("featured", null).matches(new Document())).isFalse();
        assertThat(new EqualsMatch("featured", false).matches(new Document("featured", false))).isTrue();
    }

    private static BsonDocument render(Bson bson) {
        return bson.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
    }
}
