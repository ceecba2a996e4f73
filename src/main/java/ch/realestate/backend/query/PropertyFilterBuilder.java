package ch.realestate.backend.query;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

import static ch.realestate.backend.models.PropertyFields.BATHROOMS;
import static ch.realestate.backend.models.PropertyFields.BEDROOMS;
import static ch.realestate.backend.models.PropertyFields.CITY;
import static ch.realestate.backend.models.PropertyFields.DESCRIPTION;
import static ch.realestate.backend.models.PropertyFields.FEATURED;
import static ch.realestate.backend.models.PropertyFields.PRICE;
import static ch.realestate.backend.models.PropertyFields.PROPERTY_TYPE;
import static ch.realestate.backend.models.PropertyFields.STATE;
import static ch.realestate.backend.models.PropertyFields.TITLE;

/**
 * Translates {@link PropertyFilter} criteria into a {@link Predicate} over the property collection.
 *
 * <p>Each present criterion contributes exactly one constraint and absent criteria contribute nothing, so an empty
 * filter yields {@link Predicate#always()}. The free-text query becomes one OR-group across title, description,
 * city and state, ANDed with the rest.
 */
@Component
public class PropertyFilterBuilder {

    static final List<String> FREE_TEXT_FIELDS = List.of(TITLE, DESCRIPTION, CITY, STATE);

    public Predicate build(PropertyFilter filter) {
        if (filter == null) {
            return Predicate.always();
        }
        List<Constraint> constraints = new ArrayList<>();

        if (StringUtils.hasText(filter.getCity())) {
            constraints.add(TextMatch.contains(CITY, filter.getCity()));
        }
        if (StringUtils.hasText(filter.getPropertyType())) {
            constraints.add(TextMatch.equalsIgnoreCase(PROPERTY_TYPE, filter.getPropertyType()));
        }
        if (filter.getFeatured() != null) {
            constraints.add(new EqualsMatch(FEATURED, filter.getFeatured()));
        }
        if (filter.getMinPrice() != null || filter.getMaxPrice() != null) {
            constraints.add(RangeMatch.between(PRICE, filter.getMinPrice(), filter.getMaxPrice()));
        }
        if (filter.getBedrooms() != null) {
            constraints.add(RangeMatch.atLeast(BEDROOMS, filter.getBedrooms()));
        }
        if (filter.getBathrooms() != null) {
            constraints.add(RangeMatch.atLeast(BATHROOMS, filter.getBathrooms()));
        }
        if (StringUtils.hasText(filter.getQuery())) {
            List<Constraint> anyField = new ArrayList<>();
            for (String field : FREE_TEXT_FIELDS) {
                anyField.add(TextMatch.contains(field, filter.getQuery()));
            }
            constraints.add(new AnyOf(anyField));
        }

        return Predicate.allOf(constraints);
    }
}
