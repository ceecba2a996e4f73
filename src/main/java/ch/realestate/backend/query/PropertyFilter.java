package ch.realestate.backend.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Search criteria for the property catalog. Every field is optional; a null field places no constraint on its
 * dimension.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyFilter {
    private String city;          // substring, case-insensitive
    private String propertyType;  // whole value, case-insensitive
    private Double minPrice;
    private Double maxPrice;
    private Integer bedrooms;     // minimum
    private Double bathrooms;     // minimum
    private String query;         // free text over title, description, city, state
    private Boolean featured;

    public static PropertyFilter none() {
        return new PropertyFilter();
    }

    public static PropertyFilter featuredOnly() {
        return PropertyFilter.builder().featured(Boolean.TRUE).build();
    }
}
