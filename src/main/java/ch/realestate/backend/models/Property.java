package ch.realestate.backend.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Date;
import java.util.List;

import static ch.realestate.backend.models.PropertyFields.ADDRESS;
import static ch.realestate.backend.models.PropertyFields.AMENITIES;
import static ch.realestate.backend.models.PropertyFields.AREA_SQFT;
import static ch.realestate.backend.models.PropertyFields.BATHROOMS;
import static ch.realestate.backend.models.PropertyFields.BEDROOMS;
import static ch.realestate.backend.models.PropertyFields.CITY;
import static ch.realestate.backend.models.PropertyFields.DESCRIPTION;
import static ch.realestate.backend.models.PropertyFields.FEATURED;
import static ch.realestate.backend.models.PropertyFields.IMAGES;
import static ch.realestate.backend.models.PropertyFields.LISTED_AT;
import static ch.realestate.backend.models.PropertyFields.PRICE;
import static ch.realestate.backend.models.PropertyFields.PROPERTY_TYPE;
import static ch.realestate.backend.models.PropertyFields.STATE;
import static ch.realestate.backend.models.PropertyFields.STATUS;
import static ch.realestate.backend.models.PropertyFields.TITLE;
import static ch.realestate.backend.models.PropertyFields.ZIP_CODE;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = PropertyFields.COLLECTION)
public class Property {
    @Id
    private String id; // assigned by the store, absent before insert
    private String title;
    private String description;
    private Number price;        // stored with the numeric type it was given
    private String address;
    private String city;
    private String state;
    private String zipCode;
    private int bedrooms;
    private double bathrooms;
    private Number areaSqft;
    private String propertyType; // e.g. "House", "Apartment", "Condo"
    private List<String> images;
    private List<String> amenities;
    private boolean featured;
    private String status;       // e.g. "For Sale"
    private Instant listedAt;

    /**
     * Stored form of this property, without identity.
     */
    public org.bson.Document toDocument() {
        org.bson.Document doc = new org.bson.Document(TITLE, title)
                .append(DESCRIPTION, description)
                .append(PRICE, price)
                .append(ADDRESS, address)
                .append(CITY, city)
                .append(STATE, state)
                .append(ZIP_CODE, zipCode)
                .append(BEDROOMS, bedrooms)
                .append(BATHROOMS, bathrooms)
                .append(AREA_SQFT, areaSqft)
                .append(PROPERTY_TYPE, propertyType)
                .append(IMAGES, images != null ? images : List.of())
                .append(AMENITIES, amenities != null ? amenities : List.of())
                .append(FEATURED, featured)
                .append(STATUS, status);
        if (listedAt != null) {
            doc.append(LISTED_AT, Date.from(listedAt));
        }
        return doc;
    }
}
