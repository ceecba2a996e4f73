package ch.realestate.backend.models;

/**
 * Stored field names of documents in the {@value #COLLECTION} collection.
 */
public final class PropertyFields {

    public static final String COLLECTION = "property";

    public static final String ID = "_id";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String PRICE = "price";
    public static final String ADDRESS = "address";
    public static final String CITY = "city";
    public static final String STATE = "state";
    public static final String ZIP_CODE = "zip_code";
    public static final String BEDROOMS = "bedrooms";
    public static final String BATHROOMS = "bathrooms";
    public static final String AREA_SQFT = "area_sqft";
    public static final String PROPERTY_TYPE = "property_type";
    public static final String IMAGES = "images";
    public static final String AMENITIES = "amenities";
    public static final String FEATURED = "featured";
    public static final String STATUS = "status";
    public static final String LISTED_AT = "listed_at";

    private PropertyFields() {
    }
}
