package ch.realestate.backend.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.Document;

/**
 * Contact submission from a prospective buyer, stored as submitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Inquiry {

    public static final String COLLECTION = "inquiry";

    @NotBlank
    private String name;
    @NotBlank
    @Email
    private String email;
    private String phone;
    @NotBlank
    private String message;
    @JsonProperty("property_id")
    private String propertyId;

    public Document toDocument() {
        Document doc = new Document("name", name)
                .append("email", email);
        if (phone != null) {
            doc.append("phone", phone);
        }
        doc.append("message", message);
        if (propertyId != null) {
            doc.append("property_id", propertyId);
        }
        return doc;
    }
}
