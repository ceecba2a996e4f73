package ch.realestate.backend.controller;

import ch.realestate.backend.serialization.DocumentSerializer;
import ch.realestate.backend.store.DocumentStore;
import ch.realestate.backend.store.InMemoryDocumentStore;
import ch.realestate.backend.store.StoreError;
import ch.realestate.backend.store.StoreResult;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class InquiryControllerTest {

    private static final String INQUIRY = """
            {
              "name": "Ann Lee",
              "email": "ann@example.com",
              "message": "Is the apartment still available?",
              "property_id": "665f1c2e8a1b2c3d4e5f6a7b"
            }
            """;

    @Test
    void storesTheInquiryAsSubmitted() throws Exception {
        InMemoryDocumentStore store = new InMemoryDocumentStore();

        mockMvcFor(store).perform(post("/api/inquiries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(INQUIRY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        assertThat(store.contents("inquiry")).hasSize(1);
        Document stored = store.contents("inquiry").get(0);
        assertThat(stored.getString("name")).isEqualTo("Ann Lee");
        assertThat(stored.getString("email")).isEqualTo("ann@example.com");
        assertThat(stored.getString("property_id")).isEqualTo("665f1c2e8a1b2c3d4e5f6a7b");
        assertThat(stored).doesNotContainKey("phone");
        assertThat(stored.keySet()).containsExactly("name", "email", "message", "property_id", "_id");
    }

    @Test
    void failedWriteIsServiceUnavailable() throws Exception {
        DocumentStore store = mock(DocumentStore.class);
        when(store.insert(eq("inquiry"), any(Document.class)))
                .thenReturn(StoreResult.failure(StoreError.WRITE_ERROR, "rejected"));

        mockMvcFor(store).perform(post("/api/inquiries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(INQUIRY))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void incompleteInquiryIsRejected() throws Exception {
        InMemoryDocumentStore store = new InMemoryDocumentStore();

        mockMvcFor(store).perform(post("/api/inquiries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Ann Lee\", \"email\": \"ann@example.com\"}"))
                .andExpect(status().isBadRequest());

        assertThat(store.getInsertCalls()).isZero();
    }

    private static MockMvc mockMvcFor(DocumentStore store) {
        return MockMvcBuilders.standaloneSetup(new InquiryController(new DocumentSerializer(), store)).build();
    }
}
