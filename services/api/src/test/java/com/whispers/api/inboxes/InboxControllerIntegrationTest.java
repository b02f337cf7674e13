package com.whispers.api.inboxes;

import com.whispers.api.ApiIntegrationSupport;
import com.whispers.api.messages.MessageRepository;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class InboxControllerIntegrationTest extends ApiIntegrationSupport {

    @Autowired
    private InboxRepository inboxRepository;

    @Autowired
    private MessageRepository messageRepository;

    private String bob;
    private String alice;
    private Cookie bobSession;
    private Cookie aliceSession;

    @BeforeEach
    void users() throws Exception {
        bob = createUser("bob", "bob@x.com", "pw");
        alice = createUser("alice", "alice@x.com", "pw");
        bobSession = login("bob@x.com", "pw");
        aliceSession = login("alice@x.com", "pw");
    }

    // ── POST /api/users/{id}/inboxes ──────────────────────────────────────────

    @Test
    void createInbox_derivesUrlAndRejectsSecondInboxWithSameName() throws Exception {
        var result = mockMvc.perform(post("/api/users/{id}/inboxes", bob)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "work"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("work"))
                .andExpect(jsonPath("$.user_id").value(bob))
                .andReturn();
        String id = read(result, "$.id");
        assertTrue(read(result, "$.url").endsWith("/inboxes/" + id));

        mockMvc.perform(post("/api/users/{id}/inboxes", bob)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "work"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("DUPLICATE_NAME"))
                .andExpect(jsonPath("$.message").value("Inbox already exists"));

        assertEquals(1, inboxRepository.count());
    }

    @Test
    void createInbox_overlongNameIsValidationErrorAndWritesNothing() throws Exception {
        mockMvc.perform(post("/api/users/{id}/inboxes", bob)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "w".repeat(65)))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Name must be at most 64 characters"));

        assertEquals(0, inboxRepository.count());

        mockMvc.perform(post("/api/users/{id}/inboxes", bob)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "w".repeat(64)))))
                .andExpect(status().isCreated());
    }

    @Test
    void createInbox_sameNameIsFineForAnotherUser() throws Exception {
        createInbox(bob, "work");

        mockMvc.perform(post("/api/users/{id}/inboxes", alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "work"))))
                .andExpect(status().isCreated());
    }

    @Test
    void createInbox_ignoresClientSuppliedUrlAndOwner() throws Exception {
        var result = mockMvc.perform(post("/api/users/{id}/inboxes", bob)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "work", "url", "http://evil.example/x", "user_id", alice))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user_id").value(bob))
                .andExpect(jsonPath("$.url").value(startsWith("http://localhost:8080/api/inboxes/")))
                .andReturn();

        mockMvc.perform(get("/api/inboxes/{id}", read(result, "$.id")).cookie(bobSession))
                .andExpect(jsonPath("$.url").value(endsWith("/inboxes/" + read(result, "$.id"))));
    }

    @Test
    void createInbox_requiresNameAndExistingUser() throws Exception {
        mockMvc.perform(post("/api/users/{id}/inboxes", bob)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "  "))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Name is required"));

        mockMvc.perform(post("/api/users/{id}/inboxes", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "work"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("User not found"));
    }

    // ── GET /api/users/{id}/inboxes ───────────────────────────────────────────

    @Test
    void listInboxes_returnsOnlyThatUsersInboxes() throws Exception {
        createInbox(bob, "work");
        createInbox(bob, "home");
        createInbox(alice, "work");

        mockMvc.perform(get("/api/users/{id}/inboxes", bob))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(get("/api/users/{id}/inboxes", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    // ── GET /api/inboxes/{id} ─────────────────────────────────────────────────

    @Test
    void getInbox_ownerOnly() throws Exception {
        String inbox = createInbox(bob, "work");

        mockMvc.perform(get("/api/inboxes/{id}", inbox).cookie(bobSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("work"));

        mockMvc.perform(get("/api/inboxes/{id}", inbox).cookie(aliceSession))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.name").doesNotExist())
                .andExpect(jsonPath("$.url").doesNotExist());

        mockMvc.perform(get("/api/inboxes/{id}", inbox))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    void getInbox_unknownIdIs404ForAuthenticatedCaller() throws Exception {
        mockMvc.perform(get("/api/inboxes/{id}", UUID.randomUUID()).cookie(bobSession))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Inbox not found"));
    }

    // ── PUT /api/inboxes/{id} ─────────────────────────────────────────────────

    @Test
    void updateInbox_ownerRenames() throws Exception {
        String inbox = createInbox(bob, "work");

        mockMvc.perform(put("/api/inboxes/{id}", inbox)
                        .cookie(bobSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "office"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("office"))
                .andExpect(jsonPath("$.url").value(endsWith("/inboxes/" + inbox)));
    }

    @Test
    void updateInbox_otherUserIsRejectedAndNothingChanges() throws Exception {
        String inbox = createInbox(bob, "work");

        mockMvc.perform(put("/api/inboxes/{id}", inbox)
                        .cookie(aliceSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "stolen"))))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/api/inboxes/{id}", inbox).cookie(bobSession))
                .andExpect(jsonPath("$.name").value("work"));
    }

    @Test
    void updateInbox_renameToTakenNameIsRejected() throws Exception {
        createInbox(bob, "work");
        String home = createInbox(bob, "home");

        mockMvc.perform(put("/api/inboxes/{id}", home)
                        .cookie(bobSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "work"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("DUPLICATE_NAME"));

        mockMvc.perform(get("/api/inboxes/{id}", home).cookie(bobSession))
                .andExpect(jsonPath("$.name").value("home"));
        assertEquals(2, inboxRepository.count());
    }

    @Test
    void updateInbox_overlongNameLeavesInboxUntouched() throws Exception {
        String inbox = createInbox(bob, "work");

        mockMvc.perform(put("/api/inboxes/{id}", inbox)
                        .cookie(bobSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "w".repeat(65)))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/api/inboxes/{id}", inbox).cookie(bobSession))
                .andExpect(jsonPath("$.name").value("work"));
    }

    @Test
    void updateInbox_requiresName() throws Exception {
        String inbox = createInbox(bob, "work");

        mockMvc.perform(put("/api/inboxes/{id}", inbox)
                        .cookie(bobSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", ""))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Name is required"));
    }

    // ── DELETE /api/inboxes/{id} ──────────────────────────────────────────────

    @Test
    void deleteInbox_ownerDeletesInboxAndItsMessages() throws Exception {
        String inbox = createInbox(bob, "work");
        String message = postMessage(inbox, "hi", "hello");

        mockMvc.perform(delete("/api/inboxes/{id}", inbox).cookie(bobSession))
                .andExpect(status().isNoContent());

        assertFalse(inboxRepository.existsById(UUID.fromString(inbox)));
        assertFalse(messageRepository.existsById(UUID.fromString(message)));
    }

    @Test
    void deleteInbox_otherUserIsRejected() throws Exception {
        String inbox = createInbox(bob, "work");

        mockMvc.perform(delete("/api/inboxes/{id}", inbox).cookie(aliceSession))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(delete("/api/inboxes/{id}", inbox))
                .andExpect(status().isUnauthorized());

        assertTrue(inboxRepository.existsById(UUID.fromString(inbox)));
    }
}
