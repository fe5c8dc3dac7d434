package com.relaychat.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.relaychat.model.ChatMessage;
import com.relaychat.store.MirrorStore;
import com.relaychat.store.PrimaryStore;
import com.relaychat.store.StoreUnavailableException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class HistoryControllerTest {

    private static final Instant NOON = Instant.parse("2024-05-01T12:00:00Z");

    private MirrorStore mirrorStore;
    private PrimaryStore primaryStore;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mirrorStore = mock(MirrorStore.class);
        primaryStore = mock(PrimaryStore.class);
        mvc = MockMvcBuilders.standaloneSetup(new HistoryController(mirrorStore, primaryStore)).build();
    }

    @Test
    void getMessagesReturnsTheMirrorWithoutIds() throws Exception {
        when(mirrorStore.load()).thenReturn(List.of(new ChatMessage(NOON, "alice", "hi")));

        mvc.perform(get("/get_messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].date").value("2024-05-01T12:00:00Z"))
                .andExpect(jsonPath("$[0].username").value("alice"))
                .andExpect(jsonPath("$[0].message").value("hi"))
                .andExpect(jsonPath("$[0].id").doesNotExist());
    }

    @Test
    void missingMirrorIsAnEmptyArray() throws Exception {
        when(mirrorStore.load()).thenReturn(new ArrayList<>());

        mvc.perform(get("/api/messages/history"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
        verifyNoInteractions(primaryStore);
    }

    @Test
    void primaryHistoryIsCappedAtTheMaximumLimit() throws Exception {
        when(primaryStore.recent(HistoryController.MAX_LIMIT))
                .thenReturn(List.of(new ChatMessage(5L, NOON, "bob", "yo")));

        mvc.perform(get("/api/messages/history").param("source", "primary").param("limit", "10000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].username").value("bob"));
        verify(primaryStore).recent(HistoryController.MAX_LIMIT);
    }

    @Test
    void primaryHistoryDefaultsToFiftyMessages() throws Exception {
        when(primaryStore.recent(HistoryController.DEFAULT_LIMIT)).thenReturn(List.of());

        mvc.perform(get("/api/messages/history").param("source", "primary"))
                .andExpect(status().isOk());
        verify(primaryStore).recent(50);
    }

    @Test
    void unavailablePrimaryIsServiceUnavailable() throws Exception {
        when(primaryStore.recent(50)).thenThrow(new StoreUnavailableException("down",
                new DataAccessResourceFailureException("Communications link failure")));

        mvc.perform(get("/api/messages/history").param("source", "primary"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void badParametersAreRejected() throws Exception {
        mvc.perform(get("/api/messages/history").param("source", "cache"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/messages/history").param("source", "primary").param("limit", "0"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(primaryStore);
    }
}
