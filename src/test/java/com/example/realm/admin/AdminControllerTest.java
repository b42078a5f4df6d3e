package com.example.realm.admin;

import com.example.realm.error.OccupancyConflictException;
import com.example.realm.error.ValidationException;
import com.example.realm.logic.WorldExecutor;
import com.example.realm.protocol.EntityView;
import com.example.realm.world.EntityKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AdminControllerTest {
    private final AdminService admin = mock(AdminService.class);
    private WorldExecutor worldExecutor;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        worldExecutor = new WorldExecutor();
        mvc = MockMvcBuilders.standaloneSetup(new AdminController(admin, worldExecutor)).build();
    }

    @AfterEach
    void tearDown() {
        worldExecutor.close();
    }

    @Test
    void statusIsReadOnTheWorldThread() throws Exception {
        when(admin.status()).thenReturn(new AdminService.Status(42, 3, 10, 2, 15));

        mvc.perform(get("/admin/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tick").value(42))
                .andExpect(jsonPath("$.online").value(3));
    }

    @Test
    void spawnAnswersCreated() throws Exception {
        when(admin.spawnNpc(1, 1, 20, 20)).thenReturn(
                new EntityView(1005, EntityKind.NPC, 1, 20, 21, null, "Goblin", 1, 30, 30, 0, "IDLE"));

        mvc.perform(post("/admin/npcs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\":1,\"mapId\":1,\"x\":20,\"y\":20}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1005))
                .andExpect(jsonPath("$.y").value(21));
    }

    @Test
    void invalidRequestIsBadRequest() throws Exception {
        when(admin.spawnNpc(anyInt(), anyInt(), anyInt(), anyInt()))
                .thenThrow(new ValidationException("unknown npc template"));

        mvc.perform(post("/admin/npcs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\":99,\"mapId\":1,\"x\":20,\"y\":20}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("unknown npc template"));
    }

    @Test
    void occupiedTargetIsConflict() throws Exception {
        when(admin.teleport(anyLong(), anyInt(), anyInt(), anyInt()))
                .thenThrow(new OccupancyConflictException("tile is occupied"));

        mvc.perform(post("/admin/teleport").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":7,\"mapId\":1,\"x\":3,\"y\":3}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("tile is occupied"));
    }

    @Test
    void despawnAnswersNoContent() throws Exception {
        mvc.perform(delete("/admin/entities/1007")).andExpect(status().isNoContent());

        verify(admin).despawn(1007);
    }

    @Test
    void despawnOfUnknownEntityIsBadRequest() throws Exception {
        doThrow(new ValidationException("no such entity")).when(admin).despawn(5);

        mvc.perform(delete("/admin/entities/5")).andExpect(status().isBadRequest());
    }
}
