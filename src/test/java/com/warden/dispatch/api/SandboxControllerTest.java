package com.warden.dispatch.api;

import com.warden.core.gateway.DegradationLadder;
import com.warden.core.gateway.SecurityGateway;
import com.warden.core.model.IsolationLevel;
import com.warden.sandbox.PoolStats;
import com.warden.sandbox.SandboxPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SandboxController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SandboxControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SandboxPool pool;

    @MockitoBean
    private DegradationLadder ladder;

    @MockitoBean
    private SecurityGateway gateway;

    @Test
    @DisplayName("GET /sandboxes lists pool occupancy and ladder state")
    void listSandboxes() throws Exception {
        when(pool.snapshot()).thenReturn(List.of(new PoolStats(IsolationLevel.CONTAINER, 2, 3, 1, 2, 1, 0, true)));
        when(ladder.status()).thenReturn(List.of(
                new DegradationLadder.LevelStatus(IsolationLevel.MICRO_VM, 3, true)));

        mockMvc.perform(get("/api/v1/sandboxes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pools[0].level").value("CONTAINER"))
                .andExpect(jsonPath("$.pools[0].idle").value(1))
                .andExpect(jsonPath("$.levels[0].level").value("MICRO_VM"))
                .andExpect(jsonPath("$.levels[0].down").value(true));
    }

    @Test
    @DisplayName("POST /{level}/reset resets a down level")
    void resetLevel() throws Exception {
        when(gateway.resetLevel(IsolationLevel.MICRO_VM, "api")).thenReturn(true);

        mockMvc.perform(post("/api/v1/sandboxes/micro_vm/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.level").value("MICRO_VM"))
                .andExpect(jsonPath("$.reset").value(true));
    }

    @Test
    @DisplayName("POST /{level}/reset with an unknown level returns 400")
    void resetUnknownLevel() throws Exception {
        mockMvc.perform(post("/api/v1/sandboxes/quantum/reset"))
                .andExpect(status().isBadRequest());
    }
}
