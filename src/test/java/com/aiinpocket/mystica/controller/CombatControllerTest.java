package com.aiinpocket.mystica.controller;

import com.aiinpocket.mystica.exception.CombatConflictException;
import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.model.dto.CombatHistorySummary;
import com.aiinpocket.mystica.model.dto.CombatRewards;
import com.aiinpocket.mystica.service.combat.CombatHistoryService;
import com.aiinpocket.mystica.service.combat.CombatService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("戰鬥 REST API")
class CombatControllerTest {

    @Mock
    private CombatService combatService;

    @Mock
    private CombatHistoryService historyService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CombatController(combatService, historyService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("已有進行中戰鬥時開戰回傳 409")
    void startConflict() throws Exception {
        when(combatService.startCombat("p-1", "forest", 5))
                .thenThrow(new CombatConflictException("Player p-1 already has an active combat session"));

        mockMvc.perform(post("/api/combat/start")
                        .header("X-Player-Id", "p-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"locationId\":\"forest\",\"level\":5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Player p-1 already has an active combat session"));
    }

    @Test
    @DisplayName("缺少等級時回傳 400")
    void startWithoutLevel() throws Exception {
        mockMvc.perform(post("/api/combat/start")
                        .header("X-Player-Id", "p-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"locationId\":\"forest\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("level is required"));
    }

    @Test
    @DisplayName("缺少玩家標頭時回傳 400")
    void missingPlayerHeader() throws Exception {
        mockMvc.perform(get("/api/combat/active-session"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("攻擊他人或已結束的 session 回傳 404，且不執行回合")
    void attackUnknownSession() throws Exception {
        when(combatService.getCombatSessionForRecovery("s-9", "p-1"))
                .thenThrow(new CombatNotFoundException("Combat session", "s-9"));

        mockMvc.perform(post("/api/combat/attack")
                        .header("X-Player-Id", "p-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s-9\",\"tapDegrees\":15}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Combat session not found: s-9"));
        verify(combatService, never()).executeAttack("s-9", 15);
    }

    @Test
    @DisplayName("手動結算回傳帶型別欄位的獎勵")
    void completeReturnsTypedRewards() throws Exception {
        CombatHistorySummary history = new CombatHistorySummary("forest", 3, 1, 2, 0, 1);
        when(combatService.completeCombat("s-1", "defeat")).thenReturn(new CombatRewards.Defeat(history));

        mockMvc.perform(post("/api/combat/complete")
                        .header("X-Player-Id", "p-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s-1\",\"result\":\"defeat\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("defeat"))
                .andExpect(jsonPath("$.combatHistory.defeats").value(2));
    }

    @Test
    @DisplayName("沒有進行中戰鬥時回傳 204")
    void noActiveSession() throws Exception {
        when(combatService.getActiveSession("p-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/combat/active-session").header("X-Player-Id", "p-1"))
                .andExpect(status().isNoContent());
    }
}
