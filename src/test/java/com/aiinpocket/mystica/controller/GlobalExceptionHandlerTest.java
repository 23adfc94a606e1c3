package com.aiinpocket.mystica.controller;

import com.aiinpocket.mystica.exception.CombatConflictException;
import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.exception.CombatValidationException;
import com.aiinpocket.mystica.exception.GameDataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("全域例外對應")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("輸入錯誤 → 400")
    void validationIsBadRequest() {
        ResponseEntity<Map<String, String>> response = handler.handleIllegalArgument(
                new CombatValidationException("Tap position must be between 0 and 360 degrees, got 400.0"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("error", "Tap position must be between 0 and 360 degrees, got 400.0");
    }

    @Test
    @DisplayName("已有進行中戰鬥 → 409")
    void conflictIs409() {
        assertThat(handler.handleConflict(new CombatConflictException("Player p-1 already has an active combat session"))
                .getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    @DisplayName("查無資源 → 404")
    void notFoundIs404() {
        ResponseEntity<Map<String, String>> response =
                handler.handleNotFound(new CombatNotFoundException("Combat session", "s-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsEntry("error", "Combat session not found: s-1");
    }

    @Test
    @DisplayName("遊戲資料錯誤 → 422")
    void gameDataIs422() {
        assertThat(handler.handleGameData(new GameDataException("Enemy pools [pool-cave] have no members"))
                .getStatusCode().value()).isEqualTo(422);
    }

    @Test
    @DisplayName("未預期的錯誤 → 500，不外洩內部訊息")
    void unexpectedIs500() {
        ResponseEntity<Map<String, String>> response = handler.handleGeneral(new RuntimeException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("error", "系統發生錯誤，請稍後重試");
    }

    @Test
    @DisplayName("含敏感字眼的訊息改為通用文字")
    void sanitizesSensitiveMessages() {
        assertThat(GlobalExceptionHandler.sanitizeMessage("could not execute SQL statement"))
                .isEqualTo("操作失敗，請稍後重試");
        assertThat(GlobalExceptionHandler.sanitizeMessage(null)).isEqualTo("操作失敗，請稍後重試");
        assertThat(GlobalExceptionHandler.sanitizeMessage("level is required")).isEqualTo("level is required");
    }
}
