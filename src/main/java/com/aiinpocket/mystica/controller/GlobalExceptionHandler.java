package com.aiinpocket.mystica.controller;

import com.aiinpocket.mystica.exception.CombatConflictException;
import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.exception.GameDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/**
 * 全域 REST API 異常處理器。
 * 戰鬥例外對應：輸入錯誤 400、已有進行中戰鬥 409、查無資源 404、遊戲資料錯誤 422，其餘 500。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        String msg = sanitizeMessage(e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", msg));
    }

    @ExceptionHandler(CombatConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(CombatConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", sanitizeMessage(e.getMessage())));
    }

    @ExceptionHandler(CombatNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(CombatNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", sanitizeMessage(e.getMessage())));
    }

    @ExceptionHandler(GameDataException.class)
    public ResponseEntity<Map<String, String>> handleGameData(GameDataException e) {
        log.error("[GlobalExceptionHandler] 遊戲資料設定錯誤: {}", e.getMessage());
        return ResponseEntity.status(422).body(Map.of("error", sanitizeMessage(e.getMessage())));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "缺少必要的標頭: " + e.getHeaderName()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "請求格式不正確，請檢查欄位型別"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, String>> handleNoResource(NoResourceFoundException e) {
        log.debug("資源不存在: {}", e.getResourcePath());
        return ResponseEntity.status(404).body(Map.of("error", "資源不存在"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "系統發生錯誤，請稍後重試"));
    }

    /** 過濾可能含有敏感資訊的錯誤訊息 */
    static String sanitizeMessage(String msg) {
        if (msg == null || msg.length() > 200) return "操作失敗，請稍後重試";
        String lower = msg.toLowerCase();
        if (lower.contains("sql") || lower.contains("exception") || lower.contains("constraint")
                || lower.contains("connection") || lower.contains("timeout")
                || lower.contains("password") || lower.contains("token")) {
            return "操作失敗，請稍後重試";
        }
        return msg;
    }
}
