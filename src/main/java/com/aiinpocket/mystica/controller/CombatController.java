package com.aiinpocket.mystica.controller;

import com.aiinpocket.mystica.exception.CombatValidationException;
import com.aiinpocket.mystica.model.dto.AttackResult;
import com.aiinpocket.mystica.model.dto.CombatHistorySummary;
import com.aiinpocket.mystica.model.dto.CombatRewards;
import com.aiinpocket.mystica.model.dto.CombatSessionView;
import com.aiinpocket.mystica.model.dto.DefenseResult;
import com.aiinpocket.mystica.service.combat.CombatHistoryService;
import com.aiinpocket.mystica.service.combat.CombatService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 戰鬥 REST API。
 * 呼叫者身分由 X-Player-Id 標頭帶入；回合操作前會確認 session 屬於該玩家。
 */
@RestController
@RequestMapping("/api/combat")
@RequiredArgsConstructor
public class CombatController {

    static final String PLAYER_HEADER = "X-Player-Id";

    private final CombatService combatService;
    private final CombatHistoryService historyService;

    /** 開戰 */
    @PostMapping("/start")
    public ResponseEntity<CombatSessionView> start(
            @RequestHeader(PLAYER_HEADER) String playerId,
            @RequestBody StartRequest request) {
        if (request.locationId() == null || request.locationId().isBlank()) {
            throw new CombatValidationException("locationId is required");
        }
        if (request.level() == null) {
            throw new CombatValidationException("level is required");
        }
        return ResponseEntity.ok(combatService.startCombat(playerId, request.locationId(), request.level()));
    }

    /** 攻擊回合 */
    @PostMapping("/attack")
    public ResponseEntity<AttackResult> attack(
            @RequestHeader(PLAYER_HEADER) String playerId,
            @RequestBody TapRequest request) {
        requireOwned(request.sessionId(), playerId);
        return ResponseEntity.ok(combatService.executeAttack(request.sessionId(), requireTap(request)));
    }

    /** 防禦回合 */
    @PostMapping("/defend")
    public ResponseEntity<DefenseResult> defend(
            @RequestHeader(PLAYER_HEADER) String playerId,
            @RequestBody TapRequest request) {
        requireOwned(request.sessionId(), playerId);
        return ResponseEntity.ok(combatService.executeDefense(request.sessionId(), requireTap(request)));
    }

    /** 手動結算（自動結算失敗後重試用） */
    @PostMapping("/complete")
    public ResponseEntity<CombatRewards> complete(
            @RequestHeader(PLAYER_HEADER) String playerId,
            @RequestBody CompleteRequest request) {
        requireOwned(request.sessionId(), playerId);
        return ResponseEntity.ok(combatService.completeCombat(request.sessionId(), request.result()));
    }

    /** 放棄戰鬥；session 已不存在時同樣回傳 204 */
    @PostMapping("/abandon")
    public ResponseEntity<Void> abandon(
            @RequestHeader(PLAYER_HEADER) String playerId,
            @RequestBody SessionRequest request) {
        combatService.getActiveSession(playerId)
                .filter(view -> view.sessionId().equals(request.sessionId()))
                .ifPresent(view -> combatService.abandonCombat(view.sessionId()));
        return ResponseEntity.noContent().build();
    }

    /** 自動續戰：玩家目前進行中的 session */
    @GetMapping("/active-session")
    public ResponseEntity<CombatSessionView> activeSession(@RequestHeader(PLAYER_HEADER) String playerId) {
        return combatService.getActiveSession(playerId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /** 斷線復原 */
    @GetMapping("/session/{sessionId}")
    public ResponseEntity<CombatSessionView> session(
            @RequestHeader(PLAYER_HEADER) String playerId,
            @PathVariable String sessionId) {
        return ResponseEntity.ok(combatService.getCombatSessionForRecovery(sessionId, playerId));
    }

    /** 玩家在指定地點的戰績；尚未結算過任何戰鬥時回傳 204 */
    @GetMapping("/history/{locationId}")
    public ResponseEntity<CombatHistorySummary> history(
            @RequestHeader(PLAYER_HEADER) String playerId,
            @PathVariable String locationId) {
        return historyService.find(playerId, locationId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    private void requireOwned(String sessionId, String playerId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new CombatValidationException("sessionId is required");
        }
        combatService.getCombatSessionForRecovery(sessionId, playerId);
    }

    private static double requireTap(TapRequest request) {
        if (request.tapDegrees() == null) {
            throw new CombatValidationException("tapDegrees is required");
        }
        return request.tapDegrees();
    }

    // ===== Request =====

    record StartRequest(String locationId, Integer level) {}

    record TapRequest(String sessionId, Double tapDegrees) {}

    record CompleteRequest(String sessionId, String result) {}

    record SessionRequest(String sessionId) {}
}
