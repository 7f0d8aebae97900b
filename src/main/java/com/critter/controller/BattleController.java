package com.critter.controller;

import com.critter.dto.BattleStateDTO;
import com.critter.dto.StartBattleRequest;
import com.critter.dto.UserActionRequest;
import com.critter.dto.TurnActionRequest;
import com.critter.dto.TurnResult;
import com.critter.service.BattleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API controller for battles.
 */
@RestController
@RequestMapping("/api/battles")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class BattleController {

    private final BattleService battleService;

    /**
     * Start a battle. Without an opponent id the challenger fights a generated team.
     */
    @PostMapping
    public ResponseEntity<BattleStateDTO> startBattle(@Valid @RequestBody StartBattleRequest request) {
        BattleStateDTO battle = request.getOpponentId() != null
                ? battleService.startPlayerBattle(request.getChallengerId(), request.getOpponentId())
                : battleService.startAiBattle(request.getChallengerId(), request.getDifficulty());
        return ResponseEntity.ok(battle);
    }

    @GetMapping("/{battleId}")
    public ResponseEntity<BattleStateDTO> getBattle(@PathVariable String battleId) {
        return ResponseEntity.ok(battleService.getBattle(battleId));
    }

    @PostMapping("/{battleId}/turns")
    public ResponseEntity<TurnResult> submitTurn(@PathVariable String battleId,
                                                 @Valid @RequestBody TurnActionRequest request) {
        log.debug("Turn {} {} in battle {} from {}", request.getTurnNumber(), request.getType(),
                battleId, request.getUserId());
        return ResponseEntity.ok(battleService.submitTurn(battleId, request.getUserId(),
                request.getTurnNumber(), request.toAction()));
    }

    @PostMapping("/{battleId}/forfeit")
    public ResponseEntity<BattleStateDTO> forfeit(@PathVariable String battleId,
                                                  @Valid @RequestBody UserActionRequest request) {
        return ResponseEntity.ok(battleService.forfeit(battleId, request.getUserId()));
    }
}
